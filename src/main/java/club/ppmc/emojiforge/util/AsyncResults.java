package club.ppmc.emojiforge.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 在同步调用点（例如 Controller）等待 CompletableFuture，并把业务异常原样抛出。
 */
public final class AsyncResults {

    private AsyncResults() {}

    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
