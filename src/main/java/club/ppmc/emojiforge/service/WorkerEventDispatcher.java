/**
 * WorkerEventDispatcher.java
 *
 * 后端事件的单一有序投递通道。两个读取线程（stdout、stderr）把事件发布到同一个队列，
 * 由唯一的投递线程按发布顺序交给所有订阅者。
 * 需要修改运行状态的操作（开始、取消等意图）也通过 {@link #submit(Supplier)} 在同一线程上执行，
 * 因此订阅者持有的状态只有一个写入者，无需加锁。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.protocol.WorkerEvent;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class WorkerEventDispatcher {

    private static final String THREAD_NAME = "worker-event-dispatcher";

    private final List<WorkerEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService deliveryExecutor =
            Executors.newSingleThreadExecutor(
                    runnable -> {
                        var thread = new Thread(runnable, THREAD_NAME);
                        thread.setDaemon(true);
                        return thread;
                    });

    public void subscribe(WorkerEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(WorkerEventListener listener) {
        listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }

    /**
     * 将事件加入投递队列。可以从任意线程调用，不会阻塞。
     */
    public void publish(WorkerEvent event) {
        try {
            deliveryExecutor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.debug("投递通道已关闭，丢弃事件: {}", event.type());
        }
    }

    /**
     * 在投递线程上执行一个操作，排在所有已发布事件之后。
     */
    public <T> CompletableFuture<T> submit(Supplier<T> action) {
        return CompletableFuture.supplyAsync(action, deliveryExecutor);
    }

    private void deliver(WorkerEvent event) {
        for (WorkerEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("事件订阅者处理 '{}' 事件时出错", event.type(), e);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
