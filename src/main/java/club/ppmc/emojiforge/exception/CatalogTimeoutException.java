package club.ppmc.emojiforge.exception;

import java.time.Duration;
import lombok.Getter;

/**
 * 在等待窗口内没有收到 emoji_list 响应。
 */
@Getter
public class CatalogTimeoutException extends ForgeException {

    private final Duration timeout;

    public CatalogTimeoutException(Duration timeout) {
        super("TIMEOUT_ERROR", "Timed out after " + timeout.toSeconds() + "s waiting for the emoji catalog.");
        this.timeout = timeout;
    }
}
