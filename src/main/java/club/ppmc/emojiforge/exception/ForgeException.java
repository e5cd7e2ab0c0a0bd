/**
 * ForgeException.java
 *
 * 所有 EmojiForge 业务异常的基类。它携带了一个错误类型标识，
 * 以便 Controller 层可以将其转换为对前端友好的结构化响应。
 */
package club.ppmc.emojiforge.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public abstract class ForgeException extends RuntimeException {

    /** 错误类型标识，例如 "STARTUP_ERROR"。 */
    private final String errorType;

    protected ForgeException(String errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected ForgeException(String errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     */
    public Map<String, Object> toErrorData() {
        return Map.of("type", errorType, "message", getMessage() != null ? getMessage() : "");
    }
}
