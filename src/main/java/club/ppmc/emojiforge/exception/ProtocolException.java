/**
 * ProtocolException.java
 *
 * 后端输出的一行无法解析为已知事件。仅在 MessageCodec 内部使用，
 * 对外一律降级为日志行，从不终止会话。
 */
package club.ppmc.emojiforge.exception;

public class ProtocolException extends ForgeException {

    public ProtocolException(String message) {
        super("PROTOCOL_ERROR", message);
    }

    public ProtocolException(String message, Throwable cause) {
        super("PROTOCOL_ERROR", message, cause);
    }
}
