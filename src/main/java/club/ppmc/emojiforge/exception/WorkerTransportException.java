/**
 * WorkerTransportException.java
 *
 * 与后端进程通信失败：没有活动会话，或者写入标准输入失败。可恢复，重新启动会话即可。
 */
package club.ppmc.emojiforge.exception;

public class WorkerTransportException extends ForgeException {

    public WorkerTransportException(String message) {
        super("TRANSPORT_ERROR", message);
    }

    public WorkerTransportException(String message, Throwable cause) {
        super("TRANSPORT_ERROR", message, cause);
    }
}
