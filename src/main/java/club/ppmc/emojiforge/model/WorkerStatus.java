/**
 * WorkerStatus.java
 *
 * 后端进程的状态，推送到 /topic/worker/status 并由 GET /api/worker/status 返回。
 *
 * @param running 进程是否存活。
 * @param ready 是否已收到 ready 事件。
 * @param mode ready 事件报告的运行模式，例如 "diffusion"。
 * @param fallback 扩散管线不可用时为 true，此时不允许开始生成。
 * @param message ready 事件附带的说明，或最近一次退出的原因。
 */
package club.ppmc.emojiforge.model;

public record WorkerStatus(boolean running, boolean ready, String mode, boolean fallback, String message) {

    public static WorkerStatus stopped(String message) {
        return new WorkerStatus(false, false, null, false, message);
    }
}
