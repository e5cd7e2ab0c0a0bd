/**
 * WorkerSession.java
 *
 * 该文件定义了一个不可变记录，聚合了一个运行中的 Python 后端进程的所有核心组件：
 * 进程本身、标准输入写入器、读取线程的停止信号以及会话生命周期状态。
 * 仅由 WorkerBridgeService 在内部创建和管理，不会对外共享。
 */
package club.ppmc.emojiforge.model;

import java.io.BufferedWriter;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * @param process 底层的操作系统进程对象。
 * @param writer 指向进程标准输入的写入器。
 * @param readersActive 读取线程的运行标志，置为 false 表示读取线程应当停止。
 * @param lifecycle 会话生命周期，用于在进程退出时区分主动停止与崩溃。
 */
public record WorkerSession(
        Process process,
        BufferedWriter writer,
        AtomicBoolean readersActive,
        AtomicReference<Lifecycle> lifecycle) {

    public enum Lifecycle {
        LIVE,
        STOPPING_INTENTIONALLY,
        EXITED
    }

    public static WorkerSession live(Process process, BufferedWriter writer) {
        return new WorkerSession(
                process, writer, new AtomicBoolean(true), new AtomicReference<>(Lifecycle.LIVE));
    }

    /** LIVE → STOPPING_INTENTIONALLY。 */
    public boolean markStopping() {
        return lifecycle.compareAndSet(Lifecycle.LIVE, Lifecycle.STOPPING_INTENTIONALLY);
    }

    /**
     * LIVE → EXITED。
     *
     * @return 仅当进程在未被主动停止的情况下退出时返回 true。
     */
    public boolean markCrashed() {
        return lifecycle.compareAndSet(Lifecycle.LIVE, Lifecycle.EXITED);
    }
}
