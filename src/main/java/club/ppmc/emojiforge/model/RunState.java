/**
 * RunState.java
 *
 * 一次生成运行的可变状态：总数、完成数、失败数、开始时间和阶段。
 * 该对象没有任何同步措施，只能由 WorkerEventDispatcher 的投递线程修改，
 * 其他线程只能通过 {@link #snapshot(Instant)} 得到的只读副本读取。
 * 不变式：completed + failed <= total；当且仅当二者相等时运行结束。
 */
package club.ppmc.emojiforge.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public final class RunState {

    private final String runId;
    private final int total;
    private final Instant startedAt;
    private final Path outputDirectory;
    private int completed;
    private int failed;
    private RunPhase phase;

    private RunState(String runId, int total, Instant startedAt, Path outputDirectory, RunPhase phase) {
        this.runId = runId;
        this.total = total;
        this.startedAt = startedAt;
        this.outputDirectory = outputDirectory;
        this.phase = phase;
    }

    public static RunState idle() {
        return new RunState(null, 0, null, null, RunPhase.IDLE);
    }

    public static RunState start(int total, Instant startedAt, Path outputDirectory) {
        if (total < 1) {
            throw new IllegalArgumentException("total must be at least 1, got " + total);
        }
        return new RunState(UUID.randomUUID().toString(), total, startedAt, outputDirectory, RunPhase.RUNNING);
    }

    /**
     * 记录一个完成的单元。
     *
     * @return 计数是否发生了变化。运行不处于活动阶段或计数已满时返回 false。
     */
    public boolean recordCompleted() {
        if (!acceptsResults()) {
            return false;
        }
        completed++;
        return true;
    }

    /**
     * 记录一个失败的单元。
     *
     * @return 计数是否发生了变化。
     */
    public boolean recordFailed() {
        if (!acceptsResults()) {
            return false;
        }
        failed++;
        return true;
    }

    private boolean acceptsResults() {
        return phase.isActive() && completed + failed < total;
    }

    /** 进入 CANCEL_REQUESTED。每次运行只接受一次。 */
    public boolean requestCancel() {
        if (phase != RunPhase.RUNNING) {
            return false;
        }
        phase = RunPhase.CANCEL_REQUESTED;
        return true;
    }

    public boolean markCompleted() {
        return transitionFromActive(RunPhase.COMPLETED);
    }

    public boolean markCanceled() {
        return transitionFromActive(RunPhase.CANCELED);
    }

    public boolean markInterrupted() {
        return transitionFromActive(RunPhase.INTERRUPTED);
    }

    private boolean transitionFromActive(RunPhase target) {
        if (!phase.isActive()) {
            return false;
        }
        phase = target;
        return true;
    }

    public boolean isFinished() {
        return total > 0 && completed + failed >= total;
    }

    public boolean isActive() {
        return phase.isActive();
    }

    public String runId() {
        return runId;
    }

    public int total() {
        return total;
    }

    public int completed() {
        return completed;
    }

    public int failed() {
        return failed;
    }

    public RunPhase phase() {
        return phase;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public Duration elapsed(Instant now) {
        return startedAt == null ? Duration.ZERO : Duration.between(startedAt, now);
    }

    /**
     * 按已完成数量的平均耗时估算剩余时间：elapsed / completed * (total - completed)。
     *
     * @return 预计剩余时间；尚无完成项或已全部完成时返回 null。
     */
    public Duration eta(Instant now) {
        if (completed > 0 && total > completed) {
            return elapsed(now).dividedBy(completed).multipliedBy(total - completed);
        }
        return null;
    }

    public RunSnapshot snapshot(Instant now) {
        return new RunSnapshot(
                runId,
                phase,
                total,
                completed,
                failed,
                Math.min(completed + failed, total),
                elapsed(now),
                eta(now),
                outputDirectory == null ? null : outputDirectory.toString());
    }
}
