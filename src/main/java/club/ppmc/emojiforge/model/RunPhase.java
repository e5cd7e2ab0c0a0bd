package club.ppmc.emojiforge.model;

/**
 * 一次运行的生命周期阶段。
 * IDLE → RUNNING → CANCEL_REQUESTED → {CANCELED, COMPLETED}；
 * 后端进程意外退出时进入 INTERRUPTED。
 */
public enum RunPhase {
    IDLE,
    RUNNING,
    CANCEL_REQUESTED,
    CANCELED,
    COMPLETED,
    INTERRUPTED;

    /** 仍在等待后端事件的阶段。 */
    public boolean isActive() {
        return this == RUNNING || this == CANCEL_REQUESTED;
    }
}
