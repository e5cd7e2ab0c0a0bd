/**
 * RunSnapshot.java
 *
 * RunState 的只读快照，发送到前端并作为 REST 接口的返回值。
 */
package club.ppmc.emojiforge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

/**
 * @param runId 运行ID，空闲时为 null。
 * @param phase 当前阶段。
 * @param total 预期的总单元数。
 * @param completed 已完成数（含跳过的已存在输出）。
 * @param failed 失败数。
 * @param progress 显示用进度，即 min(completed + failed, total)。
 * @param elapsed 已用时间。
 * @param eta 预计剩余时间；无法估算时为 null。
 * @param outputDirectory 本次运行的输出目录。
 */
public record RunSnapshot(
        String runId,
        RunPhase phase,
        int total,
        int completed,
        int failed,
        int progress,
        Duration elapsed,
        Duration eta,
        String outputDirectory) {

    /** 控制面板上是否允许开始新的运行。 */
    @JsonProperty("canStart")
    public boolean canStart() {
        return !phase.isActive();
    }

    /** 控制面板上是否允许取消。 */
    @JsonProperty("canCancel")
    public boolean canCancel() {
        return phase == RunPhase.RUNNING;
    }
}
