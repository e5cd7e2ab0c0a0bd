/**
 * GenerationProgress.java
 *
 * 推送到 /topic/generation/progress 的进度消息。时间以秒为单位，便于前端直接格式化。
 */
package club.ppmc.emojiforge.model;

public record GenerationProgress(
        String runId,
        int progress,
        int total,
        int completed,
        int failed,
        long elapsedSeconds,
        Long etaSeconds,
        String currentEmoji) {

    public static GenerationProgress of(RunSnapshot snapshot, String currentEmoji) {
        return new GenerationProgress(
                snapshot.runId(),
                snapshot.progress(),
                snapshot.total(),
                snapshot.completed(),
                snapshot.failed(),
                snapshot.elapsed().toSeconds(),
                snapshot.eta() == null ? null : snapshot.eta().toSeconds(),
                currentEmoji);
    }
}
