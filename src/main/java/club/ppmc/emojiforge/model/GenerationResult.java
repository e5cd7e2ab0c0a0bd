/**
 * GenerationResult.java
 *
 * 推送到 /topic/generation/result 的单个输出通知，前端据此显示预览图。
 * 复用已存在文件的结果不会产生该通知。
 */
package club.ppmc.emojiforge.model;

public record GenerationResult(String runId, String jobId, String emoji, String outputPath) {}
