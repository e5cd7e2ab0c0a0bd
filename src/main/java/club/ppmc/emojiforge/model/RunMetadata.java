/**
 * RunMetadata.java
 *
 * 写入运行输出目录 run_metadata.json 的内容。由 RunMetadataWriter 以 snake_case 序列化。
 */
package club.ppmc.emojiforge.model;

/**
 * @param prompt 提示词。
 * @param model 模型标识。
 * @param date 写入时刻的 UTC 时间戳（ISO-8601）。
 * @param settings 参数快照，seed 为本次运行的基准种子。
 * @param totalEmojis 预期总数。
 * @param completed 已完成数。
 * @param failed 失败数。
 * @param partial 运行尚未完整结束时为 true。
 */
public record RunMetadata(
        String prompt,
        String model,
        String date,
        GenerationSettings settings,
        int totalEmojis,
        int completed,
        int failed,
        boolean partial) {}
