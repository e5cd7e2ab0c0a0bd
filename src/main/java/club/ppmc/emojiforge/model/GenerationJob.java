package club.ppmc.emojiforge.model;

import java.nio.file.Path;

/**
 * SELECTED 模式下的一个独立任务，创建后不再修改，只会被一条 generate 命令消费一次。
 *
 * @param jobId 全局唯一的任务ID。
 * @param emoji 目标 emoji。
 * @param outputPath 已完全解析的输出文件路径。
 * @param seed 分配给该任务的种子。
 * @param ordinal 在 batch × emoji 双重循环中的序号，从1开始。
 * @param batchIndex 所属批次，从1开始。
 */
public record GenerationJob(
        String jobId, EmojiInfo emoji, Path outputPath, long seed, int ordinal, int batchIndex) {}
