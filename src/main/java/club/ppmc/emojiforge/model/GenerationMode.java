package club.ppmc.emojiforge.model;

/**
 * 生成模式。ALL 由后端在内部遍历整个目录；SELECTED 由编排器逐个展开为独立任务。
 */
public enum GenerationMode {
    ALL,
    SELECTED
}
