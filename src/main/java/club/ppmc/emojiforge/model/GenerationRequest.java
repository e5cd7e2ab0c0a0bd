/**
 * GenerationRequest.java
 *
 * 一次用户发起的生成请求。由 GenerationController 构造，交给 GenerationOrchestratorService 展开为任务。
 */
package club.ppmc.emojiforge.model;

import java.util.List;

/**
 * @param prompt 提示词。
 * @param mode 生成模式。
 * @param settings 参数快照，其中的 seed 仅在 randomSeed 为 false 时作为基准种子。
 * @param randomSeed 为 true 时，编排器为本次运行随机抽取一个63位基准种子。
 * @param targets SELECTED 模式下已解析的目标 emoji 列表，按用户输入顺序排列。
 */
public record GenerationRequest(
        String prompt,
        GenerationMode mode,
        GenerationSettings settings,
        boolean randomSeed,
        List<EmojiInfo> targets) {

    public GenerationRequest {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }
}
