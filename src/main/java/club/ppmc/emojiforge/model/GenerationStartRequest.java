/**
 * GenerationStartRequest.java
 *
 * POST /api/generation 的请求体。未提供的生成参数取自当前设置。
 */
package club.ppmc.emojiforge.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * @param prompt 风格提示词。
 * @param mode 生成模式。
 * @param selection SELECTED 模式下用户输入的 emoji 文本。
 * @param sameSeed 是否所有任务使用同一种子。
 * @param batchSize 每个 emoji 生成的张数，1 ~ 100，默认1。
 * @param seed 覆盖设置中的种子。
 * @param randomSeed 覆盖设置中的随机种子开关。
 */
public record GenerationStartRequest(
        @NotBlank String prompt,
        @NotNull GenerationMode mode,
        String selection,
        boolean sameSeed,
        @Min(1) @Max(GenerationSettings.MAX_BATCH_SIZE) Integer batchSize,
        Long seed,
        Boolean randomSeed) {

    public int effectiveBatchSize() {
        return batchSize == null ? 1 : batchSize;
    }
}
