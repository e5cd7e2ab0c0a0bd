/**
 * GenerationSettings.java
 *
 * 随 generate / generate_all 命令发送给后端的生成参数快照。
 * 同一个快照也会写入 run_metadata.json。
 */
package club.ppmc.emojiforge.model;

/**
 * @param strength img2img 强度，0.1 ~ 1.0。
 * @param numInferenceSteps 推理步数。
 * @param guidanceScale CFG 引导系数。
 * @param seed 种子。在 generate 命令中是该任务的种子，在元数据中是本次运行的基准种子。
 * @param outputSizePx 输出图片边长（像素）。
 * @param removeBackground 是否去除背景。
 * @param removeBackgroundStrength 去背景强度。
 * @param sameSeed 是否所有任务使用同一种子。
 * @param batchSize 每个 emoji 生成的张数。
 */
public record GenerationSettings(
        float strength,
        int numInferenceSteps,
        float guidanceScale,
        long seed,
        int outputSizePx,
        boolean removeBackground,
        float removeBackgroundStrength,
        boolean sameSeed,
        int batchSize) {

    /** 每个 emoji 允许的最大生成张数。 */
    public static final int MAX_BATCH_SIZE = 100;

    public GenerationSettings withSeed(long newSeed) {
        return new GenerationSettings(
                strength,
                numInferenceSteps,
                guidanceScale,
                newSeed,
                outputSizePx,
                removeBackground,
                removeBackgroundStrength,
                sameSeed,
                batchSize);
    }

    /**
     * 以用户设置为基础构造一个参数快照。种子此时取设置中的固定值，随机种子由编排器在运行开始时决定。
     */
    public static GenerationSettings fromSettings(Settings settings, boolean sameSeed, int batchSize) {
        return new GenerationSettings(
                settings.getStrength(),
                settings.getNumInferenceSteps(),
                settings.getCfgScale(),
                settings.getSeed(),
                settings.getOutputSizePx(),
                settings.isRemoveBackground(),
                settings.getBackgroundRemovalStrength(),
                sameSeed,
                batchSize);
    }
}
