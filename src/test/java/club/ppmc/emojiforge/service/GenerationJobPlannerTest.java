package club.ppmc.emojiforge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.emojiforge.model.EmojiInfo;
import club.ppmc.emojiforge.model.GenerationJob;
import club.ppmc.emojiforge.model.GenerationMode;
import club.ppmc.emojiforge.model.GenerationRequest;
import club.ppmc.emojiforge.model.GenerationSettings;
import club.ppmc.emojiforge.protocol.WorkerCommand.GenerateAllCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.GenerateCommand;
import club.ppmc.emojiforge.service.GenerationJobPlanner.RunPlan;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * GenerationJobPlanner 单元测试
 */
class GenerationJobPlannerTest {

    private static final Path RUN_DIR = Path.of("/out/pixel_art_20260101_120000");
    private static final EmojiInfo GRINNING = new EmojiInfo("😀", "grinning face", "Smileys & Emotion", "1F600");
    private static final EmojiInfo HEART = new EmojiInfo("❤️", "red heart", "Smileys & Emotion", "2764_FE0F");
    private static final EmojiInfo ROCKET = new EmojiInfo("🚀", "rocket", "Travel & Places", "1F680");

    private GenerationJobPlanner planner;

    @BeforeEach
    void setUp() {
        var counter = new AtomicInteger();
        planner = new GenerationJobPlanner(() -> 777L, () -> "job-" + counter.incrementAndGet());
    }

    private static GenerationSettings settings(boolean sameSeed, int batchSize) {
        return new GenerationSettings(0.1f, 30, 1.0f, 42L, 512, true, 1.0f, sameSeed, batchSize);
    }

    private static GenerationRequest selected(boolean sameSeed, int batchSize, List<EmojiInfo> targets) {
        return new GenerationRequest("pixel art", GenerationMode.SELECTED, settings(sameSeed, batchSize), false, targets);
    }

    @Test
    @DisplayName("单个 emoji、固定种子：一个任务，文件名没有批次后缀")
    void singleEmojiFixedSeed() {
        // given
        GenerationRequest request = selected(false, 1, List.of(GRINNING));

        // when
        RunPlan plan = planner.plan(request, planner.drawBaseSeed(request), RUN_DIR, 0);

        // then
        assertThat(plan.total()).isEqualTo(1);
        assertThat(plan.jobs()).hasSize(1);
        GenerationJob job = plan.jobs().get(0);
        assertThat(job.seed()).isEqualTo(42L);
        assertThat(job.outputPath()).isEqualTo(RUN_DIR.resolve("emoji_1F600_s42.png"));
        var command = (GenerateCommand) plan.commands().get(0);
        assertThat(command.settings().seed()).isEqualTo(42L);
        assertThat(command.outputPath()).isEqualTo(job.outputPath().toString());
    }

    @Test
    @DisplayName("批次在外层循环，种子按序号递增，文件名带批次后缀")
    void batchMajorOrderingWithIncrementingSeeds() {
        GenerationRequest request = selected(false, 2, List.of(GRINNING));

        RunPlan plan = planner.plan(request, 42L, RUN_DIR, 0);

        assertThat(plan.total()).isEqualTo(2);
        assertThat(plan.jobs()).extracting(GenerationJob::seed).containsExactly(42L, 43L);
        assertThat(plan.jobs()).extracting(GenerationJob::batchIndex).containsExactly(1, 2);
        assertThat(plan.jobs())
                .extracting(job -> job.outputPath().getFileName().toString())
                .containsExactly("emoji_1F600_s42_b1.png", "emoji_1F600_s42_b2.png");
    }

    @Test
    @DisplayName("多个 emoji 与多个批次：先遍历完所有 emoji 再进入下一批次")
    void multipleEmojisIterateInsideBatches() {
        GenerationRequest request = selected(false, 2, List.of(GRINNING, HEART, ROCKET));

        RunPlan plan = planner.plan(request, 100L, RUN_DIR, 0);

        assertThat(plan.total()).isEqualTo(6);
        assertThat(plan.jobs())
                .extracting(job -> job.emoji().character())
                .containsExactly("😀", "❤️", "🚀", "😀", "❤️", "🚀");
        assertThat(plan.jobs()).extracting(GenerationJob::ordinal).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(plan.jobs()).extracting(GenerationJob::seed).containsExactly(100L, 101L, 102L, 103L, 104L, 105L);
    }

    @Test
    @DisplayName("所有任务的输出路径互不相同，任务ID也互不相同")
    void outputPathsAndJobIdsAreUnique() {
        GenerationRequest request = selected(true, 3, List.of(GRINNING, HEART));

        RunPlan plan = planner.plan(request, 5L, RUN_DIR, 0);

        assertThat(plan.jobs().stream().map(GenerationJob::outputPath).collect(Collectors.toSet())).hasSize(6);
        assertThat(plan.jobs().stream().map(GenerationJob::jobId).collect(Collectors.toSet())).hasSize(6);
    }

    @Test
    @DisplayName("sameSeed 时所有任务使用基准种子")
    void sameSeedUsesBaseSeedEverywhere() {
        GenerationRequest request = selected(true, 2, List.of(GRINNING, ROCKET));

        RunPlan plan = planner.plan(request, 9L, RUN_DIR, 0);

        assertThat(plan.jobs()).extracting(GenerationJob::seed).containsOnly(9L);
        assertThat(plan.commands())
                .allSatisfy(command -> assertThat(((GenerateCommand) command).settings().seed()).isEqualTo(9L));
    }

    @Test
    @DisplayName("元数据中的种子是基准种子")
    void runSettingsCarryBaseSeed() {
        RunPlan plan = planner.plan(selected(false, 2, List.of(GRINNING)), 42L, RUN_DIR, 0);

        assertThat(plan.settings().seed()).isEqualTo(42L);
    }

    @Test
    @DisplayName("ALL 模式只发送一条 generate_all，总数为目录大小乘以批次")
    void allModeSendsSingleCommand() {
        var request = new GenerationRequest("flat", GenerationMode.ALL, settings(false, 2), false, List.of());

        RunPlan plan = planner.plan(request, 42L, RUN_DIR, 1900);

        assertThat(plan.total()).isEqualTo(3800);
        assertThat(plan.jobs()).isEmpty();
        assertThat(plan.commands()).singleElement().isInstanceOf(GenerateAllCommand.class);
        var command = (GenerateAllCommand) plan.commands().get(0);
        assertThat(command.outputDir()).isEqualTo(RUN_DIR.toString());
        assertThat(command.settings().seed()).isEqualTo(42L);
    }

    @Test
    @DisplayName("ALL 模式在目录为空时总数至少为批次大小")
    void allModeWithEmptyCatalog() {
        var request = new GenerationRequest("flat", GenerationMode.ALL, settings(false, 3), false, List.of());

        assertThat(planner.plan(request, 42L, RUN_DIR, 0).total()).isEqualTo(3);
    }

    @Test
    @DisplayName("随机种子时从种子源抽取，且每次请求只抽取一次")
    void randomSeedDrawnFromSource() {
        var request = new GenerationRequest("p", GenerationMode.SELECTED, settings(false, 1), true, List.of(GRINNING));

        assertThat(planner.drawBaseSeed(request)).isEqualTo(777L);
    }

    @Test
    @DisplayName("默认种子源产生非负的63位种子")
    void defaultSeedSourceIsNonNegative() {
        var request = new GenerationRequest("p", GenerationMode.SELECTED, settings(false, 1), true, List.of(GRINNING));
        var defaultPlanner = new GenerationJobPlanner();

        for (int i = 0; i < 100; i++) {
            assertThat(defaultPlanner.drawBaseSeed(request)).isNotNegative();
        }
    }

    @Test
    @DisplayName("运行目录名由清理后的提示词和时间戳组成")
    void runFolderName() {
        String name = GenerationJobPlanner.runFolderName("Pixel Art, 8-bit!", LocalDateTime.of(2026, 1, 2, 3, 4, 5));

        assertThat(name).isEqualTo("pixel_art_8-bit_20260102_030405");
    }

    @Test
    @DisplayName("清理后为空的提示词使用 run")
    void sanitizeFallsBackToRun() {
        assertThat(GenerationJobPlanner.sanitizePathSegment("!!! ???")).isEqualTo("run");
    }

    @Test
    @DisplayName("过长的提示词被截断并附加哈希")
    void sanitizeShortensLongPrompts() {
        String prompt = "a".repeat(40) + " " + "b".repeat(40);

        String sanitized = GenerationJobPlanner.sanitizePathSegment(prompt);

        assertThat(sanitized).hasSize(64).startsWith("a".repeat(40) + "_").matches(".*_[0-9a-f]{8}");
        assertThat(GenerationJobPlanner.sanitizePathSegment(prompt)).isEqualTo(sanitized);
    }

    @Test
    @DisplayName("批次超过上限时拒绝规划")
    void rejectsBatchSizeAboveLimit() {
        GenerationRequest request = selected(false, GenerationSettings.MAX_BATCH_SIZE + 1, List.of(GRINNING));

        assertThatThrownBy(() -> planner.plan(request, 42L, RUN_DIR, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batchSize");
    }

    @Test
    @DisplayName("总数溢出 int 时抛出 ArithmeticException，而不是得到错误的总数")
    void totalOverflowIsDetected() {
        var request =
                new GenerationRequest(
                        "flat icon", GenerationMode.ALL, settings(false, GenerationSettings.MAX_BATCH_SIZE), false, List.of());

        assertThatThrownBy(() -> planner.plan(request, 42L, RUN_DIR, Integer.MAX_VALUE / 2))
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    @DisplayName("批次等于上限时总数为目标数乘以批次")
    void maximumBatchSize() {
        GenerationRequest request = selected(false, GenerationSettings.MAX_BATCH_SIZE, List.of(GRINNING, HEART, ROCKET));

        RunPlan plan = planner.plan(request, 42L, RUN_DIR, 0);

        assertThat(plan.total()).isEqualTo(300);
        assertThat(plan.commands()).hasSize(300);
    }
}
