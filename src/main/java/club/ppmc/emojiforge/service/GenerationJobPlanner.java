/**
 * GenerationJobPlanner.java
 *
 * 将一次生成请求展开为要发送的命令。
 * ALL 模式只发送一条 generate_all 命令，由后端在内部逐个展开；
 * SELECTED 模式由这里按“批次在外、emoji 在内”的双重循环展开为独立任务，
 * 并确定每个任务的种子和输出文件名。这里只做纯计算，不涉及任何 I/O。
 */
package club.ppmc.emojiforge.service;

import static com.google.common.base.Preconditions.checkArgument;

import club.ppmc.emojiforge.model.EmojiInfo;
import club.ppmc.emojiforge.model.GenerationJob;
import club.ppmc.emojiforge.model.GenerationMode;
import club.ppmc.emojiforge.model.GenerationRequest;
import club.ppmc.emojiforge.model.GenerationSettings;
import club.ppmc.emojiforge.protocol.WorkerCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.GenerateAllCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.GenerateCommand;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
public class GenerationJobPlanner {

    private static final DateTimeFormatter RUN_FOLDER_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_FOLDER_NAME_LENGTH = 70;
    private static final int HASHED_PREFIX_LENGTH = 55;

    private final LongSupplier seedSource;
    private final Supplier<String> jobIdSource;

    public GenerationJobPlanner() {
        this(() -> ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), () -> UUID.randomUUID().toString());
    }

    GenerationJobPlanner(LongSupplier seedSource, Supplier<String> jobIdSource) {
        this.seedSource = seedSource;
        this.jobIdSource = jobIdSource;
    }

    /**
     * 一次运行的展开结果。
     *
     * @param total 用于进度计算的预期总数。
     * @param settings 以基准种子为 seed 的参数快照，写入元数据。
     * @param jobs SELECTED 模式下的任务；ALL 模式为空。
     * @param commands 按顺序发送的命令。
     */
    public record RunPlan(
            int total, GenerationSettings settings, List<GenerationJob> jobs, List<WorkerCommand> commands) {}

    /**
     * 为请求抽取基准种子：用户指定的值，或一个新的63位随机值。每次请求只调用一次。
     */
    public long drawBaseSeed(GenerationRequest request) {
        return request.randomSeed() ? seedSource.getAsLong() : request.settings().seed();
    }

    /**
     * @param request 已通过校验的请求。
     * @param baseSeed 本次运行的基准种子。
     * @param runDirectory 本次运行的输出目录。
     * @param catalogSize 当前目录大小，仅用于 ALL 模式。
     */
    public RunPlan plan(GenerationRequest request, long baseSeed, Path runDirectory, int catalogSize) {
        int batchSize = request.settings().batchSize();
        checkArgument(
                batchSize >= 1 && batchSize <= GenerationSettings.MAX_BATCH_SIZE,
                "batchSize must be between 1 and %s, got %s",
                GenerationSettings.MAX_BATCH_SIZE,
                batchSize);
        GenerationSettings runSettings = request.settings().withSeed(baseSeed);
        String prompt = request.prompt().trim();

        if (request.mode() == GenerationMode.ALL) {
            int emojiCount = catalogSize == 0 ? 1 : catalogSize;
            int total = Math.max(1, Math.multiplyExact(emojiCount, batchSize));
            var command = new GenerateAllCommand(prompt, runDirectory.toString(), runSettings);
            return new RunPlan(total, runSettings, List.of(), List.of(command));
        }

        List<EmojiInfo> selected = request.targets();
        checkArgument(!selected.isEmpty(), "selected mode requires at least one target");
        int total = Math.max(1, Math.multiplyExact(selected.size(), batchSize));
        List<GenerationJob> jobs = new ArrayList<>(total);
        List<WorkerCommand> commands = new ArrayList<>(total);
        int ordinal = 0;
        for (int batchIndex = 1; batchIndex <= batchSize; batchIndex++) {
            for (EmojiInfo emoji : selected) {
                ordinal++;
                long seed = runSettings.sameSeed() ? baseSeed : baseSeed + (ordinal - 1);
                Path outputPath =
                        runDirectory.resolve(outputFileName(emoji.codepoints(), baseSeed, batchIndex, batchSize));
                var job = new GenerationJob(jobIdSource.get(), emoji, outputPath, seed, ordinal, batchIndex);
                jobs.add(job);
                commands.add(
                        new GenerateCommand(
                                job.jobId(), emoji.character(), prompt, outputPath.toString(), runSettings.withSeed(seed)));
            }
        }
        return new RunPlan(total, runSettings, List.copyOf(jobs), List.copyOf(commands));
    }

    /**
     * emoji_&lt;codepoints&gt;_s&lt;baseSeed&gt;[_b&lt;batchIndex&gt;].png，批次后缀仅在 batchSize &gt; 1 时出现。
     * 文件名使用本次运行的基准种子，同一 emoji 的不同批次靠后缀区分。
     */
    public static String outputFileName(String codepoints, long seed, int batchIndex, int batchSize) {
        String suffix = batchSize > 1 ? "_b" + batchIndex : "";
        return "emoji_" + codepoints + "_s" + seed + suffix + ".png";
    }

    /**
     * 运行目录名：清理后的提示词加时间戳，例如 "pixel_art_style_20260101_120000"。
     */
    public static String runFolderName(String prompt, LocalDateTime startedAt) {
        return sanitizePathSegment(prompt) + "_" + RUN_FOLDER_STAMP.format(startedAt);
    }

    /**
     * 转为小写，只保留字母、数字、空格、'-' 和 '_'，空格替换为 '_'。
     * 结果为空时返回 "run"；超过70个字符时截取前55个字符并附加内容哈希的前8位。
     */
    static String sanitizePathSegment(String value) {
        var builder = new StringBuilder(value.length());
        value.toLowerCase(Locale.ROOT)
                .codePoints()
                .filter(cp -> Character.isLetterOrDigit(cp) || cp == ' ' || cp == '-' || cp == '_')
                .forEach(builder::appendCodePoint);

        String baseText = builder.toString().trim().replace(' ', '_');
        if (baseText.isEmpty()) {
            return "run";
        }
        if (baseText.length() <= MAX_FOLDER_NAME_LENGTH) {
            return baseText;
        }

        String hash = Hashing.sha256().hashString(baseText, StandardCharsets.UTF_8).toString().substring(0, 8);
        String prefix = baseText.substring(0, HASHED_PREFIX_LENGTH).replaceAll("[_. ]+$", "");
        return prefix + "_" + hash;
    }
}
