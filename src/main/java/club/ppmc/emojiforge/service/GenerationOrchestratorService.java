/**
 * GenerationOrchestratorService.java
 *
 * 生成运行的编排中心。负责校验请求、确保后端可用、创建运行目录、将请求展开为命令并发送，
 * 随后根据后端事件维护运行状态（计数、阶段、预计剩余时间），并把状态变化写入 run_metadata.json
 * 和推送到前端。
 *
 * 运行状态只在 WorkerEventDispatcher 的投递线程上读写：后端事件本身在该线程上到达，
 * 开始和取消这两个意图也通过 dispatcher.submit() 排队执行，因此不需要额外的锁。
 * 投递线程从不等待写入标准输入：命令只放入桥接层的出站队列，写入失败再作为任务提交回投递线程处理。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.exception.GenerationValidationException;
import club.ppmc.emojiforge.exception.WorkerTransportException;
import club.ppmc.emojiforge.model.GenerationMode;
import club.ppmc.emojiforge.model.GenerationProgress;
import club.ppmc.emojiforge.model.GenerationRequest;
import club.ppmc.emojiforge.model.GenerationResult;
import club.ppmc.emojiforge.model.GenerationSettings;
import club.ppmc.emojiforge.model.RunMetadata;
import club.ppmc.emojiforge.model.RunPhase;
import club.ppmc.emojiforge.model.RunSnapshot;
import club.ppmc.emojiforge.model.RunState;
import club.ppmc.emojiforge.model.Settings;
import club.ppmc.emojiforge.model.WorkerStatus;
import club.ppmc.emojiforge.protocol.WorkerCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.CancelCommand;
import club.ppmc.emojiforge.protocol.WorkerEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.CanceledEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.ErrorEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.ProgressEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.ReadyEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.ResultEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.WorkerExitedEvent;
import club.ppmc.emojiforge.service.GenerationJobPlanner.RunPlan;
import club.ppmc.emojiforge.util.AsyncResults;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class GenerationOrchestratorService {

    private final WorkerBridgeService bridge;
    private final EmojiCatalogService catalogService;
    private final GenerationJobPlanner planner;
    private final RunMetadataWriter metadataWriter;
    private final WebSocketNotificationService notificationService;
    private final SettingsService settingsService;
    private final WorkerEventDispatcher eventDispatcher;
    private final Clock clock;
    private final Duration cancelEscalationTimeout;
    private final ScheduledExecutorService escalationScheduler;
    private final WorkerEventListener eventListener = this::onEvent;

    // --- 仅由投递线程访问 ---
    private RunState run = RunState.idle();
    private RunContext context;

    // ready 事件报告的后端状态，由投递线程写入，Controller 线程读取
    private volatile WorkerStatus workerStatus = WorkerStatus.stopped(null);

    /** 写入元数据所需的、在运行开始时确定的信息。 */
    private record RunContext(String prompt, String model, GenerationSettings settings) {}

    public GenerationOrchestratorService(
            WorkerBridgeService bridge,
            EmojiCatalogService catalogService,
            GenerationJobPlanner planner,
            RunMetadataWriter metadataWriter,
            WebSocketNotificationService notificationService,
            SettingsService settingsService,
            WorkerEventDispatcher eventDispatcher,
            Clock clock,
            @Value("${app.generation.cancel-escalation-timeout:PT0S}") Duration cancelEscalationTimeout) {
        this.bridge = bridge;
        this.catalogService = catalogService;
        this.planner = planner;
        this.metadataWriter = metadataWriter;
        this.notificationService = notificationService;
        this.settingsService = settingsService;
        this.eventDispatcher = eventDispatcher;
        this.clock = clock;
        this.cancelEscalationTimeout = cancelEscalationTimeout;
        this.escalationScheduler =
                Executors.newSingleThreadScheduledExecutor(
                        runnable -> {
                            var thread = new Thread(runnable, "cancel-escalation");
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    @PostConstruct
    public void init() {
        eventDispatcher.subscribe(eventListener);
    }

    /**
     * 开始一次生成运行。
     *
     * @param request 生成请求。
     * @return 运行开始后的状态快照。
     * @throws GenerationValidationException 请求无效、已有运行在进行中或后端处于降级模式时。
     * @throws club.ppmc.emojiforge.exception.WorkerStartupException 后端需要启动但启动失败时。
     */
    public RunSnapshot startRun(GenerationRequest request) {
        validate(request);
        Settings settings = settingsService.getSettings();
        if (!bridge.isRunning()) {
            log.info("后端未运行，在开始生成前启动后端。");
            bridge.start(settings);
            catalogService.loadCatalog();
        }
        return AsyncResults.await(eventDispatcher.submit(() -> dispatchRun(request, settings)));
    }

    /**
     * 请求取消当前运行。每次运行只接受一次取消请求，重复调用只返回当前状态。
     */
    public RunSnapshot cancelRun() {
        return AsyncResults.await(eventDispatcher.submit(this::requestCancel));
    }

    /**
     * 主动停止后端。进行中的运行会被标记为 INTERRUPTED，因为主动停止不会产生退出事件。
     */
    public RunSnapshot stopWorker() {
        return AsyncResults.await(
                eventDispatcher.submit(
                        () -> {
                            bridge.stop();
                            if (run.markInterrupted()) {
                                log.warn("后端被主动停止，运行 {} 已中断。", run.runId());
                                writeMetadata(true);
                                publishRunStatus();
                            }
                            updateWorkerStatus(WorkerStatus.stopped("Python backend stopped."));
                            return snapshot();
                        }));
    }

    public RunSnapshot currentRun() {
        return AsyncResults.await(eventDispatcher.submit(this::snapshot));
    }

    public WorkerStatus workerStatus() {
        WorkerStatus status = workerStatus;
        boolean running = bridge.isRunning();
        if (status.running() == running) {
            return status;
        }
        return new WorkerStatus(running, running && status.ready(), status.mode(), status.fallback(), status.message());
    }

    static void validate(GenerationRequest request) {
        if (request.prompt() == null || request.prompt().isBlank()) {
            throw new GenerationValidationException("Please enter a style prompt.");
        }
        if (request.mode() == null) {
            throw new GenerationValidationException("Generation mode is required.");
        }
        if (request.settings() == null) {
            throw new GenerationValidationException("Generation settings are required.");
        }
        int batchSize = request.settings().batchSize();
        if (batchSize < 1 || batchSize > GenerationSettings.MAX_BATCH_SIZE) {
            throw new GenerationValidationException(
                    "Batch size must be between 1 and " + GenerationSettings.MAX_BATCH_SIZE + ".");
        }
        if (request.mode() == GenerationMode.SELECTED && request.targets().isEmpty()) {
            throw new GenerationValidationException("No emojis selected. Enter emojis in the selection field.");
        }
    }

    private RunSnapshot dispatchRun(GenerationRequest request, Settings settings) {
        if (run.isActive()) {
            throw new GenerationValidationException("A generation run is already in progress.");
        }
        if (workerStatus.fallback()) {
            throw new GenerationValidationException(
                    "Diffusion pipeline is not available; generation is disabled. " + workerStatus.message());
        }

        Instant startedAt = clock.instant();
        long baseSeed = planner.drawBaseSeed(request);
        Path runDirectory = createRunDirectory(settings.getDefaultOutputDirectory(), request.prompt(), startedAt);
        RunPlan plan = planner.plan(request, baseSeed, runDirectory, catalogService.currentCatalog().size());

        run = RunState.start(plan.total(), startedAt, runDirectory);
        context = new RunContext(request.prompt().trim(), settings.getModelPath(), plan.settings());
        log.info(
                "开始运行 {}: 模式 {}, 共 {} 个单元, 基准种子 {}, 输出目录 {}",
                run.runId(),
                request.mode(),
                plan.total(),
                baseSeed,
                runDirectory);

        String runId = run.runId();
        try {
            for (WorkerCommand command : plan.commands()) {
                bridge.enqueueCommand(command)
                        .whenComplete(
                                (ignored, failure) -> {
                                    if (failure != null) {
                                        eventDispatcher.submit(() -> onDispatchFailed(runId, failure));
                                    }
                                });
            }
        } catch (WorkerTransportException e) {
            log.warn("发送生成命令失败，运行 {} 已中断: {}", run.runId(), e.getMessage());
            run.markInterrupted();
            writeMetadata(true);
            publishRunStatus();
            throw e;
        }

        writeMetadata(true);
        publishRunStatus();
        return snapshot();
    }

    private Void onDispatchFailed(String runId, Throwable failure) {
        if (runId.equals(run.runId()) && run.markInterrupted()) {
            log.warn("写入生成命令失败，运行 {} 已中断: {}", runId, rootMessage(failure));
            writeMetadata(true);
            publishRunStatus();
        }
        return null;
    }

    private Path createRunDirectory(String outputDirectory, String prompt, Instant startedAt) {
        String folderName =
                GenerationJobPlanner.runFolderName(prompt, LocalDateTime.ofInstant(startedAt, clock.getZone()));
        File directory = Paths.get(outputDirectory, folderName).toAbsolutePath().normalize().toFile();
        try {
            FileUtils.forceMkdir(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output directory " + directory, e);
        }
        return directory.toPath();
    }

    private RunSnapshot requestCancel() {
        if (!run.requestCancel()) {
            log.debug("当前阶段 {} 不接受取消请求。", run.phase());
            return snapshot();
        }
        log.info("收到运行 {} 的取消请求。", run.runId());
        publishRunStatus();

        if (run.total() <= 1) {
            // 单个任务无法在中途取消，直接停止后端
            bridge.stop();
            updateWorkerStatus(WorkerStatus.stopped("Python backend stopped to cancel generation."));
            finishCanceled();
        } else if (!bridge.isRunning()) {
            finishCanceled();
        } else {
            String runId = run.runId();
            try {
                bridge.enqueueCommand(new CancelCommand())
                        .whenComplete(
                                (ignored, failure) -> {
                                    if (failure != null) {
                                        eventDispatcher.submit(() -> onCancelSendFailed(runId, failure));
                                    }
                                });
                scheduleEscalation(runId);
            } catch (WorkerTransportException e) {
                log.warn("发送取消命令失败，直接结束运行: {}", e.getMessage());
                finishCanceled();
            }
        }
        return snapshot();
    }

    private Void onCancelSendFailed(String runId, Throwable failure) {
        if (runId.equals(run.runId()) && run.phase() == RunPhase.CANCEL_REQUESTED) {
            log.warn("发送取消命令失败，直接结束运行: {}", rootMessage(failure));
            finishCanceled();
        }
        return null;
    }

    private void scheduleEscalation(String runId) {
        if (cancelEscalationTimeout.isZero() || cancelEscalationTimeout.isNegative()) {
            return;
        }
        escalationScheduler.schedule(
                () -> eventDispatcher.submit(() -> escalateCancel(runId)),
                cancelEscalationTimeout.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    private Void escalateCancel(String runId) {
        if (runId.equals(run.runId()) && run.phase() == RunPhase.CANCEL_REQUESTED) {
            log.warn("后端在 {} 秒内未响应取消命令，强制停止后端。", cancelEscalationTimeout.toSeconds());
            bridge.stop();
            updateWorkerStatus(WorkerStatus.stopped("Python backend stopped to cancel generation."));
            finishCanceled();
        }
        return null;
    }

    private void finishCanceled() {
        if (run.markCanceled()) {
            log.info("运行 {} 已取消: 完成 {}, 失败 {}, 共 {}", run.runId(), run.completed(), run.failed(), run.total());
            writeMetadata(true);
            publishRunStatus();
        }
    }

    void onEvent(WorkerEvent event) {
        if (event instanceof ReadyEvent ready) {
            onReady(ready);
        } else if (event instanceof ProgressEvent progress) {
            if (run.isActive()) {
                notificationService.sendProgress(GenerationProgress.of(snapshot(), progress.emoji()));
            }
        } else if (event instanceof ResultEvent result) {
            onResult(result);
        } else if (event instanceof ErrorEvent error) {
            onError(error);
        } else if (event instanceof CanceledEvent) {
            finishCanceled();
        } else if (event instanceof WorkerExitedEvent exited) {
            onWorkerExited(exited);
        }
    }

    private void onReady(ReadyEvent ready) {
        if (ready.fallback()) {
            log.warn("后端以降级模式启动，生成已禁用: {}", ready.message());
        } else {
            log.info("后端已就绪，模式: {}", ready.mode());
        }
        updateWorkerStatus(new WorkerStatus(true, true, ready.mode(), ready.fallback(), ready.message()));
    }

    private void onResult(ResultEvent result) {
        if (!run.recordCompleted()) {
            log.debug("忽略运行之外的结果事件: {}", result.outputPath());
            return;
        }
        if (!result.skipped()) {
            notificationService.sendResult(
                    new GenerationResult(run.runId(), result.jobId(), result.emoji(), result.outputPath()));
        }
        afterUnitFinished(result.emoji());
    }

    private void onError(ErrorEvent error) {
        if (!run.recordFailed()) {
            log.warn("后端报告错误: {}", error.message());
            return;
        }
        log.warn("任务 {} 失败: {}", error.jobId() == null ? "-" : error.jobId(), error.message());
        afterUnitFinished(null);
    }

    private void afterUnitFinished(String emoji) {
        if (run.isFinished() && run.markCompleted()) {
            log.info("运行 {} 已完成: 完成 {}, 失败 {}, 共 {}", run.runId(), run.completed(), run.failed(), run.total());
            writeMetadata(false);
        } else {
            writeMetadata(true);
        }
        RunSnapshot snapshot = snapshot();
        notificationService.sendProgress(GenerationProgress.of(snapshot, emoji));
        notificationService.sendRunStatus(snapshot);
    }

    private void onWorkerExited(WorkerExitedEvent exited) {
        updateWorkerStatus(WorkerStatus.stopped(exited.message() + " Exit code: " + exited.exitCode()));
        if (run.markInterrupted()) {
            log.error(
                    "后端在运行 {} 期间退出: 完成 {}, 失败 {}, 共 {}",
                    run.runId(),
                    run.completed(),
                    run.failed(),
                    run.total());
            writeMetadata(true);
            publishRunStatus();
        }
    }

    private void writeMetadata(boolean partial) {
        if (context == null || run.outputDirectory() == null) {
            return;
        }
        var metadata =
                new RunMetadata(
                        context.prompt(),
                        context.model(),
                        clock.instant().toString(),
                        context.settings(),
                        run.total(),
                        run.completed(),
                        run.failed(),
                        partial);
        try {
            metadataWriter.write(run.outputDirectory(), metadata);
        } catch (IOException e) {
            log.warn("写入运行元数据失败: {}", e.getMessage());
        }
    }

    private void updateWorkerStatus(WorkerStatus status) {
        this.workerStatus = status;
        notificationService.sendWorkerStatus(status);
    }

    private void publishRunStatus() {
        notificationService.sendRunStatus(snapshot());
    }

    private static String rootMessage(Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
        return cause.getMessage();
    }

    private RunSnapshot snapshot() {
        return run.snapshot(clock.instant());
    }

    @PreDestroy
    public void shutdown() {
        eventDispatcher.unsubscribe(eventListener);
        escalationScheduler.shutdownNow();
    }
}
