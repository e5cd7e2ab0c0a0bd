/**
 * WorkerBridgeService.java
 *
 * 该服务负责管理 Python 后端进程的生命周期和基于行的 JSON 协议。
 * 它维护一个单例的后端会话：启动前执行一次依赖检查，随后创建进程、启动 stdout/stderr 两个读取线程，
 * 并立即发送 init 命令。stdout 的每一行经 MessageCodec 解析后发布到 WorkerEventDispatcher，
 * stderr 的每一行作为日志事件原样发布。
 * 所有写入标准输入的命令都经过一个单线程的出站队列，按入队顺序逐行写入。后端只在两个任务之间读取标准输入，
 * 管道写满时只有出站线程被阻塞，入队的调用方不受影响。
 * 进程意外退出（不是由 stop() 引起的）时发布一个 error 事件。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.exception.WorkerStartupException;
import club.ppmc.emojiforge.exception.WorkerTransportException;
import club.ppmc.emojiforge.model.Settings;
import club.ppmc.emojiforge.model.WorkerSession;
import club.ppmc.emojiforge.protocol.MessageCodec;
import club.ppmc.emojiforge.protocol.WorkerCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.InitCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.QuitCommand;
import club.ppmc.emojiforge.protocol.WorkerEvent.LogEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.LogSource;
import club.ppmc.emojiforge.protocol.WorkerEvent.WorkerExitedEvent;
import club.ppmc.emojiforge.util.AsyncResults;
import club.ppmc.emojiforge.util.BackendPaths;
import club.ppmc.emojiforge.util.WorkerProcessLauncher;
import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class WorkerBridgeService {

    static final Duration STOP_GRACE_PERIOD = Duration.ofSeconds(2);

    private final MessageCodec codec;
    private final WorkerEventDispatcher eventDispatcher;
    private final DependencyBootstrapper dependencyBootstrapper;
    private final WorkerProcessLauncher processLauncher;
    private final AtomicReference<WorkerSession> currentSession = new AtomicReference<>();
    private final ExecutorService readerExecutor = Executors.newCachedThreadPool();
    private final ExecutorService outboundExecutor =
            Executors.newSingleThreadExecutor(
                    runnable -> {
                        var thread = new Thread(runnable, "worker-stdin");
                        thread.setDaemon(true);
                        return thread;
                    });

    public WorkerBridgeService(
            MessageCodec codec,
            WorkerEventDispatcher eventDispatcher,
            DependencyBootstrapper dependencyBootstrapper,
            WorkerProcessLauncher processLauncher) {
        this.codec = codec;
        this.eventDispatcher = eventDispatcher;
        this.dependencyBootstrapper = dependencyBootstrapper;
        this.processLauncher = processLauncher;
    }

    public boolean isRunning() {
        WorkerSession session = currentSession.get();
        return session != null && session.process().isAlive();
    }

    /**
     * 启动后端进程。如果已有存活的会话，则什么也不做。
     *
     * @param settings 当前设置。
     * @throws WorkerStartupException 脚本不存在、依赖检查失败、进程无法创建或 init 命令无法发送时。
     */
    public synchronized void start(Settings settings) {
        if (isRunning()) {
            log.debug("后端进程已在运行，忽略启动请求。");
            return;
        }
        WorkerSession stale = currentSession.getAndSet(null);
        if (stale != null) {
            releaseSession(stale);
        }

        Path backendScript =
                BackendPaths.resolveBackendScript(
                        settings.getBackendScriptPath(), Paths.get("").toAbsolutePath());
        if (!Files.isRegularFile(backendScript)) {
            throw new WorkerStartupException(
                    "Python backend script not found. Checked path: " + backendScript);
        }

        dependencyBootstrapper.ensureDependencies(settings, backendScript);

        List<String> command = List.of(settings.getPythonExecutablePath(), backendScript.toString());
        Process process;
        try {
            process = processLauncher.launch(command, backendScript.getParent(), backendEnvironment(settings));
        } catch (IOException e) {
            log.error("启动后端进程失败，命令: {}", command, e);
            throw new WorkerStartupException("Failed to start Python backend process: " + e.getMessage(), e);
        }
        log.info("已启动后端进程，PID: {}. 脚本: {}", process.pid(), backendScript);

        var writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        var session = WorkerSession.live(process, writer);
        currentSession.set(session);

        startReader(session, process.getInputStream(), "stdout", line -> eventDispatcher.publish(codec.decode(line)));
        startReader(
                session,
                process.getErrorStream(),
                "stderr",
                line -> eventDispatcher.publish(new LogEvent(line, LogSource.STDERR)));
        process.onExit().thenAccept(exited -> handleProcessExit(session, exited));

        try {
            sendCommand(
                    new InitCommand(
                            BackendPaths.resolveModelPath(settings),
                            settings.getDevice(),
                            settings.getEmojiFontPath(),
                            settings.isEnableCpuOffload()));
        } catch (WorkerTransportException e) {
            throw new WorkerStartupException("Failed to initialize Python backend: " + e.getMessage(), e);
        }
    }

    /**
     * 停止后端进程。先尝试发送 quit 命令让其自然退出，在宽限期后仍存活则强制终止整个进程树。
     * 可以重复调用。无论走哪条路径，会话持有的资源都会被释放。
     */
    public synchronized void stop() {
        WorkerSession session = currentSession.get();
        if (session == null) {
            return;
        }
        session.markStopping();
        Process process = session.process();
        try {
            if (process.isAlive()) {
                log.info("正在停止后端进程，PID: {}", process.pid());
                enqueueLine(session, codec.encode(new QuitCommand()))
                        .whenComplete(
                                (ignored, failure) -> {
                                    if (failure != null) {
                                        log.debug("发送 quit 命令失败，进程可能已经退出: {}", failure.getMessage());
                                    }
                                });
                session.readersActive().set(false);
                if (!process.waitFor(STOP_GRACE_PERIOD.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("后端进程 PID {} 未在 {} 秒内退出，将强制终止。", process.pid(), STOP_GRACE_PERIOD.toSeconds());
                    destroyProcessTree(process);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyProcessTree(process);
        } finally {
            session.readersActive().set(false);
            releaseSession(session);
            currentSession.compareAndSet(session, null);
        }
    }

    /**
     * 将命令序列化为一行 JSON 放入出站队列，立即返回。
     * 命令按入队顺序写入并刷新，并发调用者的写入不会交错。
     *
     * @return 该命令写入完成时完成的 future；写入失败时以 WorkerTransportException 异常完成。
     * @throws WorkerTransportException 没有活动会话时。
     */
    public CompletableFuture<Void> enqueueCommand(WorkerCommand command) {
        WorkerSession session = currentSession.get();
        if (session == null) {
            throw new WorkerTransportException("Python backend is not running.");
        }
        return enqueueLine(session, codec.encode(command))
                .thenRun(() -> log.debug("已发送命令: {}", command.cmd()));
    }

    /**
     * 入队并等待命令写入完成。调用方会一直等到排在前面的命令都被后端读取，不要在事件投递线程上调用。
     *
     * @throws WorkerTransportException 没有活动会话或写入失败时。
     */
    void sendCommand(WorkerCommand command) {
        AsyncResults.await(enqueueCommand(command));
    }

    private CompletableFuture<Void> enqueueLine(WorkerSession session, String line) {
        try {
            return CompletableFuture.runAsync(() -> writeLine(session, line), outboundExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new WorkerTransportException("Python backend bridge is shut down.", e));
        }
    }

    // 只在出站线程上调用
    private static void writeLine(WorkerSession session, String line) {
        try {
            session.writer().write(line);
            session.writer().write('\n');
            session.writer().flush();
        } catch (IOException e) {
            throw new WorkerTransportException("Failed to write to Python backend: " + e.getMessage(), e);
        }
    }

    private CompletableFuture<Void> startReader(
            WorkerSession session, InputStream stream, String streamName, Consumer<String> lineHandler) {
        return CompletableFuture.runAsync(
                () -> {
                    try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                        String line;
                        while (session.readersActive().get() && (line = reader.readLine()) != null) {
                            lineHandler.accept(line);
                        }
                    } catch (IOException e) {
                        // 进程被终止时流会被关闭，这是正常现象
                        if (session.readersActive().get()) {
                            log.warn("读取后端 {} 时出错: {}", streamName, e.getMessage());
                        }
                    } finally {
                        log.debug("后端 {} 读取线程已结束。", streamName);
                    }
                },
                readerExecutor);
    }

    private void handleProcessExit(WorkerSession session, Process process) {
        if (!session.markCrashed()) {
            log.info("后端进程 PID {} 已按预期退出。", process.pid());
            return;
        }
        int exitCode = process.exitValue();
        log.error("后端进程 PID {} 意外退出，退出码: {}", process.pid(), exitCode);
        eventDispatcher.publish(new WorkerExitedEvent(exitCode));
        if (currentSession.compareAndSet(session, null)) {
            releaseSession(session);
        }
    }

    private static void destroyProcessTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    /**
     * 在出站线程上关闭标准输入，排在已入队的命令之后。
     */
    private void releaseSession(WorkerSession session) {
        try {
            outboundExecutor.execute(() -> closeWriter(session));
        } catch (RejectedExecutionException e) {
            closeWriter(session);
        }
    }

    private static void closeWriter(WorkerSession session) {
        try {
            session.writer().close();
        } catch (IOException e) {
            log.debug("关闭后端标准输入时出错: {}", e.getMessage());
        }
    }

    /**
     * 后端及其依赖检查进程共用的环境变量。
     */
    static Map<String, String> backendEnvironment(Settings settings) {
        Map<String, String> environment = new HashMap<>();
        if (StringUtils.hasText(settings.getHuggingFaceToken())) {
            environment.put("HF_TOKEN", settings.getHuggingFaceToken());
        }
        environment.put("PYTHONUTF8", "1");
        environment.put("PYTHONIOENCODING", "utf-8");
        return environment;
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 WorkerBridgeService...");
        stop();
        readerExecutor.shutdownNow();
        outboundExecutor.shutdown();
        try {
            if (!outboundExecutor.awaitTermination(STOP_GRACE_PERIOD.toMillis(), TimeUnit.MILLISECONDS)) {
                outboundExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            outboundExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
