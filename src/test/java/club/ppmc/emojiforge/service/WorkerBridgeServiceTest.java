package club.ppmc.emojiforge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import club.ppmc.emojiforge.exception.WorkerStartupException;
import club.ppmc.emojiforge.exception.WorkerTransportException;
import club.ppmc.emojiforge.model.GenerationSettings;
import club.ppmc.emojiforge.model.Settings;
import club.ppmc.emojiforge.protocol.CommandLineDecoder;
import club.ppmc.emojiforge.protocol.MessageCodec;
import club.ppmc.emojiforge.protocol.WorkerCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.CancelCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.GenerateCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.InitCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.QuitCommand;
import club.ppmc.emojiforge.protocol.WorkerEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.LogEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.LogSource;
import club.ppmc.emojiforge.protocol.WorkerEvent.ReadyEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.WorkerExitedEvent;
import club.ppmc.emojiforge.util.FakeWorkerProcess;
import club.ppmc.emojiforge.util.WorkerProcessLauncher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * WorkerBridgeService 单元测试，使用内存中的进程替身代替真实的 Python 进程。
 */
@ExtendWith(MockitoExtension.class)
class WorkerBridgeServiceTest {

    private static final long TIMEOUT_MS = 2000;

    @TempDir
    Path backendDirectory;

    @Mock
    private DependencyBootstrapper dependencyBootstrapper;

    private final MessageCodec codec = new MessageCodec();
    private final BlockingQueue<WorkerEvent> events = new LinkedBlockingQueue<>();
    private final List<Launch> launches = new ArrayList<>();
    private FakeWorkerProcess nextProcess;
    private WorkerEventDispatcher dispatcher;
    private WorkerBridgeService bridge;
    private Settings settings;

    private record Launch(List<String> command, Path workingDirectory, Map<String, String> environment) {}

    @BeforeEach
    void setUp() throws IOException {
        Path script = Files.createFile(backendDirectory.resolve("main.py"));
        settings = new Settings();
        settings.setPythonExecutablePath("python3");
        settings.setBackendScriptPath(script.toString());
        settings.setModelPath("/models/flux");
        settings.setDevice("cpu");
        settings.setHuggingFaceToken("hf_secret");

        nextProcess = FakeWorkerProcess.cooperative();
        WorkerProcessLauncher launcher =
                (command, workingDirectory, environment) -> {
                    launches.add(new Launch(command, workingDirectory, environment));
                    return nextProcess;
                };

        dispatcher = new WorkerEventDispatcher();
        dispatcher.subscribe(events::add);
        bridge = new WorkerBridgeService(codec, dispatcher, dependencyBootstrapper, launcher);
    }

    @AfterEach
    void tearDown() {
        bridge.shutdown();
        dispatcher.shutdown();
    }

    private WorkerCommand nextCommand(FakeWorkerProcess process) throws Exception {
        String line = process.nextCommand(TIMEOUT_MS);
        assertThat(line).as("expected a command on stdin").isNotNull();
        return CommandLineDecoder.decode(line);
    }

    private WorkerEvent nextEvent() throws InterruptedException {
        WorkerEvent event = events.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS);
        assertThat(event).as("expected an event").isNotNull();
        return event;
    }

    private void drainDispatcher() {
        dispatcher.submit(() -> null).join();
    }

    @Test
    @DisplayName("启动时在脚本目录中运行解释器，并立即发送 init 命令")
    void startSpawnsAndSendsInit() throws Exception {
        // when
        bridge.start(settings);

        // then
        assertThat(bridge.isRunning()).isTrue();
        assertThat(launches).singleElement().satisfies(launch -> {
            assertThat(launch.command())
                    .containsExactly("python3", backendDirectory.resolve("main.py").toString());
            assertThat(launch.workingDirectory()).isEqualTo(backendDirectory);
            assertThat(launch.environment())
                    .containsEntry("HF_TOKEN", "hf_secret")
                    .containsEntry("PYTHONUTF8", "1")
                    .containsEntry("PYTHONIOENCODING", "utf-8");
        });
        assertThat(nextCommand(nextProcess)).isEqualTo(new InitCommand("/models/flux", "cpu", null, false));
        verify(dependencyBootstrapper).ensureDependencies(any(Settings.class), any(Path.class));
    }

    @Test
    @DisplayName("已有存活的会话时，再次启动什么也不做")
    void startIsNoOpWhenRunning() {
        bridge.start(settings);
        bridge.start(settings);

        assertThat(launches).hasSize(1);
    }

    @Test
    @DisplayName("标准输出的 JSON 行被解析为事件，其他行作为日志")
    void stdoutLinesAreDecoded() throws Exception {
        bridge.start(settings);

        nextProcess.stdout().println("{\"type\":\"ready\",\"mode\":\"diffusion\",\"fallback\":false,\"message\":\"Model loaded\"}");
        nextProcess.stdout().println("Fetching 4 files: 100%");

        assertThat(nextEvent()).isEqualTo(new ReadyEvent("diffusion", false, "Model loaded"));
        assertThat(nextEvent()).isEqualTo(new LogEvent("Fetching 4 files: 100%", LogSource.STDOUT));
    }

    @Test
    @DisplayName("标准错误的每一行都作为日志事件发布")
    void stderrLinesBecomeLogs() throws Exception {
        bridge.start(settings);

        nextProcess.stderr().println("{\"type\":\"ready\"}");

        assertThat(nextEvent()).isEqualTo(new LogEvent("{\"type\":\"ready\"}", LogSource.STDERR));
    }

    @Test
    @DisplayName("命令按调用顺序逐行写入")
    void sendCommandWritesOneLinePerCommand() throws Exception {
        bridge.start(settings);
        nextCommand(nextProcess);

        bridge.sendCommand(new CancelCommand());

        assertThat(nextProcess.nextCommand(TIMEOUT_MS)).isEqualTo("{\"cmd\":\"cancel\"}");
    }

    @Test
    @DisplayName("多个线程并发发送命令时，每一行都是一条完整的命令")
    void concurrentSendsDoNotInterleave() throws Exception {
        // given
        bridge.start(settings);
        nextCommand(nextProcess);
        int threads = 8;
        int commandsPerThread = 50;
        var settingsPayload = new GenerationSettings(0.1f, 30, 1.0f, 42L, 512, true, 1.0f, false, 1);
        String longPrompt = "pixel art ".repeat(200);
        ExecutorService senders = Executors.newFixedThreadPool(threads);
        var ready = new CountDownLatch(threads);

        // when
        try {
            List<CompletableFuture<Void>> sends =
                    IntStream.range(0, threads)
                            .mapToObj(
                                    thread ->
                                            CompletableFuture.runAsync(
                                                    () -> {
                                                        ready.countDown();
                                                        try {
                                                            ready.await();
                                                        } catch (InterruptedException e) {
                                                            Thread.currentThread().interrupt();
                                                        }
                                                        for (int i = 0; i < commandsPerThread; i++) {
                                                            bridge.sendCommand(
                                                                    new GenerateCommand(
                                                                            "job-" + thread + "-" + i,
                                                                            "😀",
                                                                            longPrompt,
                                                                            "/out/emoji_1F600_s42.png",
                                                                            settingsPayload));
                                                        }
                                                    },
                                                    senders))
                            .toList();
            CompletableFuture.allOf(sends.toArray(CompletableFuture[]::new)).get(10, TimeUnit.SECONDS);
        } finally {
            senders.shutdownNow();
        }

        // then
        List<WorkerCommand> received = new ArrayList<>();
        for (int i = 0; i < threads * commandsPerThread; i++) {
            received.add(nextCommand(nextProcess));
        }
        assertThat(nextProcess.nextCommand(50)).isNull();
        assertThat(received).allSatisfy(command -> assertThat(command).isInstanceOf(GenerateCommand.class));
        Set<String> jobIds =
                received.stream().map(command -> ((GenerateCommand) command).jobId()).collect(Collectors.toSet());
        assertThat(jobIds).hasSize(threads * commandsPerThread);
    }

    @Test
    @DisplayName("后端不再读取标准输入时，入队立即返回；进程退出后积压的命令以传输错误结束")
    void enqueueDoesNotWaitForStalledStdin() throws Exception {
        // given
        nextProcess = FakeWorkerProcess.stopsReadingStdinAfter(1);
        bridge.start(settings);
        FakeWorkerProcess process = nextProcess;
        assertThat(nextCommand(process)).isInstanceOf(InitCommand.class);

        // when
        long startedAt = System.nanoTime();
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            writes.add(bridge.enqueueCommand(new CancelCommand()));
        }
        Duration enqueueTime = Duration.ofNanos(System.nanoTime() - startedAt);

        // then
        assertThat(enqueueTime).isLessThan(Duration.ofSeconds(1));
        assertThat(writes).noneMatch(CompletableFuture::isDone);

        process.exit(1);

        assertThat(writes.get(0))
                .failsWithin(Duration.ofSeconds(2))
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(WorkerTransportException.class);
        assertThat(writes.get(writes.size() - 1)).failsWithin(Duration.ofSeconds(2));
        assertThat(nextEvent()).isEqualTo(new WorkerExitedEvent(1));
    }

    @Test
    @DisplayName("进程意外退出时恰好发布一个错误事件，会话随之失效")
    void unexpectedExitPublishesOneError() throws Exception {
        bridge.start(settings);

        nextProcess.exit(1);

        assertThat(nextEvent()).isEqualTo(new WorkerExitedEvent(1));
        drainDispatcher();
        assertThat(events).noneMatch(WorkerExitedEvent.class::isInstance);
        assertThat(bridge.isRunning()).isFalse();
        assertThatThrownBy(() -> bridge.sendCommand(new CancelCommand()))
                .isInstanceOf(WorkerTransportException.class)
                .hasMessage("Python backend is not running.");
    }

    @Test
    @DisplayName("主动停止时发送 quit，且不发布错误事件")
    void stopSendsQuitWithoutError() throws Exception {
        bridge.start(settings);
        FakeWorkerProcess process = nextProcess;
        nextCommand(process);

        bridge.stop();

        assertThat(nextCommand(process)).isInstanceOf(QuitCommand.class);
        assertThat(process.isAlive()).isFalse();
        assertThat(process.wasForciblyDestroyed()).isFalse();
        drainDispatcher();
        assertThat(events).noneMatch(WorkerExitedEvent.class::isInstance);
        assertThat(bridge.isRunning()).isFalse();

        bridge.stop();
    }

    @Test
    @DisplayName("进程在宽限期内未退出时被强制终止")
    void stopForceKillsAfterGracePeriod() {
        nextProcess = FakeWorkerProcess.stubborn();
        bridge.start(settings);
        FakeWorkerProcess process = nextProcess;

        bridge.stop();

        assertThat(process.wasForciblyDestroyed()).isTrue();
        drainDispatcher();
        assertThat(events).noneMatch(WorkerExitedEvent.class::isInstance);
    }

    @Test
    @DisplayName("停止后可以重新启动一个新会话")
    void restartAfterStop() throws Exception {
        bridge.start(settings);
        bridge.stop();

        nextProcess = FakeWorkerProcess.cooperative();
        bridge.start(settings);

        assertThat(launches).hasSize(2);
        assertThat(nextCommand(nextProcess)).isInstanceOf(InitCommand.class);
    }

    @Test
    @DisplayName("没有会话时发送命令抛出 WorkerTransportException")
    void sendWithoutSessionFails() {
        assertThatThrownBy(() -> bridge.sendCommand(new CancelCommand()))
                .isInstanceOf(WorkerTransportException.class);
    }

    @Test
    @DisplayName("脚本不存在时抛出 WorkerStartupException 且不创建进程")
    void missingScriptFailsStartup() {
        settings.setBackendScriptPath(backendDirectory.resolve("missing.py").toString());

        assertThatThrownBy(() -> bridge.start(settings))
                .isInstanceOf(WorkerStartupException.class)
                .hasMessageContaining("Python backend script not found");
        assertThat(launches).isEmpty();
    }

    @Test
    @DisplayName("依赖检查失败时不创建进程")
    void bootstrapFailurePreventsSpawn() {
        doThrow(new WorkerStartupException("Backend dependency check failed (exit 1). No module named torch"))
                .when(dependencyBootstrapper)
                .ensureDependencies(any(Settings.class), any(Path.class));

        assertThatThrownBy(() -> bridge.start(settings))
                .isInstanceOf(WorkerStartupException.class)
                .hasMessageContaining("No module named torch");
        assertThat(launches).isEmpty();
        assertThat(bridge.isRunning()).isFalse();
    }

    @Test
    @DisplayName("进程无法创建时抛出 WorkerStartupException")
    void spawnFailureIsStartupError() {
        WorkerProcessLauncher failing =
                (command, workingDirectory, environment) -> {
                    throw new IOException("No such file or directory");
                };
        var failingBridge = new WorkerBridgeService(codec, dispatcher, dependencyBootstrapper, failing);

        assertThatThrownBy(() -> failingBridge.start(settings))
                .isInstanceOf(WorkerStartupException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("未配置访问令牌时不设置 HF_TOKEN")
    void environmentWithoutToken() {
        settings.setHuggingFaceToken(" ");

        assertThat(WorkerBridgeService.backendEnvironment(settings)).doesNotContainKey("HF_TOKEN");
    }
}
