/**
 * SystemCommandExecutor.java
 *
 * 这是一个工具类，负责异步执行短生命周期的外部命令（例如后端依赖检查）。
 * 它接受一个命令列表（而不是单个字符串）以避免因路径中存在空格而导致的解析问题。
 * 标准输出和标准错误被分别收集，同时逐行交给调用方的消费者；执行结果通过 CompletableFuture 返回。
 * 等待进程和读取两个输出流都在本组件自有的线程池上进行，不占用公共 ForkJoinPool。
 */
package club.ppmc.emojiforge.util;

import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SystemCommandExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemCommandExecutor.class);

    private final WorkerProcessLauncher processLauncher;
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService commandThreads =
            Executors.newCachedThreadPool(
                    runnable -> {
                        var thread = new Thread(runnable, "system-command-" + threadCounter.incrementAndGet());
                        thread.setDaemon(true);
                        return thread;
                    });

    public SystemCommandExecutor(WorkerProcessLauncher processLauncher) {
        this.processLauncher = processLauncher;
    }

    /**
     * 一个已结束命令的结果。
     *
     * @param exitCode 退出码；超时时为 -1。
     * @param stdout 标准输出的所有行。
     * @param stderr 标准错误的所有行。
     * @param timedOut 是否因超时被强制终止。
     */
    public record CommandResult(int exitCode, List<String> stdout, List<String> stderr, boolean timedOut) {

        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }

    /**
     * 异步执行一个系统命令，并实时流式传输其标准输出和错误流。
     *
     * @param commandList 要执行的命令及其参数列表。
     * @param workingDirectory 命令执行的工作目录。
     * @param environment 额外的环境变量。
     * @param timeout 最长等待时间，超时后强制终止进程及其子进程。
     * @param outputConsumer 一个消费者，用于处理两个输出流中的每一行。
     * @return 一个CompletableFuture，当命令执行完毕时完成。进程无法启动时以 UncheckedIOException 异常完成。
     */
    public CompletableFuture<CommandResult> executeCommand(
            List<String> commandList,
            Path workingDirectory,
            Map<String, String> environment,
            Duration timeout,
            Consumer<String> outputConsumer) {
        return CompletableFuture.supplyAsync(
                () -> {
                    LOGGER.info("在目录 {} 中执行命令: {}", workingDirectory, String.join(" ", commandList));
                    Process process;
                    try {
                        process = processLauncher.launch(commandList, workingDirectory, environment);
                    } catch (IOException e) {
                        LOGGER.error("启动命令 {} 失败", commandList, e);
                        throw new UncheckedIOException(e);
                    }

                    List<String> stdout = Collections.synchronizedList(new ArrayList<>());
                    List<String> stderr = Collections.synchronizedList(new ArrayList<>());
                    CompletableFuture<Void> stdoutReader =
                            collectLines(process.getInputStream(), stdout, outputConsumer);
                    CompletableFuture<Void> stderrReader =
                            collectLines(process.getErrorStream(), stderr, outputConsumer);

                    try {
                        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                            LOGGER.warn("命令 {} 在 {} 内未结束，将强制终止。", commandList, timeout);
                            process.descendants().forEach(ProcessHandle::destroyForcibly);
                            process.destroyForcibly();
                            return new CommandResult(-1, List.copyOf(stdout), List.copyOf(stderr), true);
                        }
                        CompletableFuture.allOf(stdoutReader, stderrReader).join();
                        int exitCode = process.exitValue();
                        LOGGER.info("命令执行完毕，退出码: {}", exitCode);
                        return new CommandResult(exitCode, List.copyOf(stdout), List.copyOf(stderr), false);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt(); // 重新设置中断状态
                        process.destroyForcibly();
                        throw new CompletionException(e);
                    }
                },
                commandThreads);
    }

    private CompletableFuture<Void> collectLines(
            InputStream stream, List<String> sink, Consumer<String> outputConsumer) {
        return CompletableFuture.runAsync(
                () -> {
                    try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                        String line;
                        while ((line = reader.readLine()) != null) {
                            sink.add(line);
                            outputConsumer.accept(line);
                        }
                    } catch (IOException e) {
                        // 进程被强制终止时流会被关闭，这是正常现象
                        LOGGER.debug("读取命令输出时出错: {}", e.getMessage());
                    }
                },
                commandThreads);
    }

    @PreDestroy
    public void shutdown() {
        commandThreads.shutdownNow();
    }
}
