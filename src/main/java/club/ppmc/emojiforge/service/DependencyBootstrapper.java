/**
 * DependencyBootstrapper.java
 *
 * 在首次启动后端之前运行 check_dependencies.py --install，检查并按需安装 Python 依赖。
 * 检查脚本的输出通过日志通道实时转发；检查失败时启动中止。
 * 检查成功的结果在本实例的生命周期内缓存，之后的每次启动都不再重复检查。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.exception.WorkerStartupException;
import club.ppmc.emojiforge.model.Settings;
import club.ppmc.emojiforge.protocol.WorkerEvent.LogEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.LogSource;
import club.ppmc.emojiforge.util.SystemCommandExecutor;
import club.ppmc.emojiforge.util.SystemCommandExecutor.CommandResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class DependencyBootstrapper {

    static final String CHECKER_SCRIPT = "check_dependencies.py";

    private final SystemCommandExecutor commandExecutor;
    private final WorkerEventDispatcher eventDispatcher;
    private final Duration timeout;
    private volatile boolean dependenciesValidated;

    public DependencyBootstrapper(
            SystemCommandExecutor commandExecutor,
            WorkerEventDispatcher eventDispatcher,
            @Value("${app.worker.bootstrap-timeout:PT30M}") Duration timeout) {
        this.commandExecutor = commandExecutor;
        this.eventDispatcher = eventDispatcher;
        this.timeout = timeout;
    }

    boolean isValidated() {
        return dependenciesValidated;
    }

    /**
     * 确保后端依赖可用。检查脚本不存在时视为通过。
     *
     * @param settings 当前设置，用于确定解释器、设备和访问令牌。
     * @param backendScript 已解析的后端入口脚本，检查脚本位于同一目录。
     * @throws WorkerStartupException 检查进程无法启动、超时或以非零退出码结束时。
     */
    public synchronized void ensureDependencies(Settings settings, Path backendScript) {
        if (dependenciesValidated) {
            return;
        }

        Path backendDirectory = backendScript.getParent();
        Path checkerScript = backendDirectory.resolve(CHECKER_SCRIPT);
        if (!Files.isRegularFile(checkerScript)) {
            log.info("未找到依赖检查脚本 {}，跳过依赖检查。", checkerScript);
            dependenciesValidated = true;
            return;
        }

        List<String> command = new ArrayList<>();
        command.add(settings.getPythonExecutablePath());
        command.add(checkerScript.toString());
        command.add("--install");
        if ("cuda".equalsIgnoreCase(settings.getDevice())) {
            command.add("--require-cuda");
        }

        publishLog("Checking backend dependencies...");
        CommandResult result = runChecker(command, backendDirectory, settings);

        if (result.timedOut()) {
            throw new WorkerStartupException(
                    "Backend dependency check timed out after " + timeout.toMinutes() + " minutes.",
                    String.join(System.lineSeparator(), result.stdout()),
                    null);
        }
        if (result.exitCode() != 0) {
            String stderr = String.join(System.lineSeparator(), result.stderr());
            String diagnostics = stderr.isBlank() ? String.join(System.lineSeparator(), result.stdout()) : stderr;
            log.error("后端依赖检查失败，退出码: {}", result.exitCode());
            throw new WorkerStartupException(
                    ("Backend dependency check failed (exit " + result.exitCode() + "). " + diagnostics).trim(),
                    diagnostics,
                    null);
        }

        dependenciesValidated = true;
        publishLog("Dependencies OK.");
    }

    private CommandResult runChecker(List<String> command, Path backendDirectory, Settings settings) {
        try {
            return commandExecutor
                    .executeCommand(
                            command,
                            backendDirectory,
                            WorkerBridgeService.backendEnvironment(settings),
                            timeout,
                            this::publishLog)
                    .get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerStartupException("Interrupted while checking backend dependencies.", e);
        } catch (ExecutionException e) {
            throw new WorkerStartupException(
                    "Failed to start dependency check process: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private void publishLog(String line) {
        eventDispatcher.publish(new LogEvent(line, LogSource.BRIDGE));
    }
}
