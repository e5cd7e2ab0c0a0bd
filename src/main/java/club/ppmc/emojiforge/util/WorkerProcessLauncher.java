package club.ppmc.emojiforge.util;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 创建外部进程的唯一入口。生产环境使用 {@link ProcessBuilder}，测试中可以替换为模拟进程。
 */
@FunctionalInterface
public interface WorkerProcessLauncher {

    /**
     * @param command 可执行文件及其参数。
     * @param workingDirectory 工作目录。
     * @param environment 追加到继承环境变量之上的变量。
     * @return 已启动的进程，标准输入、输出和错误流均为管道。
     */
    Process launch(List<String> command, Path workingDirectory, Map<String, String> environment)
            throws IOException;

    static WorkerProcessLauncher processBuilder() {
        return (command, workingDirectory, environment) -> {
            var processBuilder = new ProcessBuilder(command).directory(workingDirectory.toFile());
            processBuilder.environment().putAll(environment);
            return processBuilder.start();
        };
    }
}
