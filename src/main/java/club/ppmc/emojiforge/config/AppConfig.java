/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义应用级别的Bean：用于计时和生成时间戳的系统时钟，以及创建后端进程的启动器。
 */
package club.ppmc.emojiforge.config;

import club.ppmc.emojiforge.util.WorkerProcessLauncher;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 运行计时、ETA 和元数据时间戳使用的时钟。测试中可以替换为固定时钟。
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * 基于 ProcessBuilder 的进程启动器，Python 后端和依赖检查脚本都通过它创建。
     */
    @Bean
    public WorkerProcessLauncher workerProcessLauncher() {
        return WorkerProcessLauncher.processBuilder();
    }
}
