/**
 * EmojiForgeApplication.java
 *
 * Spring Boot 应用的主入口类。
 * @EnableWebSocketMessageBroker 注解用于启用 WebSocket 和 STOMP 消息代理功能。
 * @EnableScheduling 注解用于启用Spring的定时任务功能，供 WorkerLogRelayService 批量推送日志使用。
 */
package club.ppmc.emojiforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;

@SpringBootApplication
@EnableWebSocketMessageBroker
@EnableScheduling
public class EmojiForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmojiForgeApplication.class, args);
    }
}
