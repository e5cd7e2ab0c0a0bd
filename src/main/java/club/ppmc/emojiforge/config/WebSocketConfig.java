/**
 * WebSocketConfig.java
 *
 * 配置Spring WebSocket和STOMP消息代理。
 * 该类负责定义WebSocket端点，配置消息代理（broker），并设置心跳机制以保持连接稳定。
 * 所有推送都是广播到 /topic 下的主题，前端没有需要发送到服务器的消息。
 */
package club.ppmc.emojiforge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    /**
     * 配置消息代理。
     * `/topic` 用于广播消息；STOMP 心跳为10秒发送、10秒接收，用于应用级别的存活检测。
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("ws-heartbeat-thread-");
        taskScheduler.initialize();

        config.enableSimpleBroker("/topic")
                .setHeartbeatValue(new long[] {10000, 10000}) // 10秒心跳
                .setTaskScheduler(taskScheduler);
        config.setApplicationDestinationPrefixes("/app");
    }

    /**
     * 注册STOMP端点 `/ws`，并启用 SockJS 作为不支持WebSocket时的降级方案。
     * SockJS 每隔25秒发送一个心跳帧，防止代理因长时间无数据而断开连接（例如等待模型加载时）。
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS()
                .setHeartbeatTime(25000); // 传输层心跳，防止代理超时
    }
}
