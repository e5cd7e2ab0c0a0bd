/**
 * WebSocketNotificationService.java
 *
 * 统一的WebSocket消息发送服务。
 * 封装了 SimpMessagingTemplate 的使用细节，为运行状态、进度、输出预览、后端状态和后端日志
 * 提供各自的主题(topic)。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.model.GenerationProgress;
import club.ppmc.emojiforge.model.GenerationResult;
import club.ppmc.emojiforge.model.RunSnapshot;
import club.ppmc.emojiforge.model.WorkerStatus;
import java.util.List;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class WebSocketNotificationService {

    public static final String RUN_STATUS_TOPIC = "/topic/generation/status";
    public static final String PROGRESS_TOPIC = "/topic/generation/progress";
    public static final String RESULT_TOPIC = "/topic/generation/result";
    public static final String WORKER_STATUS_TOPIC = "/topic/worker/status";
    public static final String WORKER_LOG_TOPIC = "/topic/worker-log";

    private final SimpMessagingTemplate messagingTemplate;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    /**
     * 发送运行状态快照。前端据此切换开始/取消按钮的可用状态。
     */
    public void sendRunStatus(RunSnapshot snapshot) {
        sendMessage(RUN_STATUS_TOPIC, snapshot);
    }

    public void sendProgress(GenerationProgress progress) {
        sendMessage(PROGRESS_TOPIC, progress);
    }

    public void sendResult(GenerationResult result) {
        sendMessage(RESULT_TOPIC, result);
    }

    public void sendWorkerStatus(WorkerStatus status) {
        sendMessage(WORKER_STATUS_TOPIC, status);
    }

    /**
     * 发送一批后端日志行，按原始顺序排列。
     */
    public void sendWorkerLog(List<String> lines) {
        sendMessage(WORKER_LOG_TOPIC, lines);
    }

    /**
     * 向指定的WebSocket主题发送一个通用载荷(payload)。
     *
     * @param destination 目标WebSocket主题
     * @param payload 要发送的任何对象 (将被框架自动序列化为JSON)
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }
}
