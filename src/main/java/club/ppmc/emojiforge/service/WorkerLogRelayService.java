/**
 * WorkerLogRelayService.java
 *
 * 将后端的非结构化输出（无法解析的 stdout 行、stderr、依赖检查输出）转发到前端日志面板。
 * 每行日志都会立即写入应用日志，但推送到WebSocket时按固定间隔批量发送，
 * 避免模型下载等场景下大量的进度行淹没消息通道。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.protocol.WorkerEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.LogEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class WorkerLogRelayService {

    private final WebSocketNotificationService notificationService;
    private final WorkerEventDispatcher eventDispatcher;
    private final Queue<String> pendingLines = new ConcurrentLinkedQueue<>();
    private final WorkerEventListener eventListener = this::onEvent;

    public WorkerLogRelayService(
            WebSocketNotificationService notificationService, WorkerEventDispatcher eventDispatcher) {
        this.notificationService = notificationService;
        this.eventDispatcher = eventDispatcher;
    }

    @PostConstruct
    public void init() {
        eventDispatcher.subscribe(eventListener);
    }

    void onEvent(WorkerEvent event) {
        if (event instanceof LogEvent logEvent) {
            switch (logEvent.source()) {
                case STDERR -> log.info("[python:stderr] {}", logEvent.line());
                case BRIDGE -> log.info("[bridge] {}", logEvent.line());
                default -> log.debug("[python:stdout] {}", logEvent.line());
            }
            pendingLines.add(logEvent.line());
        }
    }

    /**
     * 定时任务，每200毫秒执行一次，把累积的日志行作为一批推送。没有新日志时不发送。
     */
    @Scheduled(fixedDelayString = "${app.worker.log-flush-interval-ms:200}")
    public void flush() {
        List<String> batch = new ArrayList<>();
        String line;
        while ((line = pendingLines.poll()) != null) {
            batch.add(line);
        }
        if (batch.isEmpty()) {
            return;
        }
        try {
            notificationService.sendWorkerLog(batch);
        } catch (RuntimeException e) {
            log.error("推送后端日志时出错", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        eventDispatcher.unsubscribe(eventListener);
        flush();
    }
}
