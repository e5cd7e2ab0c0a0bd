/**
 * WorkerController.java
 *
 * 该控制器负责 Python 后端进程的启动、停止和状态查询。
 * 启动成功后会立即加载一次 emoji 目录。
 */
package club.ppmc.emojiforge.controller;

import club.ppmc.emojiforge.exception.ForgeException;
import club.ppmc.emojiforge.model.EmojiInfo;
import club.ppmc.emojiforge.model.WorkerStatus;
import club.ppmc.emojiforge.service.EmojiCatalogService;
import club.ppmc.emojiforge.service.GenerationOrchestratorService;
import club.ppmc.emojiforge.service.SettingsService;
import club.ppmc.emojiforge.service.WorkerBridgeService;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/worker")
@Slf4j
public class WorkerController {

    private final WorkerBridgeService bridge;
    private final EmojiCatalogService catalogService;
    private final GenerationOrchestratorService orchestrator;
    private final SettingsService settingsService;

    public WorkerController(
            WorkerBridgeService bridge,
            EmojiCatalogService catalogService,
            GenerationOrchestratorService orchestrator,
            SettingsService settingsService) {
        this.bridge = bridge;
        this.catalogService = catalogService;
        this.orchestrator = orchestrator;
        this.settingsService = settingsService;
    }

    /**
     * 启动后端并加载 emoji 目录。首次启动时可能包含耗时较长的依赖安装。
     */
    @PostMapping("/start")
    public ResponseEntity<?> start() {
        try {
            bridge.start(settingsService.getSettings());
            List<EmojiInfo> catalog = catalogService.loadCatalog();
            return ResponseEntity.ok(Map.of("message", "Python 后端已启动。", "emojiCount", catalog.size()));
        } catch (ForgeException e) {
            log.error("启动后端失败: {}", e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    /**
     * 停止后端进程。
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop() {
        orchestrator.stopWorker();
        return ResponseEntity.ok(Map.of("message", "已向 Python 后端发送停止信号。"));
    }

    @GetMapping("/status")
    public ResponseEntity<WorkerStatus> status() {
        return ResponseEntity.ok(orchestrator.workerStatus());
    }
}
