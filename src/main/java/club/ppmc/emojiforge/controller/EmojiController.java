/**
 * EmojiController.java
 *
 * 该控制器提供 emoji 目录的查询与重新加载，以及将用户输入的文本解析为目标 emoji 列表。
 */
package club.ppmc.emojiforge.controller;

import club.ppmc.emojiforge.exception.ForgeException;
import club.ppmc.emojiforge.model.EmojiInfo;
import club.ppmc.emojiforge.service.EmojiCatalogService;
import club.ppmc.emojiforge.service.EmojiSelectionResolver;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/emojis")
@Slf4j
public class EmojiController {

    private final EmojiCatalogService catalogService;
    private final EmojiSelectionResolver selectionResolver;

    public EmojiController(EmojiCatalogService catalogService, EmojiSelectionResolver selectionResolver) {
        this.catalogService = catalogService;
        this.selectionResolver = selectionResolver;
    }

    /**
     * 返回最近一次加载的目录。后端尚未启动时为空列表。
     */
    @GetMapping
    public ResponseEntity<List<EmojiInfo>> list() {
        return ResponseEntity.ok(catalogService.currentCatalog());
    }

    /**
     * 向后端重新请求目录。
     */
    @PostMapping("/reload")
    public ResponseEntity<?> reload() {
        try {
            return ResponseEntity.ok(catalogService.loadCatalog());
        } catch (ForgeException e) {
            log.warn("重新加载 emoji 目录失败: {}", e.getMessage());
            return ErrorResponses.of(e);
        }
    }

    /**
     * 将一段文本解析为目标 emoji 列表，用于在开始生成前预览选择结果。
     */
    @PostMapping("/resolve")
    public ResponseEntity<List<EmojiInfo>> resolve(@RequestBody Map<String, String> payload) {
        String text = payload.getOrDefault("text", "");
        return ResponseEntity.ok(selectionResolver.resolve(text, catalogService.currentCatalog()));
    }
}
