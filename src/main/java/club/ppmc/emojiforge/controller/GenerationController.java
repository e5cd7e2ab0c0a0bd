/**
 * GenerationController.java
 *
 * 该控制器处理生成运行的开始、取消和状态查询。
 * 它把请求体和当前设置合并为一个 GenerationRequest，交给 GenerationOrchestratorService 处理。
 */
package club.ppmc.emojiforge.controller;

import club.ppmc.emojiforge.exception.ForgeException;
import club.ppmc.emojiforge.exception.GenerationValidationException;
import club.ppmc.emojiforge.model.EmojiInfo;
import club.ppmc.emojiforge.model.GenerationMode;
import club.ppmc.emojiforge.model.GenerationRequest;
import club.ppmc.emojiforge.model.GenerationSettings;
import club.ppmc.emojiforge.model.GenerationStartRequest;
import club.ppmc.emojiforge.model.RunSnapshot;
import club.ppmc.emojiforge.model.Settings;
import club.ppmc.emojiforge.service.EmojiCatalogService;
import club.ppmc.emojiforge.service.EmojiSelectionResolver;
import club.ppmc.emojiforge.service.GenerationOrchestratorService;
import club.ppmc.emojiforge.service.SettingsService;
import jakarta.validation.Valid;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/generation")
@Slf4j
public class GenerationController {

    private final GenerationOrchestratorService orchestrator;
    private final EmojiCatalogService catalogService;
    private final EmojiSelectionResolver selectionResolver;
    private final SettingsService settingsService;

    public GenerationController(
            GenerationOrchestratorService orchestrator,
            EmojiCatalogService catalogService,
            EmojiSelectionResolver selectionResolver,
            SettingsService settingsService) {
        this.orchestrator = orchestrator;
        this.catalogService = catalogService;
        this.selectionResolver = selectionResolver;
        this.settingsService = settingsService;
    }

    /**
     * 开始一次生成运行。
     */
    @PostMapping
    public ResponseEntity<?> start(@Valid @RequestBody GenerationStartRequest body) {
        try {
            RunSnapshot snapshot = orchestrator.startRun(toGenerationRequest(body));
            return ResponseEntity.ok(snapshot);
        } catch (GenerationValidationException e) {
            return ErrorResponses.of(e);
        } catch (ForgeException e) {
            log.error("开始生成失败: {}", e.getMessage());
            return ErrorResponses.of(e);
        } catch (UncheckedIOException e) {
            log.error("创建输出目录失败", e);
            return ResponseEntity.internalServerError().body(Map.of("message", e.getMessage()));
        }
    }

    /**
     * 请求取消当前运行。
     */
    @PostMapping("/cancel")
    public ResponseEntity<RunSnapshot> cancel() {
        return ResponseEntity.ok(orchestrator.cancelRun());
    }

    @GetMapping("/status")
    public ResponseEntity<RunSnapshot> status() {
        return ResponseEntity.ok(orchestrator.currentRun());
    }

    private GenerationRequest toGenerationRequest(GenerationStartRequest body) {
        Settings settings = settingsService.getSettings();
        GenerationSettings generationSettings =
                GenerationSettings.fromSettings(settings, body.sameSeed(), body.effectiveBatchSize());
        if (body.seed() != null) {
            generationSettings = generationSettings.withSeed(body.seed());
        }
        boolean randomSeed = body.randomSeed() != null ? body.randomSeed() : settings.isRandomSeed();

        List<EmojiInfo> targets =
                body.mode() == GenerationMode.SELECTED
                        ? selectionResolver.resolve(body.selection(), catalogService.currentCatalog())
                        : List.of();
        return new GenerationRequest(body.prompt(), body.mode(), generationSettings, randomSeed, targets);
    }
}
