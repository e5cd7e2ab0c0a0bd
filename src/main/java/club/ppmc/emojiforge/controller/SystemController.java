/**
 * SystemController.java
 *
 * 提供状态栏所需的系统信息。
 */
package club.ppmc.emojiforge.controller;

import club.ppmc.emojiforge.service.GpuInfoService;
import club.ppmc.emojiforge.service.SettingsService;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/system")
public class SystemController {

    private final GpuInfoService gpuInfoService;
    private final SettingsService settingsService;

    public SystemController(GpuInfoService gpuInfoService, SettingsService settingsService) {
        this.gpuInfoService = gpuInfoService;
        this.settingsService = settingsService;
    }

    @GetMapping("/gpu")
    public ResponseEntity<Map<String, String>> gpu() {
        return ResponseEntity.ok(Map.of("gpu", gpuInfoService.describe(settingsService.getSettings())));
    }
}
