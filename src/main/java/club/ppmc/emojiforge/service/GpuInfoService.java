/**
 * GpuInfoService.java
 *
 * 为状态栏提供一行 GPU 描述。它依赖于 Oshi 库进行跨平台的显卡信息获取。
 * 设备设置不是 cuda 时直接报告 CPU 模式。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.model.Settings;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import oshi.SystemInfo;
import oshi.hardware.GraphicsCard;
import oshi.hardware.HardwareAbstractionLayer;

@Service
@Slf4j
public class GpuInfoService {

    static final String CPU_MODE = "CPU mode";
    static final String UNKNOWN = "GPU: Unknown";
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final HardwareAbstractionLayer hardware;

    public GpuInfoService() {
        this.hardware = new SystemInfo().getHardware();
    }

    public String describe(Settings settings) {
        if (!"cuda".equalsIgnoreCase(settings.getDevice())) {
            return CPU_MODE;
        }
        try {
            return describe(hardware.getGraphicsCards());
        } catch (RuntimeException e) {
            log.warn("查询显卡信息失败: {}", e.getMessage());
            return UNKNOWN;
        }
    }

    static String describe(List<GraphicsCard> cards) {
        if (cards.isEmpty()) {
            return UNKNOWN;
        }
        GraphicsCard card = cards.get(0);
        if (card.getVRam() <= 0) {
            return "GPU: " + card.getName();
        }
        return String.format("%s | %d MB VRAM", card.getName(), card.getVRam() / BYTES_PER_MB);
    }
}
