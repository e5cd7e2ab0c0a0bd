/**
 * SettingsService.java
 *
 * 该服务是整个应用的配置中心，负责管理 EmojiForge 的所有可配置项。
 * 它处理配置的加载、更新和持久化，将配置信息以JSON格式存储在数据目录下的 settings.json 中。
 * 在首次启动时，它会使用 application.properties 中的值作为默认设置来创建配置文件。
 * 其他服务在每次需要时都从这里读取当前设置，而不是直接使用 @Value 注解。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.model.Settings;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    private static final String SETTINGS_FILE_NAME = "settings.json";

    private final Path settingsFilePath;
    private final ObjectMapper objectMapper;
    private volatile Settings currentSettings;

    // --- 用于首次初始化的默认值 ---
    private final String initialPythonExecutable;
    private final String initialBackendScript;
    private final String initialModelPath;
    private final String initialOutputDirectory;
    private final String initialDevice;
    private final String initialHuggingFaceToken;

    public SettingsService(
            @Value("${app.data-dir:./.emojiforge}") String dataDirectory,
            @Value("${app.worker.python:python}") String initialPythonExecutable,
            @Value("${app.worker.script:src/emojiforge_backend/main.py}") String initialBackendScript,
            @Value("${app.worker.model-path:" + Settings.DEFAULT_MODEL_ID + "}") String initialModelPath,
            @Value("${app.output-dir:./output}") String initialOutputDirectory,
            @Value("${app.worker.device:cuda}") String initialDevice,
            @Value("${HF_TOKEN:}") String initialHuggingFaceToken) {
        this.initialPythonExecutable = initialPythonExecutable;
        this.initialBackendScript = initialBackendScript;
        this.initialModelPath = initialModelPath;
        this.initialOutputDirectory = initialOutputDirectory;
        this.initialDevice = initialDevice;
        this.initialHuggingFaceToken = initialHuggingFaceToken;
        this.settingsFilePath = Paths.get(dataDirectory, SETTINGS_FILE_NAME).toAbsolutePath().normalize();
        this.objectMapper =
                new ObjectMapper()
                        .enable(SerializationFeature.INDENT_OUTPUT)
                        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @PostConstruct
    public void init() {
        try {
            Path settingsDir = this.settingsFilePath.getParent();
            if (Files.notExists(settingsDir)) {
                Files.createDirectories(settingsDir);
            }
            if (Files.exists(this.settingsFilePath)) {
                loadSettings();
            } else {
                createAndSaveDefaultSettings();
            }
        } catch (IOException e) {
            LOGGER.error("初始化设置失败。将使用临时的默认设置。", e);
            this.currentSettings = createDefaultSettings();
        }
    }

    public synchronized Settings getSettings() {
        return this.currentSettings;
    }

    public synchronized void updateSettings(Settings newSettings) throws IOException {
        this.currentSettings = newSettings;
        saveSettings();
    }

    Path getSettingsFilePath() {
        return settingsFilePath;
    }

    private void loadSettings() throws IOException {
        try {
            byte[] jsonData = Files.readAllBytes(settingsFilePath);
            this.currentSettings = objectMapper.readValue(jsonData, Settings.class);
            LOGGER.info("已成功从 {} 加载设置。", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("读取设置文件时出错。下次保存时将创建新的默认文件。", e);
            this.currentSettings = createDefaultSettings();
            throw e;
        }
    }

    private void saveSettings() throws IOException {
        try {
            byte[] jsonData = objectMapper.writeValueAsBytes(currentSettings);
            Files.write(settingsFilePath, jsonData);
            LOGGER.info("已成功将设置保存到 {}", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("将设置保存到文件 {} 时失败", settingsFilePath, e);
            throw e;
        }
    }

    private void createAndSaveDefaultSettings() throws IOException {
        this.currentSettings = createDefaultSettings();
        saveSettings();
        LOGGER.info("未找到设置文件。已在 {} 创建了包含默认值的新文件。", settingsFilePath);
    }

    private Settings createDefaultSettings() {
        var settings = new Settings();
        settings.setPythonExecutablePath(initialPythonExecutable);
        settings.setBackendScriptPath(initialBackendScript);
        settings.setModelPath(initialModelPath);
        settings.setDefaultOutputDirectory(initialOutputDirectory);
        settings.setDevice(initialDevice);
        if (StringUtils.hasText(initialHuggingFaceToken)) {
            settings.setHuggingFaceToken(initialHuggingFaceToken);
        }
        return settings;
    }
}
