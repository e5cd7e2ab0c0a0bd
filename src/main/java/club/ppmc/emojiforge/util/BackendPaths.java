/**
 * BackendPaths.java
 *
 * 解析后端脚本和模型的实际路径。
 * 配置中的脚本路径通常是相对路径，应用可能从仓库根目录或其子目录启动，因此需要在若干候选位置中查找。
 */
package club.ppmc.emojiforge.util;

import club.ppmc.emojiforge.model.Settings;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.util.StringUtils;

public final class BackendPaths {

    static final Path DEFAULT_SCRIPT_RELATIVE_PATH = Paths.get("src", "emojiforge_backend", "main.py");
    private static final int MAX_PARENT_DEPTH = 10;

    private BackendPaths() {}

    /**
     * 解析后端入口脚本。绝对路径直接返回；相对路径依次尝试：相对工作目录、
     * 在工作目录的父目录中查找 src/emojiforge_backend/main.py。
     * 都不存在时返回第一个候选，由调用方报告“脚本不存在”。
     */
    public static Path resolveBackendScript(String configuredPath, Path workingDirectory) {
        Path configured = Paths.get(configuredPath);
        if (configured.isAbsolute()) {
            return configured.normalize();
        }

        Set<Path> candidates = new LinkedHashSet<>();
        candidates.add(workingDirectory.resolve(configured).toAbsolutePath().normalize());
        Path fromParents = findInParents(workingDirectory, DEFAULT_SCRIPT_RELATIVE_PATH);
        if (fromParents != null) {
            candidates.add(fromParents);
        }

        return candidates.stream()
                .filter(Files::isRegularFile)
                .findFirst()
                .orElse(candidates.iterator().next());
    }

    static Path findInParents(Path startDirectory, Path relativePath) {
        Path current = startDirectory.toAbsolutePath().normalize();
        for (int i = 0; i < MAX_PARENT_DEPTH && current != null; i++) {
            Path candidate = current.resolve(relativePath).normalize();
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            current = current.getParent();
        }
        return null;
    }

    /**
     * 如果配置的模型仍是默认的 HuggingFace 仓库ID，而模型已下载到本地缓存目录，则返回本地目录以避免重复下载。
     */
    public static String resolveModelPath(Settings settings) {
        String modelPath = settings.getModelPath();
        if (StringUtils.hasText(modelPath) && Files.isDirectory(Paths.get(modelPath))) {
            return modelPath;
        }
        String cacheDirectory = settings.getModelCacheDirectory();
        if (Settings.DEFAULT_MODEL_ID.equalsIgnoreCase(modelPath)
                && StringUtils.hasText(cacheDirectory)
                && Files.isDirectory(Paths.get(cacheDirectory))) {
            return cacheDirectory;
        }
        return modelPath;
    }
}
