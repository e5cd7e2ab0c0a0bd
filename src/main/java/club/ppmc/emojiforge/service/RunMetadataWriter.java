/**
 * RunMetadataWriter.java
 *
 * 将运行元数据以 JSON 格式写入运行输出目录下的 run_metadata.json。
 * 每次写入都会完整覆盖上一次的内容。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.model.RunMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RunMetadataWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunMetadataWriter.class);
    public static final String FILE_NAME = "run_metadata.json";

    private final ObjectMapper objectMapper;

    public RunMetadataWriter() {
        this.objectMapper =
                new ObjectMapper()
                        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                        .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path write(Path runDirectory, RunMetadata metadata) throws IOException {
        Path target = runDirectory.resolve(FILE_NAME);
        if (Files.notExists(runDirectory)) {
            Files.createDirectories(runDirectory);
        }
        Files.write(target, objectMapper.writeValueAsBytes(metadata));
        LOGGER.debug("已写入运行元数据 {} (partial={})", target, metadata.partial());
        return target;
    }
}
