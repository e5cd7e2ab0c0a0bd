package club.ppmc.emojiforge.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.emojiforge.exception.ProtocolException;
import club.ppmc.emojiforge.model.GenerationSettings;
import club.ppmc.emojiforge.protocol.WorkerCommand.CancelCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.GenerateAllCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.GenerateCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.InitCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.ListEmojisCommand;
import club.ppmc.emojiforge.protocol.WorkerCommand.QuitCommand;
import club.ppmc.emojiforge.protocol.WorkerEvent.CanceledEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.EmojiListEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.ErrorEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.LogEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.LogSource;
import club.ppmc.emojiforge.protocol.WorkerEvent.ProgressEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.ReadyEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.ResultEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.WorkerExitedEvent;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * MessageCodec 单元测试
 */
class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    @Nested
    @DisplayName("命令编码")
    class Encoding {

        @Test
        @DisplayName("generate 命令以 cmd 开头并使用 snake_case 字段")
        void generateCommandUsesSnakeCase() {
            // given
            var settings = new GenerationSettings(0.1f, 30, 1.0f, 43L, 512, true, 1.0f, false, 2);
            var command = new GenerateCommand("job-1", "😀", "pixel art", "/out/emoji_1F600_s43_b2.png", settings);

            // when
            String line = codec.encode(command);

            // then
            assertThat(line).startsWith("{\"cmd\":\"generate\"").doesNotContain("\n");
            JsonObject json = JsonParser.parseString(line).getAsJsonObject();
            assertThat(json.get("job_id").getAsString()).isEqualTo("job-1");
            assertThat(json.get("emoji").getAsString()).isEqualTo("😀");
            assertThat(json.get("output_path").getAsString()).isEqualTo("/out/emoji_1F600_s43_b2.png");
            JsonObject payload = json.getAsJsonObject("settings");
            assertThat(payload.get("num_inference_steps").getAsInt()).isEqualTo(30);
            assertThat(payload.get("guidance_scale").getAsFloat()).isEqualTo(1.0f);
            assertThat(payload.get("seed").getAsLong()).isEqualTo(43L);
            assertThat(payload.get("output_size_px").getAsInt()).isEqualTo(512);
            assertThat(payload.get("remove_background").getAsBoolean()).isTrue();
            assertThat(payload.get("remove_background_strength").getAsFloat()).isEqualTo(1.0f);
            assertThat(payload.get("same_seed").getAsBoolean()).isFalse();
            assertThat(payload.get("batch_size").getAsInt()).isEqualTo(2);
        }

        @Test
        @DisplayName("init 命令包含模型、设备、字体和CPU卸载开关")
        void initCommandFields() {
            String line = codec.encode(new InitCommand("/models/flux", "cuda", null, true));

            JsonObject json = JsonParser.parseString(line).getAsJsonObject();
            assertThat(json.get("cmd").getAsString()).isEqualTo("init");
            assertThat(json.get("model_path").getAsString()).isEqualTo("/models/flux");
            assertThat(json.get("device").getAsString()).isEqualTo("cuda");
            assertThat(json.get("enable_cpu_offload").getAsBoolean()).isTrue();
        }

        @Test
        @DisplayName("提示词中的换行被转义，输出仍为单行")
        void newlinesAreEscaped() {
            var settings = new GenerationSettings(0.1f, 30, 1.0f, 1L, 512, true, 1.0f, false, 1);
            String line = codec.encode(new GenerateCommand("j", "😀", "line one\nline two", "/o.png", settings));

            assertThat(line).doesNotContain("\n");
            assertThat(JsonParser.parseString(line).getAsJsonObject().get("prompt").getAsString())
                    .isEqualTo("line one\nline two");
        }

        @Test
        @DisplayName("无字段的命令只包含 cmd")
        void emptyCommand() {
            assertThat(codec.encode(new ListEmojisCommand())).isEqualTo("{\"cmd\":\"list_emojis\"}");
        }

        @Test
        @DisplayName("编码后的命令可以被重新解析")
        void commandCanBeDecoded() throws ProtocolException {
            var command = new InitCommand("m", "cpu", "/fonts/emoji.ttf", false);

            assertThat(codec.decodeCommand(codec.encode(command))).isEqualTo(command);
        }
    }

    @Nested
    @DisplayName("事件解码")
    class Decoding {

        @Test
        @DisplayName("解析 ready 事件")
        void ready() {
            WorkerEvent event = codec.decode("{\"type\":\"ready\",\"mode\":\"diffusion\",\"fallback\":false,\"message\":\"ok\"}");

            assertThat(event).isEqualTo(new ReadyEvent("diffusion", false, "ok"));
        }

        @Test
        @DisplayName("解析 progress 事件")
        void progress() {
            WorkerEvent event = codec.decode("{\"type\":\"progress\",\"current\":3,\"total\":10,\"emoji\":\"😀\"}");

            assertThat(event).isEqualTo(new ProgressEvent(3, 10, "😀"));
        }

        @Test
        @DisplayName("result 事件缺少 job_id 和 skipped 时使用默认值")
        void resultWithoutOptionalFields() {
            WorkerEvent event = codec.decode("{\"type\":\"result\",\"output_path\":\"/o/a.png\",\"emoji\":\"😀\"}");

            assertThat(event).isEqualTo(new ResultEvent(null, "/o/a.png", "😀", false));
        }

        @Test
        @DisplayName("解析带 job_id 的 error 事件")
        void error() {
            WorkerEvent event = codec.decode("{\"type\":\"error\",\"job_id\":\"j1\",\"message\":\"CUDA out of memory\"}");

            assertThat(event).isEqualTo(new ErrorEvent("j1", "CUDA out of memory"));
        }

        @Test
        @DisplayName("emoji_list 保留原始数组")
        void emojiList() {
            WorkerEvent event =
                    codec.decode("{\"type\":\"emoji_list\",\"emojis\":[{\"char\":\"😀\",\"name\":\"grinning face\"}]}");

            assertThat(event).isInstanceOf(EmojiListEvent.class);
            assertThat(((EmojiListEvent) event).emojis().getAsJsonArray()).hasSize(1);
        }

        @Test
        @DisplayName("解析 canceled 事件")
        void canceled() {
            assertThat(codec.decode("{\"type\":\"canceled\"}")).isInstanceOf(CanceledEvent.class);
        }

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "Loading pipeline components: 50%",
                    "{\"type\":\"unknown_thing\"}",
                    "{\"message\":\"no type\"}",
                    "[1,2,3]",
                    "{\"type\":\"progress\",\"current\":\"abc\"}",
                    "{not json"
                })
        @DisplayName("无法识别的行降级为标准输出日志")
        void unrecognizedLinesBecomeLogs(String line) {
            assertThat(codec.decode(line)).isEqualTo(new LogEvent(line, LogSource.STDOUT));
        }

        @Test
        @DisplayName("严格解析在类型未知时抛出 ProtocolException")
        void strictParseRejectsUnknownType() {
            assertThatThrownBy(() -> codec.parseEvent("{\"type\":\"bogus\"}"))
                    .isInstanceOf(ProtocolException.class)
                    .hasMessageContaining("bogus");
        }
    }

    @Test
    @DisplayName("后端退出事件按 error 事件的格式输出")
    void workerExitedEncodesAsError() {
        JsonObject json = JsonParser.parseString(codec.encodeEvent(new WorkerExitedEvent(1))).getAsJsonObject();

        assertThat(json.get("type").getAsString()).isEqualTo("error");
        assertThat(json.get("message").getAsString()).isEqualTo("Python backend exited unexpectedly.");
    }

    @Nested
    @DisplayName("编码后再解码得到相同的消息")
    class RoundTrip {

        private static final GenerationSettings SETTINGS =
                new GenerationSettings(0.25f, 4, 0.0f, 1234L, 256, false, 0.5f, true, 3);

        static Stream<WorkerCommand> commands() {
            return Stream.of(
                    new InitCommand("/models/flux", "cuda", "/fonts/NotoColorEmoji.ttf", true),
                    new ListEmojisCommand(),
                    new GenerateCommand("job-7", "❤️", "pixel art", "/out/emoji_2764_FE0F_s1234_b1.png", SETTINGS),
                    new GenerateAllCommand("pixel art", "/out/run", SETTINGS),
                    new CancelCommand(),
                    new QuitCommand());
        }

        static Stream<WorkerEvent> events() {
            var emojis = new JsonArray();
            var grinning = new JsonObject();
            grinning.addProperty("char", "😀");
            grinning.addProperty("name", "grinning face");
            grinning.addProperty("category", "Smileys & Emotion");
            grinning.addProperty("codepoints", "1F600");
            emojis.add(grinning);
            return Stream.of(
                    new ReadyEvent("diffusion", false, "Model loaded"),
                    new ProgressEvent(3, 12, "🚀"),
                    new ResultEvent("job-7", "/out/emoji_1F600_s1234_b1.png", "😀", true),
                    new ErrorEvent("job-8", "CUDA out of memory"),
                    new EmojiListEvent(emojis),
                    new CanceledEvent());
        }

        @ParameterizedTest
        @MethodSource("commands")
        @DisplayName("每种命令都能还原")
        void commandRoundTrip(WorkerCommand command) throws ProtocolException {
            String line = codec.encode(command);

            assertThat(line).doesNotContain("\n");
            assertThat(codec.decodeCommand(line)).isEqualTo(command);
        }

        @ParameterizedTest
        @MethodSource("events")
        @DisplayName("后端写出的每种事件都能还原")
        void eventRoundTrip(WorkerEvent event) {
            String line = codec.encodeEvent(event);

            assertThat(line).doesNotContain("\n");
            assertThat(codec.decode(line)).isEqualTo(event);
        }
    }
}
