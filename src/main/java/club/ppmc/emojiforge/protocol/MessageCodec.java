/**
 * MessageCodec.java
 *
 * Python 后端行协议的编解码器。出站命令被序列化为单行 JSON（首个字段为 "cmd"），
 * 入站的每一行被解析为类型化的 WorkerEvent。
 * 解码从不失败：无法解析的行、缺少或未知 "type" 的行都会作为日志行返回。
 * 字段名在 Java 中使用驼峰命名，线上使用 snake_case，由 Gson 的命名策略完成转换。
 */
package club.ppmc.emojiforge.protocol;

import club.ppmc.emojiforge.exception.ProtocolException;
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
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class MessageCodec {

    private static final String COMMAND_FIELD = "cmd";
    private static final String EVENT_FIELD = "type";

    private static final Map<String, Class<? extends WorkerCommand>> COMMAND_TYPES =
            Map.of(
                    "init", InitCommand.class,
                    "list_emojis", ListEmojisCommand.class,
                    "generate", GenerateCommand.class,
                    "generate_all", GenerateAllCommand.class,
                    "cancel", CancelCommand.class,
                    "quit", QuitCommand.class);

    private static final Map<String, Class<? extends WorkerEvent>> EVENT_TYPES =
            Map.of(
                    "ready", ReadyEvent.class,
                    "progress", ProgressEvent.class,
                    "result", ResultEvent.class,
                    "error", ErrorEvent.class,
                    "emoji_list", EmojiListEvent.class,
                    "canceled", CanceledEvent.class);

    private final Gson gson;

    public MessageCodec() {
        this.gson =
                new GsonBuilder()
                        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                        .disableHtmlEscaping()
                        .create();
    }

    /**
     * 将命令序列化为一行 JSON。Gson 会转义字符串中的换行符，因此结果中不会包含换行。
     */
    public String encode(WorkerCommand command) {
        return toTaggedJson(COMMAND_FIELD, command.cmd(), gson.toJsonTree(command, command.getClass()));
    }

    /**
     * 将后端输出的一行解析为事件。任何无法识别的内容都降级为来自标准输出的 LogEvent。
     */
    public WorkerEvent decode(String line) {
        try {
            return parseEvent(line);
        } catch (ProtocolException e) {
            return new LogEvent(line, LogSource.STDOUT);
        }
    }

    /**
     * 严格解析一行事件。
     *
     * @throws ProtocolException 该行不是 JSON 对象、缺少 "type" 字段、类型未知或字段类型不匹配时。
     */
    public WorkerEvent parseEvent(String line) throws ProtocolException {
        JsonObject json = parseObject(line);
        String type = readDiscriminator(json, EVENT_FIELD);
        Class<? extends WorkerEvent> eventClass = EVENT_TYPES.get(type);
        if (eventClass == null) {
            throw new ProtocolException("Unknown event type: " + type);
        }
        try {
            return gson.fromJson(json, eventClass);
        } catch (JsonParseException e) {
            throw new ProtocolException("Malformed '" + type + "' event: " + e.getMessage(), e);
        }
    }

    /**
     * 解析一行命令，供模拟后端使用。
     */
    WorkerCommand decodeCommand(String line) throws ProtocolException {
        JsonObject json = parseObject(line);
        String cmd = readDiscriminator(json, COMMAND_FIELD);
        Class<? extends WorkerCommand> commandClass = COMMAND_TYPES.get(cmd);
        if (commandClass == null) {
            throw new ProtocolException("Unknown command: " + cmd);
        }
        try {
            return gson.fromJson(json, commandClass);
        } catch (JsonParseException e) {
            throw new ProtocolException("Malformed '" + cmd + "' command: " + e.getMessage(), e);
        }
    }

    /**
     * 按后端的输出格式序列化一个事件。LogEvent 原样返回其内容。
     */
    String encodeEvent(WorkerEvent event) {
        if (event instanceof LogEvent log) {
            return log.line();
        }
        if (event instanceof WorkerExitedEvent exited) {
            var json = new JsonObject();
            json.addProperty("message", exited.message());
            return toTaggedJson(EVENT_FIELD, exited.type(), json);
        }
        return toTaggedJson(EVENT_FIELD, event.type(), gson.toJsonTree(event, event.getClass()));
    }

    private String toTaggedJson(String field, String tag, JsonElement body) {
        var tagged = new JsonObject();
        tagged.addProperty(field, tag);
        for (Map.Entry<String, JsonElement> entry : body.getAsJsonObject().entrySet()) {
            tagged.add(entry.getKey(), entry.getValue());
        }
        return gson.toJson(tagged);
    }

    private static JsonObject parseObject(String line) throws ProtocolException {
        if (line == null || line.isBlank()) {
            throw new ProtocolException("Empty line");
        }
        try {
            JsonElement element = JsonParser.parseString(line);
            if (!element.isJsonObject()) {
                throw new ProtocolException("Not a JSON object");
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ProtocolException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    private static String readDiscriminator(JsonObject json, String field) throws ProtocolException {
        JsonElement value = json.get(field);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new ProtocolException("Missing '" + field + "' field");
        }
        return value.getAsString();
    }
}
