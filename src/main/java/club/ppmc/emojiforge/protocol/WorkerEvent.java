/**
 * WorkerEvent.java
 *
 * 从 Python 后端接收的事件。线上格式以 "type" 字段区分；
 * 无法识别或无法解析的行统一降级为 {@link LogEvent}。
 * {@link WorkerExitedEvent} 不来自线上，而是由 WorkerBridgeService 在进程意外退出时发布的 error 事件。
 */
package club.ppmc.emojiforge.protocol;

import com.google.gson.JsonElement;

public sealed interface WorkerEvent
        permits WorkerEvent.ReadyEvent,
                WorkerEvent.ProgressEvent,
                WorkerEvent.ResultEvent,
                WorkerEvent.ErrorEvent,
                WorkerEvent.EmojiListEvent,
                WorkerEvent.CanceledEvent,
                WorkerEvent.LogEvent,
                WorkerEvent.WorkerExitedEvent {

    /** 线上的事件类型。 */
    String type();

    /**
     * 后端完成初始化。fallback 为 true 表示扩散管线不可用，生成将会失败。
     */
    record ReadyEvent(String mode, boolean fallback, String message) implements WorkerEvent {
        @Override
        public String type() {
            return "ready";
        }
    }

    record ProgressEvent(int current, int total, String emoji) implements WorkerEvent {
        @Override
        public String type() {
            return "progress";
        }
    }

    /**
     * 一个单元完成。skipped 为 true 表示复用了已存在的输出文件。
     */
    record ResultEvent(String jobId, String outputPath, String emoji, boolean skipped)
            implements WorkerEvent {
        @Override
        public String type() {
            return "result";
        }
    }

    record ErrorEvent(String jobId, String message) implements WorkerEvent {
        @Override
        public String type() {
            return "error";
        }
    }

    /**
     * 目录响应。emojis 保留原始 JSON，由 EmojiCatalogService 校验结构并解析。
     */
    record EmojiListEvent(JsonElement emojis) implements WorkerEvent {
        @Override
        public String type() {
            return "emoji_list";
        }
    }

    record CanceledEvent() implements WorkerEvent {
        @Override
        public String type() {
            return "canceled";
        }
    }

    /** 非结构化的诊断输出。 */
    record LogEvent(String line, LogSource source) implements WorkerEvent {
        @Override
        public String type() {
            return "log";
        }
    }

    /** 后端进程在没有被主动停止的情况下退出。 */
    record WorkerExitedEvent(int exitCode) implements WorkerEvent {

        public static final String MESSAGE = "Python backend exited unexpectedly.";

        @Override
        public String type() {
            return "error";
        }

        public String message() {
            return MESSAGE;
        }
    }

    enum LogSource {
        /** 标准输出中无法识别的行。 */
        STDOUT,
        /** 标准错误。 */
        STDERR,
        /** 桥接层自身产生的信息，例如依赖检查的输出。 */
        BRIDGE
    }
}
