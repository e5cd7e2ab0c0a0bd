/**
 * WorkerCommand.java
 *
 * 发送给 Python 后端的命令。每种命令对应一个记录类型，只携带该命令需要的字段；
 * 线上格式中的 "cmd" 鉴别字段由 {@link #cmd()} 给出，由 MessageCodec 负责写入。
 */
package club.ppmc.emojiforge.protocol;

import club.ppmc.emojiforge.model.GenerationSettings;

public sealed interface WorkerCommand
        permits WorkerCommand.InitCommand,
                WorkerCommand.ListEmojisCommand,
                WorkerCommand.GenerateCommand,
                WorkerCommand.GenerateAllCommand,
                WorkerCommand.CancelCommand,
                WorkerCommand.QuitCommand {

    /** 线上的命令名。 */
    String cmd();

    record InitCommand(String modelPath, String device, String fontPath, boolean enableCpuOffload)
            implements WorkerCommand {
        @Override
        public String cmd() {
            return "init";
        }
    }

    record ListEmojisCommand() implements WorkerCommand {
        @Override
        public String cmd() {
            return "list_emojis";
        }
    }

    /** 生成单个 emoji。settings.seed 即该任务的种子。 */
    record GenerateCommand(
            String jobId, String emoji, String prompt, String outputPath, GenerationSettings settings)
            implements WorkerCommand {
        @Override
        public String cmd() {
            return "generate";
        }
    }

    /** 由后端遍历整个目录逐个生成。 */
    record GenerateAllCommand(String prompt, String outputDir, GenerationSettings settings)
            implements WorkerCommand {
        @Override
        public String cmd() {
            return "generate_all";
        }
    }

    record CancelCommand() implements WorkerCommand {
        @Override
        public String cmd() {
            return "cancel";
        }
    }

    record QuitCommand() implements WorkerCommand {
        @Override
        public String cmd() {
            return "quit";
        }
    }
}
