/**
 * WorkerStartupException.java
 *
 * 后端进程无法启动：脚本缺失、依赖检查失败或进程创建失败。
 * 对当前会话是致命的，但不影响宿主应用，之后可以再次尝试启动。
 */
package club.ppmc.emojiforge.exception;

import java.util.HashMap;
import java.util.Map;
import lombok.Getter;

@Getter
public class WorkerStartupException extends ForgeException {

    /** (可选) 依赖检查等子进程输出的诊断文本。 */
    private final String diagnostics;

    public WorkerStartupException(String message) {
        this(message, null, null);
    }

    public WorkerStartupException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public WorkerStartupException(String message, String diagnostics, Throwable cause) {
        super("STARTUP_ERROR", message, cause);
        this.diagnostics = diagnostics;
    }

    @Override
    public Map<String, Object> toErrorData() {
        var data = new HashMap<>(super.toErrorData());
        data.put("diagnostics", diagnostics != null ? diagnostics : "");
        return data;
    }
}
