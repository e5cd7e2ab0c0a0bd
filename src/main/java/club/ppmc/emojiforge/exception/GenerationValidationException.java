/**
 * GenerationValidationException.java
 *
 * 生成请求在派发前被拒绝（提示词为空、未选择 emoji 等）。抛出时没有任何命令被发送。
 */
package club.ppmc.emojiforge.exception;

public class GenerationValidationException extends ForgeException {

    public GenerationValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
