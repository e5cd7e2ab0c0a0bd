package club.ppmc.emojiforge.exception;

/**
 * emoji_list 事件的负载结构不正确。
 */
public class CatalogParseException extends ForgeException {

    public CatalogParseException(String message) {
        super("PARSE_ERROR", message);
    }

    public CatalogParseException(String message, Throwable cause) {
        super("PARSE_ERROR", message, cause);
    }
}
