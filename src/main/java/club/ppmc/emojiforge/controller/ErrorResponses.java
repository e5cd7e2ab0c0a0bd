/**
 * ErrorResponses.java
 *
 * 将业务异常转换为带有合适HTTP状态码的响应体，供各个控制器在 catch 块中使用。
 */
package club.ppmc.emojiforge.controller;

import club.ppmc.emojiforge.exception.CatalogParseException;
import club.ppmc.emojiforge.exception.CatalogTimeoutException;
import club.ppmc.emojiforge.exception.ForgeException;
import club.ppmc.emojiforge.exception.GenerationValidationException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

final class ErrorResponses {

    private ErrorResponses() {}

    static ResponseEntity<Map<String, Object>> of(ForgeException e) {
        return ResponseEntity.status(statusOf(e)).body(e.toErrorData());
    }

    static HttpStatus statusOf(ForgeException e) {
        if (e instanceof GenerationValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof CatalogTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        if (e instanceof CatalogParseException) {
            return HttpStatus.BAD_GATEWAY;
        }
        // 启动失败、传输失败
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
