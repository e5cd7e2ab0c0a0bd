/**
 * EmojiCatalogService.java
 *
 * 通过后端事件流实现的一次性请求/响应：发送 list_emojis，注册一个临时订阅者等待 emoji_list 事件，
 * 在限定时间内完成解析。无论成功、超时还是出错，临时订阅者都会被移除。
 * 最近一次成功加载的目录会被缓存，供编排器计算 ALL 模式的总数、供 EmojiSelectionResolver 匹配用户输入。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.exception.CatalogParseException;
import club.ppmc.emojiforge.exception.CatalogTimeoutException;
import club.ppmc.emojiforge.exception.WorkerTransportException;
import club.ppmc.emojiforge.model.EmojiInfo;
import club.ppmc.emojiforge.protocol.WorkerCommand.ListEmojisCommand;
import club.ppmc.emojiforge.protocol.WorkerEvent.EmojiListEvent;
import club.ppmc.emojiforge.protocol.WorkerEvent.WorkerExitedEvent;
import club.ppmc.emojiforge.util.AsyncResults;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class EmojiCatalogService {

    private final WorkerBridgeService bridge;
    private final WorkerEventDispatcher eventDispatcher;
    private final Duration requestTimeout;
    private volatile List<EmojiInfo> catalog = List.of();

    public EmojiCatalogService(
            WorkerBridgeService bridge,
            WorkerEventDispatcher eventDispatcher,
            @Value("${app.catalog.request-timeout:PT30S}") Duration requestTimeout) {
        this.bridge = bridge;
        this.eventDispatcher = eventDispatcher;
        this.requestTimeout = requestTimeout;
    }

    /** 最近一次成功加载的目录，按名称排序。 */
    public List<EmojiInfo> currentCatalog() {
        return catalog;
    }

    /**
     * 向后端请求 emoji 目录。
     *
     * @return 以排序后的目录完成的 Future；超时以 CatalogTimeoutException 完成，
     *     负载结构错误以 CatalogParseException 完成，后端不可用以 WorkerTransportException 完成。
     */
    public CompletableFuture<List<EmojiInfo>> requestCatalog() {
        var response = new CompletableFuture<List<EmojiInfo>>();
        WorkerEventListener listener =
                event -> {
                    if (event instanceof EmojiListEvent list) {
                        try {
                            response.complete(parseCatalog(list.emojis()));
                        } catch (CatalogParseException e) {
                            response.completeExceptionally(e);
                        }
                    } else if (event instanceof WorkerExitedEvent exited) {
                        response.completeExceptionally(new WorkerTransportException(exited.message()));
                    }
                };

        eventDispatcher.subscribe(listener);
        try {
            bridge.enqueueCommand(new ListEmojisCommand())
                    .whenComplete(
                            (ignored, failure) -> {
                                if (failure != null) {
                                    response.completeExceptionally(
                                            failure instanceof CompletionException ? failure.getCause() : failure);
                                }
                            });
        } catch (WorkerTransportException e) {
            eventDispatcher.unsubscribe(listener);
            return CompletableFuture.failedFuture(e);
        }

        response.orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        return response
                .whenComplete((emojis, error) -> eventDispatcher.unsubscribe(listener))
                .handle(
                        (emojis, error) -> {
                            if (error == null) {
                                catalog = emojis;
                                log.info("已加载 {} 个 emoji。", emojis.size());
                                return emojis;
                            }
                            Throwable cause = error instanceof CompletionException ? error.getCause() : error;
                            if (cause instanceof TimeoutException) {
                                log.warn("等待 emoji 目录超时 ({} 秒)。", requestTimeout.toSeconds());
                                throw new CatalogTimeoutException(requestTimeout);
                            }
                            throw new CompletionException(cause);
                        });
    }

    /**
     * 同步加载目录，供启动流程使用。
     */
    public List<EmojiInfo> loadCatalog() {
        return AsyncResults.await(requestCatalog());
    }

    static List<EmojiInfo> parseCatalog(JsonElement payload) {
        if (payload == null || !payload.isJsonArray()) {
            throw new CatalogParseException("emoji_list payload has no 'emojis' array.");
        }
        List<EmojiInfo> emojis = new ArrayList<>();
        for (JsonElement item : payload.getAsJsonArray()) {
            if (!item.isJsonObject() || !item.getAsJsonObject().has("char")) {
                throw new CatalogParseException("emoji_list entry is missing 'char': " + item);
            }
            JsonObject entry = item.getAsJsonObject();
            emojis.add(
                    new EmojiInfo(
                            readAsString(entry.get("char"), ""),
                            readAsString(entry.get("name"), "Unknown"),
                            readAsString(entry.get("category"), ""),
                            readAsString(entry.get("codepoints"), "")));
        }
        emojis.sort(Comparator.comparing(EmojiInfo::name));
        return List.copyOf(emojis);
    }

    /**
     * 字符串原样返回，数字和布尔值取其文本形式，null 或缺失时返回默认值，其余结构按 JSON 文本返回。
     */
    private static String readAsString(JsonElement element, String fallback) {
        if (element == null || element.isJsonNull()) {
            return fallback;
        }
        if (element.isJsonPrimitive()) {
            return element.getAsString();
        }
        return element.toString();
    }
}
