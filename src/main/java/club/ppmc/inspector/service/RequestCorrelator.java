/**
 * RequestCorrelator.java
 *
 * 将发出的 Inspector 命令与其异步响应一一对应。
 * 每条命令分配一个严格递增且永不复用的 id，并登记为 PendingRequest；
 * 响应到达、超时或传输断开时，对应的 Future 恰好完成一次。
 * 领域控制器都通过它发送命令，它本身不关心命令的语义。
 */
package club.ppmc.inspector.service;

import club.ppmc.inspector.config.InspectorSettings;
import club.ppmc.inspector.exception.InspectorConnectionException;
import club.ppmc.inspector.exception.InspectorProtocolException;
import club.ppmc.inspector.exception.InspectorTimeoutException;
import club.ppmc.inspector.model.inspector.InspectorMessage;
import club.ppmc.inspector.model.inspector.PendingRequest;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class RequestCorrelator {

    private final ScheduledExecutorService scheduler;
    private final Duration commandTimeout;

    private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();
    private final AtomicLong nextMessageId = new AtomicLong(1);
    private volatile InspectorTransport transport;

    public RequestCorrelator(
            @Qualifier("inspectorReactor") ScheduledExecutorService scheduler, InspectorSettings settings) {
        this.scheduler = scheduler;
        this.commandTimeout = settings.getCommandTimeout();
    }

    /**
     * 绑定发送命令所用的传输通道。
     */
    public void attach(InspectorTransport newTransport) {
        this.transport = newTransport;
        log.debug("命令通道已绑定");
    }

    /**
     * 解除传输通道，并以 InspectorConnectionException 拒绝所有未完成的命令。
     */
    public void detach(String reason) {
        this.transport = null;
        List<PendingRequest> orphaned = new ArrayList<>(pending.values());
        pending.clear();
        if (!orphaned.isEmpty()) {
            log.info("命令通道已断开 ({})，拒绝 {} 条未完成的命令", reason, orphaned.size());
        }
        for (PendingRequest request : orphaned) {
            request.completion().completeExceptionally(
                    new InspectorConnectionException("Connection closed before response to " + request.method()
                            + ": " + reason));
        }
    }

    public boolean isConnected() {
        InspectorTransport current = transport;
        return current != null && current.isConnected();
    }

    /**
     * 发送一条命令。
     *
     * @param method 完整方法名，例如 "Debugger.stepOver"。
     * @param params 命令参数，可为 null。
     * @return 以响应的 result 对象完成的 Future。
     */
    public CompletableFuture<JsonObject> send(String method, JsonObject params) {
        InspectorTransport current = transport;
        if (current == null || !current.isConnected()) {
            return CompletableFuture.failedFuture(InspectorConnectionException.noActiveSession());
        }

        long messageId = nextMessageId.getAndIncrement();
        JsonObject safeParams = params == null ? new JsonObject() : params;
        var completion = new CompletableFuture<JsonObject>();
        Instant now = Instant.now();
        pending.put(
                messageId,
                new PendingRequest(messageId, method, safeParams, now, completion, now.plus(commandTimeout)));
        // 先登记再启动定时器，定时器总能找到这条命令
        ScheduledFuture<?> timer =
                scheduler.schedule(() -> expire(messageId), commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
        completion.whenComplete((result, error) -> timer.cancel(false));
        log.debug("发送命令 #{} {}", messageId, method);

        try {
            current.send(InspectorMessage.request(messageId, method, safeParams).toString());
        } catch (RuntimeException e) {
            PendingRequest removed = pending.remove(messageId);
            if (removed != null) {
                completion.completeExceptionally(
                        new InspectorConnectionException("Failed to send " + method + ": " + e.getMessage()));
            }
        }
        return completion;
    }

    /**
     * 处理通道上收到的一帧。只关心带 id 的响应，事件由 EventDispatcher 负责。
     */
    public void handleMessage(String text) {
        InspectorMessage message;
        try {
            message = InspectorMessage.parse(text);
        } catch (JsonParseException e) {
            log.warn("丢弃无法解析的响应: {}", e.getMessage());
            return;
        }
        if (!message.hasId()) {
            return;
        }

        PendingRequest request = pending.remove(message.numericId());
        if (request == null) {
            // 已超时或已被拒绝的命令的迟到响应
            log.debug("忽略迟到或未知的响应 id={}", message.id());
            return;
        }

        JsonObject error = message.error();
        if (error != null) {
            int code = intOrDefault(error.get("code"), 0);
            String errorMessage = error.has("message") ? error.get("message").getAsString() : "Unknown error";
            log.debug("命令 #{} {} 返回错误: {} ({})", request.messageId(), request.method(), errorMessage, code);
            request.completion().completeExceptionally(
                    new InspectorProtocolException(request.method(), code, errorMessage));
        } else {
            request.completion().complete(message.result());
        }
    }

    private void expire(long messageId) {
        PendingRequest request = pending.remove(messageId);
        if (request != null) {
            log.warn("命令 #{} {} 超时 ({} ms)", messageId, request.method(), commandTimeout.toMillis());
            request.completion().completeExceptionally(new InspectorTimeoutException(request.method(), commandTimeout));
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    private static int intOrDefault(JsonElement element, int fallback) {
        if (element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            return element.getAsInt();
        }
        return fallback;
    }
}
