/**
 * InspectorProtocolRelay.java
 *
 * Inspector 协议的 WebSocket 中继。
 * 每个实例只持有一条到被调试进程 inspector 端点的上游连接，以及任意数量的下游客户端连接。
 * 客户端发来的请求会被改写为中继全局唯一的 id 后转发到上游，响应到达时再改写回客户端原始的 id，
 * 并且只路由给发起请求的那个客户端；上游事件（没有 id 的消息）先发布到 EventDispatcher，再原样广播给所有客户端。
 * 转发出去的请求在命令超时时间内没有得到响应时，映射被释放，客户端收到错误响应。
 * 连接生命周期通过合成事件 Proxy.ready、Proxy.closed、WebSocket.open / close / error 发布出去。
 *
 * 所有状态变更都在 executor（生产环境中即单线程 reactor）上执行。
 */
package club.ppmc.inspector.service;

import club.ppmc.inspector.config.InspectorSettings;
import club.ppmc.inspector.exception.InspectorConnectionException;
import club.ppmc.inspector.exception.InspectorTimeoutException;
import club.ppmc.inspector.model.inspector.InspectorMessage;
import club.ppmc.inspector.service.relay.ClientConnection;
import club.ppmc.inspector.service.relay.InProcessClientConnection;
import club.ppmc.inspector.service.relay.UpstreamConnector;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class InspectorProtocolRelay {

    /** 中继合成错误响应时使用的 JSON-RPC 错误码（服务器错误段）。 */
    public static final int RELAY_ERROR_CODE = -32000;

    private static final int NORMAL_CLOSURE = 1000;
    private static final int GOING_AWAY = 1001;

    /** 一条已转发到上游、等待响应的客户端请求。 */
    private static final class RoutedRequest {
        private final String clientId;
        private final JsonElement originalId;
        private final String method;
        private volatile ScheduledFuture<?> deadline;

        private RoutedRequest(String clientId, JsonElement originalId, String method) {
            this.clientId = clientId;
            this.originalId = originalId;
            this.method = method;
        }

        private void settle() {
            ScheduledFuture<?> timer = deadline;
            if (timer != null) {
                timer.cancel(false);
            }
        }
    }

    private final UpstreamConnector connector;
    private final EventDispatcher dispatcher;
    private final Executor executor;
    private final ScheduledExecutorService scheduler;
    private final Duration handshakeTimeout;
    private final Duration commandTimeout;

    private final Map<String, ClientConnection> clients = new ConcurrentHashMap<>();
    private final Map<Long, RoutedRequest> routes = new ConcurrentHashMap<>();
    private final AtomicLong nextGlobalId = new AtomicLong(1);

    // 以下字段只在 executor 上修改
    private volatile UpstreamConnector.Channel upstream;
    private volatile String endpointUrl;
    private CompletableFuture<Void> pendingReady;
    private long generation;

    @Autowired
    public InspectorProtocolRelay(
            UpstreamConnector connector,
            EventDispatcher dispatcher,
            @Qualifier("inspectorReactor") ScheduledExecutorService reactor,
            InspectorSettings settings) {
        this(connector, dispatcher, reactor, reactor, settings.getHandshakeTimeout(), settings.getCommandTimeout());
    }

    public InspectorProtocolRelay(
            UpstreamConnector connector,
            EventDispatcher dispatcher,
            Executor executor,
            ScheduledExecutorService scheduler,
            Duration handshakeTimeout,
            Duration commandTimeout) {
        this.connector = connector;
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.scheduler = scheduler;
        this.handshakeTimeout = handshakeTimeout;
        this.commandTimeout = commandTimeout;
    }

    // ========================================================================
    // 上游连接
    // ========================================================================

    /**
     * 立即打开到 inspector 端点的上游连接。
     *
     * @return 在 Proxy.ready 发布后完成的 Future；握手超时以 InspectorTimeoutException 失败。
     */
    public CompletableFuture<Void> connect(String inspectorUrl) {
        var ready = new CompletableFuture<Void>();
        executor.execute(() -> openUpstream(inspectorUrl, ready));
        return ready;
    }

    /**
     * 关闭上游连接与所有客户端，并忘记端点地址（不会再按需重连）。
     */
    public CompletableFuture<Void> disconnect(String reason) {
        var done = new CompletableFuture<Void>();
        executor.execute(() -> {
            try {
                endpointUrl = null;
                if (pendingReady != null && !pendingReady.isDone()) {
                    generation++;
                    pendingReady.completeExceptionally(
                            new InspectorConnectionException("Connection aborted: " + reason));
                }
                if (upstream != null) {
                    closeUpstream(NORMAL_CLOSURE, reason, true);
                } else {
                    closeClients(NORMAL_CLOSURE, reason, null);
                }
                done.complete(null);
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
            }
        });
        return done;
    }

    private void openUpstream(String url, CompletableFuture<Void> ready) {
        UpstreamConnector.Channel current = upstream;
        if (current != null && current.isOpen() && url.equals(endpointUrl)) {
            ready.complete(null);
            return;
        }
        if (pendingReady != null && !pendingReady.isDone() && url.equals(endpointUrl)) {
            // 已有同一端点的握手在进行中，共享其结果
            pendingReady.whenComplete((v, e) -> {
                if (e == null) {
                    ready.complete(null);
                } else {
                    ready.completeExceptionally(e);
                }
            });
            return;
        }
        if (current != null) {
            closeUpstream(GOING_AWAY, "Reconnecting to " + url, true);
        }

        endpointUrl = url;
        pendingReady = ready;
        long attempt = ++generation;

        ScheduledFuture<?> timer = scheduler.schedule(
                () -> executor.execute(() -> onHandshakeTimeout(attempt)),
                handshakeTimeout.toMillis(),
                TimeUnit.MILLISECONDS);
        ready.whenComplete((v, e) -> timer.cancel(false));

        CompletableFuture<UpstreamConnector.Channel> opening;
        try {
            opening = connector.connect(url, new UpstreamListener(attempt));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        opening.whenComplete((channel, error) -> executor.execute(() -> onUpstreamConnected(attempt, channel, error)));
    }

    private void onUpstreamConnected(long attempt, UpstreamConnector.Channel channel, Throwable error) {
        if (attempt != generation) {
            // 握手已超时或被放弃，迟到的连接直接关闭
            if (channel != null) {
                channel.close();
            }
            return;
        }
        CompletableFuture<Void> ready = pendingReady;
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            log.error("连接 inspector 端点 {} 失败: {}", endpointUrl, cause.getMessage());
            publish("WebSocket.error", errorParams(cause.getMessage()));
            ready.completeExceptionally(new InspectorConnectionException(
                    "Failed to connect to inspector at " + endpointUrl + ": " + cause.getMessage()));
            return;
        }

        upstream = channel;
        log.info("*** 已建立到被调试进程的上游连接: {} ***", endpointUrl);
        var params = new JsonObject();
        params.addProperty("url", endpointUrl);
        publish("WebSocket.open", params);
        publish("Proxy.ready", params.deepCopy());
        String readyFrame = InspectorMessage.event("Proxy.ready", new JsonObject()).toString();
        clients.values().forEach(client -> client.deliver(readyFrame));
        ready.complete(null);
    }

    private void onHandshakeTimeout(long attempt) {
        if (attempt != generation || pendingReady == null || pendingReady.isDone()) {
            return;
        }
        generation++;
        log.error("等待 inspector 握手超时 ({} ms): {}", handshakeTimeout.toMillis(), endpointUrl);
        publish("WebSocket.error", errorParams("Handshake timed out"));
        pendingReady.completeExceptionally(new InspectorTimeoutException("Upstream handshake", handshakeTimeout));
    }

    /**
     * 拆除上游连接：为所有未完成的客户端请求合成错误响应，发布关闭事件，然后关闭全部客户端。
     */
    private void closeUpstream(int code, String reason, boolean wasClean) {
        UpstreamConnector.Channel channel = upstream;
        upstream = null;
        generation++;
        if (channel != null && channel.isOpen()) {
            channel.close();
        }
        log.info("上游连接已关闭: code={}, reason={}", code, reason);

        failOrphanedRoutes();

        var closeParams = new JsonObject();
        closeParams.addProperty("code", code);
        closeParams.addProperty("reason", reason);
        publish("WebSocket.close", closeParams);

        var proxyClosed = closeParams.deepCopy();
        proxyClosed.addProperty("wasClean", wasClean);
        publish("Proxy.closed", proxyClosed);

        closeClients(code, reason, InspectorMessage.event("Proxy.closed", proxyClosed).toString());
    }

    private void failOrphanedRoutes() {
        for (RoutedRequest route : routes.values()) {
            route.settle();
            ClientConnection client = clients.get(route.clientId);
            if (client != null && !client.isInProcess()) {
                client.deliver(InspectorMessage.errorResponse(
                                route.originalId, RELAY_ERROR_CODE, "Upstream connection closed")
                        .toString());
            }
        }
        routes.clear();
    }

    private void closeClients(int code, String reason, String finalFrame) {
        List<ClientConnection> snapshot = new ArrayList<>(clients.values());
        clients.clear();
        int downstreamCode = code == NORMAL_CLOSURE ? NORMAL_CLOSURE : GOING_AWAY;
        for (ClientConnection client : snapshot) {
            if (finalFrame != null) {
                client.deliver(finalFrame);
            }
            client.close(downstreamCode, reason);
        }
    }

    private void handleUpstreamMessage(String text) {
        InspectorMessage message;
        try {
            message = InspectorMessage.parse(text);
        } catch (JsonParseException e) {
            log.warn("丢弃无法解析的上游消息: {}", e.getMessage());
            return;
        }

        if (message.hasId()) {
            RoutedRequest route = routes.remove(message.numericId());
            if (route == null) {
                log.warn("收到无法匹配的上游响应，id={}", message.id());
                return;
            }
            route.settle();
            ClientConnection client = clients.get(route.clientId);
            if (client == null) {
                log.debug("客户端 {} 已断开，丢弃 {} 的响应", route.clientId, route.method);
                return;
            }
            client.deliver(message.withId(route.originalId).toString());
            return;
        }

        String method = message.method();
        if (method == null) {
            log.warn("丢弃既无 id 也无 method 的上游消息");
            return;
        }
        // 先更新服务端状态（执行状态机等），再通知客户端
        publish(method, message.params());
        clients.values().forEach(client -> client.deliver(text));
    }

    private final class UpstreamListener implements UpstreamConnector.Listener {
        private final long attempt;

        private UpstreamListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onMessage(String message) {
            executor.execute(() -> {
                if (attempt == generation) {
                    handleUpstreamMessage(message);
                }
            });
        }

        @Override
        public void onClose(int code, String reason) {
            executor.execute(() -> {
                if (attempt != generation) {
                    return;
                }
                if (upstream != null) {
                    log.warn("*** 上游连接被关闭: code={}, reason={} ***", code, reason);
                    closeUpstream(code, reason, code == NORMAL_CLOSURE);
                } else if (pendingReady != null && !pendingReady.isDone()) {
                    pendingReady.completeExceptionally(
                            new InspectorConnectionException("Inspector closed the connection during handshake"));
                }
            });
        }

        @Override
        public void onError(Throwable error) {
            executor.execute(() -> {
                if (attempt == generation) {
                    log.error("*** 上游传输错误: {} ***", error.getMessage());
                    publish("WebSocket.error", errorParams(error.getMessage()));
                }
            });
        }
    }

    // ========================================================================
    // 下游客户端
    // ========================================================================

    /**
     * 注册一个下游客户端。上游已就绪时立即向其发送 Proxy.ready；
     * 若端点已知但上游尚未打开，则按需建立上游连接。
     */
    public void attachClient(ClientConnection client) {
        executor.execute(() -> {
            clients.put(client.id(), client);
            log.info("客户端 {} 已连接，当前客户端数: {}", client.id(), clients.size());
            UpstreamConnector.Channel channel = upstream;
            if (channel != null && channel.isOpen()) {
                client.deliver(InspectorMessage.event("Proxy.ready", new JsonObject()).toString());
            } else if (endpointUrl != null && (pendingReady == null || pendingReady.isDone())) {
                log.info("客户端连接时上游尚未打开，按需连接 {}", endpointUrl);
                openUpstream(endpointUrl, new CompletableFuture<>());
            }
        });
    }

    /**
     * 移除一个下游客户端及其未完成的请求映射。最后一个客户端断开时关闭上游连接。
     */
    public void detachClient(String clientId) {
        executor.execute(() -> {
            ClientConnection removed = clients.remove(clientId);
            if (removed == null) {
                return;
            }
            routes.values().removeIf(route -> {
                if (!route.clientId.equals(clientId)) {
                    return false;
                }
                route.settle();
                return true;
            });
            log.info("客户端 {} 已断开，剩余客户端数: {}", clientId, clients.size());
            if (clients.isEmpty() && upstream != null) {
                log.info("最后一个客户端已断开，关闭上游连接");
                closeUpstream(NORMAL_CLOSURE, "Last client disconnected", true);
            }
        });
    }

    /**
     * 打开一个进程内的命令通道，供服务端的领域控制器使用。
     *
     * @param name 通道名称，用于生成客户端 ID。
     * @param onMessage 收到响应或事件帧时的回调。
     * @param onClosed 通道被关闭时的回调，参数为关闭原因。
     */
    public InspectorTransport openInProcessTransport(
            String name, Consumer<String> onMessage, Consumer<String> onClosed) {
        var connection = new InProcessClientConnection(
                "in-process-" + name, this::handleClientMessage, this::isUpstreamOpen, onMessage, onClosed);
        attachClient(connection);
        return connection;
    }

    /**
     * 处理客户端发来的一帧：分配全局 id，记录映射后转发到上游。
     */
    public void handleClientMessage(String clientId, String text) {
        executor.execute(() -> forwardClientMessage(clientId, text));
    }

    private void forwardClientMessage(String clientId, String text) {
        ClientConnection client = clients.get(clientId);
        if (client == null) {
            log.warn("丢弃来自未注册客户端 {} 的消息", clientId);
            return;
        }
        InspectorMessage message;
        try {
            message = InspectorMessage.parse(text);
        } catch (JsonParseException e) {
            log.warn("丢弃客户端 {} 发来的无法解析的消息: {}", clientId, e.getMessage());
            return;
        }
        if (!message.hasId() || message.method() == null) {
            log.warn("丢弃客户端 {} 发来的缺少 id 或 method 的消息", clientId);
            return;
        }

        UpstreamConnector.Channel channel = upstream;
        if (channel == null || !channel.isOpen()) {
            client.deliver(InspectorMessage.errorResponse(
                            message.id(), RELAY_ERROR_CODE, InspectorConnectionException.NO_ACTIVE_SESSION)
                    .toString());
            return;
        }

        long globalId = nextGlobalId.getAndIncrement();
        var route = new RoutedRequest(clientId, message.id(), message.method());
        routes.put(globalId, route);
        route.deadline = scheduler.schedule(
                () -> executor.execute(() -> expireRoute(globalId)),
                commandTimeout.toMillis(),
                TimeUnit.MILLISECONDS);
        log.debug("转发 {} : 客户端 {} id={} -> 全局 id={}", message.method(), clientId, message.id(), globalId);
        try {
            channel.send(message.withId(new JsonPrimitive(globalId)).toString());
        } catch (RuntimeException e) {
            routes.remove(globalId);
            route.settle();
            log.warn("向上游转发 {} 失败: {}", message.method(), e.getMessage());
            client.deliver(InspectorMessage.errorResponse(
                            message.id(), RELAY_ERROR_CODE, "Failed to forward request: " + e.getMessage())
                    .toString());
        }
    }

    /**
     * 上游在超时时间内没有应答：释放映射，并以原始 id 向客户端回送错误响应。
     * 进程内通道的命令由 RequestCorrelator 自己计时，这里只释放映射。
     */
    private void expireRoute(long globalId) {
        RoutedRequest route = routes.remove(globalId);
        if (route == null) {
            return;
        }
        log.warn("上游未在 {} ms 内响应 {}（客户端 {} id={}）",
                commandTimeout.toMillis(), route.method, route.clientId, route.originalId);
        ClientConnection client = clients.get(route.clientId);
        if (client != null && !client.isInProcess()) {
            client.deliver(InspectorMessage.errorResponse(
                            route.originalId, RELAY_ERROR_CODE, "Request timed out: " + route.method)
                    .toString());
        }
    }

    // ========================================================================
    // 状态查询
    // ========================================================================

    public boolean isUpstreamOpen() {
        UpstreamConnector.Channel channel = upstream;
        return channel != null && channel.isOpen();
    }

    public String endpointUrl() {
        return endpointUrl;
    }

    public int clientCount() {
        return clients.size();
    }

    public int pendingRouteCount() {
        return routes.size();
    }

    private void publish(String topic, JsonObject params) {
        dispatcher.publish(topic, params);
    }

    private static JsonObject errorParams(String message) {
        var params = new JsonObject();
        params.addProperty("message", message == null ? "unknown error" : message);
        return params;
    }
}
