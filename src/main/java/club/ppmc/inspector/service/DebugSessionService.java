/**
 * DebugSessionService.java
 *
 * 调试会话注册表。持有唯一的 DebugSession，并协调会话的启动与停止：
 * 校验目标文件 -> 停止旧会话 -> 启动被调试进程 -> 建立上游连接 -> 绑定命令通道 -> 启用 Runtime / Debugger 域。
 * 启动是事务性的：任何一步失败都会先拆除已创建的进程与连接，再把错误交给调用方。
 * 所有 start / stop 操作按提交顺序串行执行，旧会话完全拆除之后才会启动新进程。
 */
package club.ppmc.inspector.service;

import club.ppmc.inspector.config.InspectorSettings;
import club.ppmc.inspector.exception.InspectorException;
import club.ppmc.inspector.model.DebugSession;
import club.ppmc.inspector.model.SessionStatus;
import club.ppmc.inspector.model.StartOptions;
import club.ppmc.inspector.model.inspector.ExecutionState;
import club.ppmc.inspector.service.domain.DebuggerDomainController;
import club.ppmc.inspector.service.domain.RuntimeDomainController;
import club.ppmc.inspector.util.WorkspacePathValidator;
import com.google.gson.JsonObject;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DebugSessionService {

    private final InspectorSettings settings;
    private final WorkspacePathValidator pathValidator;
    private final InspectorProcessSupervisor supervisor;
    private final InspectorProtocolRelay relay;
    private final RequestCorrelator correlator;
    private final ExecutionStateMachine stateMachine;
    private final RuntimeDomainController runtime;
    private final DebuggerDomainController debugger;
    private final EventDispatcher dispatcher;
    private final int proxyPort;

    private final AtomicLong nextSessionId = new AtomicLong(1);
    private volatile DebugSession current;
    private CompletableFuture<?> lifecycleTail = CompletableFuture.completedFuture(null);

    public DebugSessionService(
            InspectorSettings settings,
            WorkspacePathValidator pathValidator,
            InspectorProcessSupervisor supervisor,
            InspectorProtocolRelay relay,
            RequestCorrelator correlator,
            ExecutionStateMachine stateMachine,
            RuntimeDomainController runtime,
            DebuggerDomainController debugger,
            EventDispatcher dispatcher,
            @Value("${server.port:8888}") int proxyPort) {
        this.settings = settings;
        this.pathValidator = pathValidator;
        this.supervisor = supervisor;
        this.relay = relay;
        this.correlator = correlator;
        this.stateMachine = stateMachine;
        this.runtime = runtime;
        this.debugger = debugger;
        this.dispatcher = dispatcher;
        this.proxyPort = proxyPort;

        dispatcher.subscribe(TopicMatcher.exact("Debugger.paused"), (topic, data) -> updateLiveStatus(SessionStatus.PAUSED));
        dispatcher.subscribe(TopicMatcher.exact("Debugger.resumed"), (topic, data) -> updateLiveStatus(SessionStatus.RUNNING));
        dispatcher.subscribe(TopicMatcher.exact("Process.exited"), (topic, data) -> onProcessExited(data));
    }

    // ========================================================================
    // 公共 API
    // ========================================================================

    /**
     * 启动一个新的调试会话。已有会话时先将其完全停止。
     *
     * @param targetFile 工作区相对路径。
     * @param options 启动选项，可为 null。
     * @return 以就绪的会话完成的 Future；路径非法时以 PathViolationException 失败，
     *     文件不存在时以 TargetNotFoundException 失败。
     */
    public CompletableFuture<DebugSession> start(String targetFile, StartOptions options) {
        Path script;
        try {
            script = pathValidator.requireFile(targetFile);
        } catch (InspectorException | IllegalArgumentException e) {
            log.warn("拒绝启动调试会话: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            log.error("校验目标文件 {} 时出错: {}", targetFile, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        StartOptions effective = options == null ? StartOptions.defaults() : options;
        boolean breakOnStart =
                effective.breakOnStart() != null ? effective.breakOnStart() : settings.isBreakOnStart();
        int inspectPort = effective.inspectPort() != null ? effective.inspectPort() : settings.getInspectPort();

        return enqueue(() -> stopCurrent("Superseded by a new session")
                .thenCompose(ignored -> launch(targetFile, script, breakOnStart, inspectPort)));
    }

    /**
     * 停止指定会话；sessionId 为 null 时停止当前会话。
     *
     * @return 被停止的会话（状态为 STOPPED）；没有匹配的会话时为空。
     */
    public CompletableFuture<Optional<DebugSession>> stop(String sessionId) {
        return enqueue(() -> {
            DebugSession session = current;
            if (session == null || (sessionId != null && !session.sessionId().equals(sessionId))) {
                return CompletableFuture.completedFuture(Optional.<DebugSession>empty());
            }
            return teardown(session.sessionId(), "Session stopped").thenApply(Optional::ofNullable);
        });
    }

    /** 当前会话；没有活动会话时为空，而不是抛出异常。 */
    public Optional<DebugSession> current() {
        return Optional.ofNullable(current);
    }

    public Optional<DebugSession> find(String sessionId) {
        DebugSession session = current;
        return session != null && session.sessionId().equals(sessionId) ? Optional.of(session) : Optional.empty();
    }

    public List<DebugSession> list() {
        DebugSession session = current;
        return session == null ? List.of() : List.of(session);
    }

    public String wsUrl() {
        return "ws://" + settings.getProxyHost() + ":" + proxyPort + settings.getProxyPath();
    }

    // ========================================================================
    // 启动与拆除
    // ========================================================================

    private synchronized <T> CompletableFuture<T> enqueue(Supplier<CompletableFuture<T>> step) {
        CompletableFuture<T> result = lifecycleTail.handle((v, e) -> null).thenCompose(ignored -> step.get());
        lifecycleTail = result;
        return result;
    }

    private CompletableFuture<DebugSession> stopCurrent(String reason) {
        DebugSession session = current;
        if (session == null) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("停止旧会话 {}: {}", session.sessionId(), reason);
        return teardown(session.sessionId(), reason);
    }

    private CompletableFuture<DebugSession> launch(String targetFile, Path script, boolean breakOnStart, int inspectPort) {
        String sessionId = "session-" + nextSessionId.getAndIncrement();
        current = new DebugSession(
                sessionId,
                targetFile,
                script.toString(),
                inspectPort,
                proxyPort,
                wsUrl(),
                null,
                null,
                SessionStatus.STARTING,
                Instant.now());
        log.info("*** 启动调试会话 {}，目标: {}，breakOnStart: {} ***", sessionId, targetFile, breakOnStart);

        return supervisor.open(inspectPort, settings.getInspectHost(), breakOnStart, script)
                .thenCompose(inspectorUrl -> {
                    updateSession(sessionId, s -> s.withProcess(supervisor.pid(), inspectorUrl));
                    return relay.connect(inspectorUrl);
                })
                .thenCompose(ready -> {
                    InspectorTransport transport = relay.openInProcessTransport(
                            sessionId, correlator::handleMessage, correlator::detach);
                    correlator.attach(transport);
                    stateMachine.markConnected();
                    return runtime.enable();
                })
                .thenCompose(enabled -> debugger.enable())
                .thenCompose(enabled -> breakOnStart
                        ? runtime.runIfWaitingForDebugger()
                        : CompletableFuture.completedFuture(new JsonObject()))
                .thenApply(ignored -> {
                    SessionStatus status =
                            stateMachine.state() == ExecutionState.PAUSED ? SessionStatus.PAUSED : SessionStatus.RUNNING;
                    DebugSession started = updateSession(sessionId, s -> s.withStatus(status));
                    log.info("*** 调试会话 {} 已就绪，PID: {}，客户端地址: {} ***",
                            sessionId, started.pid(), started.wsUrl());
                    publishSessionEvent("Session.started", started);
                    return started;
                })
                .handle((started, error) -> {
                    if (error == null) {
                        return CompletableFuture.completedFuture(started);
                    }
                    Throwable cause = unwrap(error);
                    log.error("启动调试会话 {} 失败: {}", sessionId, cause.getMessage());
                    return teardown(sessionId, "Start failed: " + cause.getMessage())
                            .thenCompose(ignored -> CompletableFuture.<DebugSession>failedFuture(cause));
                })
                .thenCompose(Function.identity());
    }

    /**
     * 拆除会话：关闭中继与上游连接，终止进程，状态机置为 DISCONNECTED，会话标记为 STOPPED 并移除。
     * 各步骤的失败只记录日志，拆除总会完成。
     */
    private CompletableFuture<DebugSession> teardown(String sessionId, String reason) {
        return relay.disconnect(reason)
                .exceptionally(e -> {
                    log.warn("关闭中继时出错: {}", e.getMessage());
                    return null;
                })
                .thenCompose(ignored -> supervisor.close())
                .exceptionally(e -> {
                    log.warn("终止被调试进程时出错: {}", e.getMessage());
                    return null;
                })
                .thenApply(ignored -> {
                    correlator.detach(reason);
                    stateMachine.markDisconnected();
                    DebugSession stopped = removeSession(sessionId);
                    if (stopped != null) {
                        log.info("*** 调试会话 {} 已停止 ({}) ***", sessionId, reason);
                        publishSessionEvent("Session.stopped", stopped);
                    }
                    return stopped;
                });
    }

    private void onProcessExited(JsonObject data) {
        DebugSession session = current;
        if (session == null || session.pid() == null || !data.has("pid")) {
            return;
        }
        long pid = data.get("pid").getAsLong();
        if (session.pid() != pid) {
            return;
        }
        String sessionId = session.sessionId();
        String reason = "Debuggee exited with code " + (data.has("exitCode") ? data.get("exitCode").getAsInt() : -1);
        log.info("被调试进程 {} 已退出，结束会话 {}", pid, sessionId);
        enqueue(() -> {
            DebugSession still = current;
            if (still == null || !still.sessionId().equals(sessionId)) {
                return CompletableFuture.completedFuture(null);
            }
            return teardown(sessionId, reason);
        });
    }

    // ========================================================================
    // 会话记录
    // ========================================================================

    private synchronized DebugSession updateSession(String sessionId, UnaryOperator<DebugSession> change) {
        DebugSession session = current;
        if (session == null || !session.sessionId().equals(sessionId)) {
            return session;
        }
        current = change.apply(session);
        return current;
    }

    private synchronized DebugSession removeSession(String sessionId) {
        DebugSession session = current;
        if (session == null || !session.sessionId().equals(sessionId)) {
            return null;
        }
        current = null;
        return session.withoutProcess().withStatus(SessionStatus.STOPPED);
    }

    private synchronized void updateLiveStatus(SessionStatus status) {
        DebugSession session = current;
        if (session != null && session.status().isLive()) {
            current = session.withStatus(status);
        }
    }

    private void publishSessionEvent(String topic, DebugSession session) {
        var data = new JsonObject();
        data.addProperty("sessionId", session.sessionId());
        data.addProperty("targetFile", session.targetFile());
        data.addProperty("wsUrl", session.wsUrl());
        data.addProperty("status", session.status().label());
        dispatcher.publish(topic, data);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
