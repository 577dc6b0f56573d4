/**
 * ExecutionStateMachine.java
 *
 * 跟踪被调试目标的执行状态（RUNNING / PAUSED / DISCONNECTED），并为单步、继续、暂停等操作把关。
 * 它只是事件的观察者：状态只由 Debugger.paused / Debugger.resumed 事件和连接的建立与断开驱动，
 * 不持有也不阻塞任何进行中的请求。
 */
package club.ppmc.inspector.service;

import club.ppmc.inspector.exception.ExecutionStateException;
import club.ppmc.inspector.model.inspector.ExecutionSnapshot;
import club.ppmc.inspector.model.inspector.ExecutionState;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ExecutionStateMachine {

    private final AtomicReference<ExecutionSnapshot> snapshot =
            new AtomicReference<>(ExecutionSnapshot.disconnected());

    public ExecutionStateMachine(EventDispatcher dispatcher) {
        dispatcher.subscribe(TopicMatcher.exact("Debugger.paused"), (topic, data) -> onPaused(data));
        dispatcher.subscribe(TopicMatcher.exact("Debugger.resumed"), (topic, data) -> onResumed());
        dispatcher.subscribe(TopicMatcher.exact("Proxy.closed"), (topic, data) -> markDisconnected());
        dispatcher.subscribe(TopicMatcher.exact("WebSocket.close"), (topic, data) -> markDisconnected());
    }

    private void onPaused(JsonObject data) {
        String reason = data.has("reason") ? data.get("reason").getAsString() : null;
        JsonElement frames = data.get("callFrames");
        JsonArray callFrames = frames != null && frames.isJsonArray() ? frames.getAsJsonArray() : new JsonArray();
        snapshot.set(new ExecutionSnapshot(ExecutionState.PAUSED, reason, callFrames));
        log.debug("执行状态 -> PAUSED (reason: {})", reason);
    }

    private void onResumed() {
        // 保留最近一次暂停的信息，只切换状态
        snapshot.updateAndGet(current ->
                new ExecutionSnapshot(ExecutionState.RUNNING, current.pauseReason(), current.callFrames()));
        log.debug("执行状态 -> RUNNING");
    }

    /** 会话建立上游连接后调用，初始状态为 RUNNING。 */
    public void markConnected() {
        snapshot.set(new ExecutionSnapshot(ExecutionState.RUNNING, null, null));
        log.debug("执行状态 -> RUNNING (已连接)");
    }

    public void markDisconnected() {
        ExecutionSnapshot previous = snapshot.getAndSet(ExecutionSnapshot.disconnected());
        if (previous.state() != ExecutionState.DISCONNECTED) {
            log.debug("执行状态 -> DISCONNECTED");
        }
    }

    public ExecutionState state() {
        return snapshot.get().state();
    }

    public ExecutionSnapshot snapshot() {
        return snapshot.get();
    }

    /**
     * 要求目标处于暂停状态，否则同步抛出 {@link ExecutionStateException}。
     */
    public void requirePaused(String operation) {
        ExecutionState current = state();
        if (current != ExecutionState.PAUSED) {
            throw new ExecutionStateException(operation, ExecutionState.PAUSED, current);
        }
    }

    public void requireRunning(String operation) {
        ExecutionState current = state();
        if (current != ExecutionState.RUNNING) {
            throw new ExecutionStateException(operation, ExecutionState.RUNNING, current);
        }
    }
}
