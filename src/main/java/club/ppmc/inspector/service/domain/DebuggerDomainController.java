/**
 * DebuggerDomainController.java
 *
 * Debugger 域的命令与事件门面。
 * 单步、继续、暂停在发送之前先经过 ExecutionStateMachine 的检查，
 * 状态不符时同步抛出 ExecutionStateException，命令不会到达传输层。
 * 调用帧、作用域、断点位置等均按原样透传。
 */
package club.ppmc.inspector.service.domain;

import club.ppmc.inspector.model.inspector.BreakpointResult;
import club.ppmc.inspector.model.inspector.EvaluateResult;
import club.ppmc.inspector.service.EventDispatcher;
import club.ppmc.inspector.service.ExecutionStateMachine;
import club.ppmc.inspector.service.RequestCorrelator;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Service;

@Service
public class DebuggerDomainController extends AbstractDomainController {

    public enum Command implements DomainMethod {
        PAUSE,
        RESUME,
        STEP_OVER,
        STEP_INTO,
        STEP_OUT,
        SET_BREAKPOINT_BY_URL,
        SET_BREAKPOINT,
        REMOVE_BREAKPOINT,
        SET_BREAKPOINTS_ACTIVE,
        SET_PAUSE_ON_EXCEPTIONS,
        EVALUATE_ON_CALL_FRAME,
        SET_VARIABLE_VALUE,
        RESTART_FRAME,
        GET_POSSIBLE_BREAKPOINTS,
        GET_SCRIPT_SOURCE,
        CONTINUE_TO_LOCATION,
        SET_SCRIPT_SOURCE,
        SET_ASYNC_CALL_STACK_DEPTH,
        SET_BLACKBOX_PATTERNS,
        SET_SKIP_ALL_PAUSES
    }

    public enum Event implements DomainMethod {
        PAUSED,
        RESUMED,
        SCRIPT_PARSED,
        SCRIPT_FAILED_TO_PARSE,
        BREAKPOINT_RESOLVED
    }

    /** setPauseOnExceptions 的取值。 */
    public enum PauseOnExceptionsState {
        NONE("none"),
        UNCAUGHT("uncaught"),
        ALL("all");

        private final String wireValue;

        PauseOnExceptionsState(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }
    }

    private final ExecutionStateMachine stateMachine;

    public DebuggerDomainController(
            RequestCorrelator correlator, EventDispatcher dispatcher, Gson gson, ExecutionStateMachine stateMachine) {
        super("Debugger", correlator, dispatcher, gson);
        this.stateMachine = stateMachine;
    }

    // --- 执行控制 ---

    public CompletableFuture<JsonObject> pause() {
        stateMachine.requireRunning("pause");
        return send(Command.PAUSE);
    }

    public CompletableFuture<JsonObject> resume() {
        return resume(false);
    }

    public CompletableFuture<JsonObject> resume(boolean terminateOnResume) {
        stateMachine.requirePaused("resume");
        JsonObject params = params();
        if (terminateOnResume) {
            params.addProperty("terminateOnResume", true);
        }
        return send(Command.RESUME, params);
    }

    public CompletableFuture<JsonObject> stepOver() {
        stateMachine.requirePaused("stepOver");
        return send(Command.STEP_OVER);
    }

    public CompletableFuture<JsonObject> stepInto() {
        return stepInto(false);
    }

    public CompletableFuture<JsonObject> stepInto(boolean breakOnAsyncCall) {
        stateMachine.requirePaused("stepInto");
        JsonObject params = params();
        if (breakOnAsyncCall) {
            params.addProperty("breakOnAsyncCall", true);
        }
        return send(Command.STEP_INTO, params);
    }

    public CompletableFuture<JsonObject> stepOut() {
        stateMachine.requirePaused("stepOut");
        return send(Command.STEP_OUT);
    }

    public CompletableFuture<JsonObject> continueToLocation(JsonObject location) {
        stateMachine.requirePaused("continueToLocation");
        JsonObject params = params();
        params.add("location", location);
        return send(Command.CONTINUE_TO_LOCATION, params);
    }

    public CompletableFuture<JsonObject> restartFrame(String callFrameId) {
        JsonObject params = params();
        params.addProperty("callFrameId", callFrameId);
        return send(Command.RESTART_FRAME, params);
    }

    // --- 断点 ---

    public CompletableFuture<BreakpointResult> setBreakpointByUrl(String url, int lineNumber) {
        return setBreakpointByUrl(url, lineNumber, null, null);
    }

    /**
     * 按脚本 URL 设置断点。行号与列号从 0 开始。
     *
     * @param columnNumber 为 null 时取 0。
     * @param condition 为 null 时为无条件断点。
     */
    public CompletableFuture<BreakpointResult> setBreakpointByUrl(
            String url, int lineNumber, Integer columnNumber, String condition) {
        JsonObject params = params();
        params.addProperty("url", url);
        params.addProperty("lineNumber", lineNumber);
        params.addProperty("columnNumber", columnNumber == null ? 0 : columnNumber);
        params.addProperty("condition", condition == null ? "" : condition);
        return send(Command.SET_BREAKPOINT_BY_URL, params, BreakpointResult.class);
    }

    public CompletableFuture<JsonObject> setBreakpoint(JsonObject location, String condition) {
        JsonObject params = params();
        params.add("location", location);
        if (condition != null) {
            params.addProperty("condition", condition);
        }
        return send(Command.SET_BREAKPOINT, params);
    }

    public CompletableFuture<JsonObject> removeBreakpoint(String breakpointId) {
        JsonObject params = params();
        params.addProperty("breakpointId", breakpointId);
        return send(Command.REMOVE_BREAKPOINT, params);
    }

    public CompletableFuture<JsonObject> setBreakpointsActive(boolean active) {
        JsonObject params = params();
        params.addProperty("active", active);
        return send(Command.SET_BREAKPOINTS_ACTIVE, params);
    }

    public CompletableFuture<JsonObject> setPauseOnExceptions(PauseOnExceptionsState state) {
        JsonObject params = params();
        params.addProperty("state", state.wireValue());
        return send(Command.SET_PAUSE_ON_EXCEPTIONS, params);
    }

    /**
     * @param start 起始位置 {scriptId, lineNumber, columnNumber?}。
     */
    public CompletableFuture<JsonObject> getPossibleBreakpoints(JsonObject start) {
        JsonObject params = params();
        params.add("start", start);
        return send(Command.GET_POSSIBLE_BREAKPOINTS, params);
    }

    // --- 调用帧上的求值与修改 ---

    public CompletableFuture<EvaluateResult> evaluateOnCallFrame(String expression, String callFrameId) {
        JsonObject params = params();
        params.addProperty("callFrameId", callFrameId);
        params.addProperty("expression", expression);
        return send(Command.EVALUATE_ON_CALL_FRAME, params, EvaluateResult.class);
    }

    /**
     * @param newValue Runtime.CallArgument，例如 {"value": 42}。
     */
    public CompletableFuture<JsonObject> setVariableValue(
            int scopeNumber, String variableName, JsonObject newValue, String callFrameId) {
        JsonObject params = params();
        params.addProperty("scopeNumber", scopeNumber);
        params.addProperty("variableName", variableName);
        params.add("newValue", newValue);
        params.addProperty("callFrameId", callFrameId);
        return send(Command.SET_VARIABLE_VALUE, params);
    }

    // --- 脚本 ---

    public CompletableFuture<String> getScriptSource(String scriptId) {
        JsonObject params = params();
        params.addProperty("scriptId", scriptId);
        return send(Command.GET_SCRIPT_SOURCE, params)
                .thenApply(result -> result.has("scriptSource") ? result.get("scriptSource").getAsString() : "");
    }

    public CompletableFuture<JsonObject> setScriptSource(String scriptId, String scriptSource) {
        JsonObject params = params();
        params.addProperty("scriptId", scriptId);
        params.addProperty("scriptSource", scriptSource);
        return send(Command.SET_SCRIPT_SOURCE, params);
    }

    public CompletableFuture<JsonObject> setAsyncCallStackDepth(int maxDepth) {
        JsonObject params = params();
        params.addProperty("maxDepth", maxDepth);
        return send(Command.SET_ASYNC_CALL_STACK_DEPTH, params);
    }

    public CompletableFuture<JsonObject> setBlackboxPatterns(List<String> patterns) {
        var array = new JsonArray();
        patterns.forEach(array::add);
        JsonObject params = params();
        params.add("patterns", array);
        return send(Command.SET_BLACKBOX_PATTERNS, params);
    }

    public CompletableFuture<JsonObject> setSkipAllPauses(boolean skip) {
        JsonObject params = params();
        params.addProperty("skip", skip);
        return send(Command.SET_SKIP_ALL_PAUSES, params);
    }
}
