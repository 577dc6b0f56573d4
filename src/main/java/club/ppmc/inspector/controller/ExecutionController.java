/**
 * ExecutionController.java
 *
 * 执行控制的 REST 接口：暂停、继续、单步与表达式求值，以及执行状态查询。
 * 这些操作与 UI 客户端经中继发送的命令共享同一条上游连接。
 * 响应体含有透传的协议数据（Gson 的 JsonObject），因此用 Gson 序列化后以 JSON 字符串返回。
 */
package club.ppmc.inspector.controller;

import club.ppmc.inspector.model.EvaluateRequest;
import club.ppmc.inspector.model.inspector.ExecutionSnapshot;
import club.ppmc.inspector.service.ExecutionStateMachine;
import club.ppmc.inspector.service.domain.DebuggerDomainController;
import club.ppmc.inspector.service.domain.RuntimeDomainController;
import club.ppmc.inspector.service.domain.RuntimeDomainController.EvaluateOptions;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = "/debug/execution", produces = MediaType.APPLICATION_JSON_VALUE)
@Slf4j
public class ExecutionController {

    private final DebuggerDomainController debugger;
    private final RuntimeDomainController runtime;
    private final ExecutionStateMachine stateMachine;
    private final Gson gson;

    public ExecutionController(
            DebuggerDomainController debugger,
            RuntimeDomainController runtime,
            ExecutionStateMachine stateMachine,
            Gson gson) {
        this.debugger = debugger;
        this.runtime = runtime;
        this.stateMachine = stateMachine;
        this.gson = gson;
    }

    @PostMapping("/pause")
    public CompletableFuture<ResponseEntity<String>> pause() {
        return execute("pause", debugger::pause);
    }

    @PostMapping("/resume")
    public CompletableFuture<ResponseEntity<String>> resume() {
        return execute("resume", debugger::resume);
    }

    /**
     * 执行"步过"（Step Over）操作。目标未暂停时返回 409。
     */
    @PostMapping("/stepOver")
    public CompletableFuture<ResponseEntity<String>> stepOver() {
        return execute("stepOver", debugger::stepOver);
    }

    @PostMapping("/stepInto")
    public CompletableFuture<ResponseEntity<String>> stepInto() {
        return execute("stepInto", debugger::stepInto);
    }

    @PostMapping("/stepOut")
    public CompletableFuture<ResponseEntity<String>> stepOut() {
        return execute("stepOut", debugger::stepOut);
    }

    /**
     * 在被调试进程的全局作用域中求值。
     */
    @PostMapping("/evaluate")
    public CompletableFuture<ResponseEntity<String>> evaluate(@RequestBody EvaluateRequest request) {
        if (request == null || request.expression() == null || request.expression().isBlank()) {
            return CompletableFuture.completedFuture(ResponseEntity.badRequest()
                    .body(gson.toJson(ErrorResponses.error("Bad request", "Missing required field: expression"))));
        }
        var options = new EvaluateOptions(request.returnByValue(), null, null, null, null);
        return runtime.evaluate(request.expression(), options)
                .thenApply(result -> ResponseEntity.ok(gson.toJson(result)))
                .exceptionally(this::toErrorResponse);
    }

    @GetMapping("/state")
    public ResponseEntity<String> state() {
        ExecutionSnapshot snapshot = stateMachine.snapshot();
        var body = new JsonObject();
        body.addProperty("state", snapshot.state().label());
        body.addProperty("pauseReason", snapshot.pauseReason());
        body.add("callFrames", snapshot.callFrames());
        return ResponseEntity.ok(gson.toJson(body));
    }

    private CompletableFuture<ResponseEntity<String>> execute(
            String operation, Supplier<CompletableFuture<JsonObject>> command) {
        CompletableFuture<JsonObject> pending;
        try {
            pending = command.get();
        } catch (RuntimeException e) {
            // 状态检查失败时同步抛出
            log.warn("拒绝执行 {}: {}", operation, e.getMessage());
            return CompletableFuture.completedFuture(toErrorResponse(e));
        }
        return pending.thenApply(result -> {
                    var body = new JsonObject();
                    body.addProperty("success", true);
                    body.add("result", result);
                    return ResponseEntity.ok(gson.toJson(body));
                })
                .exceptionally(this::toErrorResponse);
    }

    private ResponseEntity<String> toErrorResponse(Throwable error) {
        HttpStatus status = ErrorResponses.statusOf(error);
        return ResponseEntity.status(status).body(gson.toJson(ErrorResponses.bodyOf(status, error)));
    }
}
