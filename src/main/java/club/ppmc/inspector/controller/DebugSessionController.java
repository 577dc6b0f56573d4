/**
 * DebugSessionController.java
 *
 * 调试会话的 REST 接口。
 * 前端通过它启动、查询和停止调试会话；会话启动成功后，响应中的 wsUrl 即为 UI 调试客户端应连接的中继地址。
 */
package club.ppmc.inspector.controller;

import club.ppmc.inspector.model.DebugSession;
import club.ppmc.inspector.model.StartSessionRequest;
import club.ppmc.inspector.service.DebugSessionService;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug")
@Slf4j
public class DebugSessionController {

    private final DebugSessionService sessionService;

    public DebugSessionController(DebugSessionService sessionService) {
        this.sessionService = sessionService;
    }

    /**
     * 启动一个调试会话。已有会话时会先将其停止。
     *
     * @param request 包含工作区相对路径的请求体。
     * @return 201 与会话信息；路径越界返回 403，缺少或找不到文件返回 400。
     */
    @PostMapping("/session")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> start(@RequestBody StartSessionRequest request) {
        if (request == null || request.file() == null || request.file().isBlank()) {
            return CompletableFuture.completedFuture(ResponseEntity.badRequest()
                    .body(ErrorResponses.error("Bad request", "Missing required field: file")));
        }
        log.info("收到启动调试会话请求: {}", request.file());
        return sessionService.start(request.file(), request.toOptions())
                .thenApply(session -> {
                    var body = new LinkedHashMap<String, Object>();
                    body.put("success", true);
                    body.put("session", session);
                    return ResponseEntity.status(HttpStatus.CREATED).body((Map<String, Object>) body);
                })
                .exceptionally(error -> {
                    log.warn("启动调试会话失败: {}", ErrorResponses.unwrap(error).getMessage());
                    return ErrorResponses.from(error);
                });
    }

    /**
     * 获取当前会话。没有活动会话时返回 404。
     */
    @GetMapping("/session")
    public ResponseEntity<?> current() {
        Optional<DebugSession> session = sessionService.current();
        if (session.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponses.error("No active session", "No debug session is currently running"));
        }
        return ResponseEntity.ok(session.get());
    }

    @GetMapping("/sessions")
    public ResponseEntity<Map<String, Object>> list() {
        return ResponseEntity.ok(Map.of("sessions", sessionService.list()));
    }

    @GetMapping("/session/{id}")
    public ResponseEntity<?> get(@PathVariable("id") String sessionId) {
        return sessionService.find(sessionId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> sessionNotFound(sessionId));
    }

    /**
     * 停止指定会话。
     */
    @DeleteMapping("/session/{id}")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> stop(@PathVariable("id") String sessionId) {
        return sessionService.stop(sessionId)
                .thenApply(stopped -> stopped.map(DebugSessionController::stoppedBody)
                        .orElseGet(() -> sessionNotFound(sessionId)));
    }

    /**
     * 停止当前会话。
     */
    @DeleteMapping("/session")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> stopCurrent() {
        return sessionService.stop(null)
                .thenApply(stopped -> stopped.map(DebugSessionController::stoppedBody)
                        .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                                .body(ErrorResponses.error("No active session", "No debug session is currently running"))));
    }

    private static ResponseEntity<Map<String, Object>> stoppedBody(DebugSession session) {
        var body = new LinkedHashMap<String, Object>();
        body.put("success", true);
        body.put("sessionId", session.sessionId());
        body.put("status", session.status().label());
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<Map<String, Object>> sessionNotFound(String sessionId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponses.error("Session not found", "Session not found: " + sessionId));
    }
}
