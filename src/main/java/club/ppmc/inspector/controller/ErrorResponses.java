/**
 * ErrorResponses.java
 *
 * 将调试中继的异常映射为 HTTP 状态码与结构化的错误响应体 {"error", "message", "type", ...}。
 */
package club.ppmc.inspector.controller;

import club.ppmc.inspector.exception.ExecutionStateException;
import club.ppmc.inspector.exception.InspectorConnectionException;
import club.ppmc.inspector.exception.InspectorException;
import club.ppmc.inspector.exception.InspectorProtocolException;
import club.ppmc.inspector.exception.InspectorTimeoutException;
import club.ppmc.inspector.exception.PathViolationException;
import club.ppmc.inspector.exception.SessionConflictException;
import club.ppmc.inspector.exception.TargetNotFoundException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

final class ErrorResponses {

    private ErrorResponses() {}

    static ResponseEntity<Map<String, Object>> from(Throwable error) {
        Throwable cause = unwrap(error);
        HttpStatus status = statusOf(cause);
        return ResponseEntity.status(status).body(bodyOf(status, cause));
    }

    static HttpStatus statusOf(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof PathViolationException) {
            return HttpStatus.FORBIDDEN;
        }
        if (cause instanceof TargetNotFoundException || cause instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (cause instanceof ExecutionStateException || cause instanceof SessionConflictException) {
            return HttpStatus.CONFLICT;
        }
        if (cause instanceof InspectorConnectionException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (cause instanceof InspectorTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        if (cause instanceof InspectorProtocolException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static Map<String, Object> bodyOf(HttpStatus status, Throwable error) {
        Throwable cause = unwrap(error);
        var body = new LinkedHashMap<String, Object>();
        body.put("error", status.getReasonPhrase());
        if (cause instanceof InspectorException inspectorException) {
            body.putAll(inspectorException.toErrorData());
        } else {
            body.put("message", String.valueOf(cause.getMessage()));
        }
        return body;
    }

    static Map<String, Object> error(String error, String message) {
        var body = new LinkedHashMap<String, Object>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }

    static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
