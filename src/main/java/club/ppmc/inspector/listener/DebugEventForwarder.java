/**
 * DebugEventForwarder.java
 *
 * 将中继内部的事件转发给 STOMP 前端：
 * 会话启停与 Debugger.paused / resumed 转为 WsDebugEvent 推送到 /topic/debug-events，
 * 被调试进程的每一行输出推送到 /topic/run-log。
 */
package club.ppmc.inspector.listener;

import club.ppmc.inspector.model.debug.PausedEventData;
import club.ppmc.inspector.model.debug.WsDebugEvent;
import club.ppmc.inspector.service.EventDispatcher;
import club.ppmc.inspector.service.TopicMatcher;
import club.ppmc.inspector.service.WebSocketNotificationService;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.springframework.stereotype.Component;

@Component
public class DebugEventForwarder {

    private final WebSocketNotificationService notificationService;

    public DebugEventForwarder(EventDispatcher dispatcher, WebSocketNotificationService notificationService) {
        this.notificationService = notificationService;

        dispatcher.subscribe(TopicMatcher.exact("Debugger.paused"), (topic, data) -> onPaused(data));
        dispatcher.subscribe(TopicMatcher.exact("Debugger.resumed"),
                (topic, data) -> notificationService.sendDebugEvent(new WsDebugEvent<>("RESUMED", null)));
        dispatcher.subscribe(TopicMatcher.exact("Session.started"),
                (topic, data) -> notificationService.sendDebugEvent(new WsDebugEvent<>("STARTED", stringOf(data, "sessionId"))));
        dispatcher.subscribe(TopicMatcher.exact("Session.stopped"),
                (topic, data) -> notificationService.sendDebugEvent(new WsDebugEvent<>("TERMINATED", stringOf(data, "sessionId"))));
        dispatcher.subscribe(TopicMatcher.exact("Process.output"), (topic, data) -> onOutput(data));
    }

    private void onPaused(JsonObject data) {
        var payload = new PausedEventData(
                stringOf(data, "reason"), arrayOf(data, "callFrames"), arrayOf(data, "hitBreakpoints"));
        notificationService.sendDebugEvent(new WsDebugEvent<>("PAUSED", payload));
    }

    private void onOutput(JsonObject data) {
        notificationService.sendDebuggeeOutput(stringOf(data, "stream"), stringOf(data, "line"));
    }

    private static String stringOf(JsonObject data, String key) {
        JsonElement element = data.get(key);
        return element != null && element.isJsonPrimitive() ? element.getAsString() : null;
    }

    private static JsonArray arrayOf(JsonObject data, String key) {
        JsonElement element = data.get(key);
        return element != null && element.isJsonArray() ? element.getAsJsonArray() : null;
    }
}
