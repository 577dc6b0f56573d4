/**
 * WebSocketNotificationService.java
 *
 * 调试中继面向前端的 STOMP 推送出口，封装了 SimpMessagingTemplate。
 * 会话生命周期与暂停 / 继续事件以 WsDebugEvent 的形式推送到 /topic/debug-events，
 * 被调试进程的输出逐行推送到 /topic/run-log。
 */
package club.ppmc.inspector.service;

import club.ppmc.inspector.model.debug.WsDebugEvent;
import com.google.gson.Gson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class WebSocketNotificationService {

    public static final String DEBUG_EVENTS_TOPIC = "/topic/debug-events";
    public static final String RUN_LOG_TOPIC = "/topic/run-log";

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /**
     * 推送一个调试事件。载荷中的调用帧是 Gson 的 JsonArray，因此先用 Gson 序列化为字符串。
     */
    public void sendDebugEvent(WsDebugEvent<?> event) {
        publish(DEBUG_EVENTS_TOPIC, gson.toJson(event));
    }

    /**
     * 推送被调试进程的一行输出，标准错误以 "[错误]" 开头，标准输出以 "[信息]" 开头。
     */
    public void sendDebuggeeOutput(String stream, String line) {
        String prefix = "stderr".equals(stream) ? "错误" : "信息";
        publish(RUN_LOG_TOPIC, String.format("[%s] %s", prefix, line));
    }

    private void publish(String destination, String payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException e) {
            // 推送失败只记录日志，不向调用方传播
            log.warn("向 {} 推送消息失败: {}", destination, e.getMessage());
        }
    }
}
