/**
 * WebSocketClientConnection.java
 *
 * 将一个下游 Spring WebSocket 会话适配为 {@link ClientConnection}。
 * 会话被包装为 ConcurrentWebSocketSessionDecorator，从而允许在任意线程上安全发送。
 */
package club.ppmc.inspector.service.relay;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@Slf4j
public class WebSocketClientConnection implements ClientConnection {

    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final WebSocketSession session;

    public WebSocketClientConnection(WebSocketSession session, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void deliver(String message) {
        if (!session.isOpen()) {
            log.debug("客户端 {} 已关闭，丢弃消息", session.getId());
            return;
        }
        try {
            session.sendMessage(new TextMessage(message));
        } catch (IOException e) {
            log.warn("向客户端 {} 发送消息失败: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.warn("关闭客户端 {} 时出错: {}", session.getId(), e.getMessage());
        }
    }
}
