/**
 * InspectorProxyHandler.java
 *
 * Inspector 协议代理的下游 WebSocket 端点。
 * 每个连接进来的 UI 调试客户端都被注册为中继的一个 ClientConnection，
 * 收到的文本帧原样交给中继做 id 重映射后转发到上游。
 */
package club.ppmc.inspector.handler;

import club.ppmc.inspector.config.InspectorSettings;
import club.ppmc.inspector.service.InspectorProtocolRelay;
import club.ppmc.inspector.service.relay.WebSocketClientConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@Slf4j
public class InspectorProxyHandler extends TextWebSocketHandler {

    private final InspectorProtocolRelay relay;
    private final InspectorSettings settings;

    public InspectorProxyHandler(InspectorProtocolRelay relay, InspectorSettings settings) {
        this.relay = relay;
        this.settings = settings;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("调试客户端已连接，会话 ID: {}，来源: {}", session.getId(), session.getRemoteAddress());
        session.setTextMessageSizeLimit(settings.getMaxMessageSize());
        relay.attachClient(new WebSocketClientConnection(session, settings.getMaxMessageSize()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        relay.handleClientMessage(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("调试客户端 {} 传输错误: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("调试客户端已断开，会话 ID: {}，状态: {}", session.getId(), status);
        relay.detachClient(session.getId());
    }
}
