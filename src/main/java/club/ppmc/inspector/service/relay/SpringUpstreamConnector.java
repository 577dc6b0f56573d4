/**
 * SpringUpstreamConnector.java
 *
 * 基于 Spring {@link WebSocketClient}（JSR-356 标准客户端）实现的上游连接器。
 * 上游会话同样包装为 ConcurrentWebSocketSessionDecorator：发送有时间上限，
 * 另一条发送尚在进行时新消息进入缓冲区而不是阻塞 reactor；关闭握手在 reactor 之外执行。
 */
package club.ppmc.inspector.service.relay;

import club.ppmc.inspector.config.InspectorSettings;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@Slf4j
public class SpringUpstreamConnector implements UpstreamConnector {

    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final WebSocketClient webSocketClient;
    private final int bufferSizeLimit;

    public SpringUpstreamConnector(WebSocketClient webSocketClient, InspectorSettings settings) {
        this.webSocketClient = webSocketClient;
        this.bufferSizeLimit = settings.getMaxMessageSize();
    }

    @Override
    public CompletableFuture<Channel> connect(String url, Listener listener) {
        log.info("正在连接被调试进程的 inspector 端点: {}", url);
        var handler = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                listener.onMessage(message.getPayload());
            }

            @Override
            public void handleTransportError(WebSocketSession session, Throwable exception) {
                listener.onError(exception);
            }

            @Override
            public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
                listener.onClose(status.getCode(), status.getReason() == null ? "" : status.getReason());
            }
        };
        return webSocketClient.execute(handler, url)
                .thenApply(session -> new SessionChannel(
                        new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, bufferSizeLimit)));
    }

    private record SessionChannel(WebSocketSession session) implements Channel {

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }

        @Override
        public void send(String message) {
            try {
                session.sendMessage(new TextMessage(message));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void close() {
            CompletableFuture.runAsync(() -> {
                try {
                    session.close(CloseStatus.NORMAL);
                } catch (IOException e) {
                    log.warn("关闭上游连接时出错: {}", e.getMessage());
                }
            });
        }
    }
}
