package club.ppmc.inspector.service.relay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.inspector.config.InspectorSettings;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

class SpringUpstreamConnectorTest {

    private static final String URL = "ws://127.0.0.1:9229/4f1c2a";

    private WebSocketClient webSocketClient;
    private WebSocketSession session;
    private SpringUpstreamConnector connector;
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final List<Integer> closeCodes = new CopyOnWriteArrayList<>();

    private final UpstreamConnector.Listener listener = new UpstreamConnector.Listener() {
        @Override
        public void onMessage(String message) {
            received.add(message);
        }

        @Override
        public void onClose(int code, String reason) {
            closeCodes.add(code);
        }

        @Override
        public void onError(Throwable error) {}
    };

    @BeforeEach
    void setUp() {
        webSocketClient = mock(WebSocketClient.class);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("upstream-1");
        when(session.isOpen()).thenReturn(true);
        when(webSocketClient.execute(any(WebSocketHandler.class), eq(URL)))
                .thenReturn(CompletableFuture.completedFuture(session));
        connector = new SpringUpstreamConnector(webSocketClient, new InspectorSettings());
    }

    @Test
    void framesAreSentThroughTheSession() throws Exception {
        UpstreamConnector.Channel channel = connector.connect(URL, listener).get(1, TimeUnit.SECONDS);

        channel.send("{\"id\":1,\"method\":\"Runtime.enable\"}");

        var captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(captor.capture());
        assertEquals("{\"id\":1,\"method\":\"Runtime.enable\"}", captor.getValue().getPayload());
        assertTrue(channel.isOpen());
    }

    @Test
    void closeRunsOffTheCallingThread() throws Exception {
        var closedOn = new AtomicReference<Thread>();
        var closed = new CountDownLatch(1);
        doAnswer(invocation -> {
            closedOn.set(Thread.currentThread());
            closed.countDown();
            return null;
        }).when(session).close(any(CloseStatus.class));
        UpstreamConnector.Channel channel = connector.connect(URL, listener).get(1, TimeUnit.SECONDS);

        channel.close();

        assertTrue(closed.await(2, TimeUnit.SECONDS));
        assertNotSame(Thread.currentThread(), closedOn.get());
        verify(session).close(CloseStatus.NORMAL);
    }

    @Test
    void sessionCallbacksReachTheListener() throws Exception {
        connector.connect(URL, listener).get(1, TimeUnit.SECONDS);
        var handler = ArgumentCaptor.forClass(WebSocketHandler.class);
        verify(webSocketClient).execute(handler.capture(), eq(URL));

        handler.getValue().handleMessage(session, new TextMessage("{\"method\":\"Debugger.resumed\"}"));
        handler.getValue().afterConnectionClosed(session, new CloseStatus(1006, "gone"));

        assertEquals(List.of("{\"method\":\"Debugger.resumed\"}"), received);
        assertEquals(List.of(1006), closeCodes);
    }
}
