/**
 * InProcessClientConnection.java
 *
 * 进程内的中继客户端：服务端的领域控制器通过它与其他 UI 客户端一样共享同一条上游连接，
 * 其发出的命令同样经过全局 id 重映射。
 */
package club.ppmc.inspector.service.relay;

import club.ppmc.inspector.service.InspectorTransport;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

public final class InProcessClientConnection implements ClientConnection, InspectorTransport {

    /**
     * 中继侧的入口：把客户端发出的一帧交给中继处理。
     */
    @FunctionalInterface
    public interface RelayInbound {
        void handleClientMessage(String clientId, String message);
    }

    private final String id;
    private final RelayInbound relay;
    private final BooleanSupplier upstreamOpen;
    private final Consumer<String> onMessage;
    private final Consumer<String> onClosed;
    private volatile boolean open = true;

    public InProcessClientConnection(
            String id,
            RelayInbound relay,
            BooleanSupplier upstreamOpen,
            Consumer<String> onMessage,
            Consumer<String> onClosed) {
        this.id = id;
        this.relay = relay;
        this.upstreamOpen = upstreamOpen;
        this.onMessage = onMessage;
        this.onClosed = onClosed;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public boolean isConnected() {
        return open && upstreamOpen.getAsBoolean();
    }

    @Override
    public void send(String message) {
        relay.handleClientMessage(id, message);
    }

    @Override
    public void deliver(String message) {
        if (open) {
            onMessage.accept(message);
        }
    }

    @Override
    public void close(int code, String reason) {
        if (open) {
            open = false;
            onClosed.accept(reason);
        }
    }

    @Override
    public boolean isInProcess() {
        return true;
    }
}
