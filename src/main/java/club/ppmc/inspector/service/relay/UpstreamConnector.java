/**
 * UpstreamConnector.java
 *
 * 打开到被调试进程 inspector 端点的 WebSocket 连接。
 */
package club.ppmc.inspector.service.relay;

import java.util.concurrent.CompletableFuture;

public interface UpstreamConnector {

    /**
     * 上游连接的回调。可能在任意线程上被调用。
     */
    interface Listener {
        void onMessage(String message);

        void onClose(int code, String reason);

        void onError(Throwable error);
    }

    /**
     * 一条已打开的上游连接。
     */
    interface Channel {
        boolean isOpen();

        void send(String message);

        void close();
    }

    /**
     * @return 在握手完成后以打开的通道完成的 Future。
     */
    CompletableFuture<Channel> connect(String url, Listener listener);
}
