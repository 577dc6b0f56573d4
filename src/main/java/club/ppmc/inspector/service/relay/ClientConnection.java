/**
 * ClientConnection.java
 *
 * 中继的一个下游客户端连接。可以是一个远端 UI 的 WebSocket 会话，也可以是进程内的命令通道。
 */
package club.ppmc.inspector.service.relay;

public interface ClientConnection {

    String id();

    boolean isOpen();

    /** 将一条（已改写 id 的）响应或事件投递给客户端。 */
    void deliver(String message);

    void close(int code, String reason);

    /**
     * 进程内连接在上游断开时由自身拒绝所有挂起请求，不需要中继为其合成错误响应。
     */
    default boolean isInProcess() {
        return false;
    }
}
