/**
 * InspectorTransport.java
 *
 * RequestCorrelator 发送命令所用的传输通道。
 */
package club.ppmc.inspector.service;

public interface InspectorTransport {

    /** 通道是否可以发送命令（即上游 inspector 连接处于打开状态）。 */
    boolean isConnected();

    void send(String message);
}
