/**
 * DebugSession.java
 *
 * 该文件定义了一个不可变的记录(record)，描述一个调试会话的元数据。
 * 由 DebugSessionService 在 start() 时创建，状态变化通过 with* 方法产生新实例。
 * 它同时是 REST 接口 /debug/session 的响应载荷。
 */
package club.ppmc.inspector.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * @param sessionId 不透明的会话标识，例如 "session-3"。
 * @param targetFile 工作区相对路径，即客户端提交的文件。
 * @param absolutePath 解析后的绝对路径，保证位于工作区根目录之内。
 * @param inspectPort 被调试进程的 inspector 端口。
 * @param proxyPort 中继对外的 WebSocket 端口。
 * @param wsUrl UI 客户端应连接的中继地址。
 * @param inspectorUrl 被调试进程自身的 inspector WebSocket 地址，就绪前为 null。
 * @param pid 被调试进程的 PID，尚未启动或已退出时为 null。
 * @param status 会话状态。
 * @param createdAt 创建时间。
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record DebugSession(
        String sessionId,
        String targetFile,
        String absolutePath,
        int inspectPort,
        int proxyPort,
        String wsUrl,
        String inspectorUrl,
        Long pid,
        SessionStatus status,
        Instant createdAt) {

    public DebugSession withStatus(SessionStatus newStatus) {
        return new DebugSession(
                sessionId, targetFile, absolutePath, inspectPort, proxyPort, wsUrl, inspectorUrl, pid, newStatus, createdAt);
    }

    public DebugSession withProcess(Long newPid, String newInspectorUrl) {
        return new DebugSession(
                sessionId, targetFile, absolutePath, inspectPort, proxyPort, wsUrl, newInspectorUrl, newPid, status, createdAt);
    }

    public DebugSession withoutProcess() {
        return new DebugSession(
                sessionId, targetFile, absolutePath, inspectPort, proxyPort, wsUrl, inspectorUrl, null, status, createdAt);
    }
}
