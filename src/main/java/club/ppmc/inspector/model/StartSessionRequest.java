/**
 * StartSessionRequest.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于封装从前端发起的启动调试会话请求。
 * 它由 DebugSessionController 接收，并传递给 DebugSessionService。
 */
package club.ppmc.inspector.model;

/**
 * @param file 要调试的脚本，相对于工作区根目录的路径。
 * @param breakOnStart (可选) 是否在第一条语句处暂停，为 null 时使用全局配置。
 * @param inspectPort (可选) inspector 端口，为 null 时使用全局配置。
 */
public record StartSessionRequest(String file, Boolean breakOnStart, Integer inspectPort) {

    public StartOptions toOptions() {
        return new StartOptions(breakOnStart, inspectPort);
    }
}
