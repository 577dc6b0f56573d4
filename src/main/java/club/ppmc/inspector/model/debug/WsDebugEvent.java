/**
 * WsDebugEvent.java
 *
 * 推送到 /topic/debug-events 的调试事件信封，前端按 type 分派。
 */
package club.ppmc.inspector.model.debug;

/**
 * @param type "STARTED"、"PAUSED"、"RESUMED" 或 "TERMINATED"。
 * @param data PAUSED 时为 {@link PausedEventData}；STARTED / TERMINATED 时为会话 ID；RESUMED 时为 null。
 * @param <T> 载荷类型。
 */
public record WsDebugEvent<T>(String type, T data) {}
