/**
 * InspectorConnectionException.java
 *
 * 没有可用的传输连接，或连接在请求尚未得到响应时断开。
 */
package club.ppmc.inspector.exception;

public class InspectorConnectionException extends InspectorException {

    public static final String NO_ACTIVE_SESSION = "No active session";

    public InspectorConnectionException(String message) {
        super("CONNECTION_ERROR", message);
    }

    public static InspectorConnectionException noActiveSession() {
        return new InspectorConnectionException(NO_ACTIVE_SESSION);
    }
}
