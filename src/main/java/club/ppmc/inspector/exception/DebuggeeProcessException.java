/**
 * DebuggeeProcessException.java
 *
 * 被调试进程启动失败，或在调试端点就绪之前意外退出。
 */
package club.ppmc.inspector.exception;

public class DebuggeeProcessException extends InspectorException {

    public DebuggeeProcessException(String message) {
        super("PROCESS_ERROR", message);
    }

    public DebuggeeProcessException(String message, Throwable cause) {
        super("PROCESS_ERROR", message, cause);
    }
}
