/**
 * SessionConflictException.java
 *
 * 进程监管器已经跟踪着一个存活的被调试进程时，又请求启动新的进程。
 */
package club.ppmc.inspector.exception;

public class SessionConflictException extends InspectorException {

    public SessionConflictException(long pid) {
        super("SESSION_CONFLICT", "Debuggee process is already running (pid " + pid + ")");
    }
}
