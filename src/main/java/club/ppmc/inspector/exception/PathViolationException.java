/**
 * PathViolationException.java
 *
 * 目标文件解析后位于允许的工作区根目录之外（路径穿越）。
 */
package club.ppmc.inspector.exception;

public class PathViolationException extends InspectorException {

    public PathViolationException(String requestedPath) {
        super("PATH_VIOLATION", "Path traversal detected: '" + requestedPath + "' escapes workspace");
    }

    /** 路径无法解析为真实路径，无法确认其位于工作区之内。 */
    public PathViolationException(String requestedPath, Throwable cause) {
        super("PATH_VIOLATION", "Cannot resolve '" + requestedPath + "' inside workspace: " + cause.getMessage(), cause);
    }
}
