/**
 * TargetNotFoundException.java
 *
 * 请求调试的脚本在工作区内不存在，或不是普通文件。
 */
package club.ppmc.inspector.exception;

public class TargetNotFoundException extends InspectorException {

    public TargetNotFoundException(String targetFile) {
        super("TARGET_NOT_FOUND", "Target file not found: " + targetFile);
    }
}
