/**
 * StartOptions.java
 *
 * 单次启动调试会话时可覆盖的选项。字段为 null 表示沿用 InspectorSettings 中的默认值。
 */
package club.ppmc.inspector.model;

public record StartOptions(Boolean breakOnStart, Integer inspectPort) {

    public static StartOptions defaults() {
        return new StartOptions(null, null);
    }
}
