/**
 * BreakpointResult.java
 *
 * Debugger.setBreakpointByUrl 的结果。
 *
 * @param breakpointId 断点 ID，可用于 removeBreakpoint。
 * @param locations 断点已解析到的位置，脚本尚未加载时为空。
 */
package club.ppmc.inspector.model.inspector;

import com.google.gson.JsonArray;

public record BreakpointResult(String breakpointId, JsonArray locations) {}
