/**
 * PausedEventData.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，聚合 Debugger.paused 事件中需要转发给前端的信息。
 * 调用帧与命中的断点按原样透传。
 */
package club.ppmc.inspector.model.debug;

import com.google.gson.JsonArray;

/**
 * @param reason 暂停原因。
 * @param callFrames 调用帧数组（不解析）。
 * @param hitBreakpoints 命中的断点 ID，可能为 null。
 */
public record PausedEventData(String reason, JsonArray callFrames, JsonArray hitBreakpoints) {}
