/**
 * ExecutionSnapshot.java
 *
 * 执行状态机在某一时刻的不可变快照。
 * 调用帧按原样透传，中继不解析其内容。
 */
package club.ppmc.inspector.model.inspector;

import com.google.gson.JsonArray;

/**
 * @param state 当前执行状态。
 * @param pauseReason 最近一次暂停的原因（例如 "Break on start"、"other"），未暂停过则为 null。
 * @param callFrames 最近一次暂停时的调用帧，未暂停过则为 null。
 */
public record ExecutionSnapshot(ExecutionState state, String pauseReason, JsonArray callFrames) {

    public static ExecutionSnapshot disconnected() {
        return new ExecutionSnapshot(ExecutionState.DISCONNECTED, null, null);
    }
}
