/**
 * ExecutionState.java
 *
 * 被调试目标的执行状态。仅由调试器事件（paused / resumed）和连接的建立与断开驱动。
 */
package club.ppmc.inspector.model.inspector;

public enum ExecutionState {
    RUNNING("running"),
    PAUSED("paused"),
    DISCONNECTED("disconnected");

    private final String label;

    ExecutionState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
