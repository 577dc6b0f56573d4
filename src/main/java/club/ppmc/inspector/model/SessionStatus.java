/**
 * SessionStatus.java
 *
 * 调试会话的生命周期状态。同一时刻最多只有一个会话处于非 STOPPED 状态。
 */
package club.ppmc.inspector.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    STARTING("starting"),
    RUNNING("running"),
    PAUSED("paused"),
    STOPPED("stopped");

    private final String label;

    SessionStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isLive() {
        return this != STOPPED;
    }
}
