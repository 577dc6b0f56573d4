/**
 * ExecutionStateException.java
 *
 * 当前执行状态下不允许该操作，例如在程序运行时单步执行。
 * 在产生任何网络流量之前同步抛出。
 */
package club.ppmc.inspector.exception;

import club.ppmc.inspector.model.inspector.ExecutionState;
import lombok.Getter;

@Getter
public class ExecutionStateException extends InspectorException {

    private final String operation;
    private final ExecutionState actualState;

    public ExecutionStateException(String operation, ExecutionState requiredState, ExecutionState actualState) {
        super(
                "STATE_ERROR",
                String.format(
                        "%s requires a %s target (current state: %s)",
                        operation, requiredState.label(), actualState.label()));
        this.operation = operation;
        this.actualState = actualState;
    }
}
