/**
 * EvaluateResult.java
 *
 * Runtime.evaluate、Runtime.callFunctionOn、Debugger.evaluateOnCallFrame 等命令的结果。
 */
package club.ppmc.inspector.model.inspector;

import com.google.gson.JsonObject;

/**
 * @param result 求值结果。
 * @param exceptionDetails 求值抛出异常时的详细信息，否则为 null。
 */
public record EvaluateResult(RemoteObject result, JsonObject exceptionDetails) {

    public boolean threw() {
        return exceptionDetails != null;
    }
}
