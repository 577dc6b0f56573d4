/**
 * InspectorProtocolException.java
 *
 * 被调试进程针对某条命令返回了 JSON-RPC 错误对象。
 */
package club.ppmc.inspector.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class InspectorProtocolException extends InspectorException {

    /** JSON-RPC 错误码。 */
    private final int code;

    /** 失败的命令，例如 "Debugger.stepOver"。 */
    private final String method;

    public InspectorProtocolException(String method, int code, String message) {
        super("PROTOCOL_ERROR", message);
        this.method = method;
        this.code = code;
    }

    @Override
    public Map<String, Object> toErrorData() {
        var data = super.toErrorData();
        data.put("code", code);
        data.put("method", method);
        return data;
    }
}
