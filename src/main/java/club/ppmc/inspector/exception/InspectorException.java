/**
 * InspectorException.java
 *
 * 调试中继所有错误的基类（非受检异常）。
 * 每个子类对应一种错误类别，携带一个机器可读的类型标识，
 * 以便 Controller 层将其转换为对前端友好的结构化响应。
 */
package club.ppmc.inspector.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

@Getter
public abstract class InspectorException extends RuntimeException {

    /** 错误类别，例如 "CONNECTION_ERROR"、"STATE_ERROR"。 */
    private final String type;

    protected InspectorException(String type, String message) {
        super(message);
        this.type = type;
    }

    protected InspectorException(String type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("type", type);
        data.put("message", getMessage());
        return data;
    }
}
