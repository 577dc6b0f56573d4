/**
 * RemoteObject.java
 *
 * 被调试进程中一个 JavaScript 值的镜像（Runtime.RemoteObject）。
 * 按值返回时 value 携带 JSON 值；无法用 JSON 表示的值（NaN、-0、Infinity、bigint）放在 unserializableValue 中。
 */
package club.ppmc.inspector.model.inspector;

import com.google.gson.JsonElement;

/**
 * @param type 值的类型，例如 "number"、"object"、"undefined"。
 * @param subtype 对象子类型，例如 "array"、"null"、"error"。
 * @param className 对象的类名。
 * @param value 按值返回时的原始值。
 * @param unserializableValue 无法用 JSON 表示的原始值的字符串形式。
 * @param description 值的字符串描述。
 * @param objectId 远程对象 ID，可用于 getProperties / callFunctionOn。
 */
public record RemoteObject(
        String type,
        String subtype,
        String className,
        JsonElement value,
        String unserializableValue,
        String description,
        String objectId) {

    public boolean hasValue() {
        return value != null && !value.isJsonNull();
    }
}
