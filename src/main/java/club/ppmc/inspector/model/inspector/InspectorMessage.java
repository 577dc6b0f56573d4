/**
 * InspectorMessage.java
 *
 * Inspector 协议（CDP）线上消息的轻量视图。
 * 带 id 的是命令或响应，不带 id 的是事件。载荷保持为 Gson 的 JsonElement，不做解释。
 */
package club.ppmc.inspector.model.inspector;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

public record InspectorMessage(JsonObject raw) {

    /**
     * 解析一帧文本。非 JSON 对象时抛出 {@link JsonParseException}。
     */
    public static InspectorMessage parse(String text) {
        JsonElement element = JsonParser.parseString(text);
        if (!element.isJsonObject()) {
            throw new JsonParseException("Inspector message must be a JSON object");
        }
        return new InspectorMessage(element.getAsJsonObject());
    }

    public static JsonObject request(long id, String method, JsonObject params) {
        var json = new JsonObject();
        json.addProperty("id", id);
        json.addProperty("method", method);
        json.add("params", params == null ? new JsonObject() : params);
        return json;
    }

    public static JsonObject event(String method, JsonObject params) {
        var json = new JsonObject();
        json.addProperty("method", method);
        json.add("params", params == null ? new JsonObject() : params);
        return json;
    }

    public static JsonObject errorResponse(JsonElement id, int code, String message) {
        var error = new JsonObject();
        error.addProperty("code", code);
        error.addProperty("message", message);
        var json = new JsonObject();
        json.add("id", id);
        json.add("error", error);
        return json;
    }

    public boolean hasId() {
        return raw.has("id") && !raw.get("id").isJsonNull();
    }

    public JsonElement id() {
        return raw.get("id");
    }

    /** 数字 id；非数字 id 返回 -1。 */
    public long numericId() {
        JsonElement id = raw.get("id");
        if (id != null && id.isJsonPrimitive() && id.getAsJsonPrimitive().isNumber()) {
            return id.getAsLong();
        }
        return -1;
    }

    public String method() {
        JsonElement method = raw.get("method");
        return method != null && method.isJsonPrimitive() ? method.getAsString() : null;
    }

    public JsonObject params() {
        JsonElement params = raw.get("params");
        return params != null && params.isJsonObject() ? params.getAsJsonObject() : new JsonObject();
    }

    public JsonObject result() {
        JsonElement result = raw.get("result");
        return result != null && result.isJsonObject() ? result.getAsJsonObject() : new JsonObject();
    }

    public JsonObject error() {
        JsonElement error = raw.get("error");
        return error != null && error.isJsonObject() ? error.getAsJsonObject() : null;
    }

    /** 返回 id 被替换后的副本，原消息保持不变。 */
    public JsonObject withId(JsonElement newId) {
        JsonObject copy = raw.deepCopy();
        copy.add("id", newId);
        return copy;
    }
}
