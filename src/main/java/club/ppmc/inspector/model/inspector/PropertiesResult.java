/**
 * PropertiesResult.java
 *
 * Runtime.getProperties 的结果。属性描述符按原样透传。
 */
package club.ppmc.inspector.model.inspector;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

public record PropertiesResult(JsonArray result, JsonArray internalProperties, JsonObject exceptionDetails) {}
