/**
 * RuntimeDomainController.java
 *
 * Runtime 域的命令与事件门面：表达式求值、对象属性查询、远程函数调用等。
 */
package club.ppmc.inspector.service.domain;

import club.ppmc.inspector.model.inspector.EvaluateResult;
import club.ppmc.inspector.model.inspector.PropertiesResult;
import club.ppmc.inspector.service.EventDispatcher;
import club.ppmc.inspector.service.RequestCorrelator;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Service;

@Service
public class RuntimeDomainController extends AbstractDomainController {

    public enum Command implements DomainMethod {
        EVALUATE,
        GET_PROPERTIES,
        CALL_FUNCTION_ON,
        RUN_IF_WAITING_FOR_DEBUGGER,
        RELEASE_OBJECT,
        RELEASE_OBJECT_GROUP,
        GET_HEAP_USAGE,
        COMPILE_SCRIPT,
        RUN_SCRIPT
    }

    public enum Event implements DomainMethod {
        CONSOLE_API_CALLED {
            @Override
            public String wireName() {
                return "consoleAPICalled";
            }
        },
        EXCEPTION_THROWN,
        EXECUTION_CONTEXT_CREATED,
        EXECUTION_CONTEXT_DESTROYED,
        EXECUTION_CONTEXTS_CLEARED
    }

    /**
     * Runtime.evaluate 的可选参数，为 null 的字段不会发送。
     */
    public record EvaluateOptions(
            Boolean returnByValue, Boolean awaitPromise, Boolean generatePreview, String objectGroup, Integer contextId) {

        public static EvaluateOptions defaults() {
            return new EvaluateOptions(null, null, null, null, null);
        }

        public static EvaluateOptions byValue() {
            return new EvaluateOptions(true, null, null, null, null);
        }

        void applyTo(JsonObject params) {
            if (returnByValue != null) {
                params.addProperty("returnByValue", returnByValue);
            }
            if (awaitPromise != null) {
                params.addProperty("awaitPromise", awaitPromise);
            }
            if (generatePreview != null) {
                params.addProperty("generatePreview", generatePreview);
            }
            if (objectGroup != null) {
                params.addProperty("objectGroup", objectGroup);
            }
            if (contextId != null) {
                params.addProperty("contextId", contextId);
            }
        }
    }

    public RuntimeDomainController(RequestCorrelator correlator, EventDispatcher dispatcher, Gson gson) {
        super("Runtime", correlator, dispatcher, gson);
    }

    public CompletableFuture<EvaluateResult> evaluate(String expression) {
        return evaluate(expression, EvaluateOptions.defaults());
    }

    public CompletableFuture<EvaluateResult> evaluate(String expression, EvaluateOptions options) {
        JsonObject params = params();
        params.addProperty("expression", expression);
        if (options != null) {
            options.applyTo(params);
        }
        return send(Command.EVALUATE, params, EvaluateResult.class);
    }

    public CompletableFuture<PropertiesResult> getProperties(String objectId) {
        return getProperties(objectId, false);
    }

    public CompletableFuture<PropertiesResult> getProperties(String objectId, boolean ownProperties) {
        JsonObject params = params();
        params.addProperty("objectId", objectId);
        params.addProperty("ownProperties", ownProperties);
        return send(Command.GET_PROPERTIES, params, PropertiesResult.class);
    }

    public CompletableFuture<EvaluateResult> callFunctionOn(String functionDeclaration, String objectId) {
        return callFunctionOn(functionDeclaration, objectId, List.of());
    }

    /**
     * @param arguments Runtime.CallArgument 列表，例如 {"value": 1} 或 {"objectId": "..."}。
     */
    public CompletableFuture<EvaluateResult> callFunctionOn(
            String functionDeclaration, String objectId, List<JsonObject> arguments) {
        JsonObject params = params();
        params.addProperty("functionDeclaration", functionDeclaration);
        params.addProperty("objectId", objectId);
        if (!arguments.isEmpty()) {
            var array = new JsonArray();
            arguments.forEach(array::add);
            params.add("arguments", array);
        }
        return send(Command.CALL_FUNCTION_ON, params, EvaluateResult.class);
    }

    public CompletableFuture<JsonObject> runIfWaitingForDebugger() {
        return send(Command.RUN_IF_WAITING_FOR_DEBUGGER);
    }

    public CompletableFuture<JsonObject> releaseObject(String objectId) {
        JsonObject params = params();
        params.addProperty("objectId", objectId);
        return send(Command.RELEASE_OBJECT, params);
    }

    public CompletableFuture<JsonObject> releaseObjectGroup(String objectGroup) {
        JsonObject params = params();
        params.addProperty("objectGroup", objectGroup);
        return send(Command.RELEASE_OBJECT_GROUP, params);
    }

    /** 返回 {usedSize, totalSize}。 */
    public CompletableFuture<JsonObject> getHeapUsage() {
        return send(Command.GET_HEAP_USAGE);
    }

    public CompletableFuture<JsonObject> compileScript(String expression, String sourceUrl, boolean persistScript) {
        JsonObject params = params();
        params.addProperty("expression", expression);
        params.addProperty("sourceURL", sourceUrl);
        params.addProperty("persistScript", persistScript);
        return send(Command.COMPILE_SCRIPT, params);
    }

    public CompletableFuture<EvaluateResult> runScript(String scriptId) {
        JsonObject params = params();
        params.addProperty("scriptId", scriptId);
        return send(Command.RUN_SCRIPT, params, EvaluateResult.class);
    }
}
