package club.ppmc.inspector.service.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.inspector.config.InspectorSettings;
import club.ppmc.inspector.model.inspector.EvaluateResult;
import club.ppmc.inspector.model.inspector.PropertiesResult;
import club.ppmc.inspector.service.EventDispatcher;
import club.ppmc.inspector.service.RequestCorrelator;
import club.ppmc.inspector.support.RecordingSubscriber;
import club.ppmc.inspector.support.RecordingTransport;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RuntimeDomainControllerTest {

    private ScheduledExecutorService scheduler;
    private EventDispatcher dispatcher;
    private RecordingTransport transport;
    private RuntimeDomainController runtime;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        dispatcher = new EventDispatcher();
        var correlator = new RequestCorrelator(scheduler, new InspectorSettings());
        transport = new RecordingTransport();
        transport.replyTo(correlator::handleMessage, this::answer);
        correlator.attach(transport);
        runtime = new RuntimeDomainController(correlator, dispatcher, new Gson());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    /** 模拟 V8 对几条表达式的求值结果。 */
    private String answer(JsonObject request) {
        JsonObject params = request.getAsJsonObject("params");
        var result = new JsonObject();
        switch (request.get("method").getAsString()) {
            case "Runtime.evaluate" -> {
                String expression = params.get("expression").getAsString();
                var remote = new JsonObject();
                switch (expression) {
                    case "2 + 2" -> {
                        remote.addProperty("type", "number");
                        remote.addProperty("value", 4);
                        remote.addProperty("description", "4");
                    }
                    case "Math.PI" -> {
                        remote.addProperty("type", "number");
                        remote.addProperty("value", Math.PI);
                        remote.addProperty("description", "3.141592653589793");
                    }
                    case "({a: 1})" -> {
                        remote.addProperty("type", "object");
                        remote.addProperty("className", "Object");
                        remote.addProperty("objectId", "obj-1");
                        remote.addProperty("description", "Object");
                    }
                    default -> {
                        remote.addProperty("type", "object");
                        remote.addProperty("subtype", "error");
                        remote.addProperty("description", "ReferenceError: nope is not defined");
                        var details = new JsonObject();
                        details.addProperty("text", "Uncaught");
                        result.add("exceptionDetails", details);
                    }
                }
                result.add("result", remote);
            }
            case "Runtime.getProperties" -> {
                var property = new JsonObject();
                property.addProperty("name", "a");
                var array = new JsonArray();
                array.add(property);
                result.add("result", array);
            }
            case "Runtime.getHeapUsage" -> {
                result.addProperty("usedSize", 1024);
                result.addProperty("totalSize", 4096);
            }
            default -> {
            }
        }
        return RecordingTransport.result(request, result);
    }

    @Test
    void evaluatesArithmetic() throws Exception {
        EvaluateResult result = runtime.evaluate("2 + 2").get(1, TimeUnit.SECONDS);

        assertFalse(result.threw());
        assertEquals("number", result.result().type());
        assertEquals(4, result.result().value().getAsInt());
    }

    @Test
    void evaluatesMathPi() throws Exception {
        EvaluateResult result = runtime.evaluate("Math.PI").get(1, TimeUnit.SECONDS);

        assertEquals(Math.PI, result.result().value().getAsDouble(), 1e-4);
    }

    @Test
    void objectResultCarriesObjectId() throws Exception {
        EvaluateResult result = runtime.evaluate("({a: 1})").get(1, TimeUnit.SECONDS);

        assertFalse(result.result().hasValue());
        assertEquals("obj-1", result.result().objectId());

        PropertiesResult properties = runtime.getProperties("obj-1", true).get(1, TimeUnit.SECONDS);
        assertEquals("a", properties.result().get(0).getAsJsonObject().get("name").getAsString());
        JsonObject sent = transport.lastSent().getAsJsonObject("params");
        assertTrue(sent.get("ownProperties").getAsBoolean());
    }

    @Test
    void thrownExceptionIsReportedInResult() throws Exception {
        EvaluateResult result = runtime.evaluate("nope").get(1, TimeUnit.SECONDS);

        assertTrue(result.threw());
        assertEquals("error", result.result().subtype());
    }

    @Test
    void onlyGivenOptionsAreSent() throws Exception {
        runtime.evaluate("2 + 2", RuntimeDomainController.EvaluateOptions.byValue()).get(1, TimeUnit.SECONDS);

        JsonObject params = transport.lastSent().getAsJsonObject("params");
        assertTrue(params.get("returnByValue").getAsBoolean());
        assertFalse(params.has("awaitPromise"));
        assertFalse(params.has("contextId"));
    }

    @Test
    void callFunctionOnPassesArguments() throws Exception {
        var argument = new JsonObject();
        argument.addProperty("value", 3);

        runtime.callFunctionOn("function(n) { return this.a + n; }", "obj-1", List.of(argument))
                .get(1, TimeUnit.SECONDS);

        JsonObject params = transport.lastSent().getAsJsonObject("params");
        assertEquals("obj-1", params.get("objectId").getAsString());
        assertEquals(3, params.getAsJsonArray("arguments").get(0).getAsJsonObject().get("value").getAsInt());
    }

    @Test
    void heapUsageIsPassedThrough() throws Exception {
        JsonObject usage = runtime.getHeapUsage().get(1, TimeUnit.SECONDS);

        assertEquals(1024, usage.get("usedSize").getAsLong());
    }

    @Test
    void enableAndRunIfWaitingUseDomainPrefix() throws Exception {
        runtime.enable().get(1, TimeUnit.SECONDS);
        runtime.runIfWaitingForDebugger().get(1, TimeUnit.SECONDS);

        assertEquals(List.of("Runtime.enable", "Runtime.runIfWaitingForDebugger"), transport.sentMethods());
    }

    @Test
    void consoleApiEventNameKeepsAcronym() {
        assertEquals("consoleAPICalled", RuntimeDomainController.Event.CONSOLE_API_CALLED.wireName());
        assertEquals("executionContextCreated", RuntimeDomainController.Event.EXECUTION_CONTEXT_CREATED.wireName());

        var console = new RecordingSubscriber();
        runtime.on(RuntimeDomainController.Event.CONSOLE_API_CALLED, console);
        dispatcher.publish("Runtime.consoleAPICalled", new JsonObject());

        assertEquals(List.of("Runtime.consoleAPICalled"), console.topics());
    }

    @Test
    void onceFiresForTheFirstEventOnly() {
        var first = new RecordingSubscriber();
        runtime.once(RuntimeDomainController.Event.EXECUTION_CONTEXT_CREATED, first);

        dispatcher.publish("Runtime.executionContextCreated", new JsonObject());
        dispatcher.publish("Runtime.executionContextCreated", new JsonObject());

        assertEquals(1, first.received().size());
    }
}
