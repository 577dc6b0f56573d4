/**
 * AbstractDomainController.java
 *
 * 单个协议域（Debugger、Runtime 等）的命令与事件门面的基类。
 * 命令是对 RequestCorrelator.send(domain + "." + method, params) 的薄包装；
 * 事件订阅通过 EventDispatcher 实现，主题限定在本域之内。
 */
package club.ppmc.inspector.service.domain;

import club.ppmc.inspector.service.EventDispatcher;
import club.ppmc.inspector.service.RequestCorrelator;
import club.ppmc.inspector.service.TopicMatcher;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

public abstract class AbstractDomainController {

    /**
     * 一个域内的命令或事件名。枚举常量 STEP_OVER 对应线上名称 "stepOver"。
     */
    public interface DomainMethod {

        String name();

        default String wireName() {
            String[] parts = name().toLowerCase(Locale.ROOT).split("_");
            var sb = new StringBuilder(parts[0]);
            for (int i = 1; i < parts.length; i++) {
                sb.append(Character.toUpperCase(parts[i].charAt(0))).append(parts[i].substring(1));
            }
            return sb.toString();
        }
    }

    private final String domain;
    protected final RequestCorrelator correlator;
    protected final EventDispatcher dispatcher;
    protected final Gson gson;

    protected AbstractDomainController(
            String domain, RequestCorrelator correlator, EventDispatcher dispatcher, Gson gson) {
        this.domain = domain;
        this.correlator = correlator;
        this.dispatcher = dispatcher;
        this.gson = gson;
    }

    public String domain() {
        return domain;
    }

    public CompletableFuture<JsonObject> enable() {
        return correlator.send(domain + ".enable", null);
    }

    public CompletableFuture<JsonObject> disable() {
        return correlator.send(domain + ".disable", null);
    }

    protected CompletableFuture<JsonObject> send(DomainMethod command) {
        return send(command, null);
    }

    protected CompletableFuture<JsonObject> send(DomainMethod command, JsonObject params) {
        return correlator.send(domain + "." + command.wireName(), params);
    }

    protected <T> CompletableFuture<T> send(DomainMethod command, JsonObject params, Class<T> resultType) {
        return send(command, params).thenApply(result -> gson.fromJson(result, resultType));
    }

    // --- 事件订阅 ---

    public EventDispatcher.Subscription on(String eventName, EventDispatcher.EventCallback callback) {
        return dispatcher.subscribe(TopicMatcher.exact(domain + "." + eventName), callback);
    }

    public EventDispatcher.Subscription on(DomainMethod event, EventDispatcher.EventCallback callback) {
        return on(event.wireName(), callback);
    }

    public EventDispatcher.Subscription once(String eventName, EventDispatcher.EventCallback callback) {
        return dispatcher.once(TopicMatcher.exact(domain + "." + eventName), callback);
    }

    public EventDispatcher.Subscription once(DomainMethod event, EventDispatcher.EventCallback callback) {
        return once(event.wireName(), callback);
    }

    /** 订阅本域的全部事件。 */
    public EventDispatcher.Subscription onAny(EventDispatcher.EventCallback callback) {
        return dispatcher.subscribe(TopicMatcher.domain(domain), callback);
    }

    protected static JsonObject params() {
        return new JsonObject();
    }
}
