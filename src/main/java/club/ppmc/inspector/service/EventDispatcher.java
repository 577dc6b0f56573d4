/**
 * EventDispatcher.java
 *
 * 基于模式匹配的发布/订阅中心。
 * 订阅者注册一个 TopicMatcher 而不是固定主题；publish() 按注册顺序同步调用所有匹配的回调。
 * 单个回调抛出的异常会被记录并吞掉，不影响其他订阅者收到事件。
 * 中继把上游事件与自身的合成事件（Proxy.ready、Proxy.closed、WebSocket.* 、Process.*）都发布到这里。
 */
package club.ppmc.inspector.service;

import com.google.gson.JsonObject;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class EventDispatcher {

    /**
     * 事件回调。
     */
    @FunctionalInterface
    public interface EventCallback {
        void onEvent(String topic, JsonObject data);
    }

    /**
     * 订阅句柄，可通过 {@link #unsubscribe(Subscription)} 或 {@link #cancel()} 单独移除。
     */
    public final class Subscription {
        private final long id;
        private final TopicMatcher matcher;
        private final EventCallback callback;
        private final boolean once;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Subscription(long id, TopicMatcher matcher, EventCallback callback, boolean once) {
            this.id = id;
            this.matcher = matcher;
            this.callback = callback;
            this.once = once;
        }

        public long id() {
            return id;
        }

        public boolean isActive() {
            return active.get();
        }

        public void cancel() {
            unsubscribe(this);
        }
    }

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong nextSubscriptionId = new AtomicLong(1);

    public Subscription subscribe(TopicMatcher matcher, EventCallback callback) {
        return register(matcher, callback, false);
    }

    /**
     * 以通配符字符串订阅，例如 "Debugger.*" 或精确主题 "Debugger.paused"。
     */
    public Subscription subscribe(String pattern, EventCallback callback) {
        return register(TopicMatcher.glob(pattern), callback, false);
    }

    /**
     * 一次性订阅：首次匹配投递后自动移除，即使回调抛出异常。
     */
    public Subscription once(TopicMatcher matcher, EventCallback callback) {
        return register(matcher, callback, true);
    }

    public Subscription once(String pattern, EventCallback callback) {
        return register(TopicMatcher.glob(pattern), callback, true);
    }

    private Subscription register(TopicMatcher matcher, EventCallback callback, boolean once) {
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(callback, "callback");
        var subscription = new Subscription(nextSubscriptionId.getAndIncrement(), matcher, callback, once);
        subscriptions.add(subscription);
        log.debug("新增订阅 #{}{}", subscription.id, once ? " (once)" : "");
        return subscription;
    }

    /**
     * 移除指定订阅，不影响使用相同模式的其他订阅。
     *
     * @return 如果订阅之前处于活动状态，返回 true。
     */
    public boolean unsubscribe(Subscription subscription) {
        if (subscription == null || !subscription.active.compareAndSet(true, false)) {
            return false;
        }
        return subscriptions.remove(subscription);
    }

    /**
     * 将事件同步投递给所有匹配的订阅者。
     *
     * @return 成功收到事件的订阅者数量。
     */
    public int publish(String topic, JsonObject data) {
        Objects.requireNonNull(topic, "topic");
        JsonObject payload = data == null ? new JsonObject() : data;
        int delivered = 0;
        for (Subscription subscription : subscriptions) {
            if (!subscription.isActive() || !subscription.matcher.matches(topic)) {
                continue;
            }
            if (subscription.once && !subscription.active.compareAndSet(true, false)) {
                continue;
            }
            try {
                subscription.callback.onEvent(topic, payload);
                delivered++;
            } catch (RuntimeException e) {
                log.error("订阅 #{} 处理主题 \"{}\" 时出错", subscription.id, topic, e);
            } finally {
                if (subscription.once) {
                    subscriptions.remove(subscription);
                }
            }
        }
        return delivered;
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public void clear() {
        subscriptions.forEach(s -> s.active.set(false));
        subscriptions.clear();
    }
}
