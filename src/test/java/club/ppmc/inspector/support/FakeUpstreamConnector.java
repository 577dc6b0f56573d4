package club.ppmc.inspector.support;

import club.ppmc.inspector.service.relay.UpstreamConnector;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory stand-in for the debuggee's inspector endpoint.
 */
public final class FakeUpstreamConnector implements UpstreamConnector {

    /** Called for every frame the relay sends upstream. */
    @FunctionalInterface
    public interface Responder {
        void respond(JsonObject request, FakeChannel channel);
    }

    public final class FakeChannel implements Channel {
        private final Listener listener;
        private final List<JsonObject> sent = new CopyOnWriteArrayList<>();
        private volatile boolean open = true;

        private FakeChannel(Listener listener) {
            this.listener = listener;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void send(String message) {
            if (!open) {
                throw new IllegalStateException("channel closed");
            }
            JsonObject request = JsonParser.parseString(message).getAsJsonObject();
            sent.add(request);
            Responder current = responder;
            if (current != null) {
                current.respond(request, this);
            }
        }

        @Override
        public void close() {
            open = false;
        }

        public List<JsonObject> sent() {
            return sent;
        }

        public void emit(String frame) {
            listener.onMessage(frame);
        }

        public String emitEvent(String method, JsonObject params) {
            var event = new JsonObject();
            event.addProperty("method", method);
            event.add("params", params);
            String frame = event.toString();
            emit(frame);
            return frame;
        }

        public void reply(JsonObject request, JsonObject result) {
            emit(RecordingTransport.result(request, result));
        }

        public void replyError(JsonObject request, int code, String message) {
            emit(RecordingTransport.error(request, code, message));
        }

        public void closeFromRemote(int code, String reason) {
            open = false;
            listener.onClose(code, reason);
        }
    }

    private final List<String> urls = new CopyOnWriteArrayList<>();
    private final List<FakeChannel> channels = new CopyOnWriteArrayList<>();
    private volatile boolean hang;
    private volatile RuntimeException failure;
    private volatile Responder responder;

    @Override
    public CompletableFuture<Channel> connect(String url, Listener listener) {
        urls.add(url);
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        if (hang) {
            return new CompletableFuture<>();
        }
        var channel = new FakeChannel(listener);
        channels.add(channel);
        return CompletableFuture.completedFuture(channel);
    }

    public void hang() {
        this.hang = true;
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public void respondWith(Responder responder) {
        this.responder = responder;
    }

    /** Answers every request with an empty result. */
    public void respondWithEmptyResults() {
        this.responder = (request, channel) -> channel.reply(request, new JsonObject());
    }

    public List<String> urls() {
        return urls;
    }

    public int connectCount() {
        return urls.size();
    }

    public FakeChannel channel() {
        return channels.isEmpty() ? null : channels.get(channels.size() - 1);
    }
}
