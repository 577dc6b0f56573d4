/**
 * ProfilerDomainController.java
 *
 * Profiler 域的命令与事件门面：CPU 采样与代码覆盖率。
 * 返回的 profile 与覆盖率数据按原样透传。
 */
package club.ppmc.inspector.service.domain;

import club.ppmc.inspector.service.EventDispatcher;
import club.ppmc.inspector.service.RequestCorrelator;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Service;

@Service
public class ProfilerDomainController extends AbstractDomainController {

    public enum Command implements DomainMethod {
        START,
        STOP,
        SET_SAMPLING_INTERVAL,
        START_PRECISE_COVERAGE,
        STOP_PRECISE_COVERAGE,
        TAKE_PRECISE_COVERAGE,
        GET_BEST_EFFORT_COVERAGE
    }

    public enum Event implements DomainMethod {
        CONSOLE_PROFILE_STARTED,
        CONSOLE_PROFILE_FINISHED
    }

    public ProfilerDomainController(RequestCorrelator correlator, EventDispatcher dispatcher, Gson gson) {
        super("Profiler", correlator, dispatcher, gson);
    }

    public CompletableFuture<JsonObject> start() {
        return send(Command.START);
    }

    /** 结果中的 "profile" 字段为完整的 CPU profile。 */
    public CompletableFuture<JsonObject> stop() {
        return send(Command.STOP);
    }

    /** 采样间隔，单位微秒。必须在 start() 之前设置。 */
    public CompletableFuture<JsonObject> setSamplingInterval(int intervalMicros) {
        JsonObject params = params();
        params.addProperty("interval", intervalMicros);
        return send(Command.SET_SAMPLING_INTERVAL, params);
    }

    public CompletableFuture<JsonObject> startPreciseCoverage(boolean callCount, boolean detailed) {
        JsonObject params = params();
        params.addProperty("callCount", callCount);
        params.addProperty("detailed", detailed);
        return send(Command.START_PRECISE_COVERAGE, params);
    }

    public CompletableFuture<JsonObject> stopPreciseCoverage() {
        return send(Command.STOP_PRECISE_COVERAGE);
    }

    public CompletableFuture<JsonObject> takePreciseCoverage() {
        return send(Command.TAKE_PRECISE_COVERAGE);
    }

    public CompletableFuture<JsonObject> getBestEffortCoverage() {
        return send(Command.GET_BEST_EFFORT_COVERAGE);
    }
}
