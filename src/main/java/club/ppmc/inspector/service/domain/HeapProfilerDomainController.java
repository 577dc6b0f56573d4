/**
 * HeapProfilerDomainController.java
 *
 * HeapProfiler 域的命令与事件门面。
 * 堆快照以 addHeapSnapshotChunk 事件分块推送，需要调用方自行订阅并拼接。
 */
package club.ppmc.inspector.service.domain;

import club.ppmc.inspector.model.inspector.RemoteObject;
import club.ppmc.inspector.service.EventDispatcher;
import club.ppmc.inspector.service.RequestCorrelator;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Service;

@Service
public class HeapProfilerDomainController extends AbstractDomainController {

    public enum Command implements DomainMethod {
        TAKE_HEAP_SNAPSHOT,
        START_TRACKING_HEAP_OBJECTS,
        STOP_TRACKING_HEAP_OBJECTS,
        COLLECT_GARBAGE,
        GET_OBJECT_BY_HEAP_OBJECT_ID,
        GET_HEAP_OBJECT_ID,
        START_SAMPLING,
        STOP_SAMPLING,
        ADD_INSPECTED_HEAP_OBJECT
    }

    public enum Event implements DomainMethod {
        ADD_HEAP_SNAPSHOT_CHUNK,
        REPORT_HEAP_SNAPSHOT_PROGRESS,
        HEAP_STATS_UPDATE,
        LAST_SEEN_OBJECT_ID,
        RESET_PROFILES
    }

    public HeapProfilerDomainController(RequestCorrelator correlator, EventDispatcher dispatcher, Gson gson) {
        super("HeapProfiler", correlator, dispatcher, gson);
    }

    public CompletableFuture<JsonObject> takeHeapSnapshot(boolean reportProgress) {
        JsonObject params = params();
        params.addProperty("reportProgress", reportProgress);
        return send(Command.TAKE_HEAP_SNAPSHOT, params);
    }

    public CompletableFuture<JsonObject> startTrackingHeapObjects(boolean trackAllocations) {
        JsonObject params = params();
        params.addProperty("trackAllocations", trackAllocations);
        return send(Command.START_TRACKING_HEAP_OBJECTS, params);
    }

    public CompletableFuture<JsonObject> stopTrackingHeapObjects(boolean reportProgress) {
        JsonObject params = params();
        params.addProperty("reportProgress", reportProgress);
        return send(Command.STOP_TRACKING_HEAP_OBJECTS, params);
    }

    public CompletableFuture<JsonObject> collectGarbage() {
        return send(Command.COLLECT_GARBAGE);
    }

    public CompletableFuture<RemoteObject> getObjectByHeapObjectId(String heapObjectId, String objectGroup) {
        JsonObject params = params();
        params.addProperty("objectId", heapObjectId);
        if (objectGroup != null) {
            params.addProperty("objectGroup", objectGroup);
        }
        return send(Command.GET_OBJECT_BY_HEAP_OBJECT_ID, params)
                .thenApply(result -> gson.fromJson(result.get("result"), RemoteObject.class));
    }

    public CompletableFuture<String> getHeapObjectId(String objectId) {
        JsonObject params = params();
        params.addProperty("objectId", objectId);
        return send(Command.GET_HEAP_OBJECT_ID, params)
                .thenApply(result -> result.get("heapSnapshotObjectId").getAsString());
    }

    public CompletableFuture<JsonObject> startSampling(double samplingInterval) {
        JsonObject params = params();
        params.addProperty("samplingInterval", samplingInterval);
        return send(Command.START_SAMPLING, params);
    }

    /** 结果中的 "profile" 字段为采样得到的堆 profile。 */
    public CompletableFuture<JsonObject> stopSampling() {
        return send(Command.STOP_SAMPLING);
    }

    public CompletableFuture<JsonObject> addInspectedHeapObject(String heapObjectId) {
        JsonObject params = params();
        params.addProperty("heapObjectId", heapObjectId);
        return send(Command.ADD_INSPECTED_HEAP_OBJECT, params);
    }
}
