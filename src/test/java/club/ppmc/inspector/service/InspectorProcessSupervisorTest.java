package club.ppmc.inspector.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.inspector.config.InspectorSettings;
import club.ppmc.inspector.exception.DebuggeeProcessException;
import club.ppmc.inspector.exception.InspectorTimeoutException;
import club.ppmc.inspector.exception.SessionConflictException;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/**
 * Uses small shell scripts in place of node so that the supervisor can be exercised anywhere a POSIX shell exists.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class InspectorProcessSupervisorTest {

    private static final String BANNER = "echo 'Debugger listening on ws://127.0.0.1:9229/0f2b' >&2; ";

    @TempDir
    Path workspace;

    private Path script;
    private ScheduledExecutorService reactor;
    private EventDispatcher dispatcher;
    private final AtomicReference<String> shellBody = new AtomicReference<>();
    private final AtomicReference<List<String>> commandOverride = new AtomicReference<>();
    private InspectorProcessSupervisor supervisor;

    @BeforeEach
    void setUp() throws IOException {
        script = Files.writeString(workspace.resolve("app.js"), "setInterval(() => {}, 1000);\n");
        reactor = Executors.newSingleThreadScheduledExecutor();
        dispatcher = new EventDispatcher();
        supervisor = newSupervisor(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
        reactor.shutdownNow();
    }

    private InspectorProcessSupervisor newSupervisor(Duration startupTimeout) {
        var settings = new InspectorSettings();
        settings.setHandshakeTimeout(startupTimeout);
        settings.setKillGracePeriod(Duration.ofSeconds(1));
        DebuggeeCommandFactory factory = (host, port, breakOnStart, target) -> {
            List<String> override = commandOverride.get();
            return override != null ? override : List.of("sh", "-c", shellBody.get());
        };
        return new InspectorProcessSupervisor(dispatcher, reactor, settings, factory);
    }

    private CompletableFuture<String> open(String body) {
        shellBody.set(body);
        return supervisor.open(9229, "127.0.0.1", true, script);
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        return e.getCause();
    }

    private CountDownLatch awaitEvent(String topic, AtomicReference<JsonObject> captured) {
        var latch = new CountDownLatch(1);
        dispatcher.subscribe(topic, (t, data) -> {
            captured.set(data);
            latch.countDown();
        });
        return latch;
    }

    @Test
    void detectsInspectorUrlFromBanner() throws Exception {
        String url = open(BANNER + "exec sleep 30").get(5, TimeUnit.SECONDS);

        assertEquals("ws://127.0.0.1:9229/0f2b", url);
        assertEquals(url, supervisor.inspectorUrl());
        assertTrue(supervisor.isActive());
        assertNotNull(supervisor.pid());
    }

    @Test
    void secondOpenWhileAliveConflicts() throws Exception {
        open(BANNER + "exec sleep 30").get(5, TimeUnit.SECONDS);
        long pid = supervisor.pid();

        CompletableFuture<String> second = open(BANNER + "exec sleep 30");

        assertInstanceOf(SessionConflictException.class, failureOf(second));
        assertEquals(pid, supervisor.pid());
    }

    @Test
    void closeTerminatesTheProcess() throws Exception {
        var exited = new AtomicReference<JsonObject>();
        CountDownLatch exitLatch = awaitEvent("Process.exited", exited);
        open(BANNER + "exec sleep 30").get(5, TimeUnit.SECONDS);
        long pid = supervisor.pid();

        supervisor.close().get(5, TimeUnit.SECONDS);

        assertFalse(supervisor.isActive());
        assertNull(supervisor.pid());
        assertNull(supervisor.inspectorUrl());
        assertFalse(ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false));
        assertTrue(exitLatch.await(5, TimeUnit.SECONDS));
        assertEquals(pid, exited.get().get("pid").getAsLong());
    }

    @Test
    void closeWithoutProcessIsANoOp() throws Exception {
        supervisor.close().get(1, TimeUnit.SECONDS);
        supervisor.delete().get(1, TimeUnit.SECONDS);

        assertFalse(supervisor.isActive());
    }

    @Test
    void processKilledOutOfBandIsForgotten() throws Exception {
        var exited = new AtomicReference<JsonObject>();
        CountDownLatch exitLatch = awaitEvent("Process.exited", exited);
        open(BANNER + "exec sleep 30").get(5, TimeUnit.SECONDS);
        long pid = supervisor.pid();

        ProcessHandle.of(pid).ifPresent(ProcessHandle::destroyForcibly);

        assertTrue(exitLatch.await(5, TimeUnit.SECONDS));
        assertFalse(supervisor.isActive());
        assertNull(supervisor.pid());
        assertNull(supervisor.inspectorUrl());

        // 进程已不在，允许重新启动
        String url = open(BANNER + "exec sleep 30").get(5, TimeUnit.SECONDS);
        assertNotNull(url);
    }

    @Test
    void exitBeforeReadyFailsWithExitCode() {
        CompletableFuture<String> ready = open("echo 'SyntaxError: Unexpected token' >&2; exit 3");

        Throwable cause = failureOf(ready);
        assertInstanceOf(DebuggeeProcessException.class, cause);
        assertTrue(cause.getMessage().contains("code 3"));
    }

    @Test
    void silentProcessTimesOut() {
        supervisor = newSupervisor(Duration.ofMillis(300));

        CompletableFuture<String> ready = open("exec sleep 30");

        assertInstanceOf(InspectorTimeoutException.class, failureOf(ready));
    }

    @Test
    void spawnFailureIsReported() {
        commandOverride.set(List.of(workspace.resolve("no-such-node").toString()));

        CompletableFuture<String> ready = supervisor.open(9229, "127.0.0.1", false, script);

        assertInstanceOf(DebuggeeProcessException.class, failureOf(ready));
        assertFalse(supervisor.isActive());
    }

    @Test
    void outputLinesArePublished() throws Exception {
        var output = new AtomicReference<JsonObject>();
        var latch = new CountDownLatch(1);
        dispatcher.subscribe("Process.output", (topic, data) -> {
            if ("stdout".equals(data.get("stream").getAsString())) {
                output.set(data);
                latch.countDown();
            }
        });

        open("echo 'hello from debuggee'; " + BANNER + "exec sleep 30").get(5, TimeUnit.SECONDS);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals("hello from debuggee", output.get().get("line").getAsString());
        assertEquals(supervisor.pid().longValue(), output.get().get("pid").getAsLong());
    }

    @Test
    void nodeCommandUsesInspectBrkWhenBreakingOnStart() {
        List<String> command = DebuggeeCommandFactory.node("node").command("127.0.0.1", 9230, true, script);

        assertEquals(List.of("node", "--inspect-brk=127.0.0.1:9230", script.toString()), command);
        assertEquals(
                "--inspect=0.0.0.0:9229",
                DebuggeeCommandFactory.node("node").command("0.0.0.0", 9229, false, script).get(1));
    }
}
