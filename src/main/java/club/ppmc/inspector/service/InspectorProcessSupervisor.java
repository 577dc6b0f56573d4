/**
 * InspectorProcessSupervisor.java
 *
 * 负责被调试进程的启动与终止。
 * 同一时刻最多跟踪一个存活的进程；进程以 --inspect / --inspect-brk 启动，
 * 从其标准错误输出中识别 "Debugger listening on ws://..." 以获得 inspector 端点地址。
 * 进程的输出与退出通过 EventDispatcher 以 Process.output / Process.exited 事件发布。
 * 使用 Process.onExit() 感知进程自行退出，退出后立即清空进程句柄与端点地址。
 */
package club.ppmc.inspector.service;

import club.ppmc.inspector.config.InspectorSettings;
import club.ppmc.inspector.exception.DebuggeeProcessException;
import club.ppmc.inspector.exception.InspectorTimeoutException;
import club.ppmc.inspector.exception.SessionConflictException;
import com.google.gson.JsonObject;
import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class InspectorProcessSupervisor {

    private static final String LISTENING_BANNER = "Debugger listening on";
    private static final Pattern INSPECTOR_URL = Pattern.compile("ws://\\S+");

    private final EventDispatcher dispatcher;
    private final ScheduledExecutorService reactor;
    private final DebuggeeCommandFactory commandFactory;
    private final Duration startupTimeout;
    private final Duration killGracePeriod;

    private final AtomicReference<Process> process = new AtomicReference<>();
    private volatile String inspectorUrl;

    public InspectorProcessSupervisor(
            EventDispatcher dispatcher,
            @Qualifier("inspectorReactor") ScheduledExecutorService reactor,
            InspectorSettings settings,
            DebuggeeCommandFactory commandFactory) {
        this.dispatcher = dispatcher;
        this.reactor = reactor;
        this.commandFactory = commandFactory;
        this.startupTimeout = settings.getHandshakeTimeout();
        this.killGracePeriod = settings.getKillGracePeriod();
    }

    /**
     * 以调试模式启动脚本。
     *
     * @param port inspector 端口。
     * @param host inspector 绑定的主机。
     * @param breakOnStart 为 true 时在第一条语句处暂停。
     * @param script 待调试脚本的绝对路径。
     * @return 以 inspector WebSocket 地址完成的 Future。已有存活进程时以 SessionConflictException 失败，
     *     启动失败或就绪前退出时以 DebuggeeProcessException 失败，超时以 InspectorTimeoutException 失败。
     */
    public synchronized CompletableFuture<String> open(int port, String host, boolean breakOnStart, Path script) {
        Process tracked = process.get();
        if (tracked != null && tracked.isAlive()) {
            log.warn("拒绝启动新进程：已有被调试进程在运行，PID: {}", tracked.pid());
            return CompletableFuture.failedFuture(new SessionConflictException(tracked.pid()));
        }

        List<String> command = commandFactory.command(host, port, breakOnStart, script);
        var pb = new ProcessBuilder(command);
        Path workingDir = script.toAbsolutePath().getParent();
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        log.info("执行调试命令: {}", String.join(" ", command));

        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            log.error("创建被调试进程时发生 I/O 错误: {}", e.getMessage());
            return CompletableFuture.failedFuture(
                    new DebuggeeProcessException("Failed to spawn debuggee: " + e.getMessage(), e));
        }
        process.set(p);
        inspectorUrl = null;
        log.info("被调试进程已启动，PID: {}", p.pid());

        var readyFuture = new CompletableFuture<String>();
        redirectStream(p, p.getInputStream(), "stdout", readyFuture);
        redirectStream(p, p.getErrorStream(), "stderr", readyFuture);
        p.onExit().thenAccept(exited -> reactor.execute(() -> onProcessExit(exited, readyFuture)));

        ScheduledFuture<?> timer = reactor.schedule(
                () -> {
                    if (readyFuture.completeExceptionally(
                            new InspectorTimeoutException("Inspector startup", startupTimeout))) {
                        log.error("等待被调试进程输出 inspector 地址超时，PID: {}", p.pid());
                    }
                },
                startupTimeout.toMillis(),
                TimeUnit.MILLISECONDS);
        readyFuture.whenComplete((url, ex) -> timer.cancel(false));
        return readyFuture;
    }

    private void redirectStream(Process p, InputStream inputStream, String stream, CompletableFuture<String> readyFuture) {
        var reader = new Thread(
                () -> {
                    try (var in = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                        String line;
                        while ((line = in.readLine()) != null) {
                            publishOutput(p, stream, line);
                            if (!readyFuture.isDone() && line.contains(LISTENING_BANNER)) {
                                Matcher matcher = INSPECTOR_URL.matcher(line);
                                if (matcher.find() && process.get() == p) {
                                    inspectorUrl = matcher.group();
                                    log.info("检测到 inspector 监听地址: {}", inspectorUrl);
                                    readyFuture.complete(inspectorUrl);
                                }
                            }
                        }
                    } catch (IOException e) {
                        log.warn("读取进程流时出错 (可能是进程已结束): {}", e.getMessage());
                    }
                },
                "debuggee-" + stream + "-" + p.pid());
        reader.setDaemon(true);
        reader.start();
    }

    private void publishOutput(Process p, String stream, String line) {
        var data = new JsonObject();
        data.addProperty("pid", p.pid());
        data.addProperty("stream", stream);
        data.addProperty("line", line);
        reactor.execute(() -> dispatcher.publish("Process.output", data));
    }

    private void onProcessExit(Process exited, CompletableFuture<String> readyFuture) {
        int exitCode = exited.exitValue();
        if (process.compareAndSet(exited, null)) {
            inspectorUrl = null;
            log.info("被调试进程 {} 已自行退出，退出码: {}", exited.pid(), exitCode);
        } else {
            log.info("被调试进程 {} 已终止，退出码: {}", exited.pid(), exitCode);
        }
        readyFuture.completeExceptionally(new DebuggeeProcessException(
                "Debuggee exited with code " + exitCode + " before the inspector was ready"));

        var data = new JsonObject();
        data.addProperty("pid", exited.pid());
        data.addProperty("exitCode", exitCode);
        dispatcher.publish("Process.exited", data);
    }

    /**
     * 终止被调试进程：先发送终止信号，宽限期过后仍存活则强制结束。
     * 没有被跟踪的进程时直接返回已完成的 Future。
     */
    public CompletableFuture<Void> close() {
        Process p = process.getAndSet(null);
        inspectorUrl = null;
        if (p == null || !p.isAlive()) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("正在终止被调试进程，PID: {}", p.pid());
        p.destroy();
        ScheduledFuture<?> forceKill = reactor.schedule(
                () -> {
                    if (p.isAlive()) {
                        log.warn("进程 {} 在 {} ms 内未退出，强制终止", p.pid(), killGracePeriod.toMillis());
                        p.destroyForcibly();
                    }
                },
                killGracePeriod.toMillis(),
                TimeUnit.MILLISECONDS);
        return p.onExit().thenAccept(exited -> forceKill.cancel(false));
    }

    /** 与 {@link #close()} 相同。 */
    public CompletableFuture<Void> delete() {
        return close();
    }

    public boolean isActive() {
        Process p = process.get();
        return p != null && p.isAlive();
    }

    public String inspectorUrl() {
        return inspectorUrl;
    }

    public Long pid() {
        Process p = process.get();
        return p == null ? null : p.pid();
    }

    @PreDestroy
    public void shutdown() {
        Process p = process.getAndSet(null);
        if (p != null && p.isAlive()) {
            log.info("应用关闭，强制终止被调试进程 {}", p.pid());
            p.destroyForcibly();
        }
    }
}
