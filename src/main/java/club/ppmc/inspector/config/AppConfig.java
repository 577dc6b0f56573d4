/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义 Gson、上游 WebSocket 客户端、被调试进程的启动命令以及中继的单线程 reactor 等应用级别的 Bean。
 */
package club.ppmc.inspector.config;

import club.ppmc.inspector.service.DebuggeeCommandFactory;
import com.google.gson.Gson;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 Gson Bean。
     * 用于 Inspector 协议帧以及推送给前端的调试事件的序列化。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }

    /**
     * 中继的 reactor：所有中继状态变更、请求超时与强制结束进程的定时器都在这一个线程上执行。
     * 任何组件都不能在该线程上执行阻塞调用。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService inspectorReactor() {
        var counter = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "inspector-reactor-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 连接被调试进程 inspector 端点的 WebSocket 客户端。
     * Tomcat 客户端默认只接受 8KB 的文本消息，而 scriptParsed、getProperties 等响应经常超出，
     * 因此这里按配置放大缓冲区。
     */
    @Bean
    public WebSocketClient upstreamWebSocketClient(InspectorSettings settings) {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(settings.getMaxMessageSize());
        container.setDefaultMaxBinaryMessageBufferSize(settings.getMaxMessageSize());
        return new StandardWebSocketClient(container);
    }

    /**
     * 启动被调试脚本的命令行，使用配置中的 node 可执行文件。
     */
    @Bean
    public DebuggeeCommandFactory debuggeeCommandFactory(InspectorSettings settings) {
        return DebuggeeCommandFactory.node(settings.getNodeExecutable());
    }
}
