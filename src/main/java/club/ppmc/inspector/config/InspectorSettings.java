/**
 * InspectorSettings.java
 *
 * 调试中继的全部可配置项，绑定 application.properties 中以 "inspector" 为前缀的属性。
 * 它是一个可变对象，以便于 Spring 进行属性绑定；测试中可以直接 new 出来并修改。
 */
package club.ppmc.inspector.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "inspector")
public class InspectorSettings {

    // --- 工作区与被调试进程 ---
    /**
     * 工作区根目录。所有待调试的脚本都必须位于此目录之内。
     * 默认值为 "./workspace"。
     */
    private String workspaceRoot = "./workspace";

    /** 用于启动被调试脚本的 node 可执行文件。 */
    private String nodeExecutable = "node";

    /** inspector 绑定的主机与端口。 */
    private String inspectHost = "127.0.0.1";
    private int inspectPort = 9229;

    /** 为 true 时使用 --inspect-brk，在第一条语句处暂停。 */
    private boolean breakOnStart = true;

    // --- 中继 ---
    /**
     * 写入 wsUrl 的主机名。端口取自 server.port，路径取自 proxyPath。
     */
    private String proxyHost = "localhost";
    private String proxyPath = "/";

    /** 单条 WebSocket 文本消息的上限（字节），同时用于上游客户端和下游服务端容器。 */
    private int maxMessageSize = 4 * 1024 * 1024;

    // --- 超时 ---
    private Duration commandTimeout = Duration.ofSeconds(5);
    private Duration handshakeTimeout = Duration.ofSeconds(10);

    /** 发送终止信号后等待进程退出的时间，超时则强制结束。 */
    private Duration killGracePeriod = Duration.ofSeconds(5);
}
