/**
 * WebSocketConfig.java
 *
 * 配置两个并存的WebSocket入口：
 * 1. Inspector 协议代理端点（原始 WebSocket，路径由 inspector.proxy-path 决定），UI 调试客户端直接发送 CDP 报文；
 * 2. STOMP 消息代理（/ws），用于向前端推送会话生命周期与被调试进程输出。
 */
package club.ppmc.inspector.config;

import club.ppmc.inspector.handler.InspectorProxyHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketConfigurer, WebSocketMessageBrokerConfigurer {

    private final InspectorProxyHandler inspectorProxyHandler;
    private final InspectorSettings settings;

    public WebSocketConfig(InspectorProxyHandler inspectorProxyHandler, InspectorSettings settings) {
        this.inspectorProxyHandler = inspectorProxyHandler;
        this.settings = settings;
    }

    /**
     * 注册 Inspector 协议代理端点。客户端连接 ws://host:port{proxy-path} 后即可收发 CDP 报文。
     */
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(inspectorProxyHandler, settings.getProxyPath()).setAllowedOriginPatterns("*");
    }

    /**
     * 下游连接同样需要放大消息缓冲区，以便转发大体积的协议消息。
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(settings.getMaxMessageSize());
        container.setMaxBinaryMessageBufferSize(settings.getMaxMessageSize());
        return container;
    }

    /**
     * 配置消息代理。
     * `/topic` 用于广播调试事件与运行日志；`/app` 是客户端发往服务器的前缀（当前未使用）。
     * 心跳为 10 秒收发。
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("ws-heartbeat-thread-");
        taskScheduler.initialize();

        config.enableSimpleBroker("/topic")
                .setHeartbeatValue(new long[] {10000, 10000})
                .setTaskScheduler(taskScheduler);
        config.setApplicationDestinationPrefixes("/app");
    }

    /**
     * 注册STOMP端点，启用 SockJS 回退，并设置 25 秒的传输层心跳以防代理超时断开。
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns("*").withSockJS().setHeartbeatTime(25000);
    }
}
