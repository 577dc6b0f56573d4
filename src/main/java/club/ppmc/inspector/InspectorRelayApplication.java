/**
 * InspectorRelayApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动整个应用程序：调试会话 REST 接口、Inspector 协议代理端点以及 STOMP 消息代理共用同一个内嵌容器。
 * @ConfigurationPropertiesScan 注解用于注册 InspectorSettings。
 */
package club.ppmc.inspector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InspectorRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(InspectorRelayApplication.class, args);
    }
}
