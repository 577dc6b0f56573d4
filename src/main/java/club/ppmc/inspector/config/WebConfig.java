/**
 * WebConfig.java
 *
 * 该文件定义了全局的Spring Web MVC配置。
 * 目前，它的主要职责是配置跨域资源共享 (CORS)，以允许调试前端调用 /debug 下的会话管理接口。
 */
package club.ppmc.inspector.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    /**
     * 配置CORS映射。
     * 使用 {@code allowedOriginPatterns("*")} 而不是 {@code allowedOrigins("*")}，
     * 这样在 allowCredentials 为 true 时仍然可以接受任意来源。
     *
     * @param registry CORS配置注册表
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/debug/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
