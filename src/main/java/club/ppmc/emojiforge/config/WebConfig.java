/**
 * WebConfig.java
 *
 * 全局的Spring Web MVC配置。
 * 负责配置跨域资源共享 (CORS)，以允许在其他端口上运行的前端与后端API进行交互。
 */
package club.ppmc.emojiforge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    /**
     * 使用 {@code allowedOriginPatterns("*")} 而不是 {@code allowedOrigins("*")}，
     * 因为后者不能与 allowCredentials(true) 同时使用。
     *
     * @param registry CORS配置注册表
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "POST")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
