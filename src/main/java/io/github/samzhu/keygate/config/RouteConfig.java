package io.github.samzhu.keygate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.keygate.exception.GlobalExceptionHandler;
import io.github.samzhu.keygate.handler.AuthHandler;
import io.github.samzhu.keygate.handler.FrontendHandler;
import io.github.samzhu.keygate.handler.HealthHandler;
import io.github.samzhu.keygate.handler.OpenAiProxyHandler;

/**
 * Functional Endpoint 路由配置
 *
 * <p>OpenAI 轉發（需 Access Key，見 {@link SecurityConfig#PROTECTED_PATHS}）：
 * <ul>
 *   <li>{@code POST /chat} - Chat Completion</li>
 *   <li>{@code POST /completion} - Text Completion</li>
 *   <li>{@code POST /images/generate} - 圖片生成</li>
 *   <li>{@code POST /embeddings} - Embeddings</li>
 *   <li>{@code GET /models} - 模型列表</li>
 * </ul>
 *
 * <p>公開端點：
 * <ul>
 *   <li>{@code POST /auth} - 以 Access Key 登入</li>
 *   <li>{@code GET /health} - 服務狀態</li>
 *   <li>{@code GET /} - 前端頁面</li>
 * </ul>
 *
 * <p>所有路由的例外都交給 {@link GlobalExceptionHandler}。
 *
 * @see <a href="https://docs.spring.io/spring-framework/reference/web/webmvc-functional.html">Functional Endpoints</a>
 */
@Configuration
public class RouteConfig {

    private static final Logger log = LoggerFactory.getLogger(RouteConfig.class);

    private final OpenAiProxyHandler openAiProxyHandler;
    private final AuthHandler authHandler;
    private final HealthHandler healthHandler;
    private final FrontendHandler frontendHandler;
    private final GlobalExceptionHandler globalExceptionHandler;

    public RouteConfig(
            OpenAiProxyHandler openAiProxyHandler,
            AuthHandler authHandler,
            HealthHandler healthHandler,
            FrontendHandler frontendHandler,
            GlobalExceptionHandler globalExceptionHandler) {
        this.openAiProxyHandler = openAiProxyHandler;
        this.authHandler = authHandler;
        this.healthHandler = healthHandler;
        this.frontendHandler = frontendHandler;
        this.globalExceptionHandler = globalExceptionHandler;
    }

    @Bean
    public RouterFunction<ServerResponse> openAiRoutes() {
        log.info("Configuring OpenAI proxy routes");
        return RouterFunctions.route()
            .POST("/chat", openAiProxyHandler::chat)
            .POST("/completion", openAiProxyHandler::completion)
            .POST("/images/generate", openAiProxyHandler::generateImage)
            .POST("/embeddings", openAiProxyHandler::embeddings)
            .GET("/models", openAiProxyHandler::models)
            .onError(Throwable.class, globalExceptionHandler::handle)
            .build();
    }

    @Bean
    public RouterFunction<ServerResponse> publicRoutes() {
        return RouterFunctions.route()
            .POST("/auth", authHandler::authenticate)
            // 不做尾斜線自動轉址，兩種寫法都接受
            .POST("/auth/", authHandler::authenticate)
            .GET("/health", healthHandler::health)
            .GET("/", frontendHandler::index)
            .onError(Throwable.class, globalExceptionHandler::handle)
            .build();
    }
}
