package io.github.samzhu.keygate.config;

import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.aot.hint.annotation.RegisterReflectionForBinding;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.keygate.model.AuthRequest;
import io.github.samzhu.keygate.model.AuthResponse;
import io.github.samzhu.keygate.model.ChatMessage;
import io.github.samzhu.keygate.model.ChatRequest;
import io.github.samzhu.keygate.model.ChatResponse;
import io.github.samzhu.keygate.model.CompletionRequest;
import io.github.samzhu.keygate.model.CompletionResponse;
import io.github.samzhu.keygate.model.EmbeddingRequest;
import io.github.samzhu.keygate.model.EmbeddingResponse;
import io.github.samzhu.keygate.model.GatewayError;
import io.github.samzhu.keygate.model.HealthResponse;
import io.github.samzhu.keygate.model.ImageRequest;
import io.github.samzhu.keygate.model.ImageResponse;
import io.github.samzhu.keygate.model.ModelsResponse;

/**
 * GraalVM Native Image 反射與資源提示配置
 *
 * <p>Functional Endpoint 以 {@code request.body(Class)} 反序列化，AOT 無法自動推導這些型別，
 * 需明確註冊。
 *
 * <p>資源配置：
 * <ul>
 *   <li>{@code static/*} - 前端頁面與腳本</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/docs/current/reference/html/native-image.html">Spring Boot Native Image Support</a>
 */
@Configuration
@ImportRuntimeHints(NativeImageHints.FrontendResourcesHints.class)
@RegisterReflectionForBinding({
    // 請求
    AuthRequest.class,
    ChatRequest.class,
    ChatMessage.class,
    CompletionRequest.class,
    ImageRequest.class,
    EmbeddingRequest.class,
    // 回應
    AuthResponse.class,
    ChatResponse.class,
    CompletionResponse.class,
    ImageResponse.class,
    EmbeddingResponse.class,
    ModelsResponse.class,
    HealthResponse.class,
    GatewayError.class,
    GatewayError.Error.class
})
public class NativeImageHints {

    static class FrontendResourcesHints implements RuntimeHintsRegistrar {
        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            hints.resources().registerPattern("static/*");
        }
    }
}
