package io.github.samzhu.keygate.handler;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.keygate.config.KeygateProperties;
import io.github.samzhu.keygate.model.HealthResponse;
import io.github.samzhu.keygate.service.AccessGate;
import io.github.samzhu.keygate.service.OpenAiService;
import io.github.samzhu.keygate.util.BearerTokenExtractor;

/**
 * 健康檢查處理器
 *
 * <p>{@code GET /health} 為公開端點，前端用來顯示連線狀態。帶入 Bearer Header 時以
 * {@link AccessGate#authorizeOptional(String)} 判斷呼叫端是否已登入，不論結果都回傳 200。
 *
 * @see io.github.samzhu.keygate.health.KeygateHealthIndicator
 */
@Component
public class HealthHandler {

    private final AccessGate accessGate;
    private final OpenAiService openAiService;
    private final KeygateProperties keygateProperties;

    public HealthHandler(AccessGate accessGate, OpenAiService openAiService, KeygateProperties keygateProperties) {
        this.accessGate = accessGate;
        this.openAiService = openAiService;
        this.keygateProperties = keygateProperties;
    }

    public ServerResponse health(ServerRequest request) {
        String openaiStatus = openAiService.isAvailable() ? "available" : "unavailable";
        String authStatus = accessGate.isConfigured() ? "configured" : "not configured";

        String presented = BearerTokenExtractor.extract(request.headers().firstHeader(HttpHeaders.AUTHORIZATION))
            .orElse(null);
        boolean callerAuthenticated = accessGate.authorizeOptional(presented).isPresent();

        HealthResponse body = new HealthResponse(
            "healthy",
            "Service is operational. OpenAI: " + openaiStatus + ", Auth: " + authStatus,
            openaiStatus,
            authStatus,
            keygateProperties.version(),
            callerAuthenticated);

        return ServerResponse.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .body(body);
    }
}
