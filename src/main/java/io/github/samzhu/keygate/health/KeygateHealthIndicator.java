package io.github.samzhu.keygate.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import io.github.samzhu.keygate.service.AccessGate;
import io.github.samzhu.keygate.service.OpenAiService;

/**
 * Keygate 健康指標
 *
 * <p>Spring Boot Actuator 健康檢查元件，檢查轉發所需的配置是否齊全。
 *
 * <p>健康狀態：
 * <ul>
 *   <li>UP - 已配置 OpenAI API Key</li>
 *   <li>DOWN - 未配置 OpenAI API Key，所有轉發端點都會回應 503</li>
 * </ul>
 *
 * <p>Access Key 未配置不影響狀態（屬於合法的啟動狀態），僅列於 details。
 *
 * <p>存取方式：{@code GET /actuator/health}
 *
 * <p>回應範例（健康）：
 * <pre>{@code
 * {
 *   "components": {
 *     "keygate": {
 *       "status": "UP",
 *       "details": { "openaiConfigured": true, "authConfigured": true }
 *     }
 *   }
 * }
 * }</pre>
 */
@Component
public class KeygateHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(KeygateHealthIndicator.class);

    private final OpenAiService openAiService;
    private final AccessGate accessGate;

    public KeygateHealthIndicator(OpenAiService openAiService, AccessGate accessGate) {
        this.openAiService = openAiService;
        this.accessGate = accessGate;
    }

    @Override
    public Health health() {
        boolean openaiConfigured = openAiService.isAvailable();
        boolean authConfigured = accessGate.isConfigured();

        if (!openaiConfigured) {
            log.warn("Health check failed: OpenAI API key not configured");
            return Health.down()
                .withDetail("openaiConfigured", false)
                .withDetail("authConfigured", authConfigured)
                .withDetail("message", "OpenAI API key not configured")
                .build();
        }

        log.debug("Health check passed: authConfigured={}", authConfigured);
        return Health.up()
            .withDetail("openaiConfigured", true)
            .withDetail("authConfigured", authConfigured)
            .build();
    }
}
