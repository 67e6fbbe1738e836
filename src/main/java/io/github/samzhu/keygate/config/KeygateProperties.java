package io.github.samzhu.keygate.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 服務一般配置屬性
 *
 * <p>從 {@code keygate} 前綴載入：
 * <pre>
 * keygate:
 *   version: 1.0.0
 *   cors:
 *     allowed-origins: ["*"]
 *     allow-credentials: true
 *     allowed-methods: ["*"]
 *     allowed-headers: ["*"]
 *     exposed-headers: ["*"]
 *     max-age: 3600
 * </pre>
 *
 * @param version 對外回報的服務版本（{@code /health}）
 * @param cors CORS 設定
 * @see SecurityConfig
 */
@ConfigurationProperties(prefix = "keygate")
public record KeygateProperties(
    String version,
    Cors cors
) {
    public KeygateProperties {
        if (version == null || version.isBlank()) {
            version = "1.0.0";
        }
        if (cors == null) {
            cors = new Cors(null, null, null, null, null, null);
        }
    }

    /**
     * CORS 設定，來源以 pattern 比對，因此 {@code *} 可與 credentials 並用
     */
    public record Cors(
        List<String> allowedOrigins,
        Boolean allowCredentials,
        List<String> allowedMethods,
        List<String> allowedHeaders,
        List<String> exposedHeaders,
        Long maxAge
    ) {
        public Cors {
            if (allowedOrigins == null || allowedOrigins.isEmpty()) {
                allowedOrigins = List.of("*");
            }
            if (allowCredentials == null) {
                allowCredentials = Boolean.TRUE;
            }
            if (allowedMethods == null || allowedMethods.isEmpty()) {
                allowedMethods = List.of("*");
            }
            if (allowedHeaders == null || allowedHeaders.isEmpty()) {
                allowedHeaders = List.of("*");
            }
            if (exposedHeaders == null) {
                exposedHeaders = List.of("*");
            }
            if (maxAge == null) {
                maxAge = 3600L;
            }
        }
    }
}
