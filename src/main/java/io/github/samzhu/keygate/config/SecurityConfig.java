package io.github.samzhu.keygate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import io.github.samzhu.keygate.exception.GatewayErrorWriter;
import io.github.samzhu.keygate.filter.AccessKeyAuthenticationFilter;
import io.github.samzhu.keygate.model.AccessOutcome;
import io.github.samzhu.keygate.model.GatewayError;
import io.github.samzhu.keygate.service.AccessGate;

/**
 * Spring Security 安全配置
 *
 * <p>以兩條 Filter Chain 區分受保護與公開端點：
 * <ul>
 *   <li>受保護（{@link #PROTECTED_PATHS}）- 由 {@link AccessKeyAuthenticationFilter} 執行 Access Gate 判定</li>
 *   <li>其他端點 - 公開存取（前端、{@code /static/**}、{@code /health}、{@code /auth}、{@code /actuator/**}）</li>
 * </ul>
 *
 * <p>兩條 Chain 共同設定：
 * <ul>
 *   <li>無狀態 Session（每個請求獨立判定）</li>
 *   <li>停用 CSRF（RESTful API 不需要）</li>
 *   <li>CORS 設定來自 {@link KeygateProperties.Cors}</li>
 * </ul>
 *
 * @see io.github.samzhu.keygate.service.AccessGate
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    /**
     * 需要 Access Key 的 OpenAI 轉發端點
     */
    public static final String[] PROTECTED_PATHS = {
        "/chat",
        "/completion",
        "/images/generate",
        "/embeddings",
        "/models"
    };

    @Bean
    @Order(1)
    public SecurityFilterChain protectedApiFilterChain(
            HttpSecurity http,
            AccessGate accessGate,
            GatewayErrorWriter errorWriter) throws Exception {
        log.info("Configuring access key authentication for {}", String.join(", ", PROTECTED_PATHS));
        http
            .securityMatcher(PROTECTED_PATHS)
            .csrf(csrf -> csrf.disable())
            .cors(Customizer.withDefaults())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(new AccessKeyAuthenticationFilter(accessGate, errorWriter),
                UsernamePasswordAuthenticationFilter.class)
            .authorizeHttpRequests(auth -> auth
                .anyRequest().authenticated()
            )
            // 過濾器已處理所有拒絕情境，以下僅作為 Spring Security 預設回應的替代
            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint((request, response, e) ->
                    errorWriter.write(response, HttpStatus.UNAUTHORIZED,
                        GatewayError.of(AccessOutcome.UNAUTHENTICATED)))
                .accessDeniedHandler((request, response, e) ->
                    errorWriter.write(response, HttpStatus.FORBIDDEN,
                        GatewayError.of(AccessOutcome.DENIED)))
            );

        return http.build();
    }

    @Bean
    @Order(2)
    public SecurityFilterChain publicFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .cors(Customizer.withDefaults())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .anyRequest().permitAll()
            );

        return http.build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource(KeygateProperties properties) {
        KeygateProperties.Cors cors = properties.cors();

        CorsConfiguration configuration = new CorsConfiguration();
        // 使用 pattern 以允許 "*" 與 credentials 並用
        configuration.setAllowedOriginPatterns(cors.allowedOrigins());
        configuration.setAllowCredentials(cors.allowCredentials());
        configuration.setAllowedMethods(cors.allowedMethods());
        configuration.setAllowedHeaders(cors.allowedHeaders());
        configuration.setExposedHeaders(cors.exposedHeaders());
        configuration.setMaxAge(cors.maxAge());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}
