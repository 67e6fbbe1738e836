package io.github.samzhu.keygate.filter;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

import io.github.samzhu.keygate.exception.AccessGateException;
import io.github.samzhu.keygate.exception.GatewayErrorWriter;
import io.github.samzhu.keygate.model.AccessDecision;
import io.github.samzhu.keygate.model.GatewayError;
import io.github.samzhu.keygate.service.AccessGate;
import io.github.samzhu.keygate.util.BearerTokenExtractor;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Access Key 認證過濾器
 *
 * <p>掛在受保護端點的 Security Filter Chain 上，對每個請求執行：
 * <ul>
 *   <li>從 {@code Authorization: Bearer <key>} 提取 credential</li>
 *   <li>呼叫 {@link AccessGate#authorize(String)} 判定</li>
 *   <li>通過：在 {@link SecurityContext} 放入已認證的 {@link PreAuthenticatedAuthenticationToken}</li>
 *   <li>拒絕：直接回應 503 / 401 / 403，請求不會到達 OpenAI 轉發處理器</li>
 * </ul>
 *
 * <p>不註冊為 Spring Bean，避免被 Servlet 容器自動套用到所有路徑。
 *
 * @see io.github.samzhu.keygate.config.SecurityConfig
 */
public class AccessKeyAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessKeyAuthenticationFilter.class);

    public static final String PRINCIPAL = "access-key";
    public static final String AUTHORITY = "ROLE_API_CLIENT";

    private final AccessGate accessGate;
    private final GatewayErrorWriter errorWriter;

    public AccessKeyAuthenticationFilter(AccessGate accessGate, GatewayErrorWriter errorWriter) {
        this.accessGate = accessGate;
        this.errorWriter = errorWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String presented = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION))
            .orElse(null);

        AccessDecision decision;
        try {
            decision = accessGate.authorize(presented);
        } catch (AccessGateException e) {
            log.warn("Access rejected: method={}, path={}, outcome={}",
                request.getMethod(), request.getRequestURI(), e.getOutcome());
            SecurityContextHolder.clearContext();
            errorWriter.write(response, e.getStatus(), GatewayError.of(e.getOutcome()));
            return;
        }

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(new PreAuthenticatedAuthenticationToken(
            PRINCIPAL, decision.credential(), List.of(new SimpleGrantedAuthority(AUTHORITY))));
        SecurityContextHolder.setContext(context);

        log.debug("Access granted: method={}, path={}", request.getMethod(), request.getRequestURI());
        filterChain.doFilter(request, response);
    }
}
