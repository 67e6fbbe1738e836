package io.github.samzhu.keygate.handler;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.keygate.model.AccessDecision;
import io.github.samzhu.keygate.model.AuthRequest;
import io.github.samzhu.keygate.model.AuthResponse;
import io.github.samzhu.keygate.service.AccessGate;
import jakarta.servlet.ServletException;

/**
 * 登入處理器
 *
 * <p>處理 {@code POST /auth}：
 * <ul>
 *   <li>Access Key 相符 - 200，回傳 {@code {"authenticated": true, "token": "<key>"}}</li>
 *   <li>未配置 - 503</li>
 *   <li>不相符 - 403</li>
 * </ul>
 *
 * <p>失敗以 {@link io.github.samzhu.keygate.exception.AccessGateException} 拋出，
 * 由 {@link io.github.samzhu.keygate.exception.GlobalExceptionHandler} 轉成錯誤回應。
 */
@Component
public class AuthHandler {

    private static final Logger log = LoggerFactory.getLogger(AuthHandler.class);

    private final AccessGate accessGate;
    private final RequestBodyReader bodyReader;

    public AuthHandler(AccessGate accessGate, RequestBodyReader bodyReader) {
        this.accessGate = accessGate;
        this.bodyReader = bodyReader;
    }

    public ServerResponse authenticate(ServerRequest request) throws ServletException, IOException {
        AuthRequest authRequest = bodyReader.read(request, AuthRequest.class);
        AccessDecision decision = accessGate.authenticate(authRequest.accessKey());

        log.info("Login succeeded: remoteAddress={}", request.remoteAddress().orElse(null));
        return ServerResponse.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .body(AuthResponse.from(decision));
    }
}
