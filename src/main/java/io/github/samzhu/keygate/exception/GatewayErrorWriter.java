package io.github.samzhu.keygate.exception;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.keygate.model.GatewayError;
import jakarta.servlet.http.HttpServletResponse;

/**
 * 在 Servlet 過濾器層直接寫出 {@link GatewayError}
 *
 * <p>Security Filter Chain 在 DispatcherServlet 之前執行，路由層的
 * {@link GlobalExceptionHandler} 無法處理這裡的錯誤，因此由此元件負責輸出相同格式。
 */
@Component
public class GatewayErrorWriter {

    private final ObjectMapper objectMapper;

    public GatewayErrorWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, HttpStatus status, GatewayError error) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
