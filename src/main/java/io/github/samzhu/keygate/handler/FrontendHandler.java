package io.github.samzhu.keygate.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.keygate.model.GatewayError;

/**
 * 前端頁面處理器
 *
 * <p>{@code GET /} 回傳 classpath 上的 {@code static/index.html}，其餘靜態資源由
 * {@code spring.mvc.static-path-pattern=/static/**} 提供。
 */
@Component
public class FrontendHandler {

    private static final Logger log = LoggerFactory.getLogger(FrontendHandler.class);

    static final String INDEX_LOCATION = "static/index.html";

    private final Resource index;

    public FrontendHandler() {
        this(new ClassPathResource(INDEX_LOCATION));
    }

    FrontendHandler(Resource index) {
        this.index = index;
        if (!index.exists()) {
            log.warn("Frontend not found at classpath:{}", INDEX_LOCATION);
        }
    }

    public ServerResponse index(ServerRequest request) {
        if (!index.exists()) {
            return ServerResponse.status(HttpStatus.NOT_FOUND)
                .contentType(MediaType.APPLICATION_JSON)
                .body(GatewayError.notFoundError(
                    "Frontend not found. Please ensure index.html exists in the static directory."));
        }
        return ServerResponse.ok()
            .contentType(MediaType.TEXT_HTML)
            .body(index);
    }
}
