package io.github.samzhu.keygate.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Component;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.keygate.model.GatewayError;

/**
 * 路由層全域異常處理器
 *
 * <p>透過 {@code RouterFunctions.Builder#onError} 套用到所有 Functional Endpoint，
 * 將例外統一轉為 {@link GatewayError}：
 * <ul>
 *   <li>{@link AccessGateException} - 503 / 401 / 403（依判定結果）</li>
 *   <li>{@link InvalidRequestException}、{@link HttpMessageNotReadableException} - 400</li>
 *   <li>{@link HttpMediaTypeNotSupportedException} - 415</li>
 *   <li>{@link OpenAiUnavailableException} - 503</li>
 *   <li>{@link UpstreamApiException} - 500（訊息包含上游錯誤）</li>
 *   <li>其他 - 500</li>
 * </ul>
 *
 * <p>Security Filter Chain 內的拒絕由 {@link GatewayErrorWriter} 直接輸出，不經過此處。
 *
 * @see io.github.samzhu.keygate.config.RouteConfig
 */
@Component
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    public ServerResponse handle(Throwable e, ServerRequest request) {
        if (e instanceof AccessGateException accessFailure) {
            log.warn("Access rejected: path={}, outcome={}", request.path(), accessFailure.getOutcome());
            return respond(accessFailure.getStatus(), GatewayError.of(accessFailure.getOutcome()));
        }
        if (e instanceof InvalidRequestException) {
            log.debug("Invalid request: path={}, message={}", request.path(), e.getMessage());
            return respond(HttpStatus.BAD_REQUEST, GatewayError.invalidRequestError(e.getMessage()));
        }
        if (e instanceof HttpMessageNotReadableException) {
            log.debug("Malformed request body: path={}, message={}", request.path(), e.getMessage());
            return respond(HttpStatus.BAD_REQUEST, GatewayError.invalidRequestError("Malformed JSON request body"));
        }
        if (e instanceof HttpMediaTypeNotSupportedException) {
            return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                GatewayError.invalidRequestError("Content type must be application/json"));
        }
        if (e instanceof OpenAiUnavailableException) {
            log.error("OpenAI unavailable: path={}", request.path());
            return respond(HttpStatus.SERVICE_UNAVAILABLE, GatewayError.serviceUnavailableError(e.getMessage()));
        }
        if (e instanceof UpstreamApiException upstream) {
            log.error("Upstream failure: path={}, upstreamStatus={}, message={}",
                request.path(), upstream.getUpstreamStatus(), upstream.getMessage());
            return respond(HttpStatus.INTERNAL_SERVER_ERROR, GatewayError.apiError(upstream.getMessage()));
        }

        log.error("Unexpected error: path={}, message={}", request.path(), e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, GatewayError.apiError("Internal server error"));
    }

    private ServerResponse respond(HttpStatus status, GatewayError error) {
        return ServerResponse.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(error);
    }
}
