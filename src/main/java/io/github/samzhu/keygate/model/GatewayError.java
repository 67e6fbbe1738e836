package io.github.samzhu.keygate.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 閘道錯誤回應格式
 *
 * <p>所有錯誤（認證、驗證、上游失敗）都使用同一結構，讓前端和 API 客戶端以
 * {@code error.type} 判斷錯誤種類，訊息文字不屬於契約。
 *
 * <p>錯誤結構：
 * <pre>{@code
 * {
 *   "type": "error",
 *   "error": {
 *     "type": "authentication_error|permission_error|service_unavailable_error|...",
 *     "message": "錯誤描述"
 *   }
 * }
 * }</pre>
 *
 * <p>支援的錯誤類型：
 * <ul>
 *   <li>{@code authentication_error} - 未提供 Access Key（401）</li>
 *   <li>{@code permission_error} - Access Key 不正確（403）</li>
 *   <li>{@code service_unavailable_error} - Access Key 或 OpenAI Key 未配置（503）</li>
 *   <li>{@code invalid_request_error} - 請求格式錯誤（400/415）</li>
 *   <li>{@code not_found_error} - 資源不存在（404）</li>
 *   <li>{@code api_error} - 上游或內部錯誤（500）</li>
 * </ul>
 *
 * @see io.github.samzhu.keygate.exception.GlobalExceptionHandler
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayError(
    String type,
    Error error
) {
    public static final String AUTHENTICATION_ERROR = "authentication_error";
    public static final String PERMISSION_ERROR = "permission_error";
    public static final String SERVICE_UNAVAILABLE_ERROR = "service_unavailable_error";
    public static final String INVALID_REQUEST_ERROR = "invalid_request_error";
    public static final String NOT_FOUND_ERROR = "not_found_error";
    public static final String API_ERROR = "api_error";

    public record Error(
        String type,
        String message
    ) {}

    public static GatewayError of(String errorType, String message) {
        return new GatewayError("error", new Error(errorType, message));
    }

    public static GatewayError of(AccessOutcome outcome) {
        return of(outcome.errorType(), outcome.message());
    }

    public static GatewayError serviceUnavailableError(String message) {
        return of(SERVICE_UNAVAILABLE_ERROR, message);
    }

    public static GatewayError apiError(String message) {
        return of(API_ERROR, message);
    }

    public static GatewayError invalidRequestError(String message) {
        return of(INVALID_REQUEST_ERROR, message);
    }

    public static GatewayError notFoundError(String message) {
        return of(NOT_FOUND_ERROR, message);
    }
}
