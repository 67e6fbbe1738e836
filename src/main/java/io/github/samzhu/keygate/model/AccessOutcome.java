package io.github.samzhu.keygate.model;

import org.springframework.http.HttpStatus;

/**
 * 單次存取判定結果
 *
 * <p>四種結果互斥，各自對應固定的 HTTP 狀態碼與錯誤類型：
 * <ul>
 *   <li>{@link #GRANTED} - Credential 與 Access Key 完全相符</li>
 *   <li>{@link #UNAVAILABLE} - 503，未配置 Access Key，任何人都無法通過</li>
 *   <li>{@link #UNAUTHENTICATED} - 401，未提供 Credential</li>
 *   <li>{@link #DENIED} - 403，提供的 Credential 不相符</li>
 * </ul>
 *
 * <p>Guard 檢查的優先順序為 503 → 401 → 403。
 */
public enum AccessOutcome {

    GRANTED(HttpStatus.OK, null, "Authentication successful"),

    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, GatewayError.SERVICE_UNAVAILABLE_ERROR,
        "Authentication not configured. Please set ACCESS_KEY."),

    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, GatewayError.AUTHENTICATION_ERROR,
        "Authentication required. Please provide access key."),

    DENIED(HttpStatus.FORBIDDEN, GatewayError.PERMISSION_ERROR, "Invalid access key.");

    private final HttpStatus status;
    private final String errorType;
    private final String message;

    AccessOutcome(HttpStatus status, String errorType, String message) {
        this.status = status;
        this.errorType = errorType;
        this.message = message;
    }

    public HttpStatus status() {
        return status;
    }

    public String errorType() {
        return errorType;
    }

    public String message() {
        return message;
    }

    public boolean isGranted() {
        return this == GRANTED;
    }
}
