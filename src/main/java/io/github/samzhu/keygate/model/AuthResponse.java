package io.github.samzhu.keygate.model;

/**
 * {@code POST /auth} 登入回應
 *
 * <p>{@code token} 即提交的 Access Key 本身，後續請求以
 * {@code Authorization: Bearer <token>} 帶入。
 *
 * @param authenticated 是否通過驗證
 * @param message 說明訊息
 * @param token 後續請求使用的 token
 */
public record AuthResponse(
    boolean authenticated,
    String message,
    String token
) {
    public static AuthResponse from(AccessDecision decision) {
        return new AuthResponse(decision.isGranted(), decision.outcome().message(), decision.credential());
    }

    @Override
    public String toString() {
        return "AuthResponse[authenticated=" + authenticated + ", message=" + message + "]";
    }
}
