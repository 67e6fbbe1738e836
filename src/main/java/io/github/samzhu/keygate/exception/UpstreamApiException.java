package io.github.samzhu.keygate.exception;

/**
 * OpenAI API 呼叫失敗
 *
 * <p>包含上游回傳非 2xx 狀態，以及連線、逾時、回應無法解析等傳輸層錯誤。
 * {@code upstreamStatus} 在傳輸層錯誤時為 0。
 */
public class UpstreamApiException extends RuntimeException {

    private final int upstreamStatus;

    public UpstreamApiException(int upstreamStatus, String message) {
        super("OpenAI API error: " + message);
        this.upstreamStatus = upstreamStatus;
    }

    public UpstreamApiException(String message, Throwable cause) {
        super("OpenAI API error: " + message, cause);
        this.upstreamStatus = 0;
    }

    public int getUpstreamStatus() {
        return upstreamStatus;
    }
}
