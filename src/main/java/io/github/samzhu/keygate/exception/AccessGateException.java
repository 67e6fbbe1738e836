package io.github.samzhu.keygate.exception;

import org.springframework.http.HttpStatus;

import io.github.samzhu.keygate.model.AccessOutcome;

/**
 * Access Gate 拒絕存取
 *
 * <p>攜帶非 {@link AccessOutcome#GRANTED} 的判定結果，由呼叫端（Guard 過濾器或登入端點）
 * 轉換為對應的 HTTP 回應。
 */
public class AccessGateException extends RuntimeException {

    private final AccessOutcome outcome;

    public AccessGateException(AccessOutcome outcome) {
        super(outcome.message());
        if (outcome.isGranted()) {
            throw new IllegalArgumentException("GRANTED is not a failure outcome");
        }
        this.outcome = outcome;
    }

    public AccessOutcome getOutcome() {
        return outcome;
    }

    public HttpStatus getStatus() {
        return outcome.status();
    }
}
