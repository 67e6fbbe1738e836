package io.github.samzhu.keygate.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.keygate.config.AccessProperties;
import io.github.samzhu.keygate.exception.AccessGateException;
import io.github.samzhu.keygate.model.AccessDecision;
import io.github.samzhu.keygate.model.AccessOutcome;

/**
 * Access Gate
 *
 * <p>以單一 Access Key 作為唯一信任來源，判定每個請求能否進入受保護的操作：
 * <ul>
 *   <li>{@link #authenticate(String)} - 登入端點使用，成功時把提交的 Key 原樣回傳作為 token</li>
 *   <li>{@link #authorize(String)} - 受保護端點的 Guard，失敗時拋出 {@link AccessGateException}</li>
 *   <li>{@link #authorizeOptional(String)} - 不拋例外，僅在驗證通過時回傳 credential</li>
 * </ul>
 *
 * <p>Access Key 在建構時決定且不可變，判定過程只讀不寫：沒有計數器、沒有鎖定、
 * 沒有 Session，因此可在任意數量的執行緒上並行呼叫，且相同輸入永遠得到相同結果。
 *
 * <p>比對使用 {@link MessageDigest#isEqual(byte[], byte[])}，耗時不隨相符前綴長度變化。
 *
 * <p>注意：回傳的 token 就是 Access Key 本身，沒有過期、簽章或撤銷機制。
 *
 * @see AccessProperties
 * @see io.github.samzhu.keygate.filter.AccessKeyAuthenticationFilter
 */
@Service
public class AccessGate {

    private static final Logger log = LoggerFactory.getLogger(AccessGate.class);

    private final byte[] accessKey;

    public AccessGate(AccessProperties properties) {
        if (properties.isConfigured()) {
            this.accessKey = properties.accessKey().getBytes(StandardCharsets.UTF_8);
            log.info("Access gate configured");
        } else {
            this.accessKey = null;
            log.warn("Access key not configured. Protected endpoints will respond 503 until ACCESS_KEY is set");
        }
    }

    public boolean isConfigured() {
        return accessKey != null;
    }

    /**
     * 登入驗證
     *
     * @param submitted 請求體中提交的 Access Key
     * @return {@code GRANTED} 判定，credential 即為要回傳的 token
     * @throws AccessGateException 未配置（503）或不相符（403）
     */
    public AccessDecision authenticate(String submitted) {
        if (!isConfigured()) {
            throw new AccessGateException(AccessOutcome.UNAVAILABLE);
        }
        if (submitted != null && matches(submitted)) {
            return AccessDecision.granted(submitted);
        }
        throw new AccessGateException(AccessOutcome.DENIED);
    }

    /**
     * 受保護端點的 Guard
     *
     * @param presented Authorization Header 中的 credential，未提供時為 null
     * @return {@code GRANTED} 判定
     * @throws AccessGateException 依序檢查：未配置（503）、未提供（401）、不相符（403）
     */
    public AccessDecision authorize(String presented) {
        AccessDecision decision = evaluate(presented);
        if (!decision.isGranted()) {
            throw new AccessGateException(decision.outcome());
        }
        return decision;
    }

    /**
     * 選擇性驗證，任何輸入都不會拋出例外
     *
     * @param presented credential，可為 null
     * @return 驗證通過時回傳 credential，其餘情況（未配置、未提供、不相符）回傳 empty
     */
    public Optional<String> authorizeOptional(String presented) {
        AccessDecision decision = evaluate(presented);
        return decision.isGranted() ? Optional.of(decision.credential()) : Optional.empty();
    }

    /**
     * 判定但不拋出例外
     */
    public AccessDecision evaluate(String presented) {
        if (!isConfigured()) {
            return AccessDecision.rejected(AccessOutcome.UNAVAILABLE);
        }
        if (StringUtils.isEmpty(presented)) {
            return AccessDecision.rejected(AccessOutcome.UNAUTHENTICATED);
        }
        if (!matches(presented)) {
            return AccessDecision.rejected(AccessOutcome.DENIED);
        }
        return AccessDecision.granted(presented);
    }

    private boolean matches(String candidate) {
        return MessageDigest.isEqual(accessKey, candidate.getBytes(StandardCharsets.UTF_8));
    }
}
