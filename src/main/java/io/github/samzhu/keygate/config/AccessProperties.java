package io.github.samzhu.keygate.config;

import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Access Key 認證配置屬性
 *
 * <p>從 {@code keygate.auth} 前綴載入，預設綁定環境變數 {@code ACCESS_KEY}：
 * <pre>
 * keygate:
 *   auth:
 *     access-key: ${ACCESS_KEY:}
 * </pre>
 *
 * <p>未設定或空字串代表「認證未配置」，此時所有受保護端點回傳 503，
 * 與「已配置但拒絕」（401/403）明確區分。啟動後不可變更。
 *
 * @param accessKey 唯一信任的 Access Key（可為 null）
 * @see io.github.samzhu.keygate.service.AccessGate
 */
@ConfigurationProperties(prefix = "keygate.auth")
public record AccessProperties(
    String accessKey
) {
    public AccessProperties {
        if (StringUtils.isEmpty(accessKey)) {
            accessKey = null;
        }
    }

    public boolean isConfigured() {
        return accessKey != null;
    }
}
