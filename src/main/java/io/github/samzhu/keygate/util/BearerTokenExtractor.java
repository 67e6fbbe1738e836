package io.github.samzhu.keygate.util;

import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

/**
 * Authorization Header Bearer credential 提取工具
 *
 * <p>提取規則：
 * <ul>
 *   <li>格式為 {@code <scheme> <credential>}，只在第一個空白處切開</li>
 *   <li>scheme 必須是 {@code Bearer}（不分大小寫）</li>
 *   <li>credential 為空白之後的全部內容，原樣交給 Access Gate，不去除前後空白</li>
 * </ul>
 *
 * <p>credential 為空字串時視為「未提供」，由 Access Gate 回應 401。
 *
 * <pre>{@code
 * BearerTokenExtractor.extract("Bearer abc123");    // Optional[abc123]
 * BearerTokenExtractor.extract("Bearer  abc123 ");  // Optional[ abc123 ]
 * BearerTokenExtractor.extract("Basic abc123");     // Optional.empty
 * BearerTokenExtractor.extract(null);               // Optional.empty
 * }</pre>
 */
public final class BearerTokenExtractor {

    private static final String BEARER_SCHEME = "Bearer";

    private BearerTokenExtractor() {
    }

    public static Optional<String> extract(String authorizationHeader) {
        if (StringUtils.isEmpty(authorizationHeader)) {
            return Optional.empty();
        }
        int separator = authorizationHeader.indexOf(' ');
        if (separator < 0) {
            return Optional.empty();
        }
        String scheme = authorizationHeader.substring(0, separator);
        String credential = authorizationHeader.substring(separator + 1);
        if (!BEARER_SCHEME.equalsIgnoreCase(scheme) || credential.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(credential);
    }
}
