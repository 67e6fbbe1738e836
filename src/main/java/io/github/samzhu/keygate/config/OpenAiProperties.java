package io.github.samzhu.keygate.config;

import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenAI API 配置屬性
 *
 * <p>從 application.yaml 中的 {@code openai.api} 前綴載入配置：
 * <ul>
 *   <li>{@code baseUrl} - OpenAI API 基礎 URL（預設: https://api.openai.com/v1）</li>
 *   <li>{@code key} - OpenAI API Key，未設定時轉發端點回傳 503</li>
 *   <li>{@code imageModel} - 圖片生成使用的模型（預設: dall-e-3）</li>
 * </ul>
 *
 * <p>配置範例：
 * <pre>
 * openai:
 *   api:
 *     base-url: https://api.openai.com/v1
 *     key: ${OPENAI_API_KEY:}
 *     image-model: dall-e-3
 * </pre>
 *
 * @param baseUrl OpenAI API 基礎 URL
 * @param key OpenAI API Key
 * @param imageModel 圖片生成模型
 * @see io.github.samzhu.keygate.service.OpenAiService
 */
@ConfigurationProperties(prefix = "openai.api")
public record OpenAiProperties(
    String baseUrl,
    String key,
    String imageModel
) {
    public OpenAiProperties {
        if (StringUtils.isBlank(baseUrl)) {
            baseUrl = "https://api.openai.com/v1";
        }
        if (StringUtils.isEmpty(key)) {
            key = null;
        }
        if (StringUtils.isBlank(imageModel)) {
            imageModel = "dall-e-3";
        }
    }

    public boolean isConfigured() {
        return key != null;
    }
}
