package io.github.samzhu.keygate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code POST /images/generate} 回應，只回傳第一張圖
 *
 * @param url 圖片 URL
 * @param prompt 原始提示
 * @param size 圖片尺寸
 * @param quality 圖片品質
 * @param revisedPrompt 模型改寫後的提示（可能為 null）
 */
public record ImageResponse(
    String url,
    String prompt,
    String size,
    String quality,

    @JsonProperty("revised_prompt")
    String revisedPrompt
) {}
