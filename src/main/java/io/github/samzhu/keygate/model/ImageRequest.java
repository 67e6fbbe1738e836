package io.github.samzhu.keygate.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * {@code POST /images/generate} 請求
 *
 * @param prompt 圖片描述（必填）
 * @param size 圖片尺寸，預設 {@code 1024x1024}
 * @param quality 圖片品質，預設 {@code standard}
 * @param n 生成張數，1 到 4，預設 1
 */
public record ImageRequest(
    @NotNull
    String prompt,

    String size,

    String quality,

    @Min(1)
    @Max(4)
    Integer n
) {
    public ImageRequest {
        if (size == null) {
            size = "1024x1024";
        }
        if (quality == null) {
            quality = "standard";
        }
        if (n == null) {
            n = 1;
        }
    }
}
