package io.github.samzhu.keygate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * {@code POST /completion} 請求
 *
 * @param model 模型名稱，預設 {@code gpt-3.5-turbo-instruct}
 * @param prompt 待補全的提示（必填）
 * @param temperature 取樣溫度，0 到 2，預設 0.7
 * @param maxTokens 最大生成 Token 數，預設 100
 */
public record CompletionRequest(
    String model,

    @NotNull
    String prompt,

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    Double temperature,

    @JsonProperty("max_tokens")
    @Positive
    Integer maxTokens
) {
    public CompletionRequest {
        if (model == null) {
            model = "gpt-3.5-turbo-instruct";
        }
        if (temperature == null) {
            temperature = 0.7;
        }
        if (maxTokens == null) {
            maxTokens = 100;
        }
    }
}
