package io.github.samzhu.keygate.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * {@code POST /chat} 請求
 *
 * <p>未提供的欄位使用預設值：model {@code gpt-3.5-turbo}、temperature {@code 0.7}、
 * max_tokens {@code 1000}。明確傳入 {@code null} 與省略欄位視為相同，一律套用預設值。
 *
 * @param model 模型名稱
 * @param messages 對話訊息（必填）
 * @param temperature 取樣溫度，0 到 2
 * @param maxTokens 最大生成 Token 數
 */
public record ChatRequest(
    String model,

    @NotNull
    List<@Valid @NotNull ChatMessage> messages,

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    Double temperature,

    @JsonProperty("max_tokens")
    @Positive
    Integer maxTokens
) {
    public ChatRequest {
        if (model == null) {
            model = "gpt-3.5-turbo";
        }
        if (temperature == null) {
            temperature = 0.7;
        }
        if (maxTokens == null) {
            maxTokens = 1000;
        }
    }
}
