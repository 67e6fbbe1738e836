package io.github.samzhu.keygate.model;

import jakarta.validation.constraints.NotNull;

/**
 * {@code POST /embeddings} 請求
 *
 * @param model 模型名稱，預設 {@code text-embedding-ada-002}
 * @param input 要轉換的文字（必填）
 */
public record EmbeddingRequest(
    String model,

    @NotNull
    String input
) {
    public EmbeddingRequest {
        if (model == null) {
            model = "text-embedding-ada-002";
        }
    }
}
