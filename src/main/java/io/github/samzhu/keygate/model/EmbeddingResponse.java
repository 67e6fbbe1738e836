package io.github.samzhu.keygate.model;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code POST /embeddings} 回應
 *
 * @param embeddings 每筆輸入對應的向量
 * @param model 請求使用的模型
 * @param usage OpenAI 回傳的用量物件
 */
public record EmbeddingResponse(
    List<List<Double>> embeddings,
    String model,
    JsonNode usage
) {}
