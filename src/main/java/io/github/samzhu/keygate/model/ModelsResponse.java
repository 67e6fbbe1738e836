package io.github.samzhu.keygate.model;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code GET /models} 回應
 *
 * @param models OpenAI 模型物件，原樣轉出
 * @param count 模型數量
 */
public record ModelsResponse(
    List<JsonNode> models,
    int count
) {}
