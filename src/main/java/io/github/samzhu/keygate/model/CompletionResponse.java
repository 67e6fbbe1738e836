package io.github.samzhu.keygate.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code POST /completion} 回應
 *
 * @param text 第一個 choice 的文字
 * @param model 請求使用的模型
 * @param usage OpenAI 回傳的用量物件
 * @param id OpenAI completion ID
 */
public record CompletionResponse(
    String text,
    String model,
    JsonNode usage,
    String id
) {}
