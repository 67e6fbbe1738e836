package io.github.samzhu.keygate.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code POST /chat} 回應
 *
 * @param message 第一個 choice 的訊息內容
 * @param model 請求使用的模型
 * @param usage OpenAI 回傳的用量物件，原樣轉出
 * @param id OpenAI completion ID
 */
public record ChatResponse(
    String message,
    String model,
    JsonNode usage,
    String id
) {}
