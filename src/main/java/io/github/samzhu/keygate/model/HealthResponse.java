package io.github.samzhu.keygate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code GET /health} 回應
 *
 * @param status 服務狀態，固定為 {@code healthy}
 * @param message 狀態摘要
 * @param openaiClient OpenAI 轉發是否可用（available / unavailable）
 * @param authentication Access Key 是否已配置（configured / not configured）
 * @param serviceVersion 服務版本
 * @param callerAuthenticated 呼叫端是否帶有有效的 Access Key
 */
public record HealthResponse(
    String status,

    String message,

    @JsonProperty("openai_client")
    String openaiClient,

    String authentication,

    @JsonProperty("service_version")
    String serviceVersion,

    @JsonProperty("caller_authenticated")
    boolean callerAuthenticated
) {}
