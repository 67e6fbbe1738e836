package io.github.samzhu.keygate.service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.github.samzhu.keygate.config.OpenAiProperties;
import io.github.samzhu.keygate.exception.OpenAiUnavailableException;
import io.github.samzhu.keygate.exception.UpstreamApiException;
import io.github.samzhu.keygate.model.ChatMessage;
import io.github.samzhu.keygate.model.ChatRequest;
import io.github.samzhu.keygate.model.ChatResponse;
import io.github.samzhu.keygate.model.CompletionRequest;
import io.github.samzhu.keygate.model.CompletionResponse;
import io.github.samzhu.keygate.model.EmbeddingRequest;
import io.github.samzhu.keygate.model.EmbeddingResponse;
import io.github.samzhu.keygate.model.ImageRequest;
import io.github.samzhu.keygate.model.ImageResponse;
import io.github.samzhu.keygate.model.ModelsResponse;
import io.micrometer.tracing.Tracer;

/**
 * OpenAI API 轉發服務
 *
 * <p>每個操作只對 OpenAI 發出一次呼叫，不重試、不快取：
 * <ul>
 *   <li>{@link #chatCompletion} → {@code POST /chat/completions}</li>
 *   <li>{@link #textCompletion} → {@code POST /completions}</li>
 *   <li>{@link #generateImage} → {@code POST /images/generations}</li>
 *   <li>{@link #createEmbeddings} → {@code POST /embeddings}</li>
 *   <li>{@link #listModels} → {@code GET /models}</li>
 * </ul>
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>未配置 OpenAI Key - {@link OpenAiUnavailableException}（503）</li>
 *   <li>上游非 2xx、連線失敗、回應無法解析 - {@link UpstreamApiException}（500）</li>
 * </ul>
 *
 * @see io.github.samzhu.keygate.handler.OpenAiProxyHandler
 * @see <a href="https://platform.openai.com/docs/api-reference">OpenAI API Reference</a>
 */
@Service
public class OpenAiService {

    private static final Logger log = LoggerFactory.getLogger(OpenAiService.class);

    private final OpenAiProperties openAiProperties;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;
    private final Tracer tracer;

    /**
     * 建構子
     *
     * <p>使用 Spring 自動配置的 {@code RestClient.Builder}，上游呼叫會自動建立子 Span 並傳播 Trace Context。
     *
     * @param openAiProperties OpenAI API 配置
     * @param objectMapper JSON 物件映射器
     * @param restClientBuilder Spring 自動配置的 RestClient.Builder
     * @param tracer Micrometer Tracer
     */
    public OpenAiService(
            OpenAiProperties openAiProperties,
            ObjectMapper objectMapper,
            RestClient.Builder restClientBuilder,
            Tracer tracer) {
        this.openAiProperties = openAiProperties;
        this.objectMapper = objectMapper;
        this.tracer = tracer;
        this.restClient = restClientBuilder
            .baseUrl(openAiProperties.baseUrl())
            .build();

        if (openAiProperties.isConfigured()) {
            log.info("OpenAI client initialized: baseUrl={}", openAiProperties.baseUrl());
        } else {
            log.warn("OpenAI API key not configured. Proxy endpoints will respond 503 until OPENAI_API_KEY is set");
        }
    }

    public boolean isAvailable() {
        return openAiProperties.isConfigured();
    }

    public ChatResponse chatCompletion(ChatRequest request) {
        ObjectNode payload = objectMapper.createObjectNode()
            .put("model", request.model())
            .put("temperature", request.temperature())
            .put("max_tokens", request.maxTokens());
        ArrayNode messages = payload.putArray("messages");
        for (ChatMessage message : request.messages()) {
            messages.addObject()
                .put("role", message.role())
                .put("content", message.content());
        }

        JsonNode root = post("/chat/completions", payload);
        JsonNode choice = firstDataElement(root, "choices");
        return new ChatResponse(
            textOrNull(choice.path("message").path("content")),
            request.model(),
            usageOf(root),
            textOrNull(root.path("id")));
    }

    public CompletionResponse textCompletion(CompletionRequest request) {
        ObjectNode payload = objectMapper.createObjectNode()
            .put("model", request.model())
            .put("prompt", request.prompt())
            .put("temperature", request.temperature())
            .put("max_tokens", request.maxTokens());

        JsonNode root = post("/completions", payload);
        JsonNode choice = firstDataElement(root, "choices");
        return new CompletionResponse(
            textOrNull(choice.path("text")),
            request.model(),
            usageOf(root),
            textOrNull(root.path("id")));
    }

    public ImageResponse generateImage(ImageRequest request) {
        ObjectNode payload = objectMapper.createObjectNode()
            .put("model", openAiProperties.imageModel())
            .put("prompt", request.prompt())
            .put("size", request.size())
            .put("quality", request.quality())
            .put("n", request.n());

        JsonNode root = post("/images/generations", payload);
        JsonNode image = firstDataElement(root, "data");
        return new ImageResponse(
            textOrNull(image.path("url")),
            request.prompt(),
            request.size(),
            request.quality(),
            textOrNull(image.path("revised_prompt")));
    }

    public EmbeddingResponse createEmbeddings(EmbeddingRequest request) {
        ObjectNode payload = objectMapper.createObjectNode()
            .put("model", request.model())
            .put("input", request.input());

        JsonNode root = post("/embeddings", payload);
        List<List<Double>> embeddings = new ArrayList<>();
        for (JsonNode data : root.path("data")) {
            embeddings.add(objectMapper.convertValue(data.path("embedding"), new TypeReference<List<Double>>() {}));
        }
        return new EmbeddingResponse(embeddings, request.model(), usageOf(root));
    }

    public ModelsResponse listModels() {
        JsonNode root = get("/models");
        List<JsonNode> models = new ArrayList<>();
        root.path("data").forEach(models::add);
        return new ModelsResponse(models, models.size());
    }

    private JsonNode post(String path, JsonNode payload) {
        checkClient();
        return execute(path, restClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .headers(headers -> headers.setBearerAuth(openAiProperties.key()))
            .body(payload));
    }

    private JsonNode get(String path) {
        checkClient();
        return execute(path, restClient.get()
            .uri(path)
            .headers(headers -> headers.setBearerAuth(openAiProperties.key())));
    }

    /**
     * 執行請求並解析 JSON，非 2xx 轉為 {@link UpstreamApiException}
     */
    private JsonNode execute(String path, RestClient.RequestHeadersSpec<?> requestSpec) {
        long startTime = System.currentTimeMillis();
        String traceId = getCurrentTraceId();

        try {
            return requestSpec
                .accept(MediaType.APPLICATION_JSON)
                .exchange((request, response) -> {
                    String responseBody = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    HttpStatusCode statusCode = response.getStatusCode();
                    long latencyMs = System.currentTimeMillis() - startTime;

                    // OpenAI 回應 header 中的 request id，用於向 OpenAI 回報問題
                    String openaiRequestId = response.getHeaders().getFirst("x-request-id");

                    if (!statusCode.is2xxSuccessful()) {
                        log.error("Upstream error: path={}, status={}, openaiRequestId={}, traceId={}, latencyMs={}",
                            path, statusCode.value(), openaiRequestId, traceId, latencyMs);
                        throw new UpstreamApiException(statusCode.value(), extractErrorMessage(responseBody, statusCode));
                    }

                    log.debug("Upstream call completed: path={}, openaiRequestId={}, traceId={}, latencyMs={}",
                        path, openaiRequestId, traceId, latencyMs);
                    return objectMapper.readTree(responseBody);
                });
        } catch (RestClientException e) {
            // 包含連線失敗與回應 JSON 解析失敗（exchange 會把 IOException 包成 ResourceAccessException）
            log.error("Upstream request failed: path={}, traceId={}, error={}", path, traceId, e.getMessage());
            throw new UpstreamApiException(e.getMessage(), e);
        }
    }

    private void checkClient() {
        if (!isAvailable()) {
            throw new OpenAiUnavailableException();
        }
    }

    /**
     * 從 OpenAI 錯誤回應 {@code {"error": {"message": ...}}} 取出訊息
     */
    private String extractErrorMessage(String responseBody, HttpStatusCode statusCode) {
        try {
            JsonNode message = objectMapper.readTree(responseBody).path("error").path("message");
            if (message.isTextual() && !message.asText().isBlank()) {
                return message.asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Upstream error body is not JSON: {}", e.getOriginalMessage());
        }
        return "HTTP " + statusCode.value();
    }

    private JsonNode firstDataElement(JsonNode root, String field) {
        JsonNode array = root.path(field);
        if (!array.isArray() || array.isEmpty()) {
            throw new UpstreamApiException(200, "response contains no " + field);
        }
        return array.get(0);
    }

    private JsonNode usageOf(JsonNode root) {
        JsonNode usage = root.path("usage");
        return usage.isObject() ? usage : null;
    }

    private String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }

    /**
     * 取得當前 OpenTelemetry Trace ID
     */
    private String getCurrentTraceId() {
        var currentSpan = tracer.currentSpan();
        if (currentSpan != null && currentSpan.context() != null) {
            return currentSpan.context().traceId();
        }
        return null;
    }
}
