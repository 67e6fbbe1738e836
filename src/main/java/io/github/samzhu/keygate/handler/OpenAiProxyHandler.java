package io.github.samzhu.keygate.handler;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.keygate.model.ChatRequest;
import io.github.samzhu.keygate.model.CompletionRequest;
import io.github.samzhu.keygate.model.EmbeddingRequest;
import io.github.samzhu.keygate.model.ImageRequest;
import io.github.samzhu.keygate.service.OpenAiService;
import jakarta.servlet.ServletException;

/**
 * OpenAI 轉發處理器
 *
 * <p>請求到達這裡時已通過 Access Gate（見 {@link io.github.samzhu.keygate.config.SecurityConfig}），
 * 只負責讀取並驗證請求體，再交給 {@link OpenAiService}。
 */
@Component
public class OpenAiProxyHandler {

    private static final Logger log = LoggerFactory.getLogger(OpenAiProxyHandler.class);

    private final OpenAiService openAiService;
    private final RequestBodyReader bodyReader;

    public OpenAiProxyHandler(OpenAiService openAiService, RequestBodyReader bodyReader) {
        this.openAiService = openAiService;
        this.bodyReader = bodyReader;
    }

    public ServerResponse chat(ServerRequest request) throws ServletException, IOException {
        ChatRequest chatRequest = bodyReader.read(request, ChatRequest.class);
        log.debug("Chat completion: model={}, messages={}", chatRequest.model(), chatRequest.messages().size());
        return json(openAiService.chatCompletion(chatRequest));
    }

    public ServerResponse completion(ServerRequest request) throws ServletException, IOException {
        CompletionRequest completionRequest = bodyReader.read(request, CompletionRequest.class);
        log.debug("Text completion: model={}", completionRequest.model());
        return json(openAiService.textCompletion(completionRequest));
    }

    public ServerResponse generateImage(ServerRequest request) throws ServletException, IOException {
        ImageRequest imageRequest = bodyReader.read(request, ImageRequest.class);
        log.debug("Image generation: size={}, quality={}, n={}",
            imageRequest.size(), imageRequest.quality(), imageRequest.n());
        return json(openAiService.generateImage(imageRequest));
    }

    public ServerResponse embeddings(ServerRequest request) throws ServletException, IOException {
        EmbeddingRequest embeddingRequest = bodyReader.read(request, EmbeddingRequest.class);
        log.debug("Embeddings: model={}", embeddingRequest.model());
        return json(openAiService.createEmbeddings(embeddingRequest));
    }

    public ServerResponse models(ServerRequest request) {
        return json(openAiService.listModels());
    }

    private ServerResponse json(Object body) {
        return ServerResponse.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .body(body);
    }
}
