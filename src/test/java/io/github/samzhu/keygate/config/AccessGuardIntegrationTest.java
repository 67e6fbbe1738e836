package io.github.samzhu.keygate.config;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.keygate.exception.OpenAiUnavailableException;
import io.github.samzhu.keygate.exception.UpstreamApiException;
import io.github.samzhu.keygate.model.ChatResponse;
import io.github.samzhu.keygate.model.ModelsResponse;
import io.github.samzhu.keygate.service.OpenAiService;

@SpringBootTest(properties = {
    "keygate.auth.access-key=abc123",
    "openai.api.key=sk-test"
})
@AutoConfigureMockMvc
class AccessGuardIntegrationTest {

    private static final String CHAT_BODY = """
        {"messages": [{"role": "user", "content": "Hi"}]}
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private OpenAiService openAiService;

    @Test
    void protectedRoute_withoutAuthorizationHeader_isUnauthorized() throws Exception {
        mockMvc.perform(post("/chat").contentType(MediaType.APPLICATION_JSON).content(CHAT_BODY))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.type").value("error"))
            .andExpect(jsonPath("$.error.type").value("authentication_error"));

        verify(openAiService, never()).chatCompletion(any());
    }

    @Test
    void protectedRoute_withNonBearerScheme_isUnauthorized() throws Exception {
        mockMvc.perform(get("/models").header(HttpHeaders.AUTHORIZATION, "Basic YWJjMTIz"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error.type").value("authentication_error"));

        verify(openAiService, never()).listModels();
    }

    @Test
    void protectedRoute_withWrongKey_isForbidden() throws Exception {
        mockMvc.perform(post("/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CHAT_BODY))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error.type").value("permission_error"));

        verify(openAiService, never()).chatCompletion(any());
    }

    @Test
    void protectedRoute_withPaddedCredential_isForbidden() throws Exception {
        mockMvc.perform(get("/models").header(HttpHeaders.AUTHORIZATION, "Bearer  abc123 "))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error.type").value("permission_error"));

        verify(openAiService, never()).listModels();
    }

    @Test
    void tokenFromLogin_isAcceptedByGuard() throws Exception {
        when(openAiService.listModels()).thenReturn(new ModelsResponse(List.of(), 0));

        String body = mockMvc.perform(post("/auth")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"access_key\": \"abc123\"}"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        String token = objectMapper.readTree(body).get("token").asText();

        mockMvc.perform(get("/models").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
            .andExpect(status().isOk());
    }

    @Test
    void protectedRoute_ignoresSessionUserWithoutAccessKey() throws Exception {
        mockMvc.perform(get("/models").with(user("admin")))
            .andExpect(status().isUnauthorized());

        verify(openAiService, never()).listModels();
    }

    @Test
    void chat_withCorrectKey_reachesOpenAi() throws Exception {
        when(openAiService.chatCompletion(any()))
            .thenReturn(new ChatResponse("Hello!", "gpt-3.5-turbo", null, "chatcmpl-1"));

        mockMvc.perform(post("/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer abc123")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CHAT_BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Hello!"))
            .andExpect(jsonPath("$.model").value("gpt-3.5-turbo"))
            .andExpect(jsonPath("$.id").value("chatcmpl-1"));
    }

    @Test
    void models_withLowercaseScheme_isGranted() throws Exception {
        when(openAiService.listModels()).thenReturn(new ModelsResponse(
            List.of(objectMapper.readTree("{\"id\": \"gpt-4\"}")), 1));

        mockMvc.perform(get("/models").header(HttpHeaders.AUTHORIZATION, "bearer abc123"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.models[0].id").value("gpt-4"));
    }

    @Test
    void chat_withInvalidBody_isBadRequestAfterAuthentication() throws Exception {
        mockMvc.perform(post("/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer abc123")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"messages\": [], \"temperature\": 3.5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.type").value("invalid_request_error"))
            .andExpect(jsonPath("$.error.message").value(containsString("temperature")));

        verify(openAiService, never()).chatCompletion(any());
    }

    @Test
    void chat_withMalformedJson_isBadRequest() throws Exception {
        mockMvc.perform(post("/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer abc123")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.type").value("invalid_request_error"));
    }

    @Test
    void chat_whenUpstreamFails_isApiError() throws Exception {
        when(openAiService.chatCompletion(any()))
            .thenThrow(new UpstreamApiException(401, "Incorrect API key provided"));

        mockMvc.perform(post("/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer abc123")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CHAT_BODY))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error.type").value("api_error"))
            .andExpect(jsonPath("$.error.message").value("OpenAI API error: Incorrect API key provided"));
    }

    @Test
    void embeddings_whenOpenAiNotConfigured_isServiceUnavailable() throws Exception {
        when(openAiService.createEmbeddings(any())).thenThrow(new OpenAiUnavailableException());

        mockMvc.perform(post("/embeddings")
                .header(HttpHeaders.AUTHORIZATION, "Bearer abc123")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"input\": \"hello\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error.type").value("service_unavailable_error"));
    }

    @Test
    void auth_withCorrectKey_echoesKeyAsToken() throws Exception {
        mockMvc.perform(post("/auth")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"access_key\": \"abc123\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.authenticated").value(true))
            .andExpect(jsonPath("$.message").value("Authentication successful"))
            .andExpect(jsonPath("$.token").value("abc123"));
    }

    @Test
    void auth_acceptsTrailingSlash() throws Exception {
        mockMvc.perform(post("/auth/")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"access_key\": \"abc123\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.token").value("abc123"));
    }

    @Test
    void auth_withWrongKey_isForbidden() throws Exception {
        mockMvc.perform(post("/auth")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"access_key\": \"nope\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error.type").value("permission_error"))
            .andExpect(jsonPath("$.token").doesNotExist());
    }

    @Test
    void auth_withoutAccessKeyField_isBadRequest() throws Exception {
        mockMvc.perform(post("/auth")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.type").value("invalid_request_error"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"access_key\": 123}", "{\"access_key\": 1.5}", "{\"access_key\": true}"})
    void auth_withNonTextualAccessKey_isBadRequest(String body) throws Exception {
        mockMvc.perform(post("/auth")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.type").value("invalid_request_error"));
    }

    @Test
    void chat_withNumericMessageContent_isBadRequest() throws Exception {
        mockMvc.perform(post("/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer abc123")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"messages\": [{\"role\": \"user\", \"content\": 42}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.type").value("invalid_request_error"));

        verify(openAiService, never()).chatCompletion(any());
    }

    @Test
    void chat_withExplicitNullModel_usesDefaultModel() throws Exception {
        when(openAiService.chatCompletion(any()))
            .thenReturn(new ChatResponse("Hello!", "gpt-3.5-turbo", null, "chatcmpl-1"));

        mockMvc.perform(post("/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer abc123")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"model\": null, \"messages\": [{\"role\": \"user\", \"content\": \"Hi\"}]}"))
            .andExpect(status().isOk());

        verify(openAiService).chatCompletion(argThat(request -> "gpt-3.5-turbo".equals(request.model())));
    }

    @Test
    void repeatedFailures_doNotLockOutCorrectKey() throws Exception {
        for (int i = 0; i < 10; i++) {
            mockMvc.perform(post("/auth")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"access_key\": \"guess-" + i + "\"}"))
                .andExpect(status().isForbidden());
        }

        mockMvc.perform(post("/auth")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"access_key\": \"abc123\"}"))
            .andExpect(status().isOk());
    }

    @Test
    void health_isPublicAndReportsCallerState() throws Exception {
        when(openAiService.isAvailable()).thenReturn(true);

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.openai_client").value("available"))
            .andExpect(jsonPath("$.authentication").value("configured"))
            .andExpect(jsonPath("$.caller_authenticated").value(false));

        mockMvc.perform(get("/health").header(HttpHeaders.AUTHORIZATION, "Bearer abc123"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.caller_authenticated").value(true));

        mockMvc.perform(get("/health").header(HttpHeaders.AUTHORIZATION, "Bearer wrong"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.caller_authenticated").value(false));
    }

    @Test
    void frontend_isServedWithoutCredential() throws Exception {
        mockMvc.perform(get("/"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
            .andExpect(content().string(containsString("OpenAI API Client")));

        mockMvc.perform(get("/static/app.js"))
            .andExpect(status().isOk());
    }

    @Test
    void corsPreflight_isAnsweredWithoutCredential() throws Exception {
        mockMvc.perform(options("/chat")
                .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "Authorization, Content-Type"))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000"))
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"));
    }
}
