package com.guardianplatform.guardian.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardianplatform.common.exception.LanguageModelUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * {@link LanguageModelClient} backed by the Anthropic Messages API ({@code POST /v1/messages}).
 *
 * <p>Returns the text of the first content block. A blank API key short-circuits with
 * {@link LanguageModelUnavailableException} before any network call.
 */
public class AnthropicLanguageModelClient implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicLanguageModelClient.class);

    static final String ANTHROPIC_VERSION = "2023-06-01";

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public AnthropicLanguageModelClient(WebClient client, ObjectMapper objectMapper,
                                        String apiKey, String model, int maxTokens) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override
    public Mono<String> complete(String prompt) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new LanguageModelUnavailableException("No Anthropic API key configured"));
        }
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", ANTHROPIC_VERSION)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .map(this::extractText)
            .doOnSuccess(text -> log.debug("[LanguageModel] Completion received. model={} chars={}",
                model, text == null ? 0 : text.length()));
    }

    String extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode first = root.path("content").path(0);
            if (!first.has("text")) {
                throw new IllegalStateException("Anthropic response has no text content");
            }
            return first.path("text").asText();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to extract text from Anthropic response", e);
        }
    }

    public String model() {
        return model;
    }
}
