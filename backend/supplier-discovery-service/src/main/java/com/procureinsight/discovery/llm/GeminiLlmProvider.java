package com.procureinsight.discovery.llm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Secondary provider: Google Gemini {@code generateContent}.
 */
@Component
@Order(2)
@Slf4j
public class GeminiLlmProvider implements LlmProvider {

    private final WebClient webClient;

    @Value("${GEMINI_API_KEY:}")
    private String apiKey;

    @Value("${GEMINI_BASE_URL:https://generativelanguage.googleapis.com/v1beta}")
    private String baseUrl;

    @Value("${GEMINI_MODEL:gemini-1.5-flash}")
    private String model;

    @Value("${discovery.llm.temperature:0.3}")
    private double temperature;

    @Value("${discovery.llm.max-tokens:2000}")
    private int maxTokens;

    public GeminiLlmProvider(@Qualifier("llmWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public String getName() {
        return "gemini";
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<String> complete(String prompt) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("Gemini API key is not configured"));
        }
        String root = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String url = root + "/models/" + model + ":generateContent";

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text",
                        "You are a procurement intelligence analyst. " + prompt)))),
                "generationConfig", Map.of(
                        "temperature", temperature,
                        "maxOutputTokens", maxTokens
                )
        );

        return webClient.post()
                .uri(url)
                .header("x-goog-api-key", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(node -> {
                    JsonNode parts = node.path("candidates").path(0).path("content").path("parts");
                    StringBuilder text = new StringBuilder();
                    for (JsonNode part : parts) {
                        text.append(part.path("text").asText(""));
                    }
                    return text.length() == 0 ? Mono.empty() : Mono.just(text.toString());
                });
    }
}
