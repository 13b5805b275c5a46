package com.procureinsight.discovery.llm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Primary provider: any OpenAI-compatible chat completions endpoint, Groq by default.
 */
@Component
@Order(1)
@Slf4j
public class OpenAiCompatibleLlmProvider implements LlmProvider {

    static final String SYSTEM_MESSAGE =
            "You are a procurement intelligence analyst. Provide accurate, structured analysis in JSON format.";

    private final WebClient webClient;

    @Value("${LLM_PRIMARY_API_KEY:${GROQ_API_KEY:}}")
    private String apiKey;

    @Value("${LLM_PRIMARY_BASE_URL:https://api.groq.com/openai/v1}")
    private String baseUrl;

    @Value("${LLM_PRIMARY_MODEL:llama3-8b-8192}")
    private String model;

    @Value("${discovery.llm.temperature:0.3}")
    private double temperature;

    @Value("${discovery.llm.max-tokens:2000}")
    private int maxTokens;

    public OpenAiCompatibleLlmProvider(@Qualifier("llmWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public String getName() {
        return "groq";
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<String> complete(String prompt) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("Primary LLM API key is not configured"));
        }
        String url = baseUrl.endsWith("/") ? baseUrl + "chat/completions" : baseUrl + "/chat/completions";

        Map<String, Object> body = Map.of(
                "model", model,
                "temperature", temperature,
                "max_tokens", maxTokens,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_MESSAGE),
                        Map.of("role", "user", "content", prompt)
                )
        );

        log.debug("Calling chat completions: {} model={}", url, model);

        return webClient.post()
                .uri(url)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(node -> {
                    String content = node.path("choices").path(0).path("message").path("content").asText("");
                    return content.isBlank() ? Mono.empty() : Mono.just(content);
                });
    }
}
