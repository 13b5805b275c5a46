package com.procureinsight.discovery.search;

import com.procureinsight.discovery.config.DiscoveryProperties;
import com.procureinsight.discovery.exception.SearchFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google results through the Serper API ({@code POST /search}).
 */
@Component
@Slf4j
public class SerperSearchProvider implements SearchProvider {

    private final WebClient webClient;
    private final Duration timeout;

    @Value("${SERPER_API_KEY:}")
    private String apiKey;

    @Value("${SERPER_BASE_URL:https://google.serper.dev}")
    private String baseUrl;

    public SerperSearchProvider(@Qualifier("searchWebClient") WebClient webClient, DiscoveryProperties properties) {
        this.webClient = webClient;
        this.timeout = properties.getSearch().getTimeout();
    }

    record SerperResponse(List<Item> organic) {
        record Item(String link, String title, String snippet) {
        }
    }

    @Override
    public String getName() {
        return "serper";
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<List<SearchHit>> search(String query, int maxResults) {
        if (!isAvailable()) {
            return Mono.error(new SearchFailureException(query, "Serper API key is not configured", null));
        }
        String url = baseUrl.endsWith("/") ? baseUrl + "search" : baseUrl + "/search";

        return webClient.post()
                .uri(url)
                .header("X-API-KEY", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("q", query, "num", maxResults))
                .retrieve()
                .bodyToMono(SerperResponse.class)
                .timeout(timeout)
                .map(SerperSearchProvider::toHits)
                .onErrorMap(e -> !(e instanceof SearchFailureException),
                        e -> new SearchFailureException(query, "Serper search failed: " + e.getMessage(), e));
    }

    private static List<SearchHit> toHits(SerperResponse response) {
        List<SearchHit> hits = new ArrayList<>();
        if (response == null || response.organic() == null) {
            return hits;
        }
        for (SerperResponse.Item item : response.organic()) {
            if (item == null || item.link() == null) {
                continue;
            }
            hits.add(SearchHit.builder()
                    .title(item.title() == null ? "" : item.title())
                    .url(item.link())
                    .snippet(item.snippet() == null ? "" : item.snippet())
                    .source(extractDomain(item.link()))
                    .build());
        }
        return hits;
    }

    static String extractDomain(String url) {
        try {
            String host = URI.create(url.trim()).getHost();
            return host != null ? host : "unknown";
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable result URL {}: {}", url, e.getMessage());
            return "unknown";
        }
    }
}
