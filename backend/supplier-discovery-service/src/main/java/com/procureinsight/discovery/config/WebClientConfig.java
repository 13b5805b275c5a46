package com.procureinsight.discovery.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    @Value("${discovery.http.user-agent:ProcureInsight-Discovery/1.0}")
    private String userAgent;

    @Value("${discovery.http.timeout.connect:10000}")
    private int connectTimeout;

    @Value("${discovery.http.timeout.read:30000}")
    private int readTimeout;

    @Value("${discovery.http.timeout.llm-read:60000}")
    private int llmReadTimeout;

    /**
     * Search provider client
     */
    @Bean
    public WebClient searchWebClient() {
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient(readTimeout)))
                .defaultHeader("User-Agent", userAgent)
                .build();
    }

    /**
     * Language-model provider client. Completions are slower and larger than search responses.
     */
    @Bean
    public WebClient llmWebClient() {
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient(llmReadTimeout)))
                .defaultHeader("User-Agent", userAgent)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
    }

    private HttpClient httpClient(int timeoutMillis) {
        return HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout)
                .responseTimeout(Duration.ofMillis(timeoutMillis))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                            .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                )
                .followRedirect(true);
    }
}
