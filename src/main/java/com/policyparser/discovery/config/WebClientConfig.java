package com.policyparser.discovery.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    private static final int MAX_BODY_BYTES = 8 * 1024 * 1024;

    @Bean
    @Qualifier("fetchWebClient")
    WebClient fetchWebClient(FetchProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(false)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, properties.timeoutMs()))
                .responseTimeout(Duration.ofMillis(properties.timeoutMs()));
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                        .build())
                .build();
    }

    @Bean
    @Qualifier("searchWebClient")
    WebClient searchWebClient(SearchProperties properties, FetchProperties fetchProperties) {
        return WebClient.builder()
                .baseUrl(properties.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create()
                        .followRedirect(true)
                        .responseTimeout(Duration.ofMillis(fetchProperties.timeoutMs()))))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                        .build())
                .build();
    }

    @Bean
    @Qualifier("analysisWebClient")
    WebClient analysisWebClient(AnalysisProperties properties) {
        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create()
                        .responseTimeout(Duration.ofMillis(properties.timeoutMs()))));
        if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + properties.apiKey());
        }
        return builder.build();
    }
}
