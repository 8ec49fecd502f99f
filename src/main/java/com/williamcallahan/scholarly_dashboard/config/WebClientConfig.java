/**
 * Configuration for the catalog WebClient
 * - Defines the shared WebClient builder used by the OpenAlex client
 * - Applies timeouts from openalex.api.timeout
 *
 * @author William Callahan
 */
package com.williamcallahan.scholarly_dashboard.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient builder
 * - Connect, read, write and response timeouts all follow the configured API timeout
 * - Raises the in-memory buffer so a full 200-record page fits
 * - Sends a polite User-Agent carrying the contact address when one is configured
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 32 * 1024 * 1024; // 32MB

    @Bean
    public WebClient.Builder webClientBuilder(OpenAlexConfigurationProperties properties) {
        Duration timeout = properties.getTimeout() == null ? Duration.ofSeconds(30) : properties.getTimeout();
        long timeoutMillis = timeout.toMillis();

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, Integer.MAX_VALUE))
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
            )
            .responseTimeout(timeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .defaultHeader(HttpHeaders.USER_AGENT, userAgent(properties.getMailto()))
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }

    static String userAgent(String mailto) {
        String base = "scholarly-dashboard/0.1";
        return (mailto == null || mailto.isBlank()) ? base : base + " (mailto:" + mailto.strip() + ")";
    }
}
