/**
 * Configuration for WebClient
 * - Defines the builder used for archive metadata and raw frame downloads
 * - Sets connection settings; per-call response timeouts are applied by the callers
 */
package com.thumbservice.thumbnail_engine.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Configures the application's WebClient instances
 * - Provides a pre-configured WebClient Builder
 * - Ensures consistent HTTP client behavior
 */
@Configuration
public class WebClientConfig {

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Sets connection timeout to 5000ms
     * - Follows redirects, since frame download URLs may point at a redirecting file host
     * - Raises the in-memory codec limit for large frame listings
     *
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .followRedirect(true);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
