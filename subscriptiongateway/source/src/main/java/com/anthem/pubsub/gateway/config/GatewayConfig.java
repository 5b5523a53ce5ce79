package com.anthem.pubsub.gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configuration for subscription gateway components.
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    /**
     * WebClient for making outbound webhook calls to backend services.
     */
    @Bean
    public WebClient webhookClient(GatewayProperties properties) {
        int maxInMemorySize = properties.getWebhook().getMaxInMemorySize();
        return WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();
    }
}
