package com.anthem.pubsub.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway configuration bound from the {@code gateway.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Backend services keyed by service name (the part of a subscription
     * name before the first dot).
     */
    private Map<String, ServiceConfig> services = new LinkedHashMap<>();

    private Webhook webhook = new Webhook();

    @Data
    public static class Webhook {

        /**
         * Maximum time to wait for a single webhook round trip.
         */
        private Duration timeout = Duration.ofSeconds(30);

        private int maxInMemorySize = 16 * 1024 * 1024;
    }
}
