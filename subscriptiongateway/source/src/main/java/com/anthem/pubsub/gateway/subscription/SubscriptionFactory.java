package com.anthem.pubsub.gateway.subscription;

import com.anthem.pubsub.gateway.client.WebhookClient;
import com.anthem.pubsub.gateway.config.GatewayProperties;
import com.anthem.pubsub.gateway.registry.SubscriptionRegistry;
import com.anthem.pubsub.gateway.session.Session;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Creates subscriptions wired to the configured services, the registry
 * and the webhook client.
 */
@Component
public class SubscriptionFactory {

    private final GatewayProperties properties;
    private final SubscriptionRegistry registry;
    private final WebhookClient webhookClient;

    public SubscriptionFactory(GatewayProperties properties, SubscriptionRegistry registry,
                               WebhookClient webhookClient) {
        this.properties = properties;
        this.registry = registry;
        this.webhookClient = webhookClient;
    }

    public Subscription create(Session session, Map<String, ?> request) {
        return new Subscription(properties.getServices(), session, request, registry, webhookClient);
    }
}
