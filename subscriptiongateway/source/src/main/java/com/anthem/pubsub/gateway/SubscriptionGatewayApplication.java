package com.anthem.pubsub.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Subscription Gateway Application.
 * 
 * Binds client sessions to "service.topic" subscriptions. Every lifecycle
 * checkpoint (authorizer, before/on subscribe, on message, before/on
 * unsubscribe) is delegated to the owning backend service through its
 * configured webhooks, and messages pushed by services are filtered and
 * ordered per subscription before they reach the client.
 */
@SpringBootApplication
public class SubscriptionGatewayApplication {
    public static void main(String[] args) {
        SpringApplication.run(SubscriptionGatewayApplication.class, args);
    }
}
