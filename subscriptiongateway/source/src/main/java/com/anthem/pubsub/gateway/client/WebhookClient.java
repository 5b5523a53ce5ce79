package com.anthem.pubsub.gateway.client;

import com.anthem.pubsub.gateway.model.ServiceResponse;

import java.util.Map;

/**
 * Outbound HTTP collaborator used for service webhooks.
 */
public interface WebhookClient {

    /**
     * POST the payload as JSON and return the parsed response envelope.
     * 
     * @throws com.anthem.pubsub.gateway.exception.WebhookException on any
     *         transport failure; the response status is not interpreted here
     */
    ServiceResponse post(String url, Map<String, Object> payload);
}
