package com.anthem.pubsub.gateway.client;

import com.anthem.pubsub.gateway.config.GatewayProperties;
import com.anthem.pubsub.gateway.exception.WebhookException;
import com.anthem.pubsub.gateway.model.ServiceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link WebhookClient} backed by the reactive WebClient.
 * Each call blocks until the response arrives or the configured timeout
 * elapses. No retries are made.
 */
@Component
public class WebClientWebhookClient implements WebhookClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientWebhookClient.class);

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webhookClient;
    private final Duration timeout;

    public WebClientWebhookClient(WebClient webhookClient, GatewayProperties properties) {
        this.webhookClient = webhookClient;
        this.timeout = properties.getWebhook().getTimeout();
    }

    @Override
    public ServiceResponse post(String url, Map<String, Object> payload) {
        log.debug("Calling webhook: url={}, subscription={}", url, payload.get("subscription"));

        Map<String, Object> body;
        try {
            body = webhookClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(RESPONSE_TYPE)
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class, e -> timedOut(url, e))
                    .block();
        } catch (WebClientResponseException e) {
            log.warn("Webhook returned error status: url={}, status={}", url, e.getStatusCode());
            throw new WebhookException(url, "HTTP " + e.getStatusCode().value() + " from " + url, e);
        } catch (WebClientException e) {
            log.warn("Webhook call failed: url={}, error={}", url, e.getMessage());
            throw new WebhookException(url, "Webhook call failed: " + url, e);
        } catch (CodecException e) {
            log.warn("Webhook returned an unreadable body: url={}, error={}", url, e.getMessage());
            throw new WebhookException(url, "Invalid webhook response from " + url, e);
        }

        if (body == null) {
            log.warn("Webhook returned an empty body: url={}", url);
            throw new WebhookException(url, "Empty webhook response from " + url);
        }
        return new ServiceResponse(body);
    }

    private WebhookException timedOut(String url, TimeoutException e) {
        log.warn("Webhook call timed out: url={}, timeout={}", url, timeout);
        return new WebhookException(url, "Webhook call timed out: " + url, e);
    }
}
