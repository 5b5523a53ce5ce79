package com.anthem.pubsub.gateway.subscription;

import com.anthem.pubsub.gateway.client.WebhookClient;
import com.anthem.pubsub.gateway.exception.EventError;
import com.anthem.pubsub.gateway.exception.WebhookException;
import com.anthem.pubsub.gateway.model.EventErrorCode;
import com.anthem.pubsub.gateway.model.ServiceEvent;
import com.anthem.pubsub.gateway.model.ServiceResponse;
import com.anthem.pubsub.gateway.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Calls the service webhooks backing the lifecycle checkpoints of one
 * subscription.
 */
public class WebhookInvoker {

    private static final Logger log = LoggerFactory.getLogger(WebhookInvoker.class);

    private final SubscriptionIdentity identity;
    private final Session session;
    private final WebhookClient webhookClient;

    public WebhookInvoker(SubscriptionIdentity identity, Session session, WebhookClient webhookClient) {
        this.identity = identity;
        this.session = session;
        this.webhookClient = webhookClient;
    }

    /**
     * Perform the webhook call for the given checkpoint.
     * 
     * @param event checkpoint to call
     * @param extraFields event-specific fields merged last into the payload
     * @param errorMessage client message used when a rejection carries no error; may be null
     * @param raiseOnError whether a non-ok status fails with {@link EventError}
     * @return the service response, or a synthetic ok when no webhook is configured
     */
    public ServiceResponse performServiceRequest(ServiceEvent event, Map<String, Object> extraFields,
                                                 String errorMessage, boolean raiseOnError) {
        if (identity.serviceConfig() == null) {
            throw new IllegalStateException("Subscription " + identity.name() + " has no service configuration");
        }

        Optional<String> url = identity.serviceConfig().getWebhookUrl(event);
        if (url.isEmpty()) {
            return ServiceResponse.ok();
        }

        Map<String, Object> payload = prepareServiceData();
        payload.putAll(extraFields);

        ServiceResponse response = webhookClient.post(url.get(), payload);

        if (raiseOnError && !response.isOk()) {
            String message = response.getError()
                    .orElse(errorMessage != null ? errorMessage : EventErrorCode.UNHANDLED.getDefaultMessage());
            log.warn("Service rejected request: subscription={}, event={}, error={}",
                    identity.name(), event.getEventName(), message);
            throw new EventError(EventErrorCode.SERVICE_REJECTED, message);
        }

        return response;
    }

    /**
     * Base payload of every webhook call: subscription name, extra fields
     * from the subscribe request, then the session's auth info.
     */
    Map<String, Object> prepareServiceData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(SubscriptionIdentity.SUBSCRIPTION_FIELD, identity.name());
        data.putAll(identity.extraData());
        data.putAll(session.getAuthInfo());
        return data;
    }

    public void authorizeSubscription() {
        performServiceRequest(ServiceEvent.AUTHORIZER, Map.of(),
                EventErrorCode.UNAUTHORIZED.getDefaultMessage(), true);
    }

    public ServiceResponse beforeSubscribe() {
        return performServiceRequest(ServiceEvent.BEFORE_SUBSCRIBE, Map.of(), null, false);
    }

    public ServiceResponse onSubscribe() {
        return notifyQuietly(ServiceEvent.ON_SUBSCRIBE);
    }

    public ServiceResponse onMessage(Object messageData) {
        Map<String, Object> extraFields = new LinkedHashMap<>();
        extraFields.put("data", messageData);
        return performServiceRequest(ServiceEvent.ON_MESSAGE, extraFields, null, false);
    }

    public ServiceResponse beforeUnsubscribe(boolean raiseOnError) {
        return performServiceRequest(ServiceEvent.BEFORE_UNSUBSCRIBE, Map.of(), null, raiseOnError);
    }

    public ServiceResponse onUnsubscribe() {
        return notifyQuietly(ServiceEvent.ON_UNSUBSCRIBE);
    }

    // Notification hooks: neither a rejection nor a transport failure reaches the client.
    private ServiceResponse notifyQuietly(ServiceEvent event) {
        try {
            ServiceResponse response = performServiceRequest(event, Map.of(), null, false);
            if (!response.isOk()) {
                log.info("Service notification not acknowledged: subscription={}, event={}, status={}",
                        identity.name(), event.getEventName(), response.getStatus());
            }
            return response;
        } catch (WebhookException e) {
            log.warn("Service notification failed: subscription={}, event={}, url={}, error={}",
                    identity.name(), event.getEventName(), e.getUrl(), e.getMessage());
            return new ServiceResponse(Map.of("status", "error", "error", String.valueOf(e.getMessage())));
        }
    }
}
