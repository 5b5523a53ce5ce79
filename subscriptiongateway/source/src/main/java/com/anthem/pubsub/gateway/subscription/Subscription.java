package com.anthem.pubsub.gateway.subscription;

import com.anthem.pubsub.gateway.client.WebhookClient;
import com.anthem.pubsub.gateway.config.ServiceConfig;
import com.anthem.pubsub.gateway.exception.EventError;
import com.anthem.pubsub.gateway.exception.WebhookException;
import com.anthem.pubsub.gateway.model.EventErrorCode;
import com.anthem.pubsub.gateway.model.ServiceResponse;
import com.anthem.pubsub.gateway.registry.SubscriptionRegistry;
import com.anthem.pubsub.gateway.session.ClientEvent;
import com.anthem.pubsub.gateway.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * A subscription of a session to a service topic.
 * 
 * Drives the subscribe / message / unsubscribe protocol against the
 * service webhooks and the subscription registry. Calls for the same
 * subscription name must not run concurrently; the owning session
 * dispatches them one at a time.
 */
public class Subscription {

    private static final Logger log = LoggerFactory.getLogger(Subscription.class);

    private final SubscriptionIdentity identity;
    private final Session session;
    private final SubscriptionRegistry registry;
    private final WebhookInvoker invoker;
    private final DeliveryFilter deliveryFilter;

    private volatile SubscriptionState state = SubscriptionState.UNVALIDATED;

    public Subscription(Map<String, ServiceConfig> services, Session session, Map<String, ?> request,
                        SubscriptionRegistry registry, WebhookClient webhookClient) {
        this.identity = SubscriptionIdentity.resolve(request, services);
        this.session = session;
        this.registry = registry;
        this.invoker = new WebhookInvoker(identity, session, webhookClient);

        List<String> filterFields = identity.serviceConfig() != null
                ? identity.serviceConfig().getFilterFields()
                : List.of();
        this.deliveryFilter = new DeliveryFilter(identity.name(), filterFields, session::getAuthInfo);
    }

    public String getName() {
        return identity.name();
    }

    public SubscriptionIdentity getIdentity() {
        return identity;
    }

    public SubscriptionState getState() {
        return state;
    }

    public void validate() {
        if (!identity.hasValidFormat()) {
            throw new EventError(EventErrorCode.INVALID_SUBSCRIPTION_FORMAT);
        }
        if (!identity.isServiceResolved()) {
            throw new EventError(EventErrorCode.INVALID_SERVICE);
        }
        if (state == SubscriptionState.UNVALIDATED) {
            state = SubscriptionState.VALIDATED;
        }
    }

    public boolean shouldDeliverMessage(Map<String, ?> data) {
        return deliveryFilter.shouldDeliverMessage(data);
    }

    /**
     * Subscribe the session.
     * 
     * Once the subscription is registered as provisional, any failure up to
     * confirmation removes it again from the session and the registry
     * before the failure is rethrown.
     */
    public void subscribe(ClientEvent event) {
        ServiceConfig serviceConfig = requireServiceConfig();
        String name = identity.name();

        if (serviceConfig.isRequireAuthentication() && session.getAuthInfo().isEmpty()) {
            throw new EventError(EventErrorCode.AUTH_REQUIRED);
        }

        if (session.getSubscriptions().containsKey(name)) {
            throw new EventError(EventErrorCode.ALREADY_SUBSCRIBED);
        }

        invoker.authorizeSubscription();

        registry.addProvisionalSubscription(session, name);
        state = SubscriptionState.PROVISIONAL;

        boolean inserted = false;
        try {
            ServiceResponse result = invoker.beforeSubscribe();

            session.getSubscriptions().put(name, this);
            inserted = true;

            if (shouldDeliverMessage(result.asMap())) {
                event.sendOk(result.getData());
            }

            registry.confirmSubscription(session, name);
        } catch (RuntimeException e) {
            log.warn("Subscribe aborted, removing provisional subscription: session={}, subscription={}, error={}",
                    session.getId(), name, e.getMessage());
            if (inserted) {
                session.getSubscriptions().remove(name, this);
            }
            registry.deleteSubscription(session, name);
            state = SubscriptionState.VALIDATED;
            throw e;
        }

        state = SubscriptionState.CONFIRMED;
        log.info("Subscribed: session={}, subscription={}", session.getId(), name);

        invoker.onSubscribe();
    }

    /**
     * Send a client message to the service. A {@code data} field in the
     * service response is returned to the client.
     */
    public void message(ClientEvent event) {
        requireSubscribed();

        Object messageData = event.getData().get("data");
        ServiceResponse result = invoker.onMessage(messageData);

        if (result.hasData()) {
            event.sendOk(result.getData());
        }
    }

    public void unsubscribe(ClientEvent event) {
        requireSubscribed();
        String name = identity.name();

        ServiceResponse result = invoker.beforeUnsubscribe(true);

        session.getSubscriptions().remove(name);
        registry.deleteSubscription(session, name);
        state = SubscriptionState.UNSUBSCRIBED;
        log.info("Unsubscribed: session={}, subscription={}", session.getId(), name);

        event.sendOk(result.getData());

        invoker.onUnsubscribe();
    }

    /**
     * Unsubscribe after the session disconnected. The caller removes the
     * subscription from the session's mapping; no acknowledgment is sent.
     * An unreachable before_unsubscribe webhook does not stop on_unsubscribe.
     */
    public void forceUnsubscribe() {
        String name = identity.name();

        registry.deleteSubscription(session, name);
        state = SubscriptionState.FORCE_UNSUBSCRIBED;
        log.info("Force unsubscribed: session={}, subscription={}", session.getId(), name);

        try {
            invoker.beforeUnsubscribe(false);
        } catch (WebhookException e) {
            log.warn("before_unsubscribe failed during force unsubscribe: session={}, subscription={}, error={}",
                    session.getId(), name, e.getMessage());
        }
        invoker.onUnsubscribe();
    }

    private void requireSubscribed() {
        if (!session.getSubscriptions().containsKey(identity.name())) {
            throw new EventError(EventErrorCode.SUBSCRIPTION_NOT_FOUND);
        }
    }

    private ServiceConfig requireServiceConfig() {
        if (identity.serviceConfig() == null) {
            throw new EventError(EventErrorCode.INVALID_SERVICE);
        }
        return identity.serviceConfig();
    }

    @Override
    public String toString() {
        return "Subscription[" + identity.name() + ", " + state + "]";
    }
}
