package com.anthem.pubsub.gateway.session;

import com.anthem.pubsub.gateway.subscription.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session of one client connection.
 * 
 * Holds the client's auth info and its subscriptions. Lifecycle events are
 * expected to be dispatched one at a time per session; service messages
 * may arrive concurrently from the registry.
 */
public class GatewaySession implements Session {

    private static final Logger log = LoggerFactory.getLogger(GatewaySession.class);

    private final String id;
    private final ClientConnection connection;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private volatile Map<String, Object> authInfo = Collections.emptyMap();

    public GatewaySession(String id, ClientConnection connection) {
        this.id = id;
        this.connection = connection;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Map<String, Object> getAuthInfo() {
        return authInfo;
    }

    public void setAuthInfo(Map<String, Object> authInfo) {
        this.authInfo = authInfo != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(authInfo))
                : Collections.emptyMap();
    }

    @Override
    public Map<String, Subscription> getSubscriptions() {
        return subscriptions;
    }

    @Override
    public void send(Map<String, Object> frame) {
        connection.send(frame);
    }

    @Override
    public void deliverServiceMessage(String subscriptionName, Map<String, Object> message) {
        Subscription subscription = subscriptions.get(subscriptionName);
        if (subscription == null) {
            log.debug("Dropping message for unknown subscription: session={}, subscription={}",
                    id, subscriptionName);
            return;
        }

        if (!subscription.shouldDeliverMessage(message)) {
            return;
        }

        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", "message");
        frame.put("subscription", subscriptionName);
        frame.put("data", message.get("data"));
        send(frame);
    }

    /**
     * Force-unsubscribe every subscription once the connection is gone.
     * A failing subscription is logged and does not stop the others.
     */
    public void close() {
        List<Subscription> active = new ArrayList<>(subscriptions.values());
        log.info("Closing session: session={}, subscriptions={}", id, active.size());

        for (Subscription subscription : active) {
            try {
                subscription.forceUnsubscribe();
            } catch (RuntimeException e) {
                log.error("Force unsubscribe failed: session={}, subscription={}, error={}",
                        id, subscription.getName(), e.getMessage(), e);
            }
        }
        subscriptions.clear();
    }

    @Override
    public String toString() {
        return "GatewaySession[" + id + "]";
    }
}
