package com.anthem.pubsub.gateway.session;

import com.anthem.pubsub.gateway.subscription.Subscription;

import java.util.Map;

/**
 * A connected client session as seen by its subscriptions.
 */
public interface Session {

    String getId();

    /**
     * Authentication info of the session. Empty when the client has not
     * authenticated. Forwarded on every webhook call and used as the
     * source of truth for per-field message filtering.
     */
    Map<String, Object> getAuthInfo();

    /**
     * Live subscriptions keyed by subscription name.
     */
    Map<String, Subscription> getSubscriptions();

    /**
     * Send a frame to the client connection.
     */
    void send(Map<String, Object> frame);

    /**
     * Deliver a message pushed by a backend service for the named
     * subscription, subject to that subscription's delivery filter.
     */
    void deliverServiceMessage(String subscriptionName, Map<String, Object> message);
}
