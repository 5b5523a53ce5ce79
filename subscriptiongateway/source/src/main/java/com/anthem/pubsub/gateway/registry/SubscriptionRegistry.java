package com.anthem.pubsub.gateway.registry;

import com.anthem.pubsub.gateway.session.Session;

import java.util.Map;

/**
 * Routing table for service messages, keyed by (session, subscription name).
 */
public interface SubscriptionRegistry {

    /**
     * Register an authorized subscription that has not been confirmed yet.
     * Messages arriving in the meantime are held back until confirmation.
     */
    void addProvisionalSubscription(Session session, String subscriptionName);

    /**
     * Promote a provisional subscription to a confirmed one.
     */
    void confirmSubscription(Session session, String subscriptionName);

    /**
     * Remove a provisional or confirmed subscription. Unknown entries are ignored.
     */
    void deleteSubscription(Session session, String subscriptionName);

    /**
     * Route a message pushed by a backend service to every session holding
     * the subscription.
     *
     * @return number of sessions the message was delivered or buffered for
     */
    int publish(String subscriptionName, Map<String, Object> message);
}
