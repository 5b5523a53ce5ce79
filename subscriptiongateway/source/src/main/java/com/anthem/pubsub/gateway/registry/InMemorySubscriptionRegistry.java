package com.anthem.pubsub.gateway.registry;

import com.anthem.pubsub.gateway.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory subscription registry.
 * 
 * Confirmed subscriptions receive published messages immediately.
 * Provisional subscriptions buffer them; the buffer is flushed in arrival
 * order when the subscription is confirmed and discarded when it is
 * deleted. Routing state is guarded by the registry monitor; messages are
 * handed to sessions outside of it, so a slow client connection never
 * holds up other sessions.
 */
@Component
public class InMemorySubscriptionRegistry implements SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemorySubscriptionRegistry.class);

    // subscription name -> confirmed sessions
    private final Map<String, Set<Session>> confirmed = new HashMap<>();

    // subscription name -> provisional session -> buffered messages
    private final Map<String, Map<Session, List<Map<String, Object>>>> provisional = new HashMap<>();

    @Override
    public synchronized void addProvisionalSubscription(Session session, String subscriptionName) {
        provisional.computeIfAbsent(subscriptionName, k -> new LinkedHashMap<>())
                .put(session, new ArrayList<>());
        log.debug("Provisional subscription added: session={}, subscription={}",
                session.getId(), subscriptionName);
    }

    /**
     * Confirms once the buffer has been flushed. Messages published while
     * the flush is running are still buffered and flushed in a following
     * round, so the session sees them in arrival order.
     */
    @Override
    public void confirmSubscription(Session session, String subscriptionName) {
        int flushed = 0;
        boolean flushing = false;

        while (true) {
            List<Map<String, Object>> batch;
            synchronized (this) {
                List<Map<String, Object>> buffer = bufferOf(session, subscriptionName);
                if (buffer == null && flushing) {
                    log.debug("Subscription deleted during confirmation: session={}, subscription={}",
                            session.getId(), subscriptionName);
                    return;
                }
                if (buffer == null || buffer.isEmpty()) {
                    removeProvisional(session, subscriptionName);
                    confirmed.computeIfAbsent(subscriptionName, k -> new LinkedHashSet<>()).add(session);
                    log.debug("Subscription confirmed: session={}, subscription={}, buffered={}",
                            session.getId(), subscriptionName, flushed);
                    return;
                }
                batch = new ArrayList<>(buffer);
                buffer.clear();
            }

            for (Map<String, Object> message : batch) {
                session.deliverServiceMessage(subscriptionName, message);
            }
            flushed += batch.size();
            flushing = true;
        }
    }

    @Override
    public synchronized void deleteSubscription(Session session, String subscriptionName) {
        List<Map<String, Object>> dropped = removeProvisional(session, subscriptionName);

        Set<Session> sessions = confirmed.get(subscriptionName);
        if (sessions != null) {
            sessions.remove(session);
            if (sessions.isEmpty()) {
                confirmed.remove(subscriptionName);
            }
        }

        log.debug("Subscription deleted: session={}, subscription={}, droppedBuffered={}",
                session.getId(), subscriptionName, dropped != null ? dropped.size() : 0);
    }

    @Override
    public int publish(String subscriptionName, Map<String, Object> message) {
        List<Session> targets;
        int buffered = 0;

        synchronized (this) {
            Set<Session> sessions = confirmed.get(subscriptionName);
            targets = sessions != null ? new ArrayList<>(sessions) : List.of();

            Map<Session, List<Map<String, Object>>> pending = provisional.get(subscriptionName);
            if (pending != null) {
                for (List<Map<String, Object>> buffer : pending.values()) {
                    buffer.add(message);
                    buffered++;
                }
            }
        }

        for (Session session : targets) {
            session.deliverServiceMessage(subscriptionName, message);
        }

        int reached = targets.size() + buffered;
        log.debug("Message published: subscription={}, sessions={}", subscriptionName, reached);
        return reached;
    }

    public synchronized int getSubscriberCount(String subscriptionName) {
        Set<Session> sessions = confirmed.get(subscriptionName);
        Map<Session, List<Map<String, Object>>> pending = provisional.get(subscriptionName);
        return (sessions != null ? sessions.size() : 0) + (pending != null ? pending.size() : 0);
    }

    public synchronized boolean isProvisional(Session session, String subscriptionName) {
        Map<Session, List<Map<String, Object>>> pending = provisional.get(subscriptionName);
        return pending != null && pending.containsKey(session);
    }

    public synchronized boolean isConfirmed(Session session, String subscriptionName) {
        Set<Session> sessions = confirmed.get(subscriptionName);
        return sessions != null && sessions.contains(session);
    }

    private List<Map<String, Object>> bufferOf(Session session, String subscriptionName) {
        Map<Session, List<Map<String, Object>>> pending = provisional.get(subscriptionName);
        return pending != null ? pending.get(session) : null;
    }

    private List<Map<String, Object>> removeProvisional(Session session, String subscriptionName) {
        Map<Session, List<Map<String, Object>>> pending = provisional.get(subscriptionName);
        if (pending == null) {
            return null;
        }
        List<Map<String, Object>> buffered = pending.remove(session);
        if (pending.isEmpty()) {
            provisional.remove(subscriptionName);
        }
        return buffered;
    }
}
