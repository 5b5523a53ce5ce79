package com.anthem.pubsub.gateway.handler;

import com.anthem.pubsub.gateway.session.ClientEvent;
import com.anthem.pubsub.gateway.session.Session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A subscribe, unsubscribe or message event received from a client.
 * Replies are framed as {@code {event, subscription, status, data|error}}.
 */
public class SubscriptionEvent implements ClientEvent {

    private final Session session;
    private final String eventName;
    private final Map<String, Object> data;

    public SubscriptionEvent(Session session, String eventName, Map<String, Object> data) {
        this.session = session;
        this.eventName = eventName;
        this.data = data != null ? data : Collections.emptyMap();
    }

    public String getEventName() {
        return eventName;
    }

    public String getSubscriptionName() {
        Object name = data.get("subscription");
        return name != null ? name.toString() : null;
    }

    @Override
    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public void sendOk(Object payload) {
        Map<String, Object> frame = baseFrame("ok");
        if (payload != null) {
            frame.put("data", payload);
        }
        session.send(frame);
    }

    public void sendError(String error) {
        Map<String, Object> frame = baseFrame("error");
        frame.put("error", error);
        session.send(frame);
    }

    private Map<String, Object> baseFrame(String status) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", eventName);
        String subscriptionName = getSubscriptionName();
        if (subscriptionName != null) {
            frame.put("subscription", subscriptionName);
        }
        frame.put("status", status);
        return frame;
    }
}
