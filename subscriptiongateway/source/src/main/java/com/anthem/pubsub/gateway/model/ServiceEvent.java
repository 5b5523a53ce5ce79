package com.anthem.pubsub.gateway.model;

/**
 * Lifecycle checkpoints that a service can back with a webhook.
 */
public enum ServiceEvent {

    AUTHORIZER("authorizer"),
    BEFORE_SUBSCRIBE("before_subscribe"),
    ON_SUBSCRIBE("on_subscribe"),
    ON_MESSAGE("on_message"),
    BEFORE_UNSUBSCRIBE("before_unsubscribe"),
    ON_UNSUBSCRIBE("on_unsubscribe");

    private final String eventName;

    ServiceEvent(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
