package com.anthem.pubsub.gateway.model;

/**
 * Error kinds reported back to the client, with their default messages.
 */
public enum EventErrorCode {

    INVALID_EVENT("Invalid event."),
    INVALID_SUBSCRIPTION_FORMAT("Invalid subscription format."),
    INVALID_SERVICE("Invalid service."),
    AUTH_REQUIRED("Authentication required."),
    ALREADY_SUBSCRIBED("Already subscribed."),
    SUBSCRIPTION_NOT_FOUND("Subscription does not exist."),
    UNAUTHORIZED("Unauthorized."),
    SERVICE_REJECTED("Service rejected the request."),
    UNHANDLED("Unhandled exception.");

    private final String defaultMessage;

    EventErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
