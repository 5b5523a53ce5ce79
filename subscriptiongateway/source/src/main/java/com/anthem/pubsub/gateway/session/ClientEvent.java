package com.anthem.pubsub.gateway.session;

import java.util.Map;

/**
 * A client protocol event being processed for a subscription.
 */
public interface ClientEvent {

    /**
     * Raw event frame as received from the client.
     */
    Map<String, Object> getData();

    /**
     * Acknowledge the event to the originating client. {@code data} may be
     * null, in which case the acknowledgment carries no payload.
     */
    void sendOk(Object data);
}
