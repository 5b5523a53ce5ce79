package com.anthem.pubsub.gateway.session;

import java.util.Map;

/**
 * Outbound side of a client transport connection.
 */
@FunctionalInterface
public interface ClientConnection {

    void send(Map<String, Object> frame);
}
