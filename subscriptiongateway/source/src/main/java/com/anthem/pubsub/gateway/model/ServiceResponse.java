package com.anthem.pubsub.gateway.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Response envelope returned by a service webhook.
 * 
 * The body is a JSON object with at least a {@code status} field; a
 * non-ok status may carry an {@code error} message and any response may
 * carry a {@code data} payload for the client. Other top-level fields
 * (such as {@code _order}) are kept so the delivery filter can see them.
 */
public class ServiceResponse {

    public static final String STATUS_OK = "ok";

    private final Map<String, Object> body;

    public ServiceResponse(Map<String, Object> body) {
        this.body = body != null ? new LinkedHashMap<>(body) : new LinkedHashMap<>();
    }

    /**
     * Synthetic success used when a checkpoint has no webhook configured.
     */
    public static ServiceResponse ok() {
        return new ServiceResponse(Map.of("status", STATUS_OK));
    }

    public boolean isOk() {
        return STATUS_OK.equals(body.get("status"));
    }

    public String getStatus() {
        Object status = body.get("status");
        return status != null ? status.toString() : null;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(body.get("error")).map(Object::toString);
    }

    public boolean hasData() {
        return body.containsKey("data");
    }

    public Object getData() {
        return body.get("data");
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(body);
    }

    @Override
    public String toString() {
        return "ServiceResponse" + body;
    }
}
