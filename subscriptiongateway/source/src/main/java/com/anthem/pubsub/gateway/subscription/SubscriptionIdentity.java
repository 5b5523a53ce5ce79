package com.anthem.pubsub.gateway.subscription;

import com.anthem.pubsub.gateway.config.ServiceConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity of a subscription resolved from a client request.
 * 
 * {@code service} and {@code topic} are null when the name has no dot,
 * {@code serviceConfig} is null when the service is not configured.
 * Resolution never fails; {@link Subscription#validate()} reports problems.
 */
public record SubscriptionIdentity(
        String name,
        String service,
        String topic,
        ServiceConfig serviceConfig,
        Map<String, Object> extraData
) {

    public static final String SUBSCRIPTION_FIELD = "subscription";

    public static SubscriptionIdentity resolve(Map<String, ?> request, Map<String, ServiceConfig> services) {
        Object rawName = request.get(SUBSCRIPTION_FIELD);
        String name = rawName != null ? rawName.toString() : "";

        String service = null;
        String topic = null;
        int separator = name.indexOf('.');
        if (separator >= 0) {
            service = name.substring(0, separator);
            topic = name.substring(separator + 1);
        }

        ServiceConfig serviceConfig = service != null ? services.get(service) : null;

        Map<String, Object> extraData = new LinkedHashMap<>();
        if (serviceConfig != null) {
            for (String field : serviceConfig.getExtraFields()) {
                if (request.containsKey(field)) {
                    extraData.put(field, request.get(field));
                }
            }
        }

        return new SubscriptionIdentity(name, service, topic, serviceConfig,
                Collections.unmodifiableMap(extraData));
    }

    public boolean hasValidFormat() {
        return service != null && !service.isEmpty() && topic != null && !topic.isEmpty();
    }

    public boolean isServiceResolved() {
        return serviceConfig != null;
    }
}
