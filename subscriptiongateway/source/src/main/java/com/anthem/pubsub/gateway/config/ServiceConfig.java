package com.anthem.pubsub.gateway.config;

import com.anthem.pubsub.gateway.model.ServiceEvent;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Webhook and delivery settings of a single backend service.
 */
@Data
public class ServiceConfig {

    /**
     * Webhook URLs per lifecycle checkpoint. A missing URL means the
     * checkpoint always succeeds without a call.
     */
    private String authorizer;
    private String beforeSubscribe;
    private String onSubscribe;
    private String onMessage;
    private String beforeUnsubscribe;
    private String onUnsubscribe;

    /**
     * Request fields copied from the subscribe request and forwarded on
     * every webhook call.
     */
    private List<String> extraFields = new ArrayList<>();

    /**
     * Message fields that must match the session's auth info for a pushed
     * message to be delivered.
     */
    private List<String> filterFields = new ArrayList<>();

    private boolean requireAuthentication = true;

    public Optional<String> getWebhookUrl(ServiceEvent event) {
        String url = switch (event) {
            case AUTHORIZER -> authorizer;
            case BEFORE_SUBSCRIBE -> beforeSubscribe;
            case ON_SUBSCRIBE -> onSubscribe;
            case ON_MESSAGE -> onMessage;
            case BEFORE_UNSUBSCRIBE -> beforeUnsubscribe;
            case ON_UNSUBSCRIBE -> onUnsubscribe;
        };
        return Optional.ofNullable(url).filter(u -> !u.isBlank());
    }
}
