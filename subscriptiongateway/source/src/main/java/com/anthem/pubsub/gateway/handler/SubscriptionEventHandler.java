package com.anthem.pubsub.gateway.handler;

import com.anthem.pubsub.gateway.exception.EventError;
import com.anthem.pubsub.gateway.model.EventErrorCode;
import com.anthem.pubsub.gateway.session.Session;
import com.anthem.pubsub.gateway.subscription.Subscription;
import com.anthem.pubsub.gateway.subscription.SubscriptionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Dispatches client subscription events to the matching {@link Subscription}
 * and translates failures into error frames.
 */
@Service
public class SubscriptionEventHandler {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionEventHandler.class);

    public static final String EVENT_SUBSCRIBE = "subscribe";
    public static final String EVENT_UNSUBSCRIBE = "unsubscribe";
    public static final String EVENT_MESSAGE = "message";

    private final SubscriptionFactory subscriptionFactory;

    public SubscriptionEventHandler(SubscriptionFactory subscriptionFactory) {
        this.subscriptionFactory = subscriptionFactory;
    }

    /**
     * Process one client frame. Never throws for client-caused failures;
     * the client always receives either an ok or an error frame.
     */
    public void handle(Session session, Map<String, Object> frame) {
        Object rawEvent = frame.get("event");
        String eventName = rawEvent != null ? rawEvent.toString() : null;
        SubscriptionEvent event = new SubscriptionEvent(session, eventName, frame);

        log.debug("Handling event: session={}, event={}, subscription={}",
                session.getId(), eventName, event.getSubscriptionName());

        try {
            dispatch(session, event);
        } catch (EventError e) {
            log.info("Event failed: session={}, event={}, subscription={}, code={}, error={}",
                    session.getId(), eventName, event.getSubscriptionName(), e.getCode(), e.getMessage());
            event.sendError(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unhandled error processing event: session={}, event={}, subscription={}",
                    session.getId(), eventName, event.getSubscriptionName(), e);
            event.sendError(EventErrorCode.UNHANDLED.getDefaultMessage());
        }
    }

    private void dispatch(Session session, SubscriptionEvent event) {
        String eventName = event.getEventName();
        if (!EVENT_SUBSCRIBE.equals(eventName)
                && !EVENT_UNSUBSCRIBE.equals(eventName)
                && !EVENT_MESSAGE.equals(eventName)) {
            throw new EventError(EventErrorCode.INVALID_EVENT);
        }

        Subscription subscription = resolveSubscription(session, event);
        subscription.validate();

        switch (eventName) {
            case EVENT_SUBSCRIBE -> subscription.subscribe(event);
            case EVENT_UNSUBSCRIBE -> subscription.unsubscribe(event);
            case EVENT_MESSAGE -> subscription.message(event);
            default -> throw new EventError(EventErrorCode.INVALID_EVENT);
        }
    }

    // Existing subscriptions keep their order state; otherwise a fresh one is resolved.
    private Subscription resolveSubscription(Session session, SubscriptionEvent event) {
        String name = event.getSubscriptionName();
        if (name != null) {
            Subscription existing = session.getSubscriptions().get(name);
            if (existing != null) {
                return existing;
            }
        }
        return subscriptionFactory.create(session, event.getData());
    }
}
