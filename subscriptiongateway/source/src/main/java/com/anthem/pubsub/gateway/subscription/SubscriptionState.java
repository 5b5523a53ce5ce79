package com.anthem.pubsub.gateway.subscription;

public enum SubscriptionState {
    UNVALIDATED,
    VALIDATED,
    PROVISIONAL,
    CONFIRMED,
    UNSUBSCRIBED,
    FORCE_UNSUBSCRIBED
}
