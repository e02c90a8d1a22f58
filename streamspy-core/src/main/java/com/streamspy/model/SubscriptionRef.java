package com.streamspy.model;

import java.util.Objects;

/**
 * Identity handle for one live subscription: the observable being subscribed to, the subscriber
 * receiving its values and the subscription object linking the two.
 *
 * <p>Refs compare by identity. Registries key their per-subscription state on the ref instance the
 * notification source hands out, so the source must pass the same instance for every lifecycle
 * call of one subscription.
 */
public final class SubscriptionRef {
    private final Object observable;
    private final Object subscriber;
    private final Object subscription;

    public SubscriptionRef(Object observable, Object subscriber, Object subscription) {
        this.observable = Objects.requireNonNull(observable, "observable");
        this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
        this.subscription = Objects.requireNonNull(subscription, "subscription");
    }

    public Object observable() {
        return observable;
    }

    public Object subscriber() {
        return subscriber;
    }

    public Object subscription() {
        return subscription;
    }

    @Override
    public String toString() {
        return "SubscriptionRef{observable="
                + observable.getClass().getSimpleName()
                + ", subscription="
                + subscription.getClass().getSimpleName()
                + "}";
    }
}
