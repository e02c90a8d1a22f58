package com.streamspy.collection.core.snapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable point-in-time projection of the instrumented graph, keyed by id. Entities reference
 * each other by id only, and every referenced id is a key of the same snapshot. {@code tick} is the
 * spy tick at capture time.
 */
public record Snapshot(
        Map<String, ObservableSnapshot> observables,
        Map<String, SubscriberSnapshot> subscribers,
        Map<String, SubscriptionSnapshot> subscriptions,
        long tick) {

    public Snapshot {
        observables = Collections.unmodifiableMap(new LinkedHashMap<>(observables));
        subscribers = Collections.unmodifiableMap(new LinkedHashMap<>(subscribers));
        subscriptions = Collections.unmodifiableMap(new LinkedHashMap<>(subscriptions));
    }
}
