package com.streamspy.collection.core.snapshot;

import java.util.List;

public record SubscriberSnapshot(
        String id, List<String> subscriptions, List<ValueSnapshot> values, boolean valuesFlushed, long tick) {
    public SubscriberSnapshot {
        subscriptions = List.copyOf(subscriptions);
        values = List.copyOf(values);
    }
}
