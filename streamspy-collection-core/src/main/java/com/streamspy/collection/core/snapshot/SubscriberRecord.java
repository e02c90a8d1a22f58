package com.streamspy.collection.core.snapshot;

import java.util.LinkedHashSet;
import java.util.Set;

final class SubscriberRecord {
    final String id;
    final Set<String> subscriptions = new LinkedHashSet<>();
    final ValueHistory values;
    long tick;

    SubscriberRecord(String id, int keptValues) {
        this.id = id;
        this.values = new ValueHistory(keptValues);
    }
}
