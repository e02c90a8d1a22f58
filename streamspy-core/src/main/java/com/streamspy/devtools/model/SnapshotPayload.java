package com.streamspy.devtools.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

/**
 * Fully dereferenced snapshot of the instrumented graph. Entities reference each other by id only
 * and every referenced id is present in the same payload.
 */
public record SnapshotPayload(
        List<ObservableEntry> observables,
        List<SubscriberEntry> subscribers,
        List<SubscriptionEntry> subscriptions,
        long tick) {

    public SnapshotPayload {
        observables = List.copyOf(observables);
        subscribers = List.copyOf(subscribers);
        subscriptions = List.copyOf(subscriptions);
    }

    @JsonInclude(Include.ALWAYS)
    public record ObservableEntry(
            String id, String path, List<String> subscriptions, String tag, long tick, String type) {}

    public record SubscriberEntry(
            String id, List<String> subscriptions, long tick, List<ValueEntry> values, boolean valuesFlushed) {}

    @JsonInclude(Include.NON_NULL)
    public record SubscriptionEntry(
            Long completeTimestamp,
            ValuePayload error,
            Long errorTimestamp,
            GraphPayload graph,
            String id,
            long nextCount,
            Long nextTimestamp,
            String observable,
            Object stackTrace,
            long subscribeTimestamp,
            String subscriber,
            long tick,
            Long unsubscribeTimestamp,
            List<ValueEntry> values,
            boolean valuesFlushed) {}

    public record ValueEntry(long tick, long timestamp, ValuePayload value) {}
}
