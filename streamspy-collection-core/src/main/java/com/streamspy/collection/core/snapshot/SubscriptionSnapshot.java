package com.streamspy.collection.core.snapshot;

import com.streamspy.devtools.model.GraphPayload;
import java.util.List;

/**
 * State of one subscription at capture time. Timestamps are epoch millis; optional ones are
 * {@code null} until the corresponding notification happened.
 */
public record SubscriptionSnapshot(
        String id,
        String observable,
        String subscriber,
        long subscribeTimestamp,
        Long unsubscribeTimestamp,
        Long completeTimestamp,
        Throwable error,
        Long errorTimestamp,
        long nextCount,
        Long nextTimestamp,
        long tick,
        Object stackTrace,
        GraphPayload graph,
        List<ValueSnapshot> values,
        boolean valuesFlushed) {

    public SubscriptionSnapshot {
        values = List.copyOf(values);
    }
}
