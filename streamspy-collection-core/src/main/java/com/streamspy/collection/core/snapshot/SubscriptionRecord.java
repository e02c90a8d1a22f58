package com.streamspy.collection.core.snapshot;

import com.streamspy.devtools.model.GraphPayload;
import com.streamspy.model.SubscriptionRef;

final class SubscriptionRecord {
    final SubscriptionRef ref;
    final String id;
    final ObservableRecord observable;
    final SubscriberRecord subscriber;
    final long subscribeTimestamp;
    final ValueHistory values;
    Long unsubscribeTimestamp;
    Long completeTimestamp;
    Throwable error;
    Long errorTimestamp;
    long nextCount;
    Long nextTimestamp;
    long tick;
    Object stackTrace;
    /** Links captured when the subscription was torn down; live links come from the graph plugin. */
    GraphPayload finalGraph;

    SubscriptionRecord(
            SubscriptionRef ref,
            String id,
            ObservableRecord observable,
            SubscriberRecord subscriber,
            long subscribeTimestamp,
            int keptValues) {
        this.ref = ref;
        this.id = id;
        this.observable = observable;
        this.subscriber = subscriber;
        this.subscribeTimestamp = subscribeTimestamp;
        this.values = new ValueHistory(keptValues);
    }
}
