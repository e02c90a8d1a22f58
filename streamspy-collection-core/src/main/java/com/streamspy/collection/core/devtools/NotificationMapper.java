package com.streamspy.collection.core.devtools;

import com.streamspy.collection.core.graph.GraphPlugin;
import com.streamspy.collection.core.pause.DeckStats;
import com.streamspy.collection.core.snapshot.ObservableSnapshot;
import com.streamspy.collection.core.snapshot.Snapshot;
import com.streamspy.collection.core.snapshot.SubscriberSnapshot;
import com.streamspy.collection.core.snapshot.SubscriptionSnapshot;
import com.streamspy.collection.core.snapshot.ValueSnapshot;
import com.streamspy.collection.core.spi.Identifier;
import com.streamspy.collection.core.spi.ObservableInference;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.collection.core.stacktrace.StackTracePlugin;
import com.streamspy.devtools.model.DeckStatsPayload;
import com.streamspy.devtools.model.GraphPayload;
import com.streamspy.devtools.model.NotificationPayload;
import com.streamspy.devtools.model.NotificationPayload.ObservableDescriptor;
import com.streamspy.devtools.model.NotificationPayload.SubscriberDescriptor;
import com.streamspy.devtools.model.NotificationPayload.SubscriptionDescriptor;
import com.streamspy.devtools.model.SnapshotPayload;
import com.streamspy.devtools.model.SnapshotPayload.ObservableEntry;
import com.streamspy.devtools.model.SnapshotPayload.SubscriberEntry;
import com.streamspy.devtools.model.SnapshotPayload.SubscriptionEntry;
import com.streamspy.devtools.model.SnapshotPayload.ValueEntry;
import com.streamspy.devtools.model.ValuePayload;
import com.streamspy.model.Notification;
import com.streamspy.model.Phase;
import com.streamspy.model.SubscriptionRef;
import java.util.List;
import java.util.Objects;

/** Projects spy state into the wire payloads. */
public class NotificationMapper {
    private final Spy spy;

    public NotificationMapper(Spy spy) {
        this.spy = Objects.requireNonNull(spy, "spy");
    }

    /**
     * Builds the payload of one notification. {@code value} is the next value or the error and is
     * only written for those two kinds; an error is also reported on the subscription.
     */
    public NotificationPayload toNotification(
            SubscriptionRef ref, Phase phase, Notification notification, Object value, long tick) {
        Identifier identifier = spy.identifier();
        ObservableInference inference = spy.inference();
        Object observable = ref.observable();

        ValuePayload error = notification == Notification.ERROR ? toValue(value) : null;
        return new NotificationPayload(
                identifier.fresh(),
                new ObservableDescriptor(
                        identifier.identify(observable),
                        inference.inferPath(observable),
                        inference.inferTag(observable),
                        inference.inferType(observable)),
                new SubscriberDescriptor(identifier.identify(ref.subscriber())),
                new SubscriptionDescriptor(
                        error, toGraph(ref), identifier.identify(ref.subscription()), stackTraceOf(ref)),
                tick,
                spy.clock().millis(),
                phase.typeOf(notification),
                notification.carriesValue() ? toValue(value) : null);
    }

    /** Current graph links of {@code ref}, or {@code null} without a graph registry. */
    public GraphPayload toGraph(SubscriptionRef ref) {
        return spy.find(GraphPlugin.class).flatMap(plugin -> plugin.graphOf(ref)).orElse(null);
    }

    public DeckStatsPayload toStats(String id, DeckStats stats) {
        return new DeckStatsPayload(
                id,
                stats.paused(),
                stats.notifications(),
                stats.resumed(),
                stats.skipped(),
                stats.stepped(),
                stats.cleared());
    }

    public SnapshotPayload toSnapshot(Snapshot snapshot) {
        List<ObservableEntry> observables = snapshot.observables().values().stream()
                .map(NotificationMapper::toEntry)
                .toList();
        List<SubscriberEntry> subscribers = snapshot.subscribers().values().stream()
                .map(this::toEntry)
                .toList();
        List<SubscriptionEntry> subscriptions = snapshot.subscriptions().values().stream()
                .map(this::toEntry)
                .toList();
        return new SnapshotPayload(observables, subscribers, subscriptions, snapshot.tick());
    }

    public ValuePayload toValue(Object value) {
        return new ValuePayload(spy.serializer().serialize(value));
    }

    private Object stackTraceOf(SubscriptionRef ref) {
        return spy.find(StackTracePlugin.class).map(plugin -> plugin.stackTraceOf(ref)).orElse(null);
    }

    private static ObservableEntry toEntry(ObservableSnapshot observable) {
        return new ObservableEntry(
                observable.id(),
                observable.path(),
                observable.subscriptions(),
                observable.tag(),
                observable.tick(),
                observable.type());
    }

    private SubscriberEntry toEntry(SubscriberSnapshot subscriber) {
        return new SubscriberEntry(
                subscriber.id(),
                subscriber.subscriptions(),
                subscriber.tick(),
                toValues(subscriber.values()),
                subscriber.valuesFlushed());
    }

    private SubscriptionEntry toEntry(SubscriptionSnapshot subscription) {
        return new SubscriptionEntry(
                subscription.completeTimestamp(),
                subscription.error() != null ? toValue(subscription.error()) : null,
                subscription.errorTimestamp(),
                subscription.graph(),
                subscription.id(),
                subscription.nextCount(),
                subscription.nextTimestamp(),
                subscription.observable(),
                subscription.stackTrace(),
                subscription.subscribeTimestamp(),
                subscription.subscriber(),
                subscription.tick(),
                subscription.unsubscribeTimestamp(),
                toValues(subscription.values()),
                subscription.valuesFlushed());
    }

    private List<ValueEntry> toValues(List<ValueSnapshot> values) {
        return values.stream()
                .map(v -> new ValueEntry(v.tick(), v.timestamp(), toValue(v.value())))
                .toList();
    }
}
