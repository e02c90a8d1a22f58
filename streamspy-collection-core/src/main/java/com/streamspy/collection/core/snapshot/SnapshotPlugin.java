package com.streamspy.collection.core.snapshot;

import com.streamspy.collection.core.graph.GraphPlugin;
import com.streamspy.collection.core.spi.Identifier;
import com.streamspy.collection.core.spi.ObservableInference;
import com.streamspy.collection.core.spy.Plugin;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.collection.core.stacktrace.StackTracePlugin;
import com.streamspy.devtools.model.GraphPayload;
import com.streamspy.model.SubscriptionRef;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps per-entity history (values, timestamps, errors, stack traces) for everything the spy has
 * seen and builds immutable {@link Snapshot}s from it.
 *
 * <p>Open subscriptions are retained until they close. At most {@code keptClosed} closed
 * subscriptions are kept, oldest evicted first, and {@link #flush()} drops all of them. Observables
 * and subscribers go with their last subscription. Value histories keep the last {@code keptValues}
 * entries.
 */
@Slf4j
public class SnapshotPlugin implements Plugin {
    public static final int DEFAULT_KEPT_VALUES = 4;
    public static final int DEFAULT_KEPT_CLOSED = 100;

    private final Spy spy;
    private final int keptValues;
    private final int keptClosed;
    private final Map<String, ObservableRecord> observables = new LinkedHashMap<>();
    private final Map<String, SubscriberRecord> subscribers = new LinkedHashMap<>();
    private final Map<String, SubscriptionRecord> subscriptions = new LinkedHashMap<>();
    private final Set<String> closed = new LinkedHashSet<>();

    public SnapshotPlugin(Spy spy) {
        this(spy, DEFAULT_KEPT_VALUES);
    }

    public SnapshotPlugin(Spy spy, int keptValues) {
        this(spy, keptValues, DEFAULT_KEPT_CLOSED);
    }

    public SnapshotPlugin(Spy spy, int keptValues, int keptClosed) {
        if (keptValues < 0) throw new IllegalArgumentException("keptValues must not be negative");
        if (keptClosed < 0) throw new IllegalArgumentException("keptClosed must not be negative");
        this.spy = Objects.requireNonNull(spy, "spy");
        this.keptValues = keptValues;
        this.keptClosed = keptClosed;
    }

    @Override
    public String name() {
        return "snapshot";
    }

    @Override
    public void beforeSubscribe(SubscriptionRef ref) {
        Identifier identifier = spy.identifier();
        ObservableInference inference = spy.inference();
        long tick = spy.tick();

        Object observable = ref.observable();
        ObservableRecord observableRecord = observables.computeIfAbsent(
                identifier.identify(observable),
                id -> new ObservableRecord(
                        id,
                        inference.inferPath(observable),
                        inference.inferTag(observable),
                        inference.inferType(observable)));
        SubscriberRecord subscriberRecord = subscribers.computeIfAbsent(
                identifier.identify(ref.subscriber()), id -> new SubscriberRecord(id, keptValues));

        String id = identifier.identify(ref.subscription());
        SubscriptionRecord record = new SubscriptionRecord(
                ref, id, observableRecord, subscriberRecord, spy.clock().millis(), keptValues);
        record.tick = tick;
        record.stackTrace =
                spy.find(StackTracePlugin.class).map(p -> p.stackTraceOf(ref)).orElse(null);
        subscriptions.put(id, record);

        observableRecord.subscriptions.add(id);
        observableRecord.tick = tick;
        subscriberRecord.subscriptions.add(id);
        subscriberRecord.tick = tick;
    }

    @Override
    public void beforeNext(SubscriptionRef ref, Object value) {
        SubscriptionRecord record = record(ref);
        if (record == null) return;
        long tick = spy.tick();
        long timestamp = spy.clock().millis();
        ValueSnapshot entry = new ValueSnapshot(tick, timestamp, value);

        record.nextCount++;
        record.nextTimestamp = timestamp;
        record.values.add(entry);
        record.tick = tick;
        record.subscriber.values.add(entry);
        record.subscriber.tick = tick;
        record.observable.tick = tick;
    }

    @Override
    public void beforeError(SubscriptionRef ref, Throwable error) {
        SubscriptionRecord record = record(ref);
        if (record == null) return;
        record.error = error;
        record.errorTimestamp = spy.clock().millis();
        touch(record);
        retire(record);
    }

    @Override
    public void beforeComplete(SubscriptionRef ref) {
        SubscriptionRecord record = record(ref);
        if (record == null) return;
        record.completeTimestamp = spy.clock().millis();
        touch(record);
        retire(record);
    }

    @Override
    public void afterUnsubscribe(SubscriptionRef ref) {
        SubscriptionRecord record = record(ref);
        if (record == null) return;
        record.unsubscribeTimestamp = spy.clock().millis();
        record.finalGraph = spy.find(GraphPlugin.class).flatMap(g -> g.graphOf(ref)).orElse(null);
        touch(record);
        retire(record);
    }

    @Override
    public void teardown() {
        spy.read(() -> {
            observables.clear();
            subscribers.clear();
            subscriptions.clear();
            closed.clear();
            return null;
        });
    }

    /** Builds a snapshot of everything recorded so far, consistent at the current tick. */
    public Snapshot snapshotAll() {
        return spy.read(this::build);
    }

    /** Drops records of subscriptions that have completed, errored or been unsubscribed. */
    public int flush() {
        return spy.read(() -> {
            int removed = closed.size();
            new ArrayList<>(closed).forEach(this::evict);
            log.debug("Flushed {} closed subscriptions, {} retained", removed, subscriptions.size());
            return removed;
        });
    }

    /** Number of subscription records currently held, open and closed. */
    public int retained() {
        return spy.read(subscriptions::size);
    }

    private Snapshot build() {
        long tick = spy.tick();
        GraphPlugin graphPlugin = spy.find(GraphPlugin.class).orElse(null);
        StackTracePlugin stackTracePlugin = spy.find(StackTracePlugin.class).orElse(null);
        Set<String> known = subscriptions.keySet();

        Map<String, ObservableSnapshot> observableSnapshots = new LinkedHashMap<>();
        observables.forEach((id, r) -> observableSnapshots.put(
                id, new ObservableSnapshot(id, r.path, r.tag, r.type, List.copyOf(r.subscriptions), r.tick)));

        Map<String, SubscriberSnapshot> subscriberSnapshots = new LinkedHashMap<>();
        subscribers.forEach((id, r) -> subscriberSnapshots.put(
                id,
                new SubscriberSnapshot(
                        id, List.copyOf(r.subscriptions), r.values.values(), r.values.flushed(), r.tick)));

        Map<String, SubscriptionSnapshot> subscriptionSnapshots = new LinkedHashMap<>();
        subscriptions.forEach((id, r) -> {
            GraphPayload graph = r.finalGraph;
            if (graph == null && graphPlugin != null) graph = graphPlugin.graphOf(r.ref).orElse(null);
            Object stackTrace = r.stackTrace;
            if (stackTrace == null && stackTracePlugin != null) stackTrace = stackTracePlugin.stackTraceOf(r.ref);
            subscriptionSnapshots.put(
                    id,
                    new SubscriptionSnapshot(
                            id,
                            r.observable.id,
                            r.subscriber.id,
                            r.subscribeTimestamp,
                            r.unsubscribeTimestamp,
                            r.completeTimestamp,
                            r.error,
                            r.errorTimestamp,
                            r.nextCount,
                            r.nextTimestamp,
                            r.tick,
                            stackTrace,
                            restrict(graph, known),
                            r.values.values(),
                            r.values.flushed()));
        });
        return new Snapshot(observableSnapshots, subscriberSnapshots, subscriptionSnapshots, tick);
    }

    private SubscriptionRecord record(SubscriptionRef ref) {
        return subscriptions.get(spy.identifier().identify(ref.subscription()));
    }

    /** Queues a newly closed record for eviction once more than {@code keptClosed} are held. */
    private void retire(SubscriptionRecord record) {
        if (!closed.add(record.id)) return;
        while (closed.size() > keptClosed) {
            evict(closed.iterator().next());
        }
    }

    private void evict(String id) {
        closed.remove(id);
        SubscriptionRecord record = subscriptions.remove(id);
        if (record == null) return;
        record.observable.subscriptions.remove(id);
        if (record.observable.subscriptions.isEmpty()) observables.remove(record.observable.id);
        record.subscriber.subscriptions.remove(id);
        if (record.subscriber.subscriptions.isEmpty()) subscribers.remove(record.subscriber.id);
    }

    private void touch(SubscriptionRecord record) {
        long tick = spy.tick();
        record.tick = tick;
        record.observable.tick = tick;
    }

    /** Drops links to subscriptions that are not part of the snapshot. */
    private static GraphPayload restrict(GraphPayload graph, Set<String> known) {
        if (graph == null) return null;
        return new GraphPayload(
                graph.flats().stream().filter(known::contains).toList(),
                graph.flatsFlushed(),
                known.contains(graph.rootSink()) ? graph.rootSink() : null,
                known.contains(graph.sink()) ? graph.sink() : null,
                graph.sources().stream().filter(known::contains).toList(),
                graph.sourcesFlushed());
    }
}
