package com.streamspy.collection.core.snapshot;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamspy.collection.core.FakeSubject;
import com.streamspy.collection.core.graph.GraphPlugin;
import com.streamspy.collection.core.spi.ClassNameInference;
import com.streamspy.collection.core.spi.JacksonValueSerializer;
import com.streamspy.collection.core.spi.WeakIdentifier;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.model.SubscriptionRef;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SnapshotPluginTest {

    private Spy spy;
    private SnapshotPlugin snapshots;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_000), ZoneOffset.UTC);
        spy = new Spy(new WeakIdentifier(), new ClassNameInference(), new JacksonValueSerializer(), clock);
        spy.plug(new GraphPlugin(spy));
        snapshots = new SnapshotPlugin(spy, 2);
        spy.plug(snapshots);
    }

    @Test
    void records_entities_with_bounded_value_history() {
        FakeSubject subject = new FakeSubject(spy, "numbers");
        SubscriptionRef ref = subject.subscribe(v -> {});
        subject.next(1);
        subject.next(2);
        subject.next(3);

        Snapshot snapshot = snapshots.snapshotAll();

        String subscriptionId = spy.identifier().identify(ref.subscription());
        SubscriptionSnapshot subscription = snapshot.subscriptions().get(subscriptionId);
        assertThat(subscription.nextCount()).isEqualTo(3);
        assertThat(subscription.nextTimestamp()).isEqualTo(1_000L);
        assertThat(subscription.values()).extracting(ValueSnapshot::value).containsExactly(2, 3);
        assertThat(subscription.valuesFlushed()).isTrue();
        assertThat(subscription.unsubscribeTimestamp()).isNull();

        ObservableSnapshot observable = snapshot.observables().get(subscription.observable());
        assertThat(observable.tag()).isEqualTo("numbers");
        assertThat(observable.type()).isEqualTo("fakeSubject");
        assertThat(observable.path()).isEqualTo("/fakeSubject");
        assertThat(observable.subscriptions()).containsExactly(subscriptionId);

        SubscriberSnapshot subscriber = snapshot.subscribers().get(subscription.subscriber());
        assertThat(subscriber.values()).hasSize(2);
        assertThat(snapshot.tick()).isEqualTo(spy.tick());
    }

    @Test
    void error_and_complete_are_timestamped() {
        FakeSubject failing = new FakeSubject(spy);
        SubscriptionRef failed = failing.subscribe(v -> {});
        IllegalStateException error = new IllegalStateException("boom");
        failing.error(error);
        FakeSubject done = new FakeSubject(spy);
        SubscriptionRef completed = done.subscribe(v -> {});
        done.complete();

        Snapshot snapshot = snapshots.snapshotAll();

        SubscriptionSnapshot erroredEntry =
                snapshot.subscriptions().get(spy.identifier().identify(failed.subscription()));
        assertThat(erroredEntry.error()).isSameAs(error);
        assertThat(erroredEntry.errorTimestamp()).isEqualTo(1_000L);
        SubscriptionSnapshot completedEntry =
                snapshot.subscriptions().get(spy.identifier().identify(completed.subscription()));
        assertThat(completedEntry.completeTimestamp()).isEqualTo(1_000L);
    }

    @Test
    void graph_references_resolve_within_the_snapshot() {
        FakeSubject outer = new FakeSubject(spy);
        FakeSubject inner = new FakeSubject(spy);
        AtomicReference<SubscriptionRef> innerRef = new AtomicReference<>();
        SubscriptionRef outerRef = outer.subscribe(v -> {}, () -> innerRef.set(inner.subscribe(v -> {})));
        inner.unsubscribe(innerRef.get());
        snapshots.flush();

        Snapshot snapshot = snapshots.snapshotAll();

        assertThat(snapshot.subscriptions()).containsOnlyKeys(spy.identifier().identify(outerRef.subscription()));
        snapshot.subscriptions().values().forEach(s -> {
            assertThat(snapshot.observables()).containsKey(s.observable());
            assertThat(snapshot.subscribers()).containsKey(s.subscriber());
            assertThat(s.graph().sources()).allMatch(snapshot.subscriptions()::containsKey);
            assertThat(s.graph().sourcesFlushed()).isTrue();
        });
        snapshot.observables().values().forEach(o ->
                assertThat(o.subscriptions()).allMatch(snapshot.subscriptions()::containsKey));
    }

    @Test
    void unsubscribed_subscription_keeps_its_final_graph_until_flushed() {
        FakeSubject outer = new FakeSubject(spy);
        FakeSubject inner = new FakeSubject(spy);
        AtomicReference<SubscriptionRef> innerRef = new AtomicReference<>();
        SubscriptionRef outerRef = outer.subscribe(v -> {}, () -> innerRef.set(inner.subscribe(v -> {})));

        outer.unsubscribe(outerRef);
        Snapshot before = snapshots.snapshotAll();
        String outerId = spy.identifier().identify(outerRef.subscription());
        String innerId = spy.identifier().identify(innerRef.get().subscription());

        assertThat(before.subscriptions().get(outerId).unsubscribeTimestamp()).isEqualTo(1_000L);
        assertThat(before.subscriptions().get(outerId).graph().sources()).containsExactly(innerId);

        assertThat(snapshots.flush()).isEqualTo(1);
        Snapshot after = snapshots.snapshotAll();
        assertThat(after.subscriptions()).containsOnlyKeys(innerId);
        assertThat(after.subscriptions().get(innerId).graph().sink()).isNull();
        assertThat(after.subscriptions().get(innerId).graph().rootSink()).isNull();
    }

    @Test
    void closed_subscriptions_beyond_the_kept_count_are_evicted_oldest_first() {
        Spy bounded = new Spy();
        bounded.plug(new GraphPlugin(bounded));
        SnapshotPlugin plugin = new SnapshotPlugin(bounded, 2, 5);
        bounded.plug(plugin);
        FakeSubject subject = new FakeSubject(bounded, "churn");
        SubscriptionRef open = subject.subscribe(v -> {});

        List<String> closedIds = new ArrayList<>();
        for (int i = 0; i < 1_000; i++) {
            SubscriptionRef ref = subject.subscribe(v -> {});
            subject.next(i);
            subject.unsubscribe(ref);
            closedIds.add(bounded.identifier().identify(ref.subscription()));
        }

        assertThat(plugin.retained()).isEqualTo(6);
        Snapshot snapshot = plugin.snapshotAll();
        assertThat(snapshot.subscriptions().keySet())
                .containsExactly(
                        bounded.identifier().identify(open.subscription()),
                        closedIds.get(995),
                        closedIds.get(996),
                        closedIds.get(997),
                        closedIds.get(998),
                        closedIds.get(999));
        assertThat(snapshot.observables()).hasSize(1);
    }

    @Test
    void flush_forgets_observables_left_without_subscriptions() {
        FakeSubject once = new FakeSubject(spy, "once");
        SubscriptionRef ref = once.subscribe(v -> {});
        once.complete();
        once.unsubscribe(ref);

        assertThat(snapshots.flush()).isEqualTo(1);

        Snapshot snapshot = snapshots.snapshotAll();
        assertThat(snapshot.subscriptions()).isEmpty();
        assertThat(snapshot.observables()).isEmpty();
        assertThat(snapshot.subscribers()).isEmpty();
        assertThat(snapshots.retained()).isZero();
    }

    @Test
    void teardown_forgets_everything() {
        new FakeSubject(spy).subscribe(v -> {});

        spy.teardown();

        Snapshot snapshot = snapshots.snapshotAll();
        assertThat(snapshot.observables()).isEmpty();
        assertThat(snapshot.subscriptions()).isEmpty();
    }
}
