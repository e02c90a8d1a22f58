package com.streamspy.collection.core.graph;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamspy.collection.core.FakeSubject;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.devtools.model.GraphPayload;
import com.streamspy.model.SubscriptionRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GraphPluginTest {

    private Spy spy;
    private GraphPlugin graph;

    @BeforeEach
    void setUp() {
        spy = new Spy();
        graph = new GraphPlugin(spy);
        spy.plug(graph);
    }

    @Test
    void subscribe_during_subscribe_links_a_source() {
        FakeSubject outer = new FakeSubject(spy);
        FakeSubject inner = new FakeSubject(spy);
        AtomicReference<SubscriptionRef> innerRef = new AtomicReference<>();

        SubscriptionRef outerRef = outer.subscribe(v -> {}, () -> innerRef.set(inner.subscribe(v -> {})));

        GraphRef innerNode = graph.graphRef(innerRef.get()).orElseThrow();
        GraphRef outerNode = graph.graphRef(outerRef).orElseThrow();
        assertThat(innerNode.sink()).isSameAs(outerNode);
        assertThat(innerNode.rootSink()).isSameAs(outerNode);
        assertThat(outerNode.sources()).containsExactly(innerNode);
        assertThat(outerNode.sink()).isNull();
        assertThat(outerNode.rootSink()).isNull();
    }

    @Test
    void subscribe_during_next_links_a_flat() {
        FakeSubject outer = new FakeSubject(spy);
        FakeSubject inner = new FakeSubject(spy);
        List<SubscriptionRef> innerRefs = new ArrayList<>();
        SubscriptionRef outerRef = outer.subscribe(v -> innerRefs.add(inner.subscribe(x -> {})));

        outer.next(1);

        GraphPayload payload = graph.graphOf(outerRef).orElseThrow();
        String innerId = spy.identifier().identify(innerRefs.get(0).subscription());
        assertThat(payload.flats()).containsExactly(innerId);
        assertThat(payload.sources()).isEmpty();
        assertThat(graph.graphOf(innerRefs.get(0)).orElseThrow().sink())
                .isEqualTo(spy.identifier().identify(outerRef.subscription()));
    }

    @Test
    void unsubscribe_flushes_and_counts_links() {
        FakeSubject outer = new FakeSubject(spy);
        FakeSubject inner = new FakeSubject(spy);
        List<SubscriptionRef> sources = new ArrayList<>();
        SubscriptionRef outerRef = outer.subscribe(v -> {}, () -> {
            sources.add(inner.subscribe(v -> {}));
            sources.add(inner.subscribe(v -> {}));
        });

        inner.unsubscribe(sources.get(0));

        GraphPayload payload = graph.graphOf(outerRef).orElseThrow();
        assertThat(payload.sources()).containsExactly(spy.identifier().identify(sources.get(1).subscription()));
        assertThat(payload.sourcesFlushed()).isTrue();
        assertThat(payload.flatsFlushed()).isFalse();
        assertThat(graph.graphRef(sources.get(0))).isEmpty();

        outer.unsubscribe(outerRef);
        assertThat(graph.graphOf(outerRef)).isEmpty();
        assertThat(graph.size()).isEqualTo(1);
    }

    @Test
    void explicit_link_is_idempotent_moves_children_and_refuses_cycles() {
        FakeSubject subject = new FakeSubject(spy);
        SubscriptionRef a = subject.subscribe(v -> {});
        SubscriptionRef b = subject.subscribe(v -> {});
        SubscriptionRef c = subject.subscribe(v -> {});

        graph.link(a, c, LinkKind.SOURCE);
        graph.link(a, c, LinkKind.SOURCE);
        assertThat(graph.graphRef(a).orElseThrow().sources()).hasSize(1);

        graph.link(b, c, LinkKind.FLAT);
        assertThat(graph.graphRef(a).orElseThrow().sources()).isEmpty();
        assertThat(graph.graphRef(b).orElseThrow().flats()).hasSize(1);

        graph.link(c, b, LinkKind.SOURCE);
        assertThat(graph.graphRef(b).orElseThrow().sink()).isNull();

        graph.link(a, b, LinkKind.SOURCE);
        assertThat(graph.graphRef(c).orElseThrow().rootSink()).isSameAs(graph.graphRef(a).orElseThrow());
    }

    @Test
    void sink_and_children_stay_inverse_over_random_activity() {
        Random random = new Random(42);
        List<FakeSubject> subjects = List.of(new FakeSubject(spy), new FakeSubject(spy), new FakeSubject(spy));
        List<SubscriptionRef> live = new ArrayList<>();

        for (int step = 0; step < 200; step++) {
            FakeSubject subject = subjects.get(random.nextInt(subjects.size()));
            FakeSubject other = subjects.get(random.nextInt(subjects.size()));
            switch (random.nextInt(4)) {
                case 0 -> live.add(subject.subscribe(v -> {}));
                case 1 -> live.add(subject.subscribe(v -> {}, () -> live.add(other.subscribe(v -> {}))));
                case 2 -> {
                    if (random.nextBoolean()) live.add(subject.subscribe(v -> live.add(other.subscribe(x -> {}))));
                    subject.next(step);
                }
                default -> {
                    if (!live.isEmpty()) {
                        SubscriptionRef ref = live.remove(random.nextInt(live.size()));
                        ((FakeSubject) ref.observable()).unsubscribe(ref);
                    }
                }
            }
            assertInverse(live);
        }
    }

    private void assertInverse(List<SubscriptionRef> live) {
        for (SubscriptionRef ref : live) {
            GraphRef node = graph.graphRef(ref).orElseThrow();
            for (GraphRef child : node.sources()) assertThat(child.sink()).isSameAs(node);
            for (GraphRef child : node.flats()) assertThat(child.sink()).isSameAs(node);
            GraphRef sink = node.sink();
            if (sink != null && graph.graphRef(sink.ref()).isPresent()) {
                assertThat(sink.sources().contains(node) || sink.flats().contains(node)).isTrue();
                assertThat(node.rootSink()).isNotNull();
            }
            if (sink == null) assertThat(node.rootSink()).isNull();
        }
    }
}
