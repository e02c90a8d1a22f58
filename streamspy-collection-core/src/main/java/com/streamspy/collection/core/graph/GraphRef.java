package com.streamspy.collection.core.graph;

import com.streamspy.model.SubscriptionRef;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural links of one subscription. {@code sink} points up toward the consumer,
 * {@code sources} and {@code flats} point down toward producers. Mutated only by
 * {@link GraphPlugin} under the spy lock.
 */
public final class GraphRef {
    private final SubscriptionRef ref;
    private final Set<GraphRef> sources = new LinkedHashSet<>();
    private final Set<GraphRef> flats = new LinkedHashSet<>();
    private GraphRef sink;
    private GraphRef rootSink;
    private int sourcesFlushed;
    private int flatsFlushed;

    GraphRef(SubscriptionRef ref) {
        this.ref = ref;
    }

    public SubscriptionRef ref() {
        return ref;
    }

    public GraphRef sink() {
        return sink;
    }

    public GraphRef rootSink() {
        return rootSink;
    }

    public List<GraphRef> sources() {
        return List.copyOf(sources);
    }

    public List<GraphRef> flats() {
        return List.copyOf(flats);
    }

    /** Number of sources dropped from this node by flushing. */
    public int sourcesFlushed() {
        return sourcesFlushed;
    }

    /** Number of flats dropped from this node by flushing. */
    public int flatsFlushed() {
        return flatsFlushed;
    }

    Set<GraphRef> children(LinkKind kind) {
        return kind == LinkKind.SOURCE ? sources : flats;
    }

    LinkKind kindOf(GraphRef child) {
        if (sources.contains(child)) return LinkKind.SOURCE;
        if (flats.contains(child)) return LinkKind.FLAT;
        return null;
    }

    void sink(GraphRef sink) {
        this.sink = sink;
    }

    void rootSink(GraphRef rootSink) {
        this.rootSink = rootSink;
    }

    void countFlushed(LinkKind kind, int count) {
        if (kind == LinkKind.SOURCE) {
            sourcesFlushed += count;
        } else {
            flatsFlushed += count;
        }
    }

    List<GraphRef> descendants() {
        List<GraphRef> children = new ArrayList<>(sources.size() + flats.size());
        children.addAll(sources);
        children.addAll(flats);
        return children;
    }
}
