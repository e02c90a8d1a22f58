package com.streamspy.collection.core.graph;

import com.streamspy.collection.core.spi.Identifier;
import com.streamspy.collection.core.spy.Plugin;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.devtools.model.GraphPayload;
import com.streamspy.model.Notification;
import com.streamspy.model.SubscriptionRef;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Graph registry: tracks the sink, root sink, sources and flats of every live subscription.
 *
 * <p>Links are inferred from nesting. A subscription made while another subscription is still
 * subscribing becomes a source of it. A subscription made while another subscription is
 * delivering next/error/complete was created by a flattening operator and becomes a flat of the
 * operator's subscription, which is the sink of the delivering one. {@link #link} is also public
 * for sources that know the topology explicitly.
 *
 * <p>On {@code after-unsubscribe} a node is flushed: its children are dropped and counted, it is
 * removed from its sink (counted there too) and forgotten, so finished subtrees do not accumulate.
 */
@Slf4j
public class GraphPlugin implements Plugin {
    private final Identifier identifier;
    private final Map<SubscriptionRef, GraphRef> nodes = new IdentityHashMap<>();
    private final Deque<Frame> frames = new ArrayDeque<>();

    public GraphPlugin(Spy spy) {
        this(spy.identifier());
    }

    public GraphPlugin(Identifier identifier) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
    }

    @Override
    public String name() {
        return "graph";
    }

    @Override
    public void beforeSubscribe(SubscriptionRef ref) {
        node(ref);
        Frame top = frames.peek();
        if (top != null) {
            switch (top.notification()) {
                case SUBSCRIBE -> link(top.ref(), ref, LinkKind.SOURCE);
                case NEXT, ERROR, COMPLETE -> {
                    GraphRef sink = node(top.ref()).sink();
                    boolean live = sink != null && nodes.get(sink.ref()) == sink;
                    SubscriptionRef owner = live ? sink.ref() : top.ref();
                    link(owner, ref, LinkKind.FLAT);
                }
                default -> {
                    // subscribing while unsubscribing creates no structural link
                }
            }
        }
        frames.push(new Frame(ref, Notification.SUBSCRIBE));
    }

    @Override
    public void afterSubscribe(SubscriptionRef ref) {
        pop(ref, Notification.SUBSCRIBE);
    }

    @Override
    public void beforeNext(SubscriptionRef ref, Object value) {
        frames.push(new Frame(ref, Notification.NEXT));
    }

    @Override
    public void afterNext(SubscriptionRef ref, Object value) {
        pop(ref, Notification.NEXT);
    }

    @Override
    public void beforeError(SubscriptionRef ref, Throwable error) {
        frames.push(new Frame(ref, Notification.ERROR));
    }

    @Override
    public void afterError(SubscriptionRef ref, Throwable error) {
        pop(ref, Notification.ERROR);
    }

    @Override
    public void beforeComplete(SubscriptionRef ref) {
        frames.push(new Frame(ref, Notification.COMPLETE));
    }

    @Override
    public void afterComplete(SubscriptionRef ref) {
        pop(ref, Notification.COMPLETE);
    }

    @Override
    public void beforeUnsubscribe(SubscriptionRef ref) {
        frames.push(new Frame(ref, Notification.UNSUBSCRIBE));
    }

    @Override
    public void afterUnsubscribe(SubscriptionRef ref) {
        pop(ref, Notification.UNSUBSCRIBE);
        unlink(ref);
    }

    @Override
    public void teardown() {
        nodes.clear();
        frames.clear();
    }

    /**
     * Records {@code child} as a source or flat of {@code parent}. Duplicate links are ignored, a
     * child already linked elsewhere is moved, and a link that would close a cycle is refused.
     */
    public void link(SubscriptionRef parent, SubscriptionRef child, LinkKind kind) {
        GraphRef parentNode = node(parent);
        GraphRef childNode = node(child);
        if (parentNode == childNode || isAncestor(childNode, parentNode)) {
            log.debug("Ignoring link of {} under its own descendant {}", child, parent);
            return;
        }
        if (childNode.sink() == parentNode && parentNode.kindOf(childNode) == kind) return;
        detachFromSink(childNode);
        parentNode.children(kind).add(childNode);
        childNode.sink(parentNode);
        updateRootSinks(childNode, parentNode.rootSink() != null ? parentNode.rootSink() : parentNode);
    }

    /** Flushes the node of {@code ref}; its former children keep pointing at it as their sink. */
    public void unlink(SubscriptionRef ref) {
        GraphRef node = nodes.remove(ref);
        if (node == null) return;
        for (LinkKind kind : LinkKind.values()) {
            Set<GraphRef> children = node.children(kind);
            node.countFlushed(kind, children.size());
            children.clear();
        }
        GraphRef sink = node.sink();
        if (sink != null) {
            LinkKind kind = sink.kindOf(node);
            if (kind != null) {
                sink.children(kind).remove(node);
                sink.countFlushed(kind, 1);
            }
        }
    }

    public Optional<GraphRef> graphRef(SubscriptionRef ref) {
        return Optional.ofNullable(nodes.get(ref));
    }

    /** Projects the current links of {@code ref} into wire form; empty when the ref is untracked. */
    public Optional<GraphPayload> graphOf(SubscriptionRef ref) {
        return graphRef(ref).map(this::toPayload);
    }

    public int size() {
        return nodes.size();
    }

    private GraphPayload toPayload(GraphRef node) {
        return new GraphPayload(
                ids(node.flats()),
                node.flatsFlushed() > 0,
                node.rootSink() != null ? idOf(node.rootSink()) : null,
                node.sink() != null ? idOf(node.sink()) : null,
                ids(node.sources()),
                node.sourcesFlushed() > 0);
    }

    private List<String> ids(List<GraphRef> refs) {
        return refs.stream().map(this::idOf).toList();
    }

    private String idOf(GraphRef node) {
        return identifier.identify(node.ref().subscription());
    }

    private GraphRef node(SubscriptionRef ref) {
        return nodes.computeIfAbsent(ref, GraphRef::new);
    }

    private void detachFromSink(GraphRef node) {
        GraphRef sink = node.sink();
        if (sink == null) return;
        LinkKind kind = sink.kindOf(node);
        if (kind != null) sink.children(kind).remove(node);
        node.sink(null);
        node.rootSink(null);
    }

    private static boolean isAncestor(GraphRef candidate, GraphRef node) {
        Set<GraphRef> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (GraphRef current = node.sink(); current != null && visited.add(current); current = current.sink()) {
            if (current == candidate) return true;
        }
        return false;
    }

    private static void updateRootSinks(GraphRef top, GraphRef root) {
        Set<GraphRef> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<GraphRef> pending = new ArrayDeque<>();
        pending.push(top);
        while (!pending.isEmpty()) {
            GraphRef current = pending.pop();
            if (!visited.add(current)) continue;
            current.rootSink(root);
            current.descendants().forEach(pending::push);
        }
    }

    private void pop(SubscriptionRef ref, Notification notification) {
        Iterator<Frame> it = frames.iterator();
        while (it.hasNext()) {
            Frame frame = it.next();
            if (frame.ref() == ref && frame.notification() == notification) {
                it.remove();
                return;
            }
        }
    }

    private record Frame(SubscriptionRef ref, Notification notification) {}
}
