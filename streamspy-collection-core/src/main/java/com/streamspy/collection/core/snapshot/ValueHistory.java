package com.streamspy.collection.core.snapshot;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** Most recent values of an entity; older values are evicted once the limit is reached. */
final class ValueHistory {
    private final int limit;
    private final Deque<ValueSnapshot> values = new ArrayDeque<>();
    private boolean flushed;

    ValueHistory(int limit) {
        this.limit = limit;
    }

    void add(ValueSnapshot value) {
        if (limit == 0) {
            flushed = true;
            return;
        }
        values.addLast(value);
        while (values.size() > limit) {
            values.removeFirst();
            flushed = true;
        }
    }

    List<ValueSnapshot> values() {
        return List.copyOf(values);
    }

    boolean flushed() {
        return flushed;
    }
}
