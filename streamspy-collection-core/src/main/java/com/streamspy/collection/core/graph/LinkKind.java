package com.streamspy.collection.core.graph;

/** How a child subscription hangs off its sink. */
public enum LinkKind {
    /** Subscribed directly while the sink was subscribing. */
    SOURCE,
    /** Subscribed by a flattening operator while the sink was handling a notification. */
    FLAT
}
