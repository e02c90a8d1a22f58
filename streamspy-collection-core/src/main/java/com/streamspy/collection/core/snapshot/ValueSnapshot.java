package com.streamspy.collection.core.snapshot;

/** A next value as it was observed; {@code value} is the raw object and may be {@code null}. */
public record ValueSnapshot(long tick, long timestamp, Object value) {}
