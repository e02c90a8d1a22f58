package com.streamspy.collection.core.spi;

/** Turns arbitrary notification values into text that is safe to send even for cyclic graphs. */
@FunctionalInterface
public interface ValueSerializer {
    String serialize(Object value);
}
