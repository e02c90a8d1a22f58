package com.streamspy.collection.core.spi;

/** Implemented by observables that carry a user-assigned tag. */
public interface Tagged {
    String tag();
}
