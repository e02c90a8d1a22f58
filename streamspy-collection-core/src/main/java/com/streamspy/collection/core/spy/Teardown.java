package com.streamspy.collection.core.spy;

/** Handle that detaches something; calling it more than once has no further effect. */
@FunctionalInterface
public interface Teardown {
    void teardown();
}
