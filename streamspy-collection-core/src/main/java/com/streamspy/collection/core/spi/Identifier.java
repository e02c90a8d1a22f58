package com.streamspy.collection.core.spi;

/** Assigns stable, process-unique string ids to tracked objects. */
public interface Identifier {
    /** Returns the id of {@code target}; repeated calls with the same instance return the same id. */
    String identify(Object target);

    /** Returns an id that has never been handed out before. */
    default String fresh() {
        return identify(new Object());
    }
}
