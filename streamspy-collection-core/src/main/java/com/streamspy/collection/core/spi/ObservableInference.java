package com.streamspy.collection.core.spi;

/** Derives human-readable labels for observables. */
public interface ObservableInference {
    /** Structural label, e.g. {@code /interval/map}. */
    String inferPath(Object observable);

    /** Operator or class name, e.g. {@code map}. */
    String inferType(Object observable);

    /** User-assigned tag, or {@code null} when the observable is untagged. */
    default String inferTag(Object observable) {
        return null;
    }
}
