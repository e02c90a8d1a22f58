package com.streamspy.collection.core.spi;

import com.streamspy.model.SubscriptionRef;

/**
 * Captures where a subscription was made. The result is opaque to the hub and passed through to
 * payloads unmodified; {@code null} means no trace is available.
 */
@FunctionalInterface
public interface StackTraceProvider {
    Object getStackTrace(SubscriptionRef ref);
}
