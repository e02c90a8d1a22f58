package com.streamspy.collection.core.spy;

import com.streamspy.model.SubscriptionRef;

/**
 * Independent observer of the notification pipeline. Every callback defaults to a no-op so a
 * plugin only implements the notifications it cares about.
 *
 * <p>Callbacks run while the owning {@link Spy} holds its lock: they see one notification at a
 * time and must not block.
 */
public interface Plugin {
    /** Short, stable name used in logs. */
    String name();

    default void beforeSubscribe(SubscriptionRef ref) {}

    default void afterSubscribe(SubscriptionRef ref) {}

    default void beforeNext(SubscriptionRef ref, Object value) {}

    default void afterNext(SubscriptionRef ref, Object value) {}

    default void beforeError(SubscriptionRef ref, Throwable error) {}

    default void afterError(SubscriptionRef ref, Throwable error) {}

    default void beforeComplete(SubscriptionRef ref) {}

    default void afterComplete(SubscriptionRef ref) {}

    default void beforeUnsubscribe(SubscriptionRef ref) {}

    default void afterUnsubscribe(SubscriptionRef ref) {}

    /** Releases whatever the plugin holds. Called once, when the plugin is detached. */
    default void teardown() {}
}
