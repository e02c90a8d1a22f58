package com.streamspy.collection.core.stacktrace;

import com.streamspy.collection.core.spi.StackTraceProvider;
import com.streamspy.collection.core.spi.ThreadStackTraceProvider;
import com.streamspy.collection.core.spy.Plugin;
import com.streamspy.model.SubscriptionRef;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Records, per subscription, where it was subscribed. Traces are captured on
 * {@code before-subscribe} and dropped after the subscription is unsubscribed.
 */
public class StackTracePlugin implements Plugin {
    private final StackTraceProvider provider;
    private final Map<SubscriptionRef, Object> traces = new IdentityHashMap<>();

    public StackTracePlugin() {
        this(new ThreadStackTraceProvider());
    }

    public StackTracePlugin(StackTraceProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    @Override
    public String name() {
        return "stackTrace";
    }

    @Override
    public void beforeSubscribe(SubscriptionRef ref) {
        Object trace = provider.getStackTrace(ref);
        if (trace != null) traces.put(ref, trace);
    }

    @Override
    public void afterUnsubscribe(SubscriptionRef ref) {
        traces.remove(ref);
    }

    @Override
    public void teardown() {
        traces.clear();
    }

    /** Trace captured for {@code ref}, or {@code null} when none was recorded. */
    public Object stackTraceOf(SubscriptionRef ref) {
        return traces.get(ref);
    }
}
