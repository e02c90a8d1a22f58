package com.streamspy.collection.core.cycle;

import com.streamspy.collection.core.spy.Plugin;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.collection.core.stacktrace.StackTracePlugin;
import com.streamspy.model.SubscriptionRef;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Detects cyclic next notifications: an observable that is handed a value while it is already
 * delivering one, nested more than {@code cycleThreshold} times.
 *
 * <p>One warning is logged per outermost next. It carries the observable's inferred name and the
 * offending value, plus where the subscription was made when a {@link StackTracePlugin} is attached.
 */
@Slf4j
public class CyclePlugin implements Plugin {
    public static final int DEFAULT_CYCLE_THRESHOLD = 100;

    private final Spy spy;
    private final int cycleThreshold;
    private final Map<Object, Integer> depths = new IdentityHashMap<>();
    private int nesting;
    private boolean reported;

    public CyclePlugin(Spy spy) {
        this(spy, DEFAULT_CYCLE_THRESHOLD);
    }

    public CyclePlugin(Spy spy, int cycleThreshold) {
        this.spy = Objects.requireNonNull(spy, "spy");
        if (cycleThreshold < 1) throw new IllegalArgumentException("cycleThreshold must be >= 1");
        this.cycleThreshold = cycleThreshold;
    }

    @Override
    public String name() {
        return "cycle";
    }

    public int cycleThreshold() {
        return cycleThreshold;
    }

    @Override
    public void beforeNext(SubscriptionRef ref, Object value) {
        nesting++;
        int depth = depths.merge(ref.observable(), 1, Integer::sum);
        if (depth > cycleThreshold && !reported) {
            reported = true;
            warn(ref, value);
        }
    }

    @Override
    public void afterNext(SubscriptionRef ref, Object value) {
        depths.computeIfPresent(ref.observable(), (observable, depth) -> depth > 1 ? depth - 1 : null);
        if (nesting > 0 && --nesting == 0) {
            reported = false;
        }
    }

    @Override
    public void teardown() {
        depths.clear();
        nesting = 0;
        reported = false;
    }

    private void warn(SubscriptionRef ref, Object value) {
        String name = spy.inference().inferType(ref.observable());
        String subscribedAt = spy.find(StackTracePlugin.class)
                .map(plugin -> plugin.stackTraceOf(ref))
                .map(CyclePlugin::format)
                .orElse("");
        log.warn(
                "Cyclic next detected; name = {}; value = {}; subscribed at\n{}",
                name,
                spy.serializer().serialize(value),
                subscribedAt);
    }

    private static String format(Object stackTrace) {
        if (stackTrace instanceof List<?> frames) {
            StringBuilder out = new StringBuilder();
            for (Object frame : frames) {
                if (out.length() > 0) out.append('\n');
                out.append(frame);
            }
            return out.toString();
        }
        return String.valueOf(stackTrace);
    }
}
