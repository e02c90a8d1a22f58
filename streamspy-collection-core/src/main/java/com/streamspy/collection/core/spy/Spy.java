package com.streamspy.collection.core.spy;

import com.streamspy.collection.core.spi.ClassNameInference;
import com.streamspy.collection.core.spi.Identifier;
import com.streamspy.collection.core.spi.JacksonValueSerializer;
import com.streamspy.collection.core.spi.ObservableInference;
import com.streamspy.collection.core.spi.ValueSerializer;
import com.streamspy.collection.core.spi.WeakIdentifier;
import com.streamspy.model.Notification;
import com.streamspy.model.Phase;
import com.streamspy.model.SubscriptionRef;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of one instrumentation session. The interception layer reports lifecycle calls
 * here; the spy advances the logical tick and fans each call out to the attached plugins.
 *
 * <p>All lifecycle calls are serialized on the spy's lock, which gives plugins a single logical
 * thread. {@code before-*} notifications reach plugins in attachment order and {@code after-*}
 * notifications in reverse order, so a plugin attached earlier brackets the ones attached after it.
 * A plugin that throws is logged and skipped; the remaining plugins still see the notification.
 */
public final class Spy {
    private static final Logger log = LoggerFactory.getLogger(Spy.class);

    private final Object lock = new Object();
    private final List<Plugin> plugins = new CopyOnWriteArrayList<>();
    private final Identifier identifier;
    private final ObservableInference inference;
    private final ValueSerializer serializer;
    private final Clock clock;
    private long tick;

    public Spy() {
        this(new WeakIdentifier(), new ClassNameInference(), new JacksonValueSerializer(), Clock.systemUTC());
    }

    public Spy(Identifier identifier, ObservableInference inference, ValueSerializer serializer, Clock clock) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.inference = Objects.requireNonNull(inference, "inference");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Attaches {@code plugin}; the returned handle detaches it and runs its teardown once. */
    public Teardown plug(Plugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        plugins.add(plugin);
        log.debug("Plugged {}", plugin.name());
        AtomicBoolean done = new AtomicBoolean();
        return () -> {
            if (done.compareAndSet(false, true)) unplug(plugin);
        };
    }

    /** Returns the first attached plugin of the given type. */
    public <T extends Plugin> Optional<T> find(Class<T> type) {
        for (Plugin plugin : plugins) {
            if (type.isInstance(plugin)) return Optional.of(type.cast(plugin));
        }
        return Optional.empty();
    }

    public List<Plugin> plugins() {
        return List.copyOf(plugins);
    }

    /** Logical clock, advanced once per {@code before-*} notification. */
    public long tick() {
        synchronized (lock) {
            return tick;
        }
    }

    /** Runs {@code reader} with notifications held off, giving it a consistent view at one tick. */
    public <T> T read(Supplier<T> reader) {
        synchronized (lock) {
            return reader.get();
        }
    }

    public Identifier identifier() {
        return identifier;
    }

    public ObservableInference inference() {
        return inference;
    }

    public ValueSerializer serializer() {
        return serializer;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Whether {@code ref} is a notification of the observable that a remote inspector refers to as
     * {@code spyId}: either its identity or its tag.
     */
    public boolean matches(SubscriptionRef ref, String spyId) {
        if (spyId == null) return false;
        Object observable = ref.observable();
        return spyId.equals(identifier.identify(observable)) || spyId.equals(inference.inferTag(observable));
    }

    public void beforeSubscribe(SubscriptionRef ref) {
        notify(Phase.BEFORE, Notification.SUBSCRIBE, ref, p -> p.beforeSubscribe(ref));
    }

    public void afterSubscribe(SubscriptionRef ref) {
        notify(Phase.AFTER, Notification.SUBSCRIBE, ref, p -> p.afterSubscribe(ref));
    }

    public void beforeNext(SubscriptionRef ref, Object value) {
        notify(Phase.BEFORE, Notification.NEXT, ref, p -> p.beforeNext(ref, value));
    }

    public void afterNext(SubscriptionRef ref, Object value) {
        notify(Phase.AFTER, Notification.NEXT, ref, p -> p.afterNext(ref, value));
    }

    public void beforeError(SubscriptionRef ref, Throwable error) {
        notify(Phase.BEFORE, Notification.ERROR, ref, p -> p.beforeError(ref, error));
    }

    public void afterError(SubscriptionRef ref, Throwable error) {
        notify(Phase.AFTER, Notification.ERROR, ref, p -> p.afterError(ref, error));
    }

    public void beforeComplete(SubscriptionRef ref) {
        notify(Phase.BEFORE, Notification.COMPLETE, ref, p -> p.beforeComplete(ref));
    }

    public void afterComplete(SubscriptionRef ref) {
        notify(Phase.AFTER, Notification.COMPLETE, ref, p -> p.afterComplete(ref));
    }

    public void beforeUnsubscribe(SubscriptionRef ref) {
        notify(Phase.BEFORE, Notification.UNSUBSCRIBE, ref, p -> p.beforeUnsubscribe(ref));
    }

    public void afterUnsubscribe(SubscriptionRef ref) {
        notify(Phase.AFTER, Notification.UNSUBSCRIBE, ref, p -> p.afterUnsubscribe(ref));
    }

    /** Detaches every plugin, most recently attached first. */
    public void teardown() {
        List<Plugin> attached = new ArrayList<>(plugins);
        Collections.reverse(attached);
        attached.forEach(this::unplug);
    }

    private void unplug(Plugin plugin) {
        if (!plugins.remove(plugin)) return;
        try {
            plugin.teardown();
            log.debug("Unplugged {}", plugin.name());
        } catch (RuntimeException ex) {
            log.warn("Plugin {} failed to tear down: {}", plugin.name(), ex.toString());
        }
    }

    private void notify(Phase phase, Notification notification, SubscriptionRef ref, Consumer<Plugin> call) {
        Objects.requireNonNull(ref, "ref");
        synchronized (lock) {
            if (phase == Phase.BEFORE) tick++;
            List<Plugin> targets = new ArrayList<>(plugins);
            if (phase == Phase.AFTER) Collections.reverse(targets);
            for (Plugin plugin : targets) {
                try {
                    call.accept(plugin);
                } catch (RuntimeException ex) {
                    log.warn(
                            "Plugin {} failed on {} for {}: {}",
                            plugin.name(),
                            phase.typeOf(notification),
                            ref,
                            ex.toString());
                }
            }
        }
    }
}
