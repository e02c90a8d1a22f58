package com.streamspy.collection.core.pause;

import com.streamspy.collection.core.spy.Plugin;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.model.Notification;
import com.streamspy.model.SubscriptionRef;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes the next/error/complete notifications of one observable through a {@link Deck}. The
 * observable is the one a remote inspector calls {@code spyId}; notifications the deck releases
 * are handed to the release listeners.
 *
 * <p>A gate decides, per notification, whether this plugin's deck takes it. Hosts running several
 * pause plugins over the same observable use it so that only one deck admits each notification.
 */
@Slf4j
public class PausePlugin implements Plugin {
    private final Spy spy;
    private final String spyId;
    private final Deck deck;
    private final BiPredicate<PausePlugin, SubscriptionRef> gate;
    private final List<Consumer<PausedNotification>> releaseListeners = new CopyOnWriteArrayList<>();

    public PausePlugin(Spy spy, String spyId) {
        this(spy, spyId, (plugin, ref) -> true);
    }

    public PausePlugin(Spy spy, String spyId, BiPredicate<PausePlugin, SubscriptionRef> gate) {
        this.spy = Objects.requireNonNull(spy, "spy");
        this.spyId = Objects.requireNonNull(spyId, "spyId");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.deck = new Deck(spyId, this::release);
    }

    @Override
    public String name() {
        return "pause";
    }

    public String spyId() {
        return spyId;
    }

    public Deck deck() {
        return deck;
    }

    /** Registers a consumer of released notifications; closing the handle removes it. */
    public AutoCloseable addReleaseListener(Consumer<PausedNotification> listener) {
        Objects.requireNonNull(listener, "listener");
        releaseListeners.add(listener);
        return () -> releaseListeners.remove(listener);
    }

    @Override
    public void beforeNext(SubscriptionRef ref, Object value) {
        admit(ref, Notification.NEXT, value);
    }

    @Override
    public void beforeError(SubscriptionRef ref, Throwable error) {
        admit(ref, Notification.ERROR, error);
    }

    @Override
    public void beforeComplete(SubscriptionRef ref) {
        admit(ref, Notification.COMPLETE, null);
    }

    @Override
    public void teardown() {
        deck.teardown();
        releaseListeners.clear();
    }

    private void admit(SubscriptionRef ref, Notification notification, Object value) {
        if (!spy.matches(ref, spyId) || !gate.test(this, ref)) return;
        deck.admit(new PausedNotification(ref, notification, value, spy.tick()));
    }

    private void release(PausedNotification notification) {
        for (Consumer<PausedNotification> listener : releaseListeners) {
            try {
                listener.accept(notification);
            } catch (RuntimeException ex) {
                log.warn("Release listener failure for {}: {}", spyId, ex.toString());
            }
        }
    }
}
