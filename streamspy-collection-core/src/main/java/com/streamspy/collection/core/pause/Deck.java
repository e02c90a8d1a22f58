package com.streamspy.collection.core.pause;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Pause/step controller gating the delivery of notifications to a downstream consumer.
 *
 * <p>While {@link DeckState#RUNNING} admitted notifications pass straight through. While
 * {@link DeckState#PAUSED} they are buffered in arrival order until released by {@link #resume()}
 * or {@link #step()}, or discarded by {@link #skip()} or {@link #clear()}.
 *
 * <p>Every transition and every admitted or discarded notification publishes fresh
 * {@link DeckStats} to the stats listeners. Listeners and the downstream consumer are invoked
 * outside the deck's lock.
 */
@Slf4j
public class Deck {
    private final String id;
    private final Consumer<PausedNotification> downstream;
    private final Deque<PausedNotification> buffer = new ArrayDeque<>();
    private final List<Consumer<DeckStats>> statsListeners = new CopyOnWriteArrayList<>();
    private DeckState state = DeckState.RUNNING;
    private long resumed;
    private long skipped;
    private long stepped;
    private long cleared;

    public Deck(String id, Consumer<PausedNotification> downstream) {
        this.id = Objects.requireNonNull(id, "id");
        this.downstream = Objects.requireNonNull(downstream, "downstream");
    }

    public String id() {
        return id;
    }

    public synchronized DeckState state() {
        return state;
    }

    public synchronized boolean paused() {
        return state == DeckState.PAUSED;
    }

    public synchronized DeckStats stats() {
        return new DeckStats(state == DeckState.PAUSED, buffer.size(), resumed, skipped, stepped, cleared);
    }

    /** Registers a stats listener; closing the returned handle removes it. */
    public AutoCloseable addStatsListener(Consumer<DeckStats> listener) {
        Objects.requireNonNull(listener, "listener");
        statsListeners.add(listener);
        return () -> statsListeners.remove(listener);
    }

    /** Offers a notification: delivered now while running, buffered while paused. */
    public void admit(PausedNotification notification) {
        boolean deliver;
        DeckStats stats;
        synchronized (this) {
            deliver = state == DeckState.RUNNING;
            if (!deliver) buffer.addLast(notification);
            stats = stats();
        }
        if (deliver) deliver(List.of(notification));
        publish(stats);
    }

    public void pause() {
        DeckStats stats;
        synchronized (this) {
            if (state == DeckState.PAUSED) return;
            state = DeckState.PAUSED;
            stats = stats();
        }
        log.debug("Deck {} paused", id);
        publish(stats);
    }

    /** Releases everything buffered, in arrival order, and lets later notifications through. */
    public void resume() {
        List<PausedNotification> released;
        DeckStats stats;
        synchronized (this) {
            if (state == DeckState.RUNNING) return;
            released = new ArrayList<>(buffer);
            buffer.clear();
            resumed += released.size();
            state = DeckState.RUNNING;
            stats = stats();
        }
        log.debug("Deck {} resumed, releasing {} notifications", id, released.size());
        deliver(released);
        publish(stats);
    }

    /** Releases exactly the oldest buffered notification and stays paused. */
    public void step() {
        PausedNotification released;
        DeckStats stats;
        synchronized (this) {
            released = buffer.pollFirst();
            if (released != null) stepped++;
            stats = stats();
        }
        if (released != null) deliver(List.of(released));
        publish(stats);
    }

    /** Discards exactly the oldest buffered notification without delivering it. */
    public void skip() {
        DeckStats stats;
        synchronized (this) {
            if (buffer.pollFirst() != null) skipped++;
            stats = stats();
        }
        publish(stats);
    }

    /** Discards the whole buffer without delivering any of it; the state is unchanged. */
    public void clear() {
        DeckStats stats;
        synchronized (this) {
            cleared += buffer.size();
            buffer.clear();
            stats = stats();
        }
        publish(stats);
    }

    /** Applies a supported command; {@link DeckCommand#INSPECT} is rejected. */
    public void apply(DeckCommand command) {
        switch (command) {
            case CLEAR -> clear();
            case PAUSE -> pause();
            case RESUME -> resume();
            case SKIP -> skip();
            case STEP -> step();
            case INSPECT -> throw new UnsupportedOperationException("inspect is not supported");
        }
    }

    /** Releases whatever is buffered and detaches all listeners. */
    public void teardown() {
        resume();
        statsListeners.clear();
    }

    private void deliver(List<PausedNotification> notifications) {
        for (PausedNotification notification : notifications) {
            downstream.accept(notification);
        }
    }

    private void publish(DeckStats stats) {
        for (Consumer<DeckStats> listener : statsListeners) {
            try {
                listener.accept(stats);
            } catch (RuntimeException ex) {
                log.warn("Deck {} stats listener failure: {}", id, ex.toString());
            }
        }
    }
}
