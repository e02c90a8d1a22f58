package com.streamspy.collection.core.devtools;

import com.streamspy.devtools.model.Batch;
import com.streamspy.devtools.model.DeckStatsBroadcast;
import com.streamspy.devtools.model.DeckStatsPayload;
import com.streamspy.devtools.model.Message;
import com.streamspy.devtools.model.NotificationBroadcast;
import com.streamspy.devtools.model.NotificationPayload;
import com.streamspy.devtools.model.SnapshotHintBroadcast;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Coalesces broadcasts into time-boxed {@link Batch} messages.
 *
 * <p>The first message enqueued while no window is open starts one; when the window expires the
 * whole queue is posted as a single batch. Two policies bound what a window carries:
 *
 * <ul>
 *   <li>overload: a notification that would take the window past {@code batchNotifications}
 *       notification broadcasts drops them all in favour of one snapshot hint, and notifications
 *       are suppressed until {@link #clearSnapshotHint()};
 *   <li>deck-stats dedup: only the latest stats per deck id stay queued.
 * </ul>
 *
 * <p>{@link #teardown()} cancels the open window and discards its queue without posting it.
 */
@Slf4j
public class MessageBatcher {
    private final Consumer<Message> post;
    private final BatchScheduler scheduler;
    private final DevToolsOptions options;

    private List<Message> queue = new ArrayList<>();
    private BatchScheduler.Scheduled timer;
    private long window;
    private boolean snapshotHinted;
    private boolean closed;

    public MessageBatcher(Consumer<Message> post, BatchScheduler scheduler, DevToolsOptions options) {
        this.post = Objects.requireNonNull(post, "post");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.options = Objects.requireNonNull(options, "options");
    }

    public synchronized void enqueue(Message message) {
        Objects.requireNonNull(message, "message");
        if (closed) return;
        if (timer != null) {
            queue.add(message);
            return;
        }
        queue = new ArrayList<>();
        queue.add(message);
        long current = ++window;
        timer = scheduler.schedule(() -> flush(current), options.batchMilliseconds());
    }

    /** Queues a notification broadcast, applying the overload policy. */
    public synchronized void enqueueNotification(NotificationPayload notification) {
        if (closed || snapshotHinted) return;
        long queued = queue.stream().filter(NotificationBroadcast.class::isInstance).count();
        if (queued >= options.batchNotifications()) {
            queue.removeIf(NotificationBroadcast.class::isInstance);
            snapshotHinted = true;
            log.debug("Collapsed {} queued notifications into a snapshot hint", queued);
            enqueue(new SnapshotHintBroadcast());
        } else {
            enqueue(new NotificationBroadcast(notification));
        }
    }

    /** Queues deck stats, replacing stats still queued for the same deck. */
    public synchronized void enqueueDeckStats(DeckStatsPayload stats) {
        if (closed) return;
        queue.removeIf(m -> m instanceof DeckStatsBroadcast broadcast && broadcast.stats().id().equals(stats.id()));
        enqueue(new DeckStatsBroadcast(stats));
    }

    public synchronized boolean snapshotHinted() {
        return snapshotHinted;
    }

    public synchronized void clearSnapshotHint() {
        snapshotHinted = false;
    }

    /** Messages queued in the open window. */
    public synchronized List<Message> pending() {
        return List.copyOf(queue);
    }

    public synchronized boolean windowOpen() {
        return timer != null;
    }

    public void teardown() {
        int dropped;
        synchronized (this) {
            if (closed) return;
            closed = true;
            window++;
            if (timer != null) {
                timer.cancel();
                timer = null;
            }
            dropped = queue.size();
            queue = new ArrayList<>();
        }
        log.debug("Batcher closed, {} queued messages dropped", dropped);
    }

    private void flush(long expected) {
        Batch batch;
        synchronized (this) {
            if (closed || expected != window) return;
            batch = new Batch(queue);
            queue = new ArrayList<>();
            timer = null;
        }
        log.debug("Posting batch of {} messages", batch.messages().size());
        try {
            post.accept(batch);
        } catch (RuntimeException ex) {
            log.warn("Batch post failure: {}", ex.toString());
        }
    }
}
