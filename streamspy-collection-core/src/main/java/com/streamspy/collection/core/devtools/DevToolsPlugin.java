package com.streamspy.collection.core.devtools;

import static com.streamspy.devtools.model.DevToolsConstants.REQUEST_LOG;
import static com.streamspy.devtools.model.DevToolsConstants.REQUEST_LOG_TEARDOWN;
import static com.streamspy.devtools.model.DevToolsConstants.REQUEST_PAUSE;
import static com.streamspy.devtools.model.DevToolsConstants.REQUEST_PAUSE_COMMAND;
import static com.streamspy.devtools.model.DevToolsConstants.REQUEST_PAUSE_TEARDOWN;
import static com.streamspy.devtools.model.DevToolsConstants.REQUEST_SNAPSHOT;

import com.streamspy.collection.core.log.LogPlugin;
import com.streamspy.collection.core.pause.DeckCommand;
import com.streamspy.collection.core.pause.PausePlugin;
import com.streamspy.collection.core.snapshot.SnapshotPlugin;
import com.streamspy.collection.core.spy.Plugin;
import com.streamspy.collection.core.spy.Spy;
import com.streamspy.collection.core.spy.Teardown;
import com.streamspy.devtools.model.Request;
import com.streamspy.devtools.model.Response;
import com.streamspy.model.Notification;
import com.streamspy.model.Phase;
import com.streamspy.model.SubscriptionRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Devtools session: streams notifications to a remote inspector in batches and serves its
 * requests.
 *
 * <p>Requests create and destroy {@link LogPlugin}s and {@link PausePlugin}s, keyed by the post id
 * of the creating request, drive pause decks and take snapshots. Every request is answered with
 * exactly one {@link Response}, posted directly rather than batched. Requests naming an unknown
 * plugin are no-ops; malformed ones are answered with an error string.
 *
 * <p>The next/error/complete notifications of an observable under a pause plugin reach the batch
 * queue only when that plugin's deck releases them. When several pause plugins match one
 * observable, the earliest created owns its notifications and the others never see them.
 */
@Slf4j
public class DevToolsPlugin implements Plugin {
    static final String NOT_IMPLEMENTED = "Not implemented.";
    static final String UNEXPECTED_COMMAND = "Unexpected command.";
    static final String UNEXPECTED_REQUEST = "Unexpected request.";
    static final String NO_SNAPSHOT_PLUGIN = "Cannot find snapshot plugin.";
    static final String MISSING_SPY_ID = "Missing spyId.";

    private final Spy spy;
    private final Connection connection;
    private final NotificationMapper mapper;
    private final MessageBatcher batcher;
    private final ExecutorBatchScheduler ownedScheduler;
    private final Map<String, PluginRecord> records = new ConcurrentHashMap<>();
    private final AtomicBoolean tornDown = new AtomicBoolean();
    private final AtomicLong sequence = new AtomicLong();
    private final AutoCloseable subscription;

    public DevToolsPlugin(Spy spy, Connection connection) {
        this(spy, connection, DevToolsOptions.defaults());
    }

    public DevToolsPlugin(Spy spy, Connection connection, DevToolsOptions options) {
        this(spy, connection, options, new ExecutorBatchScheduler(), true);
    }

    public DevToolsPlugin(Spy spy, Connection connection, DevToolsOptions options, BatchScheduler scheduler) {
        this(spy, connection, options, scheduler, false);
    }

    private DevToolsPlugin(
            Spy spy, Connection connection, DevToolsOptions options, BatchScheduler scheduler, boolean owned) {
        this.spy = Objects.requireNonNull(spy, "spy");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.mapper = new NotificationMapper(spy);
        this.batcher = new MessageBatcher(connection::post, scheduler, options);
        this.ownedScheduler = owned ? (ExecutorBatchScheduler) scheduler : null;
        this.subscription = connection.subscribe(this::onPost);
        log.info(
                "DevTools session started (batchMilliseconds={}, batchNotifications={})",
                options.batchMilliseconds(),
                options.batchNotifications());
    }

    @Override
    public String name() {
        return "devTools";
    }

    @Override
    public void beforeSubscribe(SubscriptionRef ref) {
        batchNotification(ref, Phase.BEFORE, Notification.SUBSCRIBE, null);
    }

    @Override
    public void afterSubscribe(SubscriptionRef ref) {
        batchNotification(ref, Phase.AFTER, Notification.SUBSCRIBE, null);
    }

    @Override
    public void beforeNext(SubscriptionRef ref, Object value) {
        if (!paused(ref)) batchNotification(ref, Phase.BEFORE, Notification.NEXT, value);
    }

    @Override
    public void beforeError(SubscriptionRef ref, Throwable error) {
        if (!paused(ref)) batchNotification(ref, Phase.BEFORE, Notification.ERROR, error);
    }

    @Override
    public void beforeComplete(SubscriptionRef ref) {
        if (!paused(ref)) batchNotification(ref, Phase.BEFORE, Notification.COMPLETE, null);
    }

    @Override
    public void beforeUnsubscribe(SubscriptionRef ref) {
        batchNotification(ref, Phase.BEFORE, Notification.UNSUBSCRIBE, null);
    }

    @Override
    public void afterUnsubscribe(SubscriptionRef ref) {
        batchNotification(ref, Phase.AFTER, Notification.UNSUBSCRIBE, null);
    }

    /**
     * Ends the session: cancels the open batch window, tears down every plugin created for the
     * remote side and disconnects. Runs once.
     */
    @Override
    public void teardown() {
        if (!tornDown.compareAndSet(false, true)) return;
        batcher.teardown();
        List<PluginRecord> remaining = new ArrayList<>();
        read(() -> {
            remaining.addAll(records.values());
            records.clear();
            remaining.forEach(PluginRecord::teardown);
        });
        try {
            subscription.close();
        } catch (Exception ex) {
            log.warn("Failed to unsubscribe from connection: {}", ex.toString());
        }
        connection.disconnect();
        if (ownedScheduler != null) ownedScheduler.close();
        log.info("DevTools session ended, {} plugins torn down", remaining.size());
    }

    /** Handles one inbound post; anything other than a request post is ignored. */
    public void onPost(Request post) {
        if (post == null || !post.isPostRequest() || tornDown.get()) return;
        Response response;
        try {
            response = respond(post);
        } catch (RuntimeException ex) {
            log.warn("Request {} ({}) failed: {}", post.postId(), post.requestType(), ex.toString());
            response = Response.to(post).withError(ex.getMessage() != null ? ex.getMessage() : ex.toString());
        }
        connection.post(response);
    }

    public Set<String> pluginIds() {
        return Set.copyOf(records.keySet());
    }

    MessageBatcher batcher() {
        return batcher;
    }

    private Response respond(Request request) {
        Response response = Response.to(request);
        String requestType = request.requestType();
        if (requestType == null) return response.withError(UNEXPECTED_REQUEST);
        switch (requestType) {
            case REQUEST_LOG -> {
                if (request.spyId() == null) return response.withError(MISSING_SPY_ID);
                LogPlugin plugin = new LogPlugin(spy, request.spyId());
                recordPlugin(request.postId(), request.spyId(), plugin, List.of());
                return response.withPluginId(request.postId());
            }
            case REQUEST_PAUSE -> {
                if (request.spyId() == null) return response.withError(MISSING_SPY_ID);
                String spyId = request.spyId();
                PausePlugin plugin = new PausePlugin(spy, spyId, this::owns);
                AutoCloseable stats = plugin.deck()
                        .addStatsListener(s -> batcher.enqueueDeckStats(mapper.toStats(spyId, s)));
                AutoCloseable released = plugin.addReleaseListener(n ->
                        batchNotification(n.ref(), Phase.BEFORE, n.notification(), n.value(), n.tick()));
                recordPlugin(request.postId(), spyId, plugin, List.of(stats, released));
                return response.withPluginId(request.postId());
            }
            case REQUEST_PAUSE_COMMAND -> {
                return command(response, request);
            }
            case REQUEST_LOG_TEARDOWN, REQUEST_PAUSE_TEARDOWN -> {
                teardownPlugin(request.pluginId());
                return response;
            }
            case REQUEST_SNAPSHOT -> {
                batcher.clearSnapshotHint();
                Optional<SnapshotPlugin> plugin = spy.find(SnapshotPlugin.class);
                if (plugin.isEmpty()) return response.withError(NO_SNAPSHOT_PLUGIN);
                return response.withSnapshot(mapper.toSnapshot(plugin.get().snapshotAll()));
            }
            default -> {
                return response.withError(UNEXPECTED_REQUEST);
            }
        }
    }

    private Response command(Response response, Request request) {
        PluginRecord record = request.pluginId() != null ? records.get(request.pluginId()) : null;
        if (record == null) {
            log.debug("Ignoring command {} for unknown plugin {}", request.command(), request.pluginId());
            return response;
        }
        Optional<DeckCommand> command = DeckCommand.parse(request.command());
        if (command.isPresent() && command.get() == DeckCommand.INSPECT) return response.withError(NOT_IMPLEMENTED);
        if (command.isEmpty() || !(record.plugin() instanceof PausePlugin pausePlugin)) {
            return response.withError(UNEXPECTED_COMMAND);
        }
        read(() -> pausePlugin.deck().apply(command.get()));
        return response;
    }

    /** Plugs and records {@code plugin} in one step so notifications never see half of it. */
    private void recordPlugin(String pluginId, String spyId, Plugin plugin, List<AutoCloseable> listeners) {
        read(() -> {
            Teardown teardown = spy.plug(plugin);
            PluginRecord record =
                    new PluginRecord(sequence.incrementAndGet(), pluginId, spyId, plugin, teardown, listeners);
            PluginRecord previous = records.put(pluginId, record);
            if (previous != null) previous.teardown();
        });
        log.info("Created {} plugin {} for {}", plugin.name(), pluginId, spyId);
    }

    private void teardownPlugin(String pluginId) {
        if (pluginId == null) return;
        List<PluginRecord> removed = new ArrayList<>(1);
        read(() -> {
            PluginRecord record = records.remove(pluginId);
            if (record == null) return;
            removed.add(record);
            record.teardown();
        });
        removed.forEach(record -> log.info("Tore down {} plugin {}", record.plugin().name(), pluginId));
    }

    private boolean paused(SubscriptionRef ref) {
        return owner(ref) != null;
    }

    private boolean owns(PausePlugin candidate, SubscriptionRef ref) {
        return owner(ref) == candidate;
    }

    /** The earliest created pause plugin matching {@code ref}, or {@code null}. */
    private PausePlugin owner(SubscriptionRef ref) {
        PluginRecord owner = null;
        for (PluginRecord record : records.values()) {
            if (!(record.plugin() instanceof PausePlugin) || !spy.matches(ref, record.spyId())) continue;
            if (owner == null || record.sequence() < owner.sequence()) owner = record;
        }
        return owner != null ? (PausePlugin) owner.plugin() : null;
    }

    private void batchNotification(SubscriptionRef ref, Phase phase, Notification notification, Object value) {
        batchNotification(ref, phase, notification, value, spy.tick());
    }

    private void batchNotification(
            SubscriptionRef ref, Phase phase, Notification notification, Object value, long tick) {
        if (tornDown.get() || batcher.snapshotHinted()) return;
        batcher.enqueueNotification(mapper.toNotification(ref, phase, notification, value, tick));
    }

    /** Runs {@code action} under the spy's lock so released notifications see a stable graph. */
    private void read(Runnable action) {
        spy.read(() -> {
            action.run();
            return null;
        });
    }
}
