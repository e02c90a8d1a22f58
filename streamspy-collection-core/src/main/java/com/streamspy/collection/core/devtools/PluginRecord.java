package com.streamspy.collection.core.devtools;

import com.streamspy.collection.core.spy.Plugin;
import com.streamspy.collection.core.spy.Teardown;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/** A plugin created on behalf of the remote side, with whatever must be released with it. */
@Slf4j
final class PluginRecord {
    private final long sequence;
    private final String pluginId;
    private final String spyId;
    private final Plugin plugin;
    private final Teardown teardown;
    private final List<AutoCloseable> subscriptions;
    private final AtomicBoolean tornDown = new AtomicBoolean();

    PluginRecord(
            long sequence,
            String pluginId,
            String spyId,
            Plugin plugin,
            Teardown teardown,
            List<AutoCloseable> subscriptions) {
        this.sequence = sequence;
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId");
        this.spyId = spyId;
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.teardown = Objects.requireNonNull(teardown, "teardown");
        this.subscriptions = List.copyOf(subscriptions);
    }

    /** Creation order within the session. */
    long sequence() {
        return sequence;
    }

    String pluginId() {
        return pluginId;
    }

    String spyId() {
        return spyId;
    }

    Plugin plugin() {
        return plugin;
    }

    /** Detaches the plugin, then closes its listeners. Runs once. */
    void teardown() {
        if (!tornDown.compareAndSet(false, true)) return;
        teardown.teardown();
        for (AutoCloseable subscription : subscriptions) {
            try {
                subscription.close();
            } catch (Exception ex) {
                log.warn("Failed to close listener of plugin {}: {}", pluginId, ex.toString());
            }
        }
    }
}
