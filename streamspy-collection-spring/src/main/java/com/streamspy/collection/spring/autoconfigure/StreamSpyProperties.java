package com.streamspy.collection.spring.autoconfigure;

import com.streamspy.devtools.model.DevToolsConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the StreamSpy instrumentation hub.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * streamspy:
 *   enabled: true               # register the spy and its plugins (default)
 *   devtools:
 *     batch-milliseconds: 100   # length of one batching window
 *     batch-notifications: 150  # notifications per window before a snapshot hint
 *   snapshot:
 *     kept-values: 4            # values remembered per subscription and subscriber
 *     kept-closed: 100          # closed subscriptions kept before the oldest is evicted
 *   cycle:
 *     enabled: true
 *     threshold: 100            # nested nexts of one observable before warning
 *   stack-trace:
 *     enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "streamspy")
public class StreamSpyProperties {

    /**
     * Master switch. When disabled no spy is registered and instrumentation has nothing to report
     * to.
     */
    private boolean enabled = true;

    private final Devtools devtools = new Devtools();
    private final Snapshot snapshot = new Snapshot();
    private final Cycle cycle = new Cycle();
    private final StackTrace stackTrace = new StackTrace();

    /**
     * Returns whether the hub is enabled.
     *
     * @return {@code true} if enabled (default)
     */
    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Devtools getDevtools() {
        return devtools;
    }

    public Snapshot getSnapshot() {
        return snapshot;
    }

    public Cycle getCycle() {
        return cycle;
    }

    public StackTrace getStackTrace() {
        return stackTrace;
    }

    /**
     * Batching of broadcasts sent to the remote inspector. Only used when a
     * {@link com.streamspy.collection.core.devtools.Connection} bean is present.
     */
    public static class Devtools {

        /** Length of one batching window in milliseconds. */
        private long batchMilliseconds = DevToolsConstants.BATCH_MILLISECONDS;

        /**
         * Notification broadcasts a window may hold. One more replaces them with a snapshot hint
         * and suppresses notifications until the inspector asks for a snapshot.
         */
        private int batchNotifications = DevToolsConstants.BATCH_NOTIFICATIONS;

        public long getBatchMilliseconds() {
            return batchMilliseconds;
        }

        public void setBatchMilliseconds(long batchMilliseconds) {
            this.batchMilliseconds = batchMilliseconds;
        }

        public int getBatchNotifications() {
            return batchNotifications;
        }

        public void setBatchNotifications(int batchNotifications) {
            this.batchNotifications = batchNotifications;
        }
    }

    public static class Snapshot {

        /** Most recent next values kept per subscription and per subscriber. */
        private int keptValues = 4;

        /** Closed subscriptions kept for inspection; older ones are evicted first. */
        private int keptClosed = 100;

        public int getKeptValues() {
            return keptValues;
        }

        public void setKeptValues(int keptValues) {
            this.keptValues = keptValues;
        }

        public int getKeptClosed() {
            return keptClosed;
        }

        public void setKeptClosed(int keptClosed) {
            this.keptClosed = keptClosed;
        }
    }

    public static class Cycle {

        /** Register the cyclic-next detector. */
        private boolean enabled = true;

        /** How deeply one observable may re-enter its own next before a warning is logged. */
        private int threshold = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }
    }

    public static class StackTrace {

        /** Capture where each subscription was made. Costs one stack walk per subscribe. */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
