package com.streamspy.collection.core.devtools;

import com.streamspy.devtools.model.DevToolsConstants;

/**
 * Batching limits of one devtools session.
 *
 * @param batchMilliseconds length of a batching window
 * @param batchNotifications notification broadcasts a window may hold before it collapses to a
 *     snapshot hint
 */
public record DevToolsOptions(long batchMilliseconds, int batchNotifications) {
    public DevToolsOptions {
        if (batchMilliseconds <= 0) throw new IllegalArgumentException("batchMilliseconds must be positive");
        if (batchNotifications <= 0) throw new IllegalArgumentException("batchNotifications must be positive");
    }

    public static DevToolsOptions defaults() {
        return new DevToolsOptions(DevToolsConstants.BATCH_MILLISECONDS, DevToolsConstants.BATCH_NOTIFICATIONS);
    }
}
