package com.streamspy.devtools.model;

/** Wire-level constants shared by the instrumentation hub and remote viewers. */
public final class DevToolsConstants {
    /** Length of one batching window. */
    public static final long BATCH_MILLISECONDS = 100;
    /** Notification broadcasts one batching window may hold; one more collapses it to a snapshot hint. */
    public static final int BATCH_NOTIFICATIONS = 150;

    public static final String MESSAGE_BATCH = "batch";
    public static final String MESSAGE_BROADCAST = "broadcast";
    public static final String MESSAGE_REQUEST = "request";
    public static final String MESSAGE_RESPONSE = "response";

    public static final String BROADCAST_NOTIFICATION = "notification";
    public static final String BROADCAST_DECK_STATS = "deck-stats";
    public static final String BROADCAST_SNAPSHOT_HINT = "snapshot-hint";

    public static final String REQUEST_LOG = "log";
    public static final String REQUEST_LOG_TEARDOWN = "log-teardown";
    public static final String REQUEST_PAUSE = "pause";
    public static final String REQUEST_PAUSE_COMMAND = "pause-command";
    public static final String REQUEST_PAUSE_TEARDOWN = "pause-teardown";
    public static final String REQUEST_SNAPSHOT = "snapshot";

    private DevToolsConstants() {}
}
