package com.streamspy.devtools.model;

/**
 * Pause deck statistics relayed to the remote side. {@code notifications} is the number of
 * notifications currently held back.
 */
public record DeckStatsPayload(
        String id, boolean paused, int notifications, long resumed, long skipped, long stepped, long cleared) {}
