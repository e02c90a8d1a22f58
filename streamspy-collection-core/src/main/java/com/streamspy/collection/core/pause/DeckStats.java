package com.streamspy.collection.core.pause;

/**
 * Counters of one deck. {@code notifications} is the number currently held back; the others are
 * running totals since the deck was created.
 */
public record DeckStats(boolean paused, int notifications, long resumed, long skipped, long stepped, long cleared) {}
