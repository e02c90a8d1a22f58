package com.streamspy.devtools.model;

/** Unsolicited message pushed to the remote side, discriminated by {@code broadcastType}. */
public interface Broadcast extends Message {
    String broadcastType();
}
