package com.streamspy.devtools.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tells the remote side that individual notifications are being suppressed and that it should
 * request a fresh snapshot.
 */
public record SnapshotHintBroadcast() implements Broadcast {
    @Override
    @JsonProperty("messageType")
    public String messageType() {
        return DevToolsConstants.MESSAGE_BROADCAST;
    }

    @Override
    @JsonProperty("broadcastType")
    public String broadcastType() {
        return DevToolsConstants.BROADCAST_SNAPSHOT_HINT;
    }
}
