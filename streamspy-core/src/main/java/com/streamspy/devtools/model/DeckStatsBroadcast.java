package com.streamspy.devtools.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

public record DeckStatsBroadcast(DeckStatsPayload stats) implements Broadcast {
    public DeckStatsBroadcast {
        Objects.requireNonNull(stats, "stats");
    }

    @Override
    @JsonProperty("messageType")
    public String messageType() {
        return DevToolsConstants.MESSAGE_BROADCAST;
    }

    @Override
    @JsonProperty("broadcastType")
    public String broadcastType() {
        return DevToolsConstants.BROADCAST_DECK_STATS;
    }
}
