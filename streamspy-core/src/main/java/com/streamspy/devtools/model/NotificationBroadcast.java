package com.streamspy.devtools.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

public record NotificationBroadcast(NotificationPayload notification) implements Broadcast {
    public NotificationBroadcast {
        Objects.requireNonNull(notification, "notification");
    }

    @Override
    @JsonProperty("messageType")
    public String messageType() {
        return DevToolsConstants.MESSAGE_BROADCAST;
    }

    @Override
    @JsonProperty("broadcastType")
    public String broadcastType() {
        return DevToolsConstants.BROADCAST_NOTIFICATION;
    }
}
