package com.streamspy.devtools.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Messages collected during one batching window, posted as a single wire unit. */
public record Batch(List<Message> messages) implements Message {
    public Batch {
        messages = List.copyOf(messages);
    }

    @Override
    @JsonProperty("messageType")
    public String messageType() {
        return DevToolsConstants.MESSAGE_BATCH;
    }
}
