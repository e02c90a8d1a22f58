package com.streamspy.devtools.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** Answer to one inbound {@link Request}; failures are reported through {@code error}. */
@JsonInclude(Include.NON_NULL)
public record Response(Request request, String error, String pluginId, SnapshotPayload snapshot)
        implements Message {

    public Response {
        Objects.requireNonNull(request, "request");
    }

    public static Response to(Request request) {
        return new Response(request, null, null, null);
    }

    public Response withError(String error) {
        return new Response(request, error, pluginId, snapshot);
    }

    public Response withPluginId(String pluginId) {
        return new Response(request, error, pluginId, snapshot);
    }

    public Response withSnapshot(SnapshotPayload snapshot) {
        return new Response(request, error, pluginId, snapshot);
    }

    @Override
    @JsonProperty("messageType")
    public String messageType() {
        return DevToolsConstants.MESSAGE_RESPONSE;
    }
}
