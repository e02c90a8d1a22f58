package com.streamspy.devtools.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;

/**
 * Inbound post from the remote side. Only posts whose {@code messageType} is {@code request} are
 * acted upon; the remaining fields depend on {@code requestType}.
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Request(
        String messageType, String requestType, String postId, String spyId, String pluginId, String command) {

    public static Request of(String requestType, String postId) {
        return new Request(DevToolsConstants.MESSAGE_REQUEST, requestType, postId, null, null, null);
    }

    public Request withSpyId(String spyId) {
        return new Request(messageType, requestType, postId, spyId, pluginId, command);
    }

    public Request withPluginId(String pluginId) {
        return new Request(messageType, requestType, postId, spyId, pluginId, command);
    }

    public Request withCommand(String command) {
        return new Request(messageType, requestType, postId, spyId, pluginId, command);
    }

    @JsonIgnore
    public boolean isPostRequest() {
        return DevToolsConstants.MESSAGE_REQUEST.equals(messageType) && postId != null;
    }
}
