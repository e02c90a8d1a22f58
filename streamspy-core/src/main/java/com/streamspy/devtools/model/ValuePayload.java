package com.streamspy.devtools.model;

/** A value carried by a notification, already serialized to cycle-safe JSON text. */
public record ValuePayload(String json) {}
