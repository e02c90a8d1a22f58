package com.streamspy.devtools.model;

/**
 * Unit posted to a remote connection. Every message carries a {@code messageType} discriminator:
 * {@link Batch}, {@link Broadcast} or {@link Response}.
 */
public interface Message {
    String messageType();
}
