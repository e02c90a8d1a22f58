package com.streamspy.client.transport;

import java.io.Closeable;
import java.io.IOException;
import java.util.function.Consumer;

/**
 * Minimal transport SPI: exchange opaque frames with a remote devtools viewer.
 */
public interface MessageTransport extends Closeable {
    String DEFAULT_ENDPOINT = "ws://localhost:8787/devtools";
    String PROP_ENDPOINT = "streamspy.devtools.url";
    String ENV_ENDPOINT = "STREAMSPY_DEVTOOLS_URL";

    void send(byte[] frame) throws IOException;

    /** Installs the receiver of inbound frames, replacing any previous one; {@code null} detaches. */
    void listen(Consumer<byte[]> listener);

    default String endpoint() {
        String sys = System.getProperty(PROP_ENDPOINT);
        if (sys != null && !sys.isBlank()) return sys;
        String env = System.getenv(ENV_ENDPOINT);
        if (env != null && !env.isBlank()) return env;
        return DEFAULT_ENDPOINT;
    }

    @Override
    default void close() throws IOException {
        /* no-op */
    }
}
