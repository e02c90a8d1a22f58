package com.streamspy.client.transport.okhttp;

import com.streamspy.client.transport.MessageTransport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OkHttp-based WebSocket transport. Frames are exchanged as UTF-8 text messages. */
public class OkHttpWebSocketTransport implements MessageTransport {
    private static final Logger log = LoggerFactory.getLogger(OkHttpWebSocketTransport.class);
    private static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient client;
    private final String endpoint;
    private final WebSocket webSocket;
    private volatile Consumer<byte[]> listener;
    private volatile boolean open = true;

    public OkHttpWebSocketTransport() {
        this(null);
    }

    public OkHttpWebSocketTransport(String endpoint) {
        this(new OkHttpClient.Builder().build(), endpoint);
    }

    public OkHttpWebSocketTransport(OkHttpClient client, String endpoint) {
        this.client = client;
        this.endpoint = (endpoint == null || endpoint.isBlank()) ? endpoint() : endpoint;
        Request req = new Request.Builder().url(this.endpoint).build();
        log.info("Connecting devtools transport to {}", this.endpoint);
        this.webSocket = client.newWebSocket(req, new Listener());
    }

    @Override
    public void send(byte[] frame) throws IOException {
        if (!open) throw new IOException("WebSocket to " + endpoint + " is closed");
        String text = new String(frame, StandardCharsets.UTF_8);
        if (!webSocket.send(text)) {
            throw new IOException("WebSocket to " + endpoint + " rejected frame of " + frame.length + " bytes");
        }
        if (log.isDebugEnabled()) {
            log.debug("Sent frame of {} bytes to {}", frame.length, endpoint);
        }
    }

    @Override
    public void listen(Consumer<byte[]> listener) {
        this.listener = listener;
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        listener = null;
        webSocket.close(NORMAL_CLOSURE, "teardown");
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private final class Listener extends WebSocketListener {
        @Override
        public void onMessage(WebSocket socket, String text) {
            deliver(text.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void onMessage(WebSocket socket, ByteString bytes) {
            deliver(bytes.toByteArray());
        }

        @Override
        public void onClosing(WebSocket socket, int code, String reason) {
            open = false;
            socket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onFailure(WebSocket socket, Throwable t, Response response) {
            open = false;
            log.warn(
                    "Devtools transport to {} failed with status {} due to {}",
                    endpoint,
                    response != null ? response.code() : -1,
                    t.toString());
        }

        private void deliver(byte[] frame) {
            Consumer<byte[]> current = listener;
            if (current == null) return;
            try {
                current.accept(frame);
            } catch (RuntimeException ex) {
                log.warn("Inbound frame listener failure: {}", ex.toString());
            }
        }
    }
}
