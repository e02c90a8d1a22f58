package com.streamspy.client.transport.okhttp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkHttpWebSocketTransportTest {
    private final BlockingQueue<String> serverReceived = new ArrayBlockingQueue<>(8);
    private MockWebServer server;
    private OkHttpWebSocketTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onMessage(WebSocket webSocket, String text) {
                serverReceived.offer(text);
                webSocket.send("{\"messageType\":\"request\",\"postId\":\"1\"}");
            }
        }));
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (transport != null) transport.close();
        server.shutdown();
    }

    @Test
    void exchanges_text_frames_with_remote_side() throws Exception {
        BlockingQueue<String> inbound = new ArrayBlockingQueue<>(8);
        transport = new OkHttpWebSocketTransport(server.url("/devtools").toString());
        transport.listen(frame -> inbound.offer(new String(frame, StandardCharsets.UTF_8)));

        transport.send("{\"messageType\":\"batch\",\"messages\":[]}".getBytes(StandardCharsets.UTF_8));

        assertThat(serverReceived.poll(5, TimeUnit.SECONDS)).isEqualTo("{\"messageType\":\"batch\",\"messages\":[]}");
        assertThat(inbound.poll(5, TimeUnit.SECONDS)).contains("\"postId\":\"1\"");
    }

    @Test
    void send_after_close_fails() {
        transport = new OkHttpWebSocketTransport(server.url("/devtools").toString());
        transport.close();

        assertThat(transport.isOpen()).isFalse();
        assertThatThrownBy(() -> transport.send(new byte[] {'x'})).isInstanceOf(IOException.class);
    }
}
