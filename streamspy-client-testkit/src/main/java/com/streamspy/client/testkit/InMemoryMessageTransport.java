package com.streamspy.client.testkit;

import com.streamspy.client.transport.MessageTransport;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/** Test double that records sent frames in memory and lets a test play the remote side. */
public class InMemoryMessageTransport implements MessageTransport {
    private final List<byte[]> frames = new ArrayList<>();
    private volatile Consumer<byte[]> listener;
    private volatile boolean closed;

    @Override
    public synchronized void send(byte[] frame) throws IOException {
        if (closed) throw new IOException("transport closed");
        frames.add(frame);
    }

    @Override
    public void listen(Consumer<byte[]> listener) {
        this.listener = listener;
    }

    /** Delivers a frame as if the remote side had sent it. */
    public void receive(String frame) {
        Consumer<byte[]> current = listener;
        if (current != null) current.accept(frame.getBytes(StandardCharsets.UTF_8));
    }

    public synchronized List<byte[]> frames() {
        return List.copyOf(frames);
    }

    public synchronized List<String> texts() {
        List<String> texts = new ArrayList<>(frames.size());
        for (byte[] frame : frames) texts.add(new String(frame, StandardCharsets.UTF_8));
        return texts;
    }

    public boolean hasListener() {
        return listener != null;
    }

    public boolean isClosed() {
        return closed;
    }

    public synchronized void clear() {
        frames.clear();
    }

    @Override
    public void close() {
        closed = true;
        listener = null;
    }
}
