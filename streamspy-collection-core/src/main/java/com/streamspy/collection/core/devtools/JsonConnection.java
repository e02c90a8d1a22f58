package com.streamspy.collection.core.devtools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamspy.client.transport.MessageTransport;
import com.streamspy.devtools.model.Message;
import com.streamspy.devtools.model.Request;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link Connection} that exchanges JSON text frames over a {@link MessageTransport}.
 *
 * <p>Encode and send failures are logged and the message is dropped. Inbound frames that do not
 * parse as a post are logged and ignored.
 */
@Slf4j
public class JsonConnection implements Connection {
    private final MessageTransport transport;
    private final ObjectMapper mapper;
    private final List<Consumer<Request>> subscribers = new CopyOnWriteArrayList<>();
    private volatile boolean disconnected;

    public JsonConnection(MessageTransport transport) {
        this(transport, new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public JsonConnection(MessageTransport transport, ObjectMapper mapper) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        transport.listen(this::onFrame);
    }

    @Override
    public AutoCloseable subscribe(Consumer<Request> onPost) {
        Objects.requireNonNull(onPost, "onPost");
        subscribers.add(onPost);
        return () -> subscribers.remove(onPost);
    }

    @Override
    public void post(Message message) {
        if (disconnected) {
            log.debug("Dropping {} posted after disconnect", message.messageType());
            return;
        }
        try {
            transport.send(mapper.writeValueAsBytes(message));
        } catch (JsonProcessingException ex) {
            log.warn("Cannot encode {} message: {}", message.messageType(), ex.toString());
        } catch (IOException ex) {
            log.warn("Send failure on {}: {}", transport.endpoint(), ex.toString());
        }
    }

    @Override
    public void disconnect() {
        if (disconnected) return;
        disconnected = true;
        subscribers.clear();
        try {
            transport.close();
        } catch (IOException ex) {
            log.warn("Close failure on {}: {}", transport.endpoint(), ex.toString());
        }
        log.info("Disconnected from {}", transport.endpoint());
    }

    public boolean isDisconnected() {
        return disconnected;
    }

    private void onFrame(byte[] frame) {
        Request post;
        try {
            post = mapper.readValue(frame, Request.class);
        } catch (IOException ex) {
            log.warn("Ignoring malformed post ({} bytes): {}", frame.length, ex.toString());
            log.debug("Malformed post: {}", new String(frame, StandardCharsets.UTF_8));
            return;
        }
        for (Consumer<Request> subscriber : subscribers) {
            try {
                subscriber.accept(post);
            } catch (RuntimeException ex) {
                log.warn("Post handler failure: {}", ex.toString());
            }
        }
    }
}
