package com.streamspy.collection.core.devtools;

import com.streamspy.devtools.model.Message;
import com.streamspy.devtools.model.Request;
import java.util.function.Consumer;

/** Opaque link to the remote inspector. */
public interface Connection {
    /** Registers a consumer of inbound posts; closing the handle unregisters it. */
    AutoCloseable subscribe(Consumer<Request> onPost);

    void post(Message message);

    void disconnect();
}
