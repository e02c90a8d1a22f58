package com.streamspy.devtools.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

/**
 * Structural links of one subscription, as subscription ids. {@code sink} and {@code rootSink}
 * are {@code null} at a graph root.
 */
@JsonInclude(Include.ALWAYS)
public record GraphPayload(
        List<String> flats,
        boolean flatsFlushed,
        String rootSink,
        String sink,
        List<String> sources,
        boolean sourcesFlushed) {

    public GraphPayload {
        flats = List.copyOf(flats);
        sources = List.copyOf(sources);
    }
}
