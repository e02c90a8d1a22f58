package com.streamspy.devtools.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.Objects;

/**
 * Serializable form of one lifecycle notification. Absent tag, error, graph and stack trace are
 * written as explicit {@code null}s; {@code value} is omitted unless the notification is a
 * {@code next} or an {@code error}.
 */
@JsonInclude(Include.ALWAYS)
public record NotificationPayload(
        String id,
        ObservableDescriptor observable,
        SubscriberDescriptor subscriber,
        SubscriptionDescriptor subscription,
        long tick,
        long timestamp,
        String type,
        @JsonInclude(Include.NON_NULL) ValuePayload value) {

    public NotificationPayload {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(observable, "observable");
        Objects.requireNonNull(subscriber, "subscriber");
        Objects.requireNonNull(subscription, "subscription");
        Objects.requireNonNull(type, "type");
    }

    @JsonInclude(Include.ALWAYS)
    public record ObservableDescriptor(String id, String path, String tag, String type) {}

    public record SubscriberDescriptor(String id) {}

    @JsonInclude(Include.ALWAYS)
    public record SubscriptionDescriptor(ValuePayload error, GraphPayload graph, String id, Object stackTrace) {}
}
