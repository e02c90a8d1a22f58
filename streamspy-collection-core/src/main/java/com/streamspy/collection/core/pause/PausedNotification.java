package com.streamspy.collection.core.pause;

import com.streamspy.model.Notification;
import com.streamspy.model.SubscriptionRef;

/** A notification admitted to a deck; {@code value} is the next value or the error, if any. */
public record PausedNotification(SubscriptionRef ref, Notification notification, Object value, long tick) {}
