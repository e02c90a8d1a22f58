package com.streamspy.model;

/** Lifecycle notification kinds, named as they appear on the wire. */
public enum Notification {
    SUBSCRIBE("subscribe"),
    NEXT("next"),
    ERROR("error"),
    COMPLETE("complete"),
    UNSUBSCRIBE("unsubscribe");

    private final String wireName;

    Notification(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Whether the notification carries a value (the next value or the error). */
    public boolean carriesValue() {
        return this == NEXT || this == ERROR;
    }
}
