package com.streamspy.model;

/** Whether a notification was observed before or after the underlying call ran. */
public enum Phase {
    BEFORE("before"),
    AFTER("after");

    private final String wireName;

    Phase(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Wire type of a notification in this phase, e.g. {@code before-next}. */
    public String typeOf(Notification notification) {
        return wireName + "-" + notification.wireName();
    }
}
