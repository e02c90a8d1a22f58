package com.streamspy.collection.core.snapshot;

import java.util.LinkedHashSet;
import java.util.Set;

final class ObservableRecord {
    final String id;
    final String path;
    final String tag;
    final String type;
    final Set<String> subscriptions = new LinkedHashSet<>();
    long tick;

    ObservableRecord(String id, String path, String tag, String type) {
        this.id = id;
        this.path = path;
        this.tag = tag;
        this.type = type;
    }
}
