package com.streamspy.collection.core.snapshot;

import java.util.List;

public record ObservableSnapshot(String id, String path, String tag, String type, List<String> subscriptions, long tick) {
    public ObservableSnapshot {
        subscriptions = List.copyOf(subscriptions);
    }
}
