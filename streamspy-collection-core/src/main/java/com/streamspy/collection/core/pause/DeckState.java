package com.streamspy.collection.core.pause;

public enum DeckState {
    RUNNING,
    PAUSED
}
