package com.streamspy.collection.core.pause;

import java.util.Locale;
import java.util.Optional;

/** Commands a remote inspector can issue to a deck. */
public enum DeckCommand {
    CLEAR,
    PAUSE,
    RESUME,
    SKIP,
    STEP,
    /** Recognized but not supported; the host answers it with an error. */
    INSPECT;

    public static Optional<DeckCommand> parse(String command) {
        if (command == null) return Optional.empty();
        for (DeckCommand candidate : values()) {
            if (candidate.name().toLowerCase(Locale.ROOT).equals(command)) return Optional.of(candidate);
        }
        return Optional.empty();
    }
}
