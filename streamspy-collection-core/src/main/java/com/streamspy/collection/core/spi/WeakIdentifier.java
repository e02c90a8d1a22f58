package com.streamspy.collection.core.spi;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sequential ids held in a weak-keyed cache. Weak keys compare by identity, so two equal but
 * distinct objects get distinct ids, and ids of collected objects are released.
 */
public final class WeakIdentifier implements Identifier {
    private final AtomicLong sequence = new AtomicLong();
    private final Cache<Object, String> ids = Caffeine.newBuilder().weakKeys().build();

    @Override
    public String identify(Object target) {
        Objects.requireNonNull(target, "target");
        return ids.get(target, k -> next());
    }

    @Override
    public String fresh() {
        return next();
    }

    private String next() {
        return Long.toString(sequence.incrementAndGet());
    }
}
