package com.streamspy.collection.core.spi;

import com.streamspy.model.SubscriptionRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Captures the current thread's stack as a list of frame strings. Leading frames that belong to
 * the capture machinery itself are dropped, so the first entry is the code that subscribed.
 */
public class ThreadStackTraceProvider implements StackTraceProvider {
    private static final int DEFAULT_MAX_FRAMES = 16;
    private static final Set<String> CAPTURE_CLASSES = Set.of(
            Thread.class.getName(),
            ThreadStackTraceProvider.class.getName(),
            "com.streamspy.collection.core.stacktrace.StackTracePlugin",
            "com.streamspy.collection.core.spy.Spy");

    private final int maxFrames;

    public ThreadStackTraceProvider() {
        this(DEFAULT_MAX_FRAMES);
    }

    public ThreadStackTraceProvider(int maxFrames) {
        if (maxFrames <= 0) throw new IllegalArgumentException("maxFrames must be positive");
        this.maxFrames = maxFrames;
    }

    @Override
    public List<String> getStackTrace(SubscriptionRef ref) {
        StackTraceElement[] elements = Thread.currentThread().getStackTrace();
        int start = 0;
        while (start < elements.length && isCaptureFrame(elements[start])) start++;
        List<String> frames = new ArrayList<>();
        for (int i = start; i < elements.length && frames.size() < maxFrames; i++) {
            frames.add(elements[i].toString());
        }
        return List.copyOf(frames);
    }

    private static boolean isCaptureFrame(StackTraceElement element) {
        String cls = element.getClassName();
        int nested = cls.indexOf('$');
        return CAPTURE_CLASSES.contains(nested < 0 ? cls : cls.substring(0, nested));
    }
}
