package com.streamspy.collection.core.devtools;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** {@link BatchScheduler} backed by a single daemon thread. */
public class ExecutorBatchScheduler implements BatchScheduler, AutoCloseable {
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final ScheduledExecutorService executor;

    public ExecutorBatchScheduler() {
        int n = SEQUENCE.incrementAndGet();
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r);
            thread.setDaemon(true);
            thread.setName("streamspy-batch-" + n);
            return thread;
        });
    }

    @Override
    public Scheduled schedule(Runnable task, long delayMillis) {
        ScheduledFuture<?> future = executor.schedule(task, delayMillis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
