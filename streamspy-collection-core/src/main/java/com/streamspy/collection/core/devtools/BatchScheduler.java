package com.streamspy.collection.core.devtools;

/** Runs a batch flush once after a delay. */
public interface BatchScheduler {
    Scheduled schedule(Runnable task, long delayMillis);

    /** Handle of a pending task. */
    interface Scheduled {
        /** Prevents the task from running if it has not started yet. */
        void cancel();
    }
}
