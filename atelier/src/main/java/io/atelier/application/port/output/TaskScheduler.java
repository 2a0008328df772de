package io.atelier.application.port.output;

import java.time.Duration;

/**
 * Single-shot delayed execution. Backs the idle watchdog and the analysis ticks so
 * tests can drive them in virtual time.
 */
public interface TaskScheduler {

    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Handle to a pending task.
     */
    interface ScheduledTask {
        /**
         * Cancel the task if it has not started. Idempotent.
         */
        void cancel();

        boolean isDone();
    }
}
