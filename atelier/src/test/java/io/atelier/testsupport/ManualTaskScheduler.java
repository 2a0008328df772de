package io.atelier.testsupport;

import io.atelier.application.port.output.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Virtual-time {@link TaskScheduler}. Nothing runs until {@link #advanceBy} is called;
 * due tasks then run in (due time, submission order) and the clock is moved to each
 * task's due time before it runs.
 */
public final class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock;
    private final List<Entry> queue = new ArrayList<>();
    private long sequence = 0;

    public ManualTaskScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable task, Duration delay) {
        Entry entry = new Entry(clock.instant().plus(delay), sequence++, task);
        queue.add(entry);
        return entry;
    }

    /**
     * Move virtual time forward, running every task that comes due on the way.
     */
    public void advanceBy(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Entry next = nextDue(target);
            if (next == null) {
                break;
            }
            if (next.due.isAfter(clock.instant())) {
                clock.set(next.due);
            }
            next.run();
        }
        clock.set(target);
    }

    /**
     * @return tasks scheduled and neither run nor cancelled
     */
    public synchronized int pendingCount() {
        int count = 0;
        for (Entry entry : queue) {
            if (!entry.isDone()) {
                count++;
            }
        }
        return count;
    }

    private synchronized Entry nextDue(Instant target) {
        queue.removeIf(Entry::isDone);
        return queue.stream()
            .filter(e -> !e.due.isAfter(target))
            .min(Comparator.comparing((Entry e) -> e.due).thenComparingLong(e -> e.sequence))
            .orElse(null);
    }

    private static final class Entry implements ScheduledTask {
        private final Instant due;
        private final long sequence;
        private final Runnable task;
        private volatile boolean cancelled;
        private volatile boolean ran;

        Entry(Instant due, long sequence, Runnable task) {
            this.due = due;
            this.sequence = sequence;
            this.task = task;
        }

        void run() {
            ran = true;
            task.run();
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isDone() {
            return cancelled || ran;
        }
    }
}
