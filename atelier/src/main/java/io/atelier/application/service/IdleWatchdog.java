package io.atelier.application.service;

import io.atelier.application.port.output.TaskScheduler;
import io.atelier.application.port.output.TaskScheduler.ScheduledTask;
import io.atelier.domain.event.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Turns event silence into a synthetic {@code user_idle} event.
 *
 * <p>Every {@link #reset} cancels the pending timer and schedules a new one. When a timer
 * expires, the idle event (idle time = now - last activity) goes to the sink, which is the
 * orchestrator's event handler and resets the watchdog again. The loop only ends with
 * {@link #stop()}.
 *
 * <p>At most one timer is pending. Each schedule gets a generation number; a timer whose
 * generation is stale when it runs does nothing, which covers a timer that started just as
 * it was being cancelled. All state is guarded by the shared orchestrator monitor.
 */
public final class IdleWatchdog {
    private static final Logger log = LoggerFactory.getLogger(IdleWatchdog.class);

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Object monitor;
    private final Consumer<DomainEvent> sink;

    private ScheduledTask pending;
    private long generation = 0;
    private Instant lastActivity;
    private boolean stopped = false;

    public IdleWatchdog(TaskScheduler scheduler, Clock clock, Object monitor, Consumer<DomainEvent> sink) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.monitor = monitor;
        this.sink = sink;
        this.lastActivity = clock.instant();
    }

    /**
     * Record activity and restart the countdown.
     */
    public void reset(Instant activityAt, Duration delay) {
        synchronized (monitor) {
            lastActivity = activityAt;
            cancelPending();
            if (stopped) {
                return;
            }
            long scheduledGeneration = ++generation;
            pending = scheduler.schedule(() -> fire(scheduledGeneration), delay);
            log.debug("Idle timer #{} scheduled in {}ms", scheduledGeneration, delay.toMillis());
        }
    }

    /**
     * Cancel the pending timer and refuse further scheduling.
     */
    public void stop() {
        synchronized (monitor) {
            if (stopped) {
                return;
            }
            stopped = true;
            cancelPending();
            generation++;
            log.info("Idle watchdog stopped");
        }
    }

    public boolean hasPendingTimer() {
        synchronized (monitor) {
            return pending != null && !pending.isDone();
        }
    }

    public Instant lastActivity() {
        synchronized (monitor) {
            return lastActivity;
        }
    }

    private void fire(long firedGeneration) {
        synchronized (monitor) {
            if (stopped || firedGeneration != generation) {
                log.debug("Stale idle timer #{} ignored", firedGeneration);
                return;
            }
            pending = null;

            Instant now = clock.instant();
            long idleMs = Math.max(0, Duration.between(lastActivity, now).toMillis());
            log.debug("Idle timer #{} fired after {}ms of inactivity", firedGeneration, idleMs);

            try {
                sink.accept(DomainEvent.idle(idleMs, now));
            } catch (RuntimeException e) {
                log.error("Idle event handling failed", e);
            }
        }
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }
}
