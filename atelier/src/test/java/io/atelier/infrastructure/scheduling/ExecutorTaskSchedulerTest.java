package io.atelier.infrastructure.scheduling;

import io.atelier.application.port.output.TaskScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExecutorTaskScheduler.
 *
 * Tests:
 * - Delayed execution on the worker thread
 * - Cancellation before the delay elapses
 * - A throwing task does not kill the worker
 * - Shutdown
 */
class ExecutorTaskSchedulerTest {

    private ExecutorTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ExecutorTaskScheduler("test");
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void testTaskRunsOnDaemonThread() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);
        List<Thread> threads = Collections.synchronizedList(new ArrayList<>());

        scheduler.schedule(() -> {
            threads.add(Thread.currentThread());
            ran.countDown();
        }, Duration.ofMillis(20));

        assertTrue(ran.await(2, TimeUnit.SECONDS), "Task should run");
        assertTrue(threads.get(0).isDaemon());
        assertEquals("atelier-test", threads.get(0).getName());
    }

    @Test
    void testCancelledTaskNeverRuns() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);

        TaskScheduler.ScheduledTask task = scheduler.schedule(() -> ran.set(true), Duration.ofMillis(200));
        task.cancel();
        task.cancel();

        Thread.sleep(400);
        assertFalse(ran.get(), "Cancelled task must not run");
        assertTrue(task.isDone());
    }

    @Test
    void testThrowingTaskDoesNotStopWorker() throws InterruptedException {
        CountDownLatch second = new CountDownLatch(1);

        scheduler.schedule(() -> {
            throw new IllegalStateException("boom");
        }, Duration.ZERO);
        scheduler.schedule(second::countDown, Duration.ofMillis(10));

        assertTrue(second.await(2, TimeUnit.SECONDS), "Worker survives a failing task");
    }

    @Test
    void testShutdown() {
        scheduler.shutdown();

        assertTrue(scheduler.isShutdown());
    }
}
