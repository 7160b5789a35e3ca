package org.eventstatus.services;

import org.eventstatus.config.utils.LogContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private TaskScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) scheduler.shutdown();
    }

    /**
     * Task whose first execution blocks until {@link #release()}.
     */
    private static final class BlockingTask implements ScheduledTask {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch gate = new CountDownLatch(1);
        final AtomicInteger executions = new AtomicInteger();
        final AtomicInteger concurrent = new AtomicInteger();
        final AtomicInteger maxConcurrent = new AtomicInteger();
        private final long interval;

        BlockingTask(long interval) {
            this.interval = interval;
        }

        @Override public String name() { return "blocking"; }
        @Override public long intervalSeconds() { return interval; }

        @Override
        public void execute() {
            int now = concurrent.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            executions.incrementAndGet();
            entered.countDown();
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                concurrent.decrementAndGet();
            }
        }

        void release() {
            gate.countDown();
        }
    }

    /**
     * System clock that can be stepped, like an NTP correction or a resumed VM.
     */
    private static final class SteppingClock extends Clock {
        private final AtomicReference<Duration> offset = new AtomicReference<>(Duration.ZERO);

        void step(Duration by) {
            offset.updateAndGet(current -> current.plus(by));
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return Instant.now().plus(offset.get()); }
    }

    private static ScheduledTask task(String name, long interval, Runnable body) {
        return new ScheduledTask() {
            @Override public String name() { return name; }
            @Override public long intervalSeconds() { return interval; }
            @Override public void execute() { body.run(); }
        };
    }

    private TaskStatus status(String name) {
        for (TaskStatus status : scheduler.statuses()) {
            if (status.name().equals(name)) return status;
        }
        throw new AssertionError("no task " + name);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("condition not met in time");
            Thread.sleep(10);
        }
    }

    @Test
    void overlappingTriggerIsDroppedWhenCoalescing() throws Exception {
        scheduler = new TaskScheduler(2, Duration.ofSeconds(5), true);
        BlockingTask blocking = new BlockingTask(3600);
        scheduler.register(blocking);

        assertEquals(TaskScheduler.RunResult.QUEUED, scheduler.runNow("blocking"));
        assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));
        assertEquals(TaskScheduler.RunResult.IN_PROGRESS, scheduler.runNow("blocking"));
        assertTrue(status("blocking").running());

        blocking.release();
        awaitCondition(() -> !status("blocking").running());

        TaskStatus status = status("blocking");
        assertEquals(1, status.runs());
        assertEquals(1, status.dropped());
        assertEquals(1, blocking.executions.get());
        assertEquals(1, blocking.maxConcurrent.get());
    }

    @Test
    void overlappingTriggerRunsAfterwardsWithoutCoalescing() throws Exception {
        scheduler = new TaskScheduler(4, Duration.ofSeconds(5), false);
        BlockingTask blocking = new BlockingTask(3600);
        scheduler.register(blocking);

        assertEquals(TaskScheduler.RunResult.QUEUED, scheduler.runNow("blocking"));
        assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));
        assertEquals(TaskScheduler.RunResult.DEFERRED, scheduler.runNow("blocking"));

        blocking.release();
        awaitCondition(() -> status("blocking").runs() == 2 && !status("blocking").running());

        assertEquals(2, blocking.executions.get());
        assertEquals(1, blocking.maxConcurrent.get());
        assertEquals(0, status("blocking").dropped());
    }

    @Test
    void lateTriggerBeyondGraceIsDiscarded() throws Exception {
        Instant now = Instant.parse("2025-01-01T12:00:00Z");
        scheduler = new TaskScheduler(2, Duration.ofSeconds(5), true, Clock.fixed(now, ZoneOffset.UTC), () -> 0L);
        AtomicInteger runs = new AtomicInteger();
        scheduler.register(task("late", 60, runs::incrementAndGet));

        assertEquals(TaskScheduler.RunResult.MISFIRED, scheduler.trigger("late", Duration.ofSeconds(10)));
        assertEquals(1, status("late").misfires());

        assertEquals(TaskScheduler.RunResult.QUEUED, scheduler.trigger("late", Duration.ofSeconds(3)));
        awaitCondition(() -> status("late").runs() == 1 && !status("late").running());

        assertEquals(1, runs.get());
        assertEquals(now, status("late").lastStartedAt());
    }

    @Test
    void deferredTriggerThatAgedPastGraceIsDiscarded() throws Exception {
        AtomicLong ticker = new AtomicLong();
        scheduler = new TaskScheduler(2, Duration.ofSeconds(5), false, Clock.systemUTC(), ticker::get);
        BlockingTask blocking = new BlockingTask(3600);
        scheduler.register(blocking);

        assertEquals(TaskScheduler.RunResult.QUEUED, scheduler.runNow("blocking"));
        assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));
        assertEquals(TaskScheduler.RunResult.DEFERRED, scheduler.runNow("blocking"));

        ticker.addAndGet(TimeUnit.SECONDS.toNanos(10));
        blocking.release();
        awaitCondition(() -> !status("blocking").running());

        assertEquals(1, blocking.executions.get());
        assertEquals(1, status("blocking").misfires());
    }

    @Test
    void wallClockStepDoesNotStopTheTimer() throws Exception {
        SteppingClock clock = new SteppingClock();
        scheduler = new TaskScheduler(2, Duration.ofSeconds(1), true, clock);
        AtomicInteger runs = new AtomicInteger();
        scheduler.register(task("tick", 1, runs::incrementAndGet));

        scheduler.start();
        awaitCondition(() -> runs.get() >= 1);

        clock.step(Duration.ofHours(1));
        Instant stepped = Instant.now().plus(Duration.ofMinutes(30));
        int before = runs.get();
        awaitCondition(() -> runs.get() >= before + 2
                && status("tick").lastStartedAt().isAfter(stepped));

        assertEquals(0, status("tick").misfires());
    }

    @Test
    void timerTriggersDelayedByBusyPoolAreDiscardedThenResume() throws Exception {
        scheduler = new TaskScheduler(1, Duration.ofMillis(500), true);
        BlockingTask blocking = new BlockingTask(3600);
        AtomicInteger ticks = new AtomicInteger();
        scheduler.register(blocking);
        scheduler.register(task("tick", 1, ticks::incrementAndGet));

        scheduler.start();
        assertEquals(TaskScheduler.RunResult.QUEUED, scheduler.runNow("blocking"));
        assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));

        // the only pool thread is held, so the 1s and 2s timers cannot fire on time
        Thread.sleep(3500);
        assertEquals(0, ticks.get());
        blocking.release();

        awaitCondition(() -> ticks.get() >= 2);
        assertTrue(status("tick").misfires() >= 2);
    }

    @Test
    void failingTaskIsRecordedAndKeepsRunning() throws Exception {
        scheduler = new TaskScheduler(2, Duration.ofSeconds(5), true);
        scheduler.register(task("failing", 60, () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(TaskScheduler.RunResult.QUEUED, scheduler.runNow("failing"));
        awaitCondition(() -> status("failing").runs() == 1 && !status("failing").running());

        TaskStatus status = status("failing");
        assertEquals(1, status.failures());
        assertEquals("boom", status.lastError());

        assertEquals(TaskScheduler.RunResult.QUEUED, scheduler.runNow("failing"));
        awaitCondition(() -> status("failing").runs() == 2);
        assertEquals(2, status("failing").failures());
    }

    @Test
    void shutdownWaitsForRunningTask() throws Exception {
        scheduler = new TaskScheduler(2, Duration.ofSeconds(5), true);
        BlockingTask blocking = new BlockingTask(3600);
        AtomicBoolean finished = new AtomicBoolean();
        scheduler.register(task("blocking", 3600, () -> {
            blocking.execute();
            finished.set(true);
        }));

        scheduler.runNow("blocking");
        assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));

        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            blocking.release();
        });
        releaser.start();

        scheduler.shutdown();

        assertTrue(finished.get());
        assertTrue(scheduler.isStopping());
        assertEquals(TaskScheduler.RunResult.STOPPED, scheduler.runNow("blocking"));
        releaser.join();
    }

    @Test
    void unknownTaskIsReported() {
        scheduler = new TaskScheduler(2, Duration.ofSeconds(5), true);

        assertEquals(TaskScheduler.RunResult.UNKNOWN, scheduler.runNow("missing"));
    }

    @Test
    void registrationRules() {
        scheduler = new TaskScheduler(2, Duration.ofSeconds(5), true);

        assertThrows(IllegalArgumentException.class, () -> scheduler.register(task("zero", 0, () -> {})));

        scheduler.register(task("job", 60, () -> {}));
        scheduler.register(task("job", 120, () -> {}));
        List<TaskStatus> statuses = scheduler.statuses();
        assertEquals(1, statuses.size());
        assertEquals(120, statuses.get(0).intervalSeconds());

        scheduler.start();
        assertThrows(IllegalStateException.class, () -> scheduler.register(task("other", 60, () -> {})));
    }

    @Test
    void timerFiresRepeatedly() throws Exception {
        scheduler = new TaskScheduler(2, Duration.ofSeconds(5), true);
        CountDownLatch twice = new CountDownLatch(2);
        scheduler.register(task("tick", 1, twice::countDown));

        scheduler.start();

        assertTrue(twice.await(10, TimeUnit.SECONDS));
    }

    @Test
    void eachRunGetsItsOwnLogContext() throws Exception {
        scheduler = new TaskScheduler(2, Duration.ofSeconds(5), true);
        AtomicReference<String> component = new AtomicReference<>();
        AtomicReference<String> traceId = new AtomicReference<>();
        scheduler.register(task("traced", 60, () -> {
            component.set(MDC.get("component"));
            traceId.set(LogContext.getTraceId());
        }));

        scheduler.runNow("traced");
        awaitCondition(() -> status("traced").runs() == 1);

        assertEquals("traced", component.get());
        assertNotNull(traceId.get());
    }
}
