package org.eventstatus.services;

import org.eventstatus.config.utils.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * TaskScheduler runs registered ScheduledTasks on fixed intervals.
 * <ul>
 *     <li>At most one execution per task is in flight. A trigger that fires while the task
 *     is running is dropped when {@code coalesce} is set, otherwise deferred until the
 *     running execution ends.</li>
 *     <li>A trigger later than the misfire grace period is discarded instead of run late.
 *     Lateness is measured on the executor's monotonic time base, so wall-clock steps never
 *     turn on-time triggers into misfires. The {@link Clock} only stamps reported times.</li>
 *     <li>{@link #shutdown()} stops the timers and waits for in-flight executions; nothing is
 *     interrupted.</li>
 * </ul>
 */
public class TaskScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    private static final long SHUTDOWN_PROGRESS_SECONDS = 5;

    public enum RunResult {
        /** Handed to the pool for immediate execution. */
        QUEUED,
        /** Task already running; will run right after the current execution. */
        DEFERRED,
        /** Task already running; trigger coalesced into the current execution. */
        IN_PROGRESS,
        /** Trigger was later than the misfire grace period. */
        MISFIRED,
        /** No task registered under that name. */
        UNKNOWN,
        /** Scheduler is shutting down or not started. */
        STOPPED
    }

    private final ScheduledThreadPoolExecutor executor;
    private final Duration misfireGrace;
    private final boolean coalesce;
    private final long misfireGraceNanos;
    private final Clock clock;
    private final LongSupplier ticker;

    private final Map<String, TaskState> tasks = new LinkedHashMap<>();
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();

    private volatile boolean started;
    private volatile boolean stopping;

    public TaskScheduler(int poolSize, Duration misfireGrace, boolean coalesce) {
        this(poolSize, misfireGrace, coalesce, Clock.systemUTC());
    }

    public TaskScheduler(int poolSize, Duration misfireGrace, boolean coalesce, Clock clock) {
        this(poolSize, misfireGrace, coalesce, clock, System::nanoTime);
    }

    /**
     * @param ticker monotonic nanosecond source; must share its time base with the executor's timers
     */
    TaskScheduler(int poolSize, Duration misfireGrace, boolean coalesce, Clock clock, LongSupplier ticker) {
        this.executor = new ScheduledThreadPoolExecutor(poolSize);
        this.executor.setRemoveOnCancelPolicy(true);
        this.misfireGrace = misfireGrace;
        this.misfireGraceNanos = misfireGrace.toNanos();
        this.coalesce = coalesce;
        this.clock = clock;
        this.ticker = ticker;
    }

    /**
     * Register a task. A task registered under an existing name replaces it.
     */
    public synchronized void register(ScheduledTask task) {
        if (started || stopping) {
            throw new IllegalStateException("Cannot register " + task.name() + " after the scheduler started");
        }
        if (task.intervalSeconds() <= 0) {
            throw new IllegalArgumentException("Interval of " + task.name() + " must be positive");
        }
        if (tasks.put(task.name(), new TaskState(task)) != null) {
            logger.warn("Task {} was already registered, replacing it", task.name());
        }
    }

    /**
     * Start the fixed-rate timer of every registered task. First fire is one interval from now.
     */
    public synchronized void start() {
        if (started) {
            logger.warn("TaskScheduler already started");
            return;
        }
        if (stopping) {
            throw new IllegalStateException("TaskScheduler was shut down");
        }
        if (executor.getCorePoolSize() <= tasks.size()) {
            logger.warn("Pool size {} leaves no spare thread for timers with {} tasks; triggers may misfire",
                    executor.getCorePoolSize(), tasks.size());
        }
        long now = ticker.getAsLong();
        for (TaskState state : tasks.values()) {
            long interval = state.task.intervalSeconds();
            logger.info("Scheduling task {} every {}s (misfire grace {}s, coalesce={})",
                    state.task.name(), interval, misfireGrace.toSeconds(), coalesce);
            state.nextDueNanos = now + TimeUnit.SECONDS.toNanos(interval);
            futures.add(executor.scheduleAtFixedRate(() -> onTimer(state), interval, interval, TimeUnit.SECONDS));
        }
        started = true;
    }

    /**
     * Trigger a task outside its timer, subject to the same single-flight rules.
     */
    public RunResult runNow(String name) {
        TaskState state = lookup(name);
        if (state == null) return RunResult.UNKNOWN;
        return dispatch(state, ticker.getAsLong());
    }

    /**
     * Dispatch a trigger that became due {@code lateBy} ago.
     */
    RunResult trigger(String name, Duration lateBy) {
        TaskState state = lookup(name);
        if (state == null) return RunResult.UNKNOWN;
        return dispatch(state, ticker.getAsLong() - lateBy.toNanos());
    }

    public synchronized List<TaskStatus> statuses() {
        List<TaskStatus> snapshot = new ArrayList<>(tasks.size());
        for (TaskState state : tasks.values()) {
            snapshot.add(state.snapshot());
        }
        return snapshot;
    }

    public boolean isStopping() {
        return stopping;
    }

    /**
     * Stop all timers, drop deferred triggers and block until running tasks finish.
     */
    public void shutdown() {
        synchronized (this) {
            stopping = true;
            for (ScheduledFuture<?> future : futures) future.cancel(false);
            futures.clear();
        }
        logger.info("[--------- Shutting down TaskScheduler ---------]");
        executor.shutdown();
        try {
            while (!executor.awaitTermination(SHUTDOWN_PROGRESS_SECONDS, TimeUnit.SECONDS)) {
                logger.info("Waiting for running tasks to finish: {}", runningTaskNames());
            }
            logger.info("[--------- TaskScheduler stopped ---------]");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("TaskScheduler shutdown interrupted.");
        }
    }

    private synchronized TaskState lookup(String name) {
        return tasks.get(name);
    }

    private synchronized List<String> runningTaskNames() {
        List<String> names = new ArrayList<>();
        for (TaskState state : tasks.values()) {
            if (state.snapshot().running()) names.add(state.task.name());
        }
        return names;
    }

    private void onTimer(TaskState state) {
        // An exception escaping here would silently cancel the periodic timer.
        try {
            long dueNanos = state.nextDueNanos;
            state.nextDueNanos = dueNanos + TimeUnit.SECONDS.toNanos(state.task.intervalSeconds());
            dispatch(state, dueNanos);
        } catch (RuntimeException e) {
            logger.error("Timer of task {} failed: {}", state.task.name(), e.getMessage(), e);
        }
    }

    private RunResult dispatch(TaskState state, long dueNanos) {
        String name = state.task.name();
        if (stopping) {
            logger.debug("Ignoring trigger of {}: scheduler is stopping", name);
            return RunResult.STOPPED;
        }
        if (isMisfire(dueNanos)) {
            recordMisfire(state, dueNanos);
            return RunResult.MISFIRED;
        }

        synchronized (state) {
            if (state.running) {
                if (coalesce) {
                    state.dropped.incrementAndGet();
                    logger.info("Task {} is still running, trigger coalesced", name);
                    return RunResult.IN_PROGRESS;
                }
                state.deferred.addLast(dueNanos);
                logger.info("Task {} is still running, trigger deferred ({} waiting)",
                        name, state.deferred.size());
                return RunResult.DEFERRED;
            }
            state.running = true;
        }

        try {
            executor.execute(() -> runLoop(state));
            return RunResult.QUEUED;
        } catch (RejectedExecutionException e) {
            synchronized (state) {
                state.running = false;
                state.deferred.clear();
            }
            logger.debug("Trigger of {} rejected: scheduler is stopping", name);
            return RunResult.STOPPED;
        }
    }

    private void runLoop(TaskState state) {
        boolean completed = false;
        try {
            boolean more = true;
            while (more) {
                if (!stopping) {
                    runTaskWithLogging(state);
                }
                more = takeDeferred(state);
            }
            completed = true;
        } finally {
            if (!completed) {
                synchronized (state) {
                    state.running = false;
                    state.deferred.clear();
                }
            }
        }
    }

    /**
     * Consumes the next deferred trigger still within grace, or marks the task idle and returns false.
     * Both happen under the task lock so a trigger can never slip between them.
     */
    private boolean takeDeferred(TaskState state) {
        synchronized (state) {
            Long dueNanos;
            while ((dueNanos = state.deferred.pollFirst()) != null) {
                if (stopping) continue;
                if (isMisfire(dueNanos)) {
                    recordMisfire(state, dueNanos);
                    continue;
                }
                return true;
            }
            state.running = false;
            return false;
        }
    }

    private void runTaskWithLogging(TaskState state) {
        ScheduledTask task = state.task;
        LogContext.start(task.name());
        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        String errorMessage = null;
        try {
            task.execute();
        } catch (Exception e) {
            errorMessage = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            state.failures.incrementAndGet();
            logger.error("Error in scheduled task {}: {}", task.name(), errorMessage, e);
        } finally {
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            state.runs.incrementAndGet();
            state.lastStartedAt = startedAt;
            state.lastDurationMillis = durationMillis;
            state.lastError = errorMessage;
            logger.debug("Task {} finished in {} ms", task.name(), durationMillis);
            LogContext.clear();
        }
    }

    private boolean isMisfire(long dueNanos) {
        return ticker.getAsLong() - dueNanos > misfireGraceNanos;
    }

    private void recordMisfire(TaskState state, long dueNanos) {
        state.misfires.incrementAndGet();
        logger.warn("Run time of task {} was missed by {} ms, discarding trigger",
                state.task.name(), TimeUnit.NANOSECONDS.toMillis(ticker.getAsLong() - dueNanos));
    }

    private static final class TaskState {
        final ScheduledTask task;
        // due times on the ticker's time base
        final Deque<Long> deferred = new ArrayDeque<>();
        final AtomicLong runs = new AtomicLong();
        final AtomicLong failures = new AtomicLong();
        final AtomicLong misfires = new AtomicLong();
        final AtomicLong dropped = new AtomicLong();

        // guarded by this
        boolean running;

        // only touched by the task's own timer
        volatile long nextDueNanos;

        volatile Instant lastStartedAt;
        volatile long lastDurationMillis;
        volatile String lastError;

        TaskState(ScheduledTask task) {
            this.task = task;
        }

        TaskStatus snapshot() {
            boolean isRunning;
            synchronized (this) {
                isRunning = running;
            }
            return new TaskStatus(task.name(), task.intervalSeconds(), isRunning, lastStartedAt,
                    lastDurationMillis, lastError, runs.get(), failures.get(), misfires.get(), dropped.get());
        }
    }
}
