package work.lcod.orbital.flow;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timer state shared by every evaluation: debounce timers and throttle timestamps keyed by event
 * name, plus the scheduler behind delays and timeouts. A single lock guards both maps.
 *
 * <p>The process-wide instance from {@link #global()} is created on first use; {@link #reset()}
 * clears its state (tests) and {@link #shutdown()} stops its scheduler.
 */
public final class TimerCoordinator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TimerCoordinator.class);
    private static final Object GLOBAL_LOCK = new Object();
    private static TimerCoordinator global;

    private final ScheduledExecutorService scheduler;
    private final LongSupplier clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Armed> debounceTimers = new HashMap<>();
    private final Map<String, Long> throttleTimestamps = new HashMap<>();

    private record Armed(Object token, ScheduledFuture<?> future) {}

    public TimerCoordinator() {
        this(Executors.newScheduledThreadPool(1, daemonThreads("orbital-timer")), System::currentTimeMillis);
    }

    public TimerCoordinator(ScheduledExecutorService scheduler, LongSupplier clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public static TimerCoordinator global() {
        synchronized (GLOBAL_LOCK) {
            if (global == null || global.scheduler.isShutdown()) {
                global = new TimerCoordinator();
            }
            return global;
        }
    }

    public CompletableFuture<Object> delay(long millis) {
        var future = new CompletableFuture<Object>();
        if (millis <= 0) {
            future.complete(null);
            return future;
        }
        scheduler.schedule(() -> future.complete(null), millis, TimeUnit.MILLISECONDS);
        return future;
    }

    public ScheduledFuture<?> schedule(Runnable task, long millis) {
        return scheduler.schedule(task, Math.max(0L, millis), TimeUnit.MILLISECONDS);
    }

    /**
     * Cancels any pending timer for {@code event} and arms a new one; {@code fire} runs only if no
     * further call arrives within {@code millis}.
     */
    public void debounce(String event, long millis, Runnable fire) {
        lock.lock();
        try {
            var previous = debounceTimers.remove(event);
            if (previous != null) {
                previous.future().cancel(false);
            }
            var token = new Object();
            var future = scheduler.schedule(() -> fireDebounced(event, token, fire), Math.max(0L, millis), TimeUnit.MILLISECONDS);
            debounceTimers.put(event, new Armed(token, future));
        } finally {
            lock.unlock();
        }
    }

    private void fireDebounced(String event, Object token, Runnable fire) {
        lock.lock();
        try {
            var armed = debounceTimers.get(event);
            if (armed == null || armed.token() != token) {
                return;
            }
            debounceTimers.remove(event);
        } finally {
            lock.unlock();
        }
        try {
            fire.run();
        } catch (RuntimeException ex) {
            LOG.error("Debounced emit of {} failed", event, ex);
        }
    }

    /**
     * Returns true and records the time when {@code event} has not fired within the last
     * {@code millis}; false when the call should be dropped.
     */
    public boolean throttle(String event, long millis) {
        lock.lock();
        try {
            long now = clock.getAsLong();
            var last = throttleTimestamps.get(event);
            if (last != null && now - last < millis) {
                return false;
            }
            throttleTimestamps.put(event, now);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int pendingDebounces() {
        lock.lock();
        try {
            return debounceTimers.size();
        } finally {
            lock.unlock();
        }
    }

    public void clearDebounceTimers() {
        lock.lock();
        try {
            debounceTimers.values().forEach(armed -> armed.future().cancel(false));
            debounceTimers.clear();
        } finally {
            lock.unlock();
        }
    }

    public void clearThrottleTimestamps() {
        lock.lock();
        try {
            throttleTimestamps.clear();
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        clearDebounceTimers();
        clearThrottleTimestamps();
    }

    public void shutdown() {
        reset();
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        shutdown();
    }

    public static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
