package work.lcod.orbital.behavior;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.orbital.flow.TimerCoordinator;

/**
 * Runs instance ticks periodically. Ticks sharing an interval run together, highest priority
 * first, in one scheduled task.
 */
final class TickScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TickScheduler.class);

    private final ScheduledExecutorService executor;
    private final Map<BehaviorInstance, List<ScheduledFuture<?>>> scheduled = new ConcurrentHashMap<>();

    TickScheduler(int threads) {
        this.executor = Executors.newScheduledThreadPool(threads, TimerCoordinator.daemonThreads("orbital-tick"));
    }

    int schedule(BehaviorInstance instance) {
        var byInterval = new LinkedHashMap<Long, List<Tick>>();
        for (var tick : instance.ticksByPriority()) {
            var interval = instance.tickInterval(tick);
            if (interval.isEmpty()) {
                LOG.debug("Tick {} of {} has no interval; not scheduled", tick.name(), instance.id());
                continue;
            }
            byInterval.computeIfAbsent(interval.get().toMillis(), key -> new ArrayList<>()).add(tick);
        }
        var futures = new ArrayList<ScheduledFuture<?>>();
        byInterval.forEach((millis, ticks) -> futures.add(executor.scheduleAtFixedRate(
            () -> run(instance, ticks), millis, millis, TimeUnit.MILLISECONDS)));
        var previous = scheduled.put(instance, futures);
        if (previous != null) {
            previous.forEach(future -> future.cancel(false));
        }
        return futures.size();
    }

    private void run(BehaviorInstance instance, List<Tick> ticks) {
        if (instance.isClosed()) {
            cancel(instance);
            return;
        }
        try {
            instance.runTicks(ticks);
        } catch (RuntimeException ex) {
            LOG.error("Ticks of {} failed", instance.id(), ex);
        }
    }

    void cancel(BehaviorInstance instance) {
        var futures = scheduled.remove(instance);
        if (futures != null) {
            futures.forEach(future -> future.cancel(false));
        }
    }

    @Override
    public void close() {
        scheduled.values().forEach(futures -> futures.forEach(future -> future.cancel(false)));
        scheduled.clear();
        executor.shutdownNow();
    }
}
