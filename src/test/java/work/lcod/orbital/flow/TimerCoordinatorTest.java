package work.lcod.orbital.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class TimerCoordinatorTest {
    @Test
    void throttleFollowsTheInjectedClock() {
        var clock = new AtomicLong(1_000);
        try (var timers = new TimerCoordinator(Executors.newSingleThreadScheduledExecutor(), clock::get)) {
            assertTrue(timers.throttle("JUMP", 100));
            clock.addAndGet(99);
            assertFalse(timers.throttle("JUMP", 100));
            assertTrue(timers.throttle("DUCK", 100));
            clock.addAndGet(1);
            assertTrue(timers.throttle("JUMP", 100));
        }
    }

    @Test
    void resetCancelsPendingDebounces() throws InterruptedException {
        var fired = new AtomicInteger();
        try (var timers = new TimerCoordinator()) {
            timers.debounce("SAVE", 50, fired::incrementAndGet);
            timers.debounce("LOAD", 50, fired::incrementAndGet);
            assertEquals(2, timers.pendingDebounces());
            timers.reset();
            assertEquals(0, timers.pendingDebounces());
            Thread.sleep(100);
            assertEquals(0, fired.get());
        }
    }

    @Test
    void zeroDelayCompletesImmediately() {
        try (var timers = new TimerCoordinator()) {
            assertTrue(timers.delay(0).isDone());
            assertEquals(null, timers.delay(5).join());
        }
    }
}
