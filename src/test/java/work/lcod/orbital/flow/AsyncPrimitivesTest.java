package work.lcod.orbital.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.orbital.support.RuntimeTestSupport.awaitCondition;
import static work.lcod.orbital.support.RuntimeTestSupport.map;
import static work.lcod.orbital.support.RuntimeTestSupport.op;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.orbital.runtime.Evaluator;
import work.lcod.orbital.runtime.ExpressionException;
import work.lcod.orbital.runtime.Futures;
import work.lcod.orbital.runtime.OperatorLibrary;
import work.lcod.orbital.support.RuntimeTestSupport.RecordingHost;

class AsyncPrimitivesTest {
    private TimerCoordinator timers;
    private Evaluator evaluator;

    @BeforeEach
    void setUp() {
        timers = new TimerCoordinator();
        evaluator = new Evaluator(OperatorLibrary.create(timers));
    }

    @AfterEach
    void tearDown() {
        timers.close();
    }

    @Test
    void debounceEmitsOnceAfterCallsStop() throws InterruptedException {
        var host = new RecordingHost();
        var ctx = host.context(Map.of());
        for (int i = 0; i < 3; i++) {
            evaluator.evaluate(op("async/debounce", "SEARCH", 40), ctx);
        }
        assertTrue(awaitCondition(() -> host.emitted().size() == 1, Duration.ofSeconds(2)));
        Thread.sleep(80);
        assertEquals(List.of("SEARCH"), host.emitted());
        assertEquals(0, timers.pendingDebounces());
    }

    @Test
    void throttleDropsCallsInsideTheWindow() {
        var host = new RecordingHost();
        var ctx = host.context(Map.of());
        assertEquals(true, evaluator.evaluate(op("async/throttle", "SCROLL", 10_000), ctx));
        assertEquals(false, evaluator.evaluate(op("async/throttle", "SCROLL", 10_000), ctx));
        assertEquals(List.of("SCROLL"), host.emitted());
    }

    @Test
    void retryRethrowsTheLastFailure() {
        var host = new RecordingHost();
        long started = System.nanoTime();
        var failing = op("do", op("increment", "@entity.attempts"), op("emit", (Object) null));
        var result = evaluator.evaluate(
            op("async/retry", failing, map("attempts", 3, "baseDelay", 10, "backoff", "fixed")),
            host.context(Map.of())
        );
        var ex = assertThrows(ExpressionException.class, () -> Futures.await(result));
        assertEquals(ExpressionException.INVALID_ARGUMENT, ex.code());
        assertEquals(3.0, host.entity().get("attempts"));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() >= 20);
    }

    @Test
    void retryStopsAtTheFirstSuccess() {
        var host = new RecordingHost();
        var flaky = op("do",
            op("increment", "@entity.attempts"),
            op("if", op("<", "@entity.attempts", 2), op("emit", (Object) null), "ok"));
        var result = evaluator.evaluate(op("async/retry", flaky, map("baseDelay", 5)), host.context(Map.of()));
        assertEquals("ok", Futures.await(result));
        assertEquals(2.0, host.entity().get("attempts"));
    }

    @Test
    void retryPolicyScalesWithBackoff() {
        assertEquals(100, new AsyncPrimitives.RetryPolicy(3, "fixed", 100).delayFor(2));
        assertEquals(300, new AsyncPrimitives.RetryPolicy(3, "linear", 100).delayFor(2));
        assertEquals(400, new AsyncPrimitives.RetryPolicy(3, "exponential", 100).delayFor(2));
    }

    @Test
    void acceptsDurationStrings() {
        assertEquals(1500, AsyncPrimitives.millis("1.5s"));
        assertEquals(250, AsyncPrimitives.millis("250"));
        assertEquals(40, AsyncPrimitives.millis(40));
        assertEquals(0, AsyncPrimitives.millis(-5));
        assertEquals(0, AsyncPrimitives.millis("soon"));
    }

    @Test
    void delayRunsItsEffectAfterwards() {
        var host = new RecordingHost();
        var result = evaluator.evaluate(op("async/delay", 10, op("emit", "LATER")), host.context(Map.of()));
        assertInstanceOf(CompletableFuture.class, result);
        Futures.await(result);
        assertEquals(List.of("LATER"), host.emitted());
    }

    @Test
    void timeoutFailsSlowEffects() {
        var ctx = new RecordingHost().context(Map.of());
        var slow = evaluator.evaluate(op("async/timeout", op("async/delay", 1000), 20), ctx);
        var ex = assertThrows(EffectTimeoutException.class, () -> Futures.await(slow));
        assertEquals(20, ex.timeoutMillis());
        assertEquals(EffectTimeoutException.CODE, ex.code());

        var fast = evaluator.evaluate(op("async/timeout", op("async/delay", 0, "done"), 1000), ctx);
        assertEquals("done", Futures.await(fast));
    }

    @Test
    void allCollectsResultsInOrder() {
        var ctx = new RecordingHost().context(Map.of());
        var result = evaluator.evaluate(op("async/all", op("async/delay", 20, 1), 2), ctx);
        assertEquals(List.of(1, 2), Futures.await(result));
    }

    @Test
    void raceSettlesWithTheFirstEffect() {
        var ctx = new RecordingHost().context(Map.of());
        var result = evaluator.evaluate(op("async/race", op("async/delay", 500, "slow"), op("async/delay", 5, "fast")), ctx);
        assertEquals("fast", Futures.await(result));
    }

    @Test
    void sequenceRunsEffectsInOrder() {
        var host = new RecordingHost();
        var result = evaluator.evaluate(
            op("async/sequence", op("async/delay", 20, op("emit", "FIRST")), op("emit", "SECOND")),
            host.context(Map.of())
        );
        Futures.await(result);
        assertEquals(List.of("FIRST", "SECOND"), host.emitted());
    }

    @Test
    void sequenceStopsAtTheFirstFailure() {
        var host = new RecordingHost();
        var result = evaluator.evaluate(
            op("async/sequence", op("emit", "FIRST"), op("emit", (Object) null), op("emit", "THIRD")),
            host.context(Map.of())
        );
        var ex = assertThrows(ExpressionException.class, () -> Futures.await(result));
        assertEquals(ExpressionException.INVALID_ARGUMENT, ex.code());
        assertEquals(List.of("FIRST"), host.emitted());
    }

    @Test
    void allFailsWithoutWaitingForSlowerEffects() {
        var ctx = new RecordingHost().context(Map.of());
        long started = System.nanoTime();
        var result = evaluator.evaluate(op("async/all", op("async/delay", 2000, "slow"), op("emit", (Object) null)), ctx);
        assertThrows(ExpressionException.class, () -> Futures.await(result));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() < 1500);
    }
}
