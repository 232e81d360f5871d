package work.lcod.orbital.flow;

import static work.lcod.orbital.runtime.OperatorMetadata.VARIADIC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.orbital.runtime.EvaluationContext;
import work.lcod.orbital.runtime.Evaluator;
import work.lcod.orbital.runtime.ExpressionException;
import work.lcod.orbital.runtime.Futures;
import work.lcod.orbital.runtime.OperatorMetadata;
import work.lcod.orbital.runtime.OperatorRegistry;
import work.lcod.orbital.runtime.Values;
import work.lcod.orbital.shared.DurationParser;

/**
 * {@code async/*} combinators. These are the only operators that suspend: each returns a
 * {@link CompletableFuture} that settles once the timers and nested effects it composes do.
 */
public final class AsyncPrimitives {
    private static final Logger LOG = LoggerFactory.getLogger(AsyncPrimitives.class);

    static final int DEFAULT_ATTEMPTS = 3;
    static final long DEFAULT_BASE_DELAY = 1000L;
    static final String DEFAULT_BACKOFF = "exponential";

    private AsyncPrimitives() {}

    public static OperatorRegistry register(OperatorRegistry registry, TimerCoordinator timers) {
        registry.register("async/delay", (args, ev, ctx) -> delay(args, ev, ctx, timers),
            meta(1, 2, "Wait for ms, then optionally evaluate an effect", "future"));
        registry.register("async/timeout", (args, ev, ctx) -> timeout(args, ev, ctx, timers),
            meta(2, 2, "Fail with a timeout if the effect does not settle within ms", "future"));
        registry.register("async/debounce", (args, ev, ctx) -> debounce(args, ev, ctx, timers),
            meta(2, 2, "Emit the event once calls stop arriving for ms", "void").withSideEffects());
        registry.register("async/throttle", (args, ev, ctx) -> throttle(args, ev, ctx, timers),
            meta(2, 2, "Emit the event at most once per ms", "boolean").withSideEffects());
        registry.register("async/retry", (args, ev, ctx) -> retry(args, ev, ctx, timers),
            meta(1, 2, "Retry an effect with fixed, linear or exponential backoff", "future"));
        registry.register("async/race", AsyncPrimitives::race,
            meta(1, VARIADIC, "Settle with the first effect to settle", "future"));
        registry.register("async/all", AsyncPrimitives::all,
            meta(0, VARIADIC, "Run effects concurrently and collect results in order", "future"));
        registry.register("async/sequence", AsyncPrimitives::sequence,
            meta(0, VARIADIC, "Run effects one after another and collect results", "future"));
        return registry;
    }

    private static OperatorMetadata meta(int min, int max, String description, String returnType) {
        return new OperatorMetadata("async", "std-async", min, max, description, returnType, false, false);
    }

    static Object delay(List<Object> args, Evaluator evaluator, EvaluationContext ctx, TimerCoordinator timers) {
        long millis = millis(evaluator.evaluate(args.get(0), ctx));
        var waited = timers.delay(millis);
        if (args.size() < 2) {
            return waited;
        }
        var effect = args.get(1);
        return waited.thenCompose(ignored -> Futures.attempt(() -> evaluator.evaluate(effect, ctx)));
    }

    static Object timeout(List<Object> args, Evaluator evaluator, EvaluationContext ctx, TimerCoordinator timers) {
        long millis = millis(evaluator.evaluate(args.get(1), ctx));
        var source = Futures.attempt(() -> evaluator.evaluate(args.get(0), ctx));
        var result = new CompletableFuture<Object>();
        source.whenComplete((value, error) -> settle(result, value, error));
        var timer = timers.schedule(() -> result.completeExceptionally(new EffectTimeoutException(millis)), millis);
        result.whenComplete((value, error) -> timer.cancel(false));
        return result;
    }

    static Object debounce(List<Object> args, Evaluator evaluator, EvaluationContext ctx, TimerCoordinator timers) {
        var event = eventName("async/debounce", evaluator.evaluate(args.get(0), ctx));
        long millis = millis(evaluator.evaluate(args.get(1), ctx));
        timers.debounce(event, millis, () -> emit(ctx, event));
        return null;
    }

    static Object throttle(List<Object> args, Evaluator evaluator, EvaluationContext ctx, TimerCoordinator timers) {
        var event = eventName("async/throttle", evaluator.evaluate(args.get(0), ctx));
        long millis = millis(evaluator.evaluate(args.get(1), ctx));
        if (!timers.throttle(event, millis)) {
            LOG.debug("Throttled {}", event);
            return false;
        }
        emit(ctx, event);
        return true;
    }

    static Object retry(List<Object> args, Evaluator evaluator, EvaluationContext ctx, TimerCoordinator timers) {
        var options = Values.castMap(evaluator.arg(args, 1, ctx));
        int attempts = DEFAULT_ATTEMPTS;
        long baseDelay = DEFAULT_BASE_DELAY;
        String backoff = DEFAULT_BACKOFF;
        if (options != null) {
            if (options.get("attempts") != null) {
                attempts = Math.max(1, (int) Values.toNumber(options.get("attempts")));
            }
            if (options.get("baseDelay") != null) {
                baseDelay = millis(options.get("baseDelay"));
            }
            if (options.get("backoff") != null) {
                backoff = Values.stringify(options.get("backoff")).toLowerCase(Locale.ROOT);
            }
        }
        var policy = new RetryPolicy(attempts, backoff, baseDelay);
        return attempt(0, policy, args.get(0), evaluator, ctx, timers);
    }

    private static CompletableFuture<Object> attempt(
        int index,
        RetryPolicy policy,
        Object effect,
        Evaluator evaluator,
        EvaluationContext ctx,
        TimerCoordinator timers
    ) {
        return Futures.attempt(() -> evaluator.evaluate(effect, ctx))
            .handle((value, error) -> {
                if (error == null) {
                    return CompletableFuture.completedFuture(value);
                }
                if (index + 1 >= policy.attempts()) {
                    return CompletableFuture.<Object>failedFuture(Futures.unwrap(error));
                }
                long wait = policy.delayFor(index);
                LOG.debug("Attempt {} of {} failed, retrying in {}ms", index + 1, policy.attempts(), wait);
                return timers.delay(wait).thenCompose(ignored -> attempt(index + 1, policy, effect, evaluator, ctx, timers));
            })
            .thenCompose(Function.identity());
    }

    static Object race(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
        var result = new CompletableFuture<Object>();
        for (var effect : args) {
            Futures.attempt(() -> evaluator.evaluate(effect, ctx))
                .whenComplete((value, error) -> settle(result, value, error));
        }
        return result;
    }

    static Object all(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
        var futures = new ArrayList<CompletableFuture<Object>>(args.size());
        var result = new CompletableFuture<Object>();
        for (var effect : args) {
            var future = Futures.attempt(() -> evaluator.evaluate(effect, ctx));
            future.whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(Futures.unwrap(error));
                }
            });
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).thenRun(() -> {
            var values = new ArrayList<Object>(futures.size());
            for (var future : futures) {
                values.add(future.join());
            }
            result.complete(values);
        });
        return result;
    }

    static Object sequence(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
        CompletableFuture<List<Object>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (var effect : args) {
            chain = chain.thenCompose(values -> Futures.attempt(() -> evaluator.evaluate(effect, ctx))
                .thenApply(value -> {
                    values.add(value);
                    return values;
                }));
        }
        var result = new CompletableFuture<Object>();
        chain.whenComplete((value, error) -> settle(result, value, error));
        return result;
    }

    private static void settle(CompletableFuture<Object> target, Object value, Throwable error) {
        if (error != null) {
            target.completeExceptionally(Futures.unwrap(error));
        } else {
            target.complete(value);
        }
    }

    private static void emit(EvaluationContext ctx, String event) {
        var handler = ctx.handlers().emit();
        if (handler == null) {
            LOG.debug("No emit handler in context; {} dropped", event);
            return;
        }
        handler.emit(event, null);
    }

    private static String eventName(String operator, Object value) {
        if (value == null) {
            throw ExpressionException.invalidArgument(operator, 1, "event name is null");
        }
        return Values.stringify(value);
    }

    static long millis(Object value) {
        if (value instanceof String text && DurationParser.isDuration(text)) {
            return DurationParser.parse(text).map(Duration::toMillis).orElse(0L);
        }
        return Math.max(0L, (long) Values.toNumber(value));
    }

    /**
     * Wait before attempt {@code index + 1}: fixed, linear or exponential in the attempt index.
     */
    record RetryPolicy(int attempts, String backoff, long baseDelay) {
        long delayFor(int index) {
            return switch (backoff) {
                case "fixed" -> baseDelay;
                case "linear" -> baseDelay * (index + 1L);
                default -> baseDelay * (1L << Math.min(index, 30));
            };
        }
    }
}
