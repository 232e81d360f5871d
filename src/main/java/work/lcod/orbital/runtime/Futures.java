package work.lcod.orbital.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Bridges between plain values and pending {@link CompletableFuture} results of async effects.
 */
public final class Futures {
    private Futures() {}

    @SuppressWarnings("unchecked")
    public static CompletableFuture<Object> of(Object value) {
        if (value instanceof CompletableFuture<?> future) {
            return (CompletableFuture<Object>) future;
        }
        return CompletableFuture.completedFuture(value);
    }

    /**
     * Evaluates {@code action}, turning a synchronous throw into a failed future.
     */
    public static CompletableFuture<Object> attempt(Supplier<Object> action) {
        try {
            return of(action.get());
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    /**
     * Blocks until a pending value settles and rethrows its failure unwrapped. Plain values are
     * returned unchanged.
     */
    public static Object await(Object value) {
        if (!(value instanceof CompletableFuture<?> future)) {
            return value;
        }
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while awaiting async effect", ex);
        } catch (ExecutionException ex) {
            throw propagate(ex.getCause());
        }
    }

    /**
     * Strips {@link CompletionException} wrappers so callers see the original failure.
     */
    public static Throwable unwrap(Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static RuntimeException propagate(Throwable error) {
        var cause = unwrap(error);
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new CompletionException(cause);
    }
}
