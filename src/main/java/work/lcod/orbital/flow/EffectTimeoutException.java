package work.lcod.orbital.flow;

/**
 * Raised by {@code async/timeout} when the timer settles before the wrapped effect.
 */
public final class EffectTimeoutException extends RuntimeException {
    public static final String CODE = "TIMEOUT";

    private final long timeoutMillis;

    public EffectTimeoutException(long timeoutMillis) {
        super("Timeout exceeded after " + timeoutMillis + "ms");
        this.timeoutMillis = timeoutMillis;
    }

    public String code() {
        return CODE;
    }

    public long timeoutMillis() {
        return timeoutMillis;
    }
}
