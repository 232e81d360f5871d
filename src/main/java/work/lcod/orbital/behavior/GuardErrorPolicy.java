package work.lcod.orbital.behavior;

import java.util.Locale;

/**
 * What a failing guard expression means for the transition or tick it protects.
 */
public enum GuardErrorPolicy {
    /** Log a warning and treat the guard as not passing. */
    TREAT_AS_FALSE,
    /** Rethrow the failure to the caller of {@code send} or {@code runTick}. */
    PROPAGATE;

    public static GuardErrorPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return TREAT_AS_FALSE;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return GuardErrorPolicy.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported guard error policy: " + value);
        }
    }
}
