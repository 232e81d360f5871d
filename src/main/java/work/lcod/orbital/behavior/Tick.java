package work.lcod.orbital.behavior;

import java.util.List;

/**
 * Periodic guard and effects. {@code interval} is {@code frame}, a number of milliseconds, a
 * duration string or a {@code @config.*} binding.
 */
public record Tick(
    String name,
    String description,
    int priority,
    Object interval,
    List<String> appliesTo,
    Object guard,
    List<Object> effects
) {
    public static final String FRAME = "frame";

    public Tick {
        appliesTo = appliesTo == null ? List.of() : List.copyOf(appliesTo);
        effects = Behavior.expressions(effects);
    }

    public boolean appliesTo(String state) {
        return appliesTo.isEmpty() || appliesTo.contains(state);
    }
}
