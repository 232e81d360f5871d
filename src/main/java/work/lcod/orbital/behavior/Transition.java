package work.lcod.orbital.behavior;

import java.util.List;

/**
 * Edge of a state machine. An empty {@code from} list, or one containing {@code *}, matches every
 * state; a null {@code to} keeps the current state.
 */
public record Transition(List<String> from, String to, String event, Object guard, List<Object> effects) {
    public static final String ANY_STATE = "*";

    public Transition {
        from = from == null ? List.of() : List.copyOf(from);
        effects = Behavior.expressions(effects);
    }

    public boolean matchesFrom(String state) {
        return from.isEmpty() || from.contains(ANY_STATE) || from.contains(state);
    }

    public boolean changesState() {
        return to != null;
    }
}
