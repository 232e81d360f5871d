package work.lcod.orbital.behavior;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Structural checks run before a behavior is registered or instantiated. Each check returns
 * human-readable errors; an empty list means the behavior is usable.
 */
public final class BehaviorValidator {
    public static final String NAME_PREFIX = "std/";

    private BehaviorValidator() {}

    public static List<String> validate(Behavior behavior) {
        var errors = new ArrayList<String>(validateStructure(behavior));
        if (behavior.stateMachine() != null) {
            errors.addAll(validateEvents(behavior));
            errors.addAll(validateStates(behavior));
        }
        return errors;
    }

    public static Behavior requireValid(Behavior behavior) {
        var errors = validate(behavior);
        if (!errors.isEmpty()) {
            var name = behavior.name() == null ? "<unnamed>" : behavior.name();
            throw new BehaviorDefinitionException(
                BehaviorDefinitionException.INVALID,
                "Invalid behavior " + name + ": " + String.join("; ", errors),
                Map.of("behavior", name, "errors", errors)
            );
        }
        return behavior;
    }

    public static List<String> validateStructure(Behavior behavior) {
        var errors = new ArrayList<String>();
        if (behavior.name() == null || behavior.name().isBlank()) {
            errors.add("Behavior must have a name");
        } else if (!behavior.name().startsWith(NAME_PREFIX)) {
            errors.add("Behavior name should start with '" + NAME_PREFIX + "' (got: " + behavior.name() + ")");
        }
        if (behavior.category() == null || behavior.category().isBlank()) {
            errors.add("Behavior must have a category");
        } else if (behavior.knownCategory().isEmpty()) {
            errors.add("Invalid category: " + behavior.category());
        }
        var machine = behavior.stateMachine();
        if (machine == null || machine.states().isEmpty()) {
            errors.add("State machine must have at least one state");
            return errors;
        }
        var initial = machine.initialState();
        if (initial == null || initial.isBlank()) {
            errors.add("State machine must have an initial state");
        } else if (!machine.hasState(initial)) {
            errors.add("Initial state is not declared: " + initial);
        }
        return errors;
    }

    public static List<String> validateEvents(Behavior behavior) {
        var machine = behavior.stateMachine();
        var undeclared = new LinkedHashSet<String>();
        for (var transition : machine.transitions()) {
            if (transition.event() == null || !machine.declaresEvent(transition.event())) {
                undeclared.add(String.valueOf(transition.event()));
            }
        }
        var errors = new ArrayList<String>();
        undeclared.forEach(event -> errors.add("Transition uses undeclared event: " + event));
        return errors;
    }

    public static List<String> validateStates(Behavior behavior) {
        var machine = behavior.stateMachine();
        var errors = new LinkedHashSet<String>();
        for (var transition : machine.transitions()) {
            for (var from : transition.from()) {
                if (!Transition.ANY_STATE.equals(from) && !machine.hasState(from)) {
                    errors.add("Transition from undeclared state: " + from);
                }
            }
            if (transition.to() != null && !machine.hasState(transition.to())) {
                errors.add("Transition to undeclared state: " + transition.to());
            }
        }
        for (var tick : behavior.ticks()) {
            for (var state : tick.appliesTo()) {
                if (!machine.hasState(state)) {
                    errors.add("Tick " + tick.name() + " applies to undeclared state: " + state);
                }
            }
        }
        return new ArrayList<>(errors);
    }
}
