package work.lcod.orbital.behavior;

import java.util.ArrayList;
import java.util.List;

public record StateMachine(String initial, List<State> states, List<Event> events, List<Transition> transitions) {
    public StateMachine {
        states = states == null ? List.of() : List.copyOf(states);
        events = events == null ? List.of() : List.copyOf(events);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    public record State(String name, boolean initial, boolean terminal, String description) {}

    public record Event(String key, String name, String description, List<DataEntity.Field> payload) {
        public Event {
            payload = payload == null ? List.of() : List.copyOf(payload);
        }
    }

    /**
     * The declared {@code initial} state, else the state flagged initial, else the first state.
     */
    public String initialState() {
        if (initial != null && !initial.isBlank()) {
            return initial;
        }
        for (var state : states) {
            if (state.initial()) {
                return state.name();
            }
        }
        return states.isEmpty() ? null : states.get(0).name();
    }

    public List<String> stateNames() {
        var names = new ArrayList<String>(states.size());
        states.forEach(state -> names.add(state.name()));
        return names;
    }

    public List<String> eventKeys() {
        var keys = new ArrayList<String>(events.size());
        events.forEach(event -> keys.add(event.key()));
        return keys;
    }

    public boolean hasState(String name) {
        return states.stream().anyMatch(state -> state.name().equals(name));
    }

    public boolean declaresEvent(String key) {
        return events.stream().anyMatch(event -> event.key().equals(key));
    }

    public boolean handles(String event) {
        return declaresEvent(event) || transitions.stream().anyMatch(t -> t.event().equals(event));
    }
}
