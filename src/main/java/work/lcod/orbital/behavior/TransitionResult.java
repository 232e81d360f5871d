package work.lcod.orbital.behavior;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one event delivered to a {@link BehaviorInstance}, including the events its effects
 * emitted and the follow-up transitions they caused.
 */
public record TransitionResult(
    String event,
    boolean transitioned,
    String fromState,
    String toState,
    List<Emitted> emitted,
    List<ClientEffect> clientEffects,
    String guardError,
    List<TransitionResult> followUps
) {
    public TransitionResult {
        emitted = List.copyOf(emitted);
        clientEffects = List.copyOf(clientEffects);
        followUps = List.copyOf(followUps);
    }

    public record Emitted(String event, Object payload) {}

    /**
     * A navigate, notify or render-ui call issued while the event was processed.
     */
    public record ClientEffect(String kind, Map<String, Object> data) {}

    public boolean stateChanged() {
        return transitioned && toState != null && !toState.equals(fromState);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("event", event);
        map.put("transitioned", transitioned);
        map.put("from", fromState);
        map.put("to", toState);
        var emittedEvents = new ArrayList<Object>();
        for (var item : emitted) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("event", item.event());
            entry.put("payload", item.payload());
            emittedEvents.add(entry);
        }
        map.put("emitted", emittedEvents);
        var effects = new ArrayList<Object>();
        for (var effect : clientEffects) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("kind", effect.kind());
            entry.putAll(effect.data());
            effects.add(entry);
        }
        map.put("effects", effects);
        if (guardError != null) {
            map.put("guardError", guardError);
        }
        if (!followUps.isEmpty()) {
            var chained = new ArrayList<Object>();
            followUps.forEach(result -> chained.add(result.toMap()));
            map.put("followUps", chained);
        }
        return map;
    }
}
