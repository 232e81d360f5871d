package work.lcod.orbital.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.orbital.behavior.Behavior;
import work.lcod.orbital.behavior.ConfigSchema;

/**
 * Summary of a behavior for catalogs and tooling.
 */
public record BehaviorMetadata(
    String name,
    String category,
    String description,
    List<String> suggestedFor,
    List<String> states,
    List<String> events,
    int transitionCount,
    int tickCount,
    boolean hasDataEntities,
    List<String> requiredConfig,
    List<String> optionalConfig
) {
    public static BehaviorMetadata of(Behavior behavior) {
        var machine = behavior.stateMachine();
        return new BehaviorMetadata(
            behavior.name(),
            behavior.category(),
            behavior.description(),
            behavior.suggestedFor(),
            List.copyOf(machine.stateNames()),
            List.copyOf(machine.eventKeys()),
            machine.transitions().size(),
            behavior.ticks().size(),
            !behavior.dataEntities().isEmpty(),
            names(behavior.configSchema().required()),
            names(behavior.configSchema().optional())
        );
    }

    private static List<String> names(List<ConfigSchema.Field> fields) {
        var names = new ArrayList<String>(fields.size());
        fields.forEach(field -> names.add(field.name()));
        return List.copyOf(names);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("category", category);
        map.put("description", description);
        map.put("suggestedFor", suggestedFor);
        map.put("states", states);
        map.put("events", events);
        map.put("transitionCount", transitionCount);
        map.put("tickCount", tickCount);
        map.put("hasDataEntities", hasDataEntities);
        map.put("requiredConfig", requiredConfig);
        map.put("optionalConfig", optionalConfig);
        return map;
    }
}
