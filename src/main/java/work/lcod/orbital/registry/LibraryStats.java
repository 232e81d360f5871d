package work.lcod.orbital.registry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

public record LibraryStats(
    int totalBehaviors,
    Map<String, Integer> byCategory,
    int totalStates,
    int totalEvents,
    int totalTransitions,
    int totalTicks,
    int behaviorsWithTicks
) {
    public LibraryStats {
        byCategory = Map.copyOf(byCategory);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("totalBehaviors", totalBehaviors);
        map.put("byCategory", new TreeMap<>(byCategory));
        map.put("totalStates", totalStates);
        map.put("totalEvents", totalEvents);
        map.put("totalTransitions", totalTransitions);
        map.put("totalTicks", totalTicks);
        map.put("behaviorsWithTicks", behaviorsWithTicks);
        return map;
    }
}
