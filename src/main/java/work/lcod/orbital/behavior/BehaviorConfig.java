package work.lcod.orbital.behavior;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.orbital.runtime.Values;

/**
 * Resolves the {@code @config} values of an instance from the behavior's config schema and the
 * values supplied by the host.
 */
public final class BehaviorConfig {
    private BehaviorConfig() {}

    /**
     * Schema defaults overlaid by {@code supplied}. Supplied keys unknown to the schema are kept.
     *
     * @throws BehaviorConfigException when a required field is missing or a value falls outside
     *     its field's allowed values
     */
    public static Map<String, Object> resolve(Behavior behavior, Map<String, Object> supplied) {
        var schema = behavior.configSchema();
        var resolved = new LinkedHashMap<String, Object>();
        for (var field : schema.fields()) {
            resolved.put(field.name(), Values.deepCopy(field.defaultValue()));
        }
        if (supplied != null) {
            supplied.forEach((key, value) -> resolved.put(key, Values.deepCopy(value)));
        }
        for (var field : schema.required()) {
            if (resolved.get(field.name()) == null) {
                throw new BehaviorConfigException(
                    BehaviorConfigException.MISSING_FIELD,
                    "Missing required config field '" + field.name() + "' for " + behavior.name(),
                    Map.of("behavior", behavior.name(), "field", field.name())
                );
            }
        }
        for (var field : schema.fields()) {
            var value = resolved.get(field.name());
            if (value != null && !field.allowed().isEmpty() && !allowed(field.allowed(), value)) {
                throw new BehaviorConfigException(
                    BehaviorConfigException.NOT_ALLOWED,
                    "Config field '" + field.name() + "' of " + behavior.name() + " must be one of "
                        + field.allowed() + " (got: " + Values.stringify(value) + ")",
                    Map.of("behavior", behavior.name(), "field", field.name(), "allowed", field.allowed())
                );
            }
        }
        return Collections.unmodifiableMap(resolved);
    }

    private static boolean allowed(List<Object> allowed, Object value) {
        for (var candidate : allowed) {
            if (Values.deepEquals(candidate, value)) {
                return true;
            }
        }
        return false;
    }
}
