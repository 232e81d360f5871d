package work.lcod.orbital.behavior;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.orbital.runtime.Values;

public record DataEntity(String name, boolean runtime, boolean singleton, List<Field> fields) {
    public DataEntity {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public record Field(String name, String type, Object defaultValue, boolean required, String description) {}

    /**
     * Fresh map of every field's default value; defaults are deep-copied so instances never share
     * mutable lists or maps.
     */
    public Map<String, Object> defaults() {
        var values = new LinkedHashMap<String, Object>();
        for (var field : fields) {
            values.put(field.name(), Values.deepCopy(field.defaultValue()));
        }
        return values;
    }
}
