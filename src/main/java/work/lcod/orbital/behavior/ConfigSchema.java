package work.lcod.orbital.behavior;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record ConfigSchema(List<Field> required, List<Field> optional) {
    public static final ConfigSchema EMPTY = new ConfigSchema(List.of(), List.of());

    public ConfigSchema {
        required = required == null ? List.of() : List.copyOf(required);
        optional = optional == null ? List.of() : List.copyOf(optional);
    }

    /**
     * Config field; a non-empty {@code allowed} list restricts the value to its members.
     */
    public record Field(String name, String type, String description, Object defaultValue, List<Object> allowed) {
        public Field {
            allowed = allowed == null ? List.of() : List.copyOf(allowed);
        }
    }

    public List<Field> fields() {
        var all = new ArrayList<Field>(required.size() + optional.size());
        all.addAll(required);
        all.addAll(optional);
        return all;
    }

    public Optional<Field> field(String name) {
        return fields().stream().filter(field -> field.name().equals(name)).findFirst();
    }
}
