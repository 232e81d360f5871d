package work.lcod.orbital.behavior;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import work.lcod.orbital.runtime.Values;

/**
 * Reads behavior definitions from YAML or JSON documents. States and events may be written as
 * bare strings or as objects; {@code from} may be a single state or a list.
 */
public final class BehaviorLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private BehaviorLoader() {}

    public static Behavior load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException ex) {
            throw new BehaviorDefinitionException(
                BehaviorDefinitionException.UNREADABLE, "Unable to read behavior " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static Behavior read(InputStream in, String source) {
        return fromMap(readDocument(in, source));
    }

    /**
     * Parses a YAML or JSON document into read-only maps and lists. Only {@code true} and
     * {@code false} (any case) become booleans; YAML 1.1 spellings such as {@code On} or
     * {@code no} keep their source text, so they stay usable as state and event names.
     */
    public static Map<String, Object> readDocument(InputStream in, String source) {
        Object root;
        try (var parser = YAML_MAPPER.getFactory().createParser(in)) {
            root = parser.nextToken() == null ? null : readValue(parser);
        } catch (IOException ex) {
            throw new BehaviorDefinitionException(
                BehaviorDefinitionException.UNREADABLE, "Unable to parse " + source + ": " + ex.getMessage(), ex);
        }
        if (!(root instanceof Map<?, ?>)) {
            throw new BehaviorDefinitionException(
                BehaviorDefinitionException.UNREADABLE, "Document must be an object: " + source, (Object) source);
        }
        return asMap(root);
    }

    public static Behavior fromMap(Map<String, Object> raw) {
        var machine = asMap(raw.get("stateMachine"));
        return new Behavior(
            string(raw.get("name")),
            string(raw.get("category")),
            string(raw.get("description")),
            strings(raw.get("suggestedFor")),
            mapList(raw.get("dataEntities"), BehaviorLoader::dataEntity),
            raw.get("stateMachine") == null ? null : stateMachine(machine),
            mapList(raw.get("ticks"), BehaviorLoader::tick),
            configSchema(asMap(raw.get("configSchema"))),
            mapList(raw.get("requiredFields"), BehaviorLoader::field),
            listens(raw.get("listens")),
            Values.toList(raw.get("initialEffects"))
        );
    }

    private static StateMachine stateMachine(Map<String, Object> raw) {
        var states = new ArrayList<StateMachine.State>();
        for (var item : Values.toList(raw.get("states"))) {
            if (item instanceof Map<?, ?>) {
                var state = asMap(item);
                states.add(new StateMachine.State(
                    string(state.get("name")),
                    Values.isTruthy(state.get("isInitial")),
                    Values.isTruthy(state.get("isFinal")),
                    string(state.get("description"))
                ));
            } else if (item != null) {
                states.add(new StateMachine.State(Values.stringify(item), false, false, null));
            }
        }
        var events = new ArrayList<StateMachine.Event>();
        for (var item : Values.toList(raw.get("events"))) {
            if (item instanceof Map<?, ?>) {
                var event = asMap(item);
                var key = string(event.get("key"));
                events.add(new StateMachine.Event(
                    key,
                    event.get("name") == null ? key : string(event.get("name")),
                    string(event.get("description")),
                    mapList(event.get("payload"), BehaviorLoader::field)
                ));
            } else if (item != null) {
                var key = Values.stringify(item);
                events.add(new StateMachine.Event(key, key, null, List.of()));
            }
        }
        return new StateMachine(
            string(raw.get("initial")),
            states,
            events,
            mapList(raw.get("transitions"), BehaviorLoader::transition)
        );
    }

    private static Transition transition(Map<String, Object> raw) {
        return new Transition(
            strings(raw.get("from")),
            string(raw.get("to")),
            string(raw.get("event")),
            raw.get("guard"),
            Values.toList(raw.get("effects"))
        );
    }

    private static Tick tick(Map<String, Object> raw) {
        var priority = raw.get("priority");
        return new Tick(
            string(raw.get("name")),
            string(raw.get("description")),
            priority == null ? 0 : (int) Values.toNumber(priority),
            raw.get("interval") == null ? Tick.FRAME : raw.get("interval"),
            strings(raw.get("appliesTo")),
            raw.get("guard"),
            Values.toList(raw.get("effects"))
        );
    }

    private static DataEntity dataEntity(Map<String, Object> raw) {
        return new DataEntity(
            string(raw.get("name")),
            raw.get("runtime") == null || Values.isTruthy(raw.get("runtime")),
            Values.isTruthy(raw.get("singleton")),
            mapList(raw.get("fields"), BehaviorLoader::field)
        );
    }

    private static DataEntity.Field field(Map<String, Object> raw) {
        return new DataEntity.Field(
            string(raw.get("name")),
            raw.get("type") == null ? "any" : string(raw.get("type")),
            raw.get("default"),
            Values.isTruthy(raw.get("required")),
            string(raw.get("description"))
        );
    }

    private static ConfigSchema configSchema(Map<String, Object> raw) {
        if (raw.isEmpty()) {
            return ConfigSchema.EMPTY;
        }
        return new ConfigSchema(
            mapList(raw.get("required"), BehaviorLoader::configField),
            mapList(raw.get("optional"), BehaviorLoader::configField)
        );
    }

    private static ConfigSchema.Field configField(Map<String, Object> raw) {
        return new ConfigSchema.Field(
            string(raw.get("name")),
            raw.get("type") == null ? "any" : string(raw.get("type")),
            string(raw.get("description")),
            raw.get("default"),
            raw.get("enum") == null ? List.of() : Values.toList(raw.get("enum"))
        );
    }

    private static List<String> listens(Object raw) {
        var events = new ArrayList<String>();
        for (var item : Values.toList(raw)) {
            if (item instanceof Map<?, ?> map) {
                var event = map.get("event");
                if (event != null) {
                    events.add(Values.stringify(event));
                }
            } else if (item != null) {
                events.add(Values.stringify(item));
            }
        }
        return events;
    }

    private static <T> List<T> mapList(Object raw, Function<Map<String, Object>, T> mapper) {
        var items = new ArrayList<T>();
        for (var item : Values.toList(raw)) {
            if (item instanceof Map<?, ?>) {
                items.add(mapper.apply(asMap(item)));
            }
        }
        return items;
    }

    private static List<String> strings(Object raw) {
        var values = new ArrayList<String>();
        for (var item : Values.toList(raw)) {
            if (item != null) {
                values.add(Values.stringify(item));
            }
        }
        return values;
    }

    private static String string(Object raw) {
        return raw == null ? null : Values.stringify(raw);
    }

    private static Map<String, Object> asMap(Object raw) {
        var map = Values.castMap(raw);
        return map == null ? Map.of() : map;
    }

    private static Object readValue(JsonParser parser) throws IOException {
        return switch (parser.currentToken()) {
            case START_OBJECT -> {
                var map = new LinkedHashMap<String, Object>();
                while (parser.nextToken() == JsonToken.FIELD_NAME) {
                    var name = parser.currentName();
                    parser.nextToken();
                    map.put(name, readValue(parser));
                }
                yield Collections.unmodifiableMap(map);
            }
            case START_ARRAY -> {
                var list = new ArrayList<Object>();
                while (parser.nextToken() != JsonToken.END_ARRAY) {
                    list.add(readValue(parser));
                }
                yield Collections.unmodifiableList(list);
            }
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
            case VALUE_TRUE, VALUE_FALSE -> {
                var text = parser.getText();
                boolean plain = "true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text);
                yield plain ? parser.getBooleanValue() : text;
            }
            case VALUE_NULL -> null;
            default -> parser.getText();
        };
    }
}
