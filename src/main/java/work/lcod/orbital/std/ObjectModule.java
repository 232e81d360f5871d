package work.lcod.orbital.std;

import static work.lcod.orbital.runtime.OperatorMetadata.VARIADIC;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.orbital.runtime.OperatorMetadata;
import work.lcod.orbital.runtime.OperatorRegistry;
import work.lcod.orbital.runtime.Values;

/**
 * {@code object/*}: map helpers addressing nested values by dotted path, plus the top-level
 * {@code path} operator that joins segments into such a path.
 */
public final class ObjectModule {
    private ObjectModule() {}

    public static OperatorRegistry register(OperatorRegistry registry) {
        new ModuleDefinition(registry, "object")
            .define("keys", 1, 1, "array", "Own keys in insertion order", a -> new ArrayList<Object>(a.map(0).keySet()))
            .define("values", 1, 1, "array", "Values in key order", a -> new ArrayList<>(a.map(0).values()))
            .define("entries", 1, 1, "array", "[key, value] pairs", ObjectModule::entries)
            .define("fromEntries", 1, 1, "object", "Object from [key, value] pairs", ObjectModule::fromEntries)
            .define("get", 2, 3, "any", "Value at a dotted path, or the default", ObjectModule::get)
            .define("set", 3, 3, "object", "Deep copy with the value written at a dotted path", ObjectModule::set)
            .define("has", 2, 2, "boolean", "Whether every segment of the dotted path exists", ObjectModule::has)
            .define("merge", 0, VARIADIC, "object", "Shallow merge, later objects win", ObjectModule::merge)
            .define("deepMerge", 0, VARIADIC, "object", "Recursive merge of nested objects", ObjectModule::deepMerge)
            .define("pick", 2, 2, "object", "Only the listed keys", ObjectModule::pick)
            .define("omit", 2, 2, "object", "All but the listed keys", ObjectModule::omit)
            .lambda("mapValues", 2, 2, "object", "Transform every value", ObjectModule::mapValues)
            .lambda("mapKeys", 2, 2, "object", "Transform every key", ObjectModule::mapKeys)
            .lambda("filter", 2, 2, "object", "Entries for which (key, value) matches", ObjectModule::filter)
            .define("empty?", 1, 1, "boolean", "True for null or an object without keys", a -> a.map(0).isEmpty())
            .define("equals", 2, 2, "boolean", "Deep structural equality", a -> Values.deepEquals(a.get(0), a.get(1)))
            .define("clone", 1, 1, "object", "Shallow copy", a -> new LinkedHashMap<>(a.map(0)))
            .define("deepClone", 1, 1, "object", "Recursive copy", a -> Values.deepCopy(a.map(0)));
        registry.register("path", (args, evaluator, ctx) -> path(evaluator.evaluateAll(args, ctx)),
            new OperatorMetadata("object", "std-object", 1, VARIADIC, "Join segments into a dotted path", "string", false, false));
        return registry;
    }

    static String path(List<Object> segments) {
        var parts = new ArrayList<String>(segments.size());
        for (var segment : segments) {
            parts.add(segment == null ? "" : Values.stringify(segment));
        }
        return String.join(".", parts);
    }

    private static Object entries(Args a) {
        var result = new ArrayList<Object>();
        for (var entry : a.map(0).entrySet()) {
            var pair = new ArrayList<Object>(2);
            pair.add(entry.getKey());
            pair.add(entry.getValue());
            result.add(pair);
        }
        return result;
    }

    private static Object fromEntries(Args a) {
        var result = new LinkedHashMap<String, Object>();
        for (var entry : a.list(0)) {
            if (entry instanceof List<?> pair && !pair.isEmpty()) {
                result.put(Values.stringify(pair.get(0)), pair.size() > 1 ? pair.get(1) : null);
            }
        }
        return result;
    }

    /**
     * Reads {@code path} from {@code root}; null when a segment is missing or not an object.
     */
    public static Object getPath(Object root, String path) {
        Object current = root;
        for (var part : path.split("\\.", -1)) {
            var map = Values.castMap(current);
            if (map == null) {
                return null;
            }
            current = map.get(part);
        }
        return current;
    }

    private static Object get(Args a) {
        var fallback = a.get(2);
        if (!a.has(0) || a.string(1).isEmpty()) {
            return fallback;
        }
        var value = getPath(a.get(0), a.string(1));
        return value == null ? fallback : value;
    }

    /**
     * Writes {@code value} at {@code path} inside {@code target}, creating intermediate objects and
     * replacing non-object ones.
     */
    @SuppressWarnings("unchecked")
    public static void setPath(Map<String, Object> target, String path, Object value) {
        var parts = path.split("\\.", -1);
        var current = target;
        for (int i = 0; i < parts.length - 1; i++) {
            var next = current.get(parts[i]);
            if (!(next instanceof Map<?, ?>)) {
                next = new LinkedHashMap<String, Object>();
                current.put(parts[i], next);
            }
            current = (Map<String, Object>) next;
        }
        current.put(parts[parts.length - 1], value);
    }

    @SuppressWarnings("unchecked")
    private static Object set(Args a) {
        var path = a.string(1);
        var copy = (Map<String, Object>) Values.deepCopy(a.map(0));
        if (!path.isEmpty()) {
            setPath(copy, path, a.get(2));
        }
        return copy;
    }

    private static Object has(Args a) {
        var path = a.string(1);
        if (!a.has(0) || path.isEmpty()) {
            return false;
        }
        Object current = a.get(0);
        for (var part : path.split("\\.", -1)) {
            var map = Values.castMap(current);
            if (map == null || !map.containsKey(part)) {
                return false;
            }
            current = map.get(part);
        }
        return true;
    }

    private static Object merge(Args a) {
        var result = new LinkedHashMap<String, Object>();
        for (var value : a.all()) {
            var map = Values.castMap(value);
            if (map != null) {
                result.putAll(map);
            }
        }
        return result;
    }

    private static Object deepMerge(Args a) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (var value : a.all()) {
            var map = Values.castMap(value);
            if (map != null) {
                result = deepMerge(result, map);
            }
        }
        return result;
    }

    static Map<String, Object> deepMerge(Map<String, Object> target, Map<String, Object> source) {
        var result = new LinkedHashMap<>(target);
        for (var entry : source.entrySet()) {
            var existing = Values.castMap(result.get(entry.getKey()));
            var incoming = Values.castMap(entry.getValue());
            if (existing != null && incoming != null) {
                result.put(entry.getKey(), deepMerge(existing, incoming));
            } else {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    private static Object pick(Args a) {
        var source = a.map(0);
        var result = new LinkedHashMap<String, Object>();
        for (var key : a.list(1)) {
            var name = Values.stringify(key);
            if (source.containsKey(name)) {
                result.put(name, source.get(name));
            }
        }
        return result;
    }

    private static Object omit(Args a) {
        var excluded = new HashSet<String>();
        for (var key : a.list(1)) {
            excluded.add(Values.stringify(key));
        }
        var result = new LinkedHashMap<String, Object>();
        a.map(0).forEach((key, value) -> {
            if (!excluded.contains(key)) {
                result.put(key, value);
            }
        });
        return result;
    }

    private static Object mapValues(Args a) {
        var result = new LinkedHashMap<String, Object>();
        a.map(0).forEach((key, value) -> result.put(key, a.call(a.fn(1), value)));
        return result;
    }

    private static Object mapKeys(Args a) {
        var result = new LinkedHashMap<String, Object>();
        a.map(0).forEach((key, value) -> result.put(Values.stringify(a.call(a.fn(1), key)), value));
        return result;
    }

    private static Object filter(Args a) {
        var result = new LinkedHashMap<String, Object>();
        a.map(0).forEach((key, value) -> {
            if (a.test(a.fn(1), key, value)) {
                result.put(key, value);
            }
        });
        return result;
    }
}
