package work.lcod.orbital.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores operators in two tiers: built-in core operators, which cannot be replaced, and the open
 * set of namespaced module operators.
 */
public final class OperatorRegistry {
    private final Map<String, Entry> core = new ConcurrentHashMap<>();
    private final Map<String, Entry> modules = new ConcurrentHashMap<>();

    public OperatorRegistry registerCore(String name, Operator operator, OperatorMetadata metadata) {
        core.put(name, new Entry(name, operator, metadata));
        return this;
    }

    public OperatorRegistry register(String name, Operator operator) {
        return register(name, operator, null);
    }

    public OperatorRegistry register(String name, Operator operator, OperatorMetadata metadata) {
        if (core.containsKey(name)) {
            throw new IllegalArgumentException("Cannot replace core operator: " + name);
        }
        modules.put(name, new Entry(name, operator, metadata));
        return this;
    }

    /**
     * Core operators first, then modules.
     */
    public Entry get(String name) {
        var entry = core.get(name);
        return entry != null ? entry : modules.get(name);
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public void unregister(String name) {
        if (name != null) {
            modules.remove(name);
        }
    }

    public Map<String, Entry> coreEntries() {
        return Collections.unmodifiableMap(new TreeMap<>(core));
    }

    public Map<String, Entry> moduleEntries() {
        return Collections.unmodifiableMap(new TreeMap<>(modules));
    }

    public Map<String, Entry> moduleEntries(String module) {
        var prefix = module + "/";
        var filtered = new TreeMap<String, Entry>();
        modules.forEach((name, entry) -> {
            if (name.startsWith(prefix)) {
                filtered.put(name, entry);
            }
        });
        return Collections.unmodifiableMap(filtered);
    }

    public record Entry(String name, Operator operator, OperatorMetadata metadata) {}
}
