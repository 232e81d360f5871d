package work.lcod.orbital.registry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.orbital.behavior.Behavior;
import work.lcod.orbital.behavior.BehaviorCategory;
import work.lcod.orbital.behavior.BehaviorDefinitionException;
import work.lcod.orbital.behavior.BehaviorLoader;
import work.lcod.orbital.behavior.BehaviorValidator;

/**
 * Catalog of behaviors keyed by name, in registration order. {@link #standard()} loads the
 * behaviors shipped under {@code /behaviors} on the classpath.
 */
public final class BehaviorRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(BehaviorRegistry.class);
    private static final String RESOURCE_DIR = "/behaviors/";
    private static final int SUGGESTION_DISTANCE = 3;

    static final List<String> STANDARD_RESOURCES = List.of(
        "pagination", "selection", "sort", "filter", "search",
        "loading", "fetch", "submit", "retry", "poll",
        "notification", "confirmation", "undo",
        "modal", "drawer", "tabs", "wizard",
        "game-loop", "physics-2d",
        "health", "score"
    );

    private static volatile BehaviorRegistry standard;

    private final Map<String, Behavior> behaviors = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    public BehaviorRegistry() {}

    /**
     * Registry of the standard behaviors, loaded once per class loader.
     */
    public static BehaviorRegistry standard() {
        var registry = standard;
        if (registry == null) {
            synchronized (BehaviorRegistry.class) {
                registry = standard;
                if (registry == null) {
                    registry = loadStandard();
                    standard = registry;
                }
            }
        }
        return registry;
    }

    private static BehaviorRegistry loadStandard() {
        var registry = new BehaviorRegistry();
        for (var name : STANDARD_RESOURCES) {
            var resource = RESOURCE_DIR + name + ".yaml";
            try (var in = BehaviorRegistry.class.getResourceAsStream(resource)) {
                if (in == null) {
                    throw new BehaviorDefinitionException(
                        BehaviorDefinitionException.UNREADABLE, "Missing standard behavior resource " + resource, (Object) resource);
                }
                registry.register(BehaviorLoader.read(in, resource));
            } catch (IOException ex) {
                throw new BehaviorDefinitionException(
                    BehaviorDefinitionException.UNREADABLE, "Unable to read " + resource + ": " + ex.getMessage(), ex);
            }
        }
        LOG.debug("Loaded {} standard behaviors", registry.size());
        return registry;
    }

    /**
     * Validates and registers {@code behavior}, replacing any behavior of the same name.
     */
    public BehaviorRegistry register(Behavior behavior) {
        BehaviorValidator.requireValid(behavior);
        if (behaviors.put(behavior.name(), behavior) == null) {
            order.add(behavior.name());
        }
        return this;
    }

    public Optional<Behavior> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(behaviors.get(name));
    }

    /**
     * @throws BehaviorDefinitionException with the reference error, including suggestions
     */
    public Behavior require(String name) {
        return get(name).orElseThrow(() -> new BehaviorDefinitionException(
            BehaviorDefinitionException.UNKNOWN,
            validateReference(name).orElse("Unknown behavior: " + name),
            Map.of("name", String.valueOf(name), "suggestions", suggestions(String.valueOf(name)))
        ));
    }

    public boolean isKnown(String name) {
        return name != null && behaviors.containsKey(name);
    }

    public int size() {
        return order.size();
    }

    public List<String> names() {
        return List.copyOf(order);
    }

    public List<Behavior> all() {
        var all = new ArrayList<Behavior>(order.size());
        order.forEach(name -> all.add(behaviors.get(name)));
        return all;
    }

    public List<Behavior> byCategory(BehaviorCategory category) {
        return filter(behavior -> category.id().equals(behavior.category()));
    }

    public Optional<BehaviorMetadata> metadata(String name) {
        return get(name).map(BehaviorMetadata::of);
    }

    public List<BehaviorMetadata> allMetadata() {
        var metadata = new ArrayList<BehaviorMetadata>(order.size());
        all().forEach(behavior -> metadata.add(BehaviorMetadata.of(behavior)));
        return metadata;
    }

    /**
     * Behaviors whose suggested uses or description overlap {@code useCase}, case-insensitively.
     */
    public List<Behavior> findForUseCase(String useCase) {
        var wanted = useCase.toLowerCase(Locale.ROOT).trim();
        if (wanted.isEmpty()) {
            return List.of();
        }
        return filter(behavior -> {
            for (var suggestion : behavior.suggestedFor()) {
                var candidate = suggestion.toLowerCase(Locale.ROOT);
                if (candidate.contains(wanted) || wanted.contains(candidate)) {
                    return true;
                }
            }
            var description = behavior.description();
            return description != null && description.toLowerCase(Locale.ROOT).contains(wanted);
        });
    }

    public List<Behavior> forEvent(String event) {
        return filter(behavior -> behavior.stateMachine().declaresEvent(event));
    }

    public List<Behavior> withState(String state) {
        return filter(behavior -> behavior.stateMachine().hasState(state));
    }

    /**
     * Error message for a reference to an unknown or malformed behavior name; empty when the name
     * is registered.
     */
    public Optional<String> validateReference(String name) {
        if (name == null || !name.startsWith(BehaviorValidator.NAME_PREFIX)) {
            return Optional.of("Behavior name must start with '" + BehaviorValidator.NAME_PREFIX + "': " + name);
        }
        if (isKnown(name)) {
            return Optional.empty();
        }
        var suggestions = suggestions(name);
        if (!suggestions.isEmpty()) {
            return Optional.of("Unknown behavior '" + name + "'. Did you mean: " + String.join(", ", suggestions) + "?");
        }
        return Optional.of("Unknown behavior: " + name);
    }

    /**
     * Registered names containing, contained in, or within edit distance 3 of {@code name}, ignoring
     * case and the {@code std/} prefix.
     */
    public List<String> suggestions(String name) {
        var input = normalize(name);
        var matches = new ArrayList<String>();
        for (var candidate : order) {
            var normalized = normalize(candidate);
            if (normalized.contains(input) || input.contains(normalized)
                || EditDistance.between(input, normalized) <= SUGGESTION_DISTANCE) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    public LibraryStats stats() {
        var byCategory = new LinkedHashMap<String, Integer>();
        int states = 0;
        int events = 0;
        int transitions = 0;
        int ticks = 0;
        int withTicks = 0;
        for (var behavior : all()) {
            byCategory.merge(behavior.category(), 1, Integer::sum);
            var machine = behavior.stateMachine();
            states += machine.states().size();
            events += machine.events().size();
            transitions += machine.transitions().size();
            ticks += behavior.ticks().size();
            if (!behavior.ticks().isEmpty()) {
                withTicks++;
            }
        }
        return new LibraryStats(order.size(), byCategory, states, events, transitions, ticks, withTicks);
    }

    private List<Behavior> filter(Predicate<Behavior> predicate) {
        var matches = new ArrayList<Behavior>();
        for (var behavior : all()) {
            if (predicate.test(behavior)) {
                matches.add(behavior);
            }
        }
        return matches;
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replaceFirst("^std/", "");
    }
}
