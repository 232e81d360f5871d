package work.lcod.orbital.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.orbital.behavior.BehaviorLoader;
import work.lcod.orbital.runtime.Values;
import work.lcod.orbital.shared.DurationParser;

/**
 * A scripted run of one behavior: which behavior, how it is configured and seeded, and the
 * events, ticks and pauses delivered to it.
 *
 * <pre>
 * behavior: std/Pagination          # or an inline `definition:` map
 * config: { defaultPageSize: 20 }
 * entity: { totalItems: 45 }
 * now: 1000                         # optional fixed clock, advanced by wait steps
 * events:
 *   - { event: NEXT_PAGE }
 *   - { tick: true }
 *   - { wait: 50ms }
 *   - { event: NEXT_PAGE, expect: { state: Active, entity: { page: 3 } } }
 * </pre>
 */
public record Scenario(
    Optional<String> behaviorName,
    Map<String, Object> definition,
    Map<String, Object> config,
    Map<String, Object> entity,
    Map<String, Map<String, Object>> singletons,
    Optional<Long> now,
    List<Step> steps
) {
    public Scenario {
        definition = definition == null ? null : Collections.unmodifiableMap(definition);
        config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        entity = Collections.unmodifiableMap(new LinkedHashMap<>(entity));
        singletons = Collections.unmodifiableMap(new LinkedHashMap<>(singletons));
        steps = List.copyOf(steps);
        if (behaviorName.isEmpty() && definition == null) {
            throw new IllegalArgumentException("Scenario must name a behavior or define one");
        }
    }

    public enum StepKind {
        EVENT,
        TICK,
        WAIT
    }

    /**
     * One scripted step. {@code expect} may hold {@code state} and an {@code entity} map of dotted
     * paths to expected values, checked after the step.
     */
    public record Step(StepKind kind, String event, Object payload, Duration delay, Map<String, Object> expect) {
        public static Step event(String event, Object payload) {
            return new Step(StepKind.EVENT, event, payload, null, Map.of());
        }

        public static Step tick() {
            return new Step(StepKind.TICK, null, null, null, Map.of());
        }

        public static Step pause(Duration delay) {
            return new Step(StepKind.WAIT, null, null, delay, Map.of());
        }

        public Step expecting(Map<String, Object> expect) {
            return new Step(kind, event, payload, delay, expect);
        }
    }

    public static Scenario load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return fromMap(BehaviorLoader.readDocument(in, path.toString()));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read scenario " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static Scenario fromMap(Map<String, Object> raw) {
        var singletons = new LinkedHashMap<String, Map<String, Object>>();
        map(raw.get("singletons")).forEach((name, values) -> singletons.put(name, new LinkedHashMap<>(map(values))));
        var steps = new ArrayList<Step>();
        int index = 0;
        for (var item : Values.toList(raw.get("events"))) {
            index++;
            steps.add(step(map(item), index));
        }
        Optional<Long> now = raw.get("now") instanceof Number number
            ? Optional.of(number.longValue())
            : Optional.empty();
        var definition = Values.castMap(raw.get("definition"));
        return new Scenario(
            Optional.ofNullable(raw.get("behavior")).map(Values::stringify),
            definition,
            map(raw.get("config")),
            map(raw.get("entity")),
            singletons,
            now,
            steps
        );
    }

    private static Step step(Map<String, Object> raw, int index) {
        Step step;
        if (raw.get("event") != null) {
            step = Step.event(Values.stringify(raw.get("event")), raw.get("payload"));
        } else if (Boolean.TRUE.equals(raw.get("tick"))) {
            step = Step.tick();
        } else if (raw.get("wait") != null) {
            var wait = DurationParser.parse(raw.get("wait"))
                .orElseThrow(() -> new IllegalArgumentException("Step " + index + " has an empty wait"));
            step = Step.pause(wait);
        } else {
            throw new IllegalArgumentException("Step " + index + " must have one of event, tick or wait");
        }
        return step.expecting(map(raw.get("expect")));
    }

    private static Map<String, Object> map(Object value) {
        var map = Values.castMap(value);
        return map == null ? Map.of() : map;
    }
}
