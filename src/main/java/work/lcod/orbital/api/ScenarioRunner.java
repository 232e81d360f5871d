package work.lcod.orbital.api;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.orbital.behavior.Behavior;
import work.lcod.orbital.behavior.BehaviorConfigException;
import work.lcod.orbital.behavior.BehaviorDefinitionException;
import work.lcod.orbital.behavior.BehaviorEngine;
import work.lcod.orbital.behavior.BehaviorInstance;
import work.lcod.orbital.behavior.BehaviorLoader;
import work.lcod.orbital.behavior.EngineSettings;
import work.lcod.orbital.flow.EffectTimeoutException;
import work.lcod.orbital.registry.BehaviorRegistry;
import work.lcod.orbital.runtime.EffectHandlers;
import work.lcod.orbital.runtime.ExpressionException;
import work.lcod.orbital.runtime.OperatorLibrary;
import work.lcod.orbital.runtime.Values;
import work.lcod.orbital.std.ObjectModule;

/**
 * Public entry point for running scripted behavior scenarios.
 */
public final class ScenarioRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ScenarioRunner.class);

    private final BehaviorRegistry registry;

    public ScenarioRunner() {
        this(BehaviorRegistry.standard());
    }

    public ScenarioRunner(BehaviorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        try {
            var scenario = Scenario.load(configuration.scenario());
            var settings = configuration.settingsFile().map(EngineSettings::load).orElseGet(EngineSettings::defaults);
            var metadata = configuration.timeout().isPresent()
                ? executeWithTimeout(scenario, settings, configuration.timeout().get())
                : execute(scenario, settings);
            metadata.put("scenario", configuration.scenario().toString());
            return RunResult.success(metadata, started);
        } catch (Exception ex) {
            return failure(ex, Map.of("scenario", configuration.scenario().toString()), started);
        }
    }

    public RunResult run(Scenario scenario, EngineSettings settings) {
        var started = Instant.now();
        try {
            return RunResult.success(execute(scenario, settings), started);
        } catch (Exception ex) {
            return failure(ex, Map.of(), started);
        }
    }

    private RunResult failure(Exception ex, Map<String, Object> metadata, Instant started) {
        LOG.debug("Scenario failed", ex);
        var message = ex.getMessage() == null || ex.getMessage().isBlank() ? ex.getClass().getSimpleName() : ex.getMessage();
        return RunResult.failure(errorCode(ex).orElse(null), message, metadata, started);
    }

    /**
     * Code of the runtime's coded failures; {@code TIMEOUT} for scenario timeouts.
     */
    public static Optional<String> errorCode(Throwable ex) {
        if (ex instanceof BehaviorDefinitionException definition) {
            return Optional.of(definition.code());
        }
        if (ex instanceof BehaviorConfigException config) {
            return Optional.of(config.code());
        }
        if (ex instanceof ExpressionException expression) {
            return Optional.of(expression.code());
        }
        if (ex instanceof EffectTimeoutException || ex instanceof TimeoutException) {
            return Optional.of(EffectTimeoutException.CODE);
        }
        return Optional.empty();
    }

    private Map<String, Object> executeWithTimeout(Scenario scenario, EngineSettings settings, Duration timeout)
        throws Exception {
        var executor = Executors.newSingleThreadExecutor();
        try {
            var future = CompletableFuture.supplyAsync(() -> execute(scenario, settings), executor);
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw new TimeoutException("Scenario timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw ex;
        } finally {
            executor.shutdownNow();
        }
    }

    private Map<String, Object> execute(Scenario scenario, EngineSettings settings) {
        var behavior = resolveBehavior(scenario);
        var clock = scenario.now().map(AtomicLong::new).orElse(null);
        LongSupplier time = clock != null ? clock::get : System::currentTimeMillis;
        var recorder = new EffectRecorder();
        try (var engine = new BehaviorEngine(OperatorLibrary.evaluator(), settings, time)) {
            scenario.singletons().forEach((name, values) -> engine.registerSingleton(name, new LinkedHashMap<>(values)));
            var instance = engine.create(behavior, scenario.config(), scenario.entity(), recorder.handlers());
            var transitions = new ArrayList<Object>();
            int index = 0;
            for (var step : scenario.steps()) {
                index++;
                switch (step.kind()) {
                    case EVENT -> transitions.add(instance.send(step.event(), step.payload()).toMap());
                    case TICK -> instance.runTicks();
                    case WAIT -> pause(step.delay(), clock);
                }
                verify(step, instance, index);
            }
            var snapshot = instance.snapshot();
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("behavior", behavior.name());
            metadata.put("finalState", snapshot.state());
            metadata.put("entity", snapshot.entity());
            metadata.put("transitions", transitions);
            metadata.put("effects", recorder.effects());
            return metadata;
        }
    }

    private Behavior resolveBehavior(Scenario scenario) {
        if (scenario.definition() != null) {
            return BehaviorLoader.fromMap(scenario.definition());
        }
        return registry.require(scenario.behaviorName().orElseThrow());
    }

    private static void pause(Duration wait, AtomicLong clock) {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Scenario interrupted", ex);
        }
        if (clock != null) {
            clock.addAndGet(wait.toMillis());
        }
    }

    private static void verify(Scenario.Step step, BehaviorInstance instance, int index) {
        var expect = step.expect();
        if (expect.isEmpty()) {
            return;
        }
        var expectedState = expect.get("state");
        if (expectedState != null && !expectedState.equals(instance.state())) {
            throw new IllegalStateException(
                "Step " + index + ": expected state " + expectedState + " but was " + instance.state());
        }
        var expectedEntity = Values.castMap(expect.get("entity"));
        if (expectedEntity == null) {
            return;
        }
        var entity = instance.snapshot().entity();
        expectedEntity.forEach((path, expected) -> {
            var actual = ObjectModule.getPath(entity, path);
            if (!Values.deepEquals(expected, actual)) {
                throw new IllegalStateException(
                    "Step " + index + ": expected entity." + path + " = " + expected + " but was " + actual);
            }
        });
    }

    /**
     * Host handlers that acknowledge every effect and keep a log of them.
     */
    static final class EffectRecorder {
        private final List<Map<String, Object>> effects = Collections.synchronizedList(new ArrayList<>());

        EffectHandlers handlers() {
            return EffectHandlers.builder()
                .emit((event, payload) -> record("emit", "event", event, "payload", payload))
                .navigate((route, params) -> record("navigate", "route", route, "params", params))
                .notifier((message, type) -> record("notify", "message", message, "type", type))
                .renderUi((slot, pattern, props, priority) ->
                    record("render-ui", "slot", slot, "pattern", pattern, "props", props))
                .persist((action, data) -> {
                    record("persist", "action", action, "data", data);
                    return CompletableFuture.completedFuture(data);
                })
                .callService((service, method, params) -> {
                    record("call-service", "service", service, "method", method, "params", params);
                    return CompletableFuture.completedFuture(null);
                })
                .spawn((type, props) -> record("spawn", "type", type, "props", props))
                .despawn(id -> record("despawn", "id", id))
                .build();
        }

        List<Map<String, Object>> effects() {
            synchronized (effects) {
                return new ArrayList<>(effects);
            }
        }

        private void record(String kind, Object... keyValues) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("kind", kind);
            for (int i = 0; i + 1 < keyValues.length; i += 2) {
                entry.put((String) keyValues[i], Values.deepCopy(keyValues[i + 1]));
            }
            effects.add(entry);
        }
    }
}
