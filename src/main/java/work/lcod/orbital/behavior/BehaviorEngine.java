package work.lcod.orbital.behavior;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.orbital.runtime.EffectHandlers;
import work.lcod.orbital.runtime.Evaluator;
import work.lcod.orbital.runtime.OperatorLibrary;
import work.lcod.orbital.runtime.Values;

/**
 * Creates {@link BehaviorInstance}s and owns what they share: the evaluator, the singleton store
 * read through {@code @Name.field} bindings, the clock behind {@code @now} and the tick scheduler.
 */
public final class BehaviorEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BehaviorEngine.class);
    public static final String CONFIG_SINGLETON = "config";

    private final Evaluator evaluator;
    private final EngineSettings settings;
    private final LongSupplier clock;
    private final Map<String, Map<String, Object>> singletons = new ConcurrentHashMap<>();
    private final Set<BehaviorInstance> instances = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();
    private final Object schedulerLock = new Object();
    private TickScheduler scheduler;

    public BehaviorEngine() {
        this(EngineSettings.defaults());
    }

    public BehaviorEngine(EngineSettings settings) {
        this(OperatorLibrary.evaluator(), settings, System::currentTimeMillis);
    }

    public BehaviorEngine(Evaluator evaluator, EngineSettings settings, LongSupplier clock) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    public EngineSettings settings() {
        return settings;
    }

    public long now() {
        return clock.getAsLong();
    }

    public BehaviorInstance create(Behavior behavior) {
        return create(behavior, Map.of(), Map.of(), EffectHandlers.NONE);
    }

    public BehaviorInstance create(Behavior behavior, Map<String, Object> config) {
        return create(behavior, config, Map.of(), EffectHandlers.NONE);
    }

    public BehaviorInstance create(Behavior behavior, Map<String, Object> config, Map<String, Object> entity) {
        return create(behavior, config, entity, EffectHandlers.NONE);
    }

    /**
     * Validates the behavior, resolves its config, seeds the entity from the first data entity's
     * defaults overlaid by {@code entity}, registers singleton data entities and runs the initial
     * effects.
     *
     * @throws BehaviorDefinitionException when the behavior is structurally invalid
     * @throws BehaviorConfigException when {@code config} does not satisfy the config schema
     */
    public BehaviorInstance create(
        Behavior behavior,
        Map<String, Object> config,
        Map<String, Object> entity,
        EffectHandlers handlers
    ) {
        BehaviorValidator.requireValid(behavior);
        var resolvedConfig = BehaviorConfig.resolve(behavior, config);
        var liveEntity = behavior.primaryEntity().map(DataEntity::defaults).orElseGet(LinkedHashMap::new);
        if (entity != null) {
            entity.forEach((key, value) -> liveEntity.put(key, Values.deepCopy(value)));
        }
        var dataEntities = behavior.dataEntities();
        for (int i = 0; i < dataEntities.size(); i++) {
            var data = dataEntities.get(i);
            if (!data.singleton()) {
                continue;
            }
            if (i == 0) {
                singletons.put(data.name(), liveEntity);
            } else {
                singletons.putIfAbsent(data.name(), data.defaults());
            }
        }
        var id = behavior.name() + "#" + sequence.incrementAndGet();
        var instance = new BehaviorInstance(id, behavior, this, resolvedConfig, liveEntity, handlers);
        instances.add(instance);
        instance.start();
        LOG.debug("Created {} in state {}", id, instance.state());
        return instance;
    }

    /**
     * Makes {@code values} readable as {@code @name.field} from every instance of this engine.
     */
    public void registerSingleton(String name, Map<String, Object> values) {
        if (CONFIG_SINGLETON.equals(name)) {
            throw new IllegalArgumentException("'" + CONFIG_SINGLETON + "' is reserved for instance config");
        }
        singletons.put(name, values);
    }

    public Map<String, Map<String, Object>> singletons() {
        return Collections.unmodifiableMap(singletons);
    }

    Map<String, Map<String, Object>> singletonsFor(Map<String, Object> config) {
        var view = new HashMap<String, Map<String, Object>>(singletons);
        view.put(CONFIG_SINGLETON, config);
        return view;
    }

    public Set<BehaviorInstance> instances() {
        return Collections.unmodifiableSet(instances);
    }

    /**
     * Starts running the instance's ticks periodically; returns the number of scheduled intervals.
     */
    public int schedule(BehaviorInstance instance) {
        synchronized (schedulerLock) {
            if (scheduler == null) {
                scheduler = new TickScheduler(settings.tickThreads());
            }
            return scheduler.schedule(instance);
        }
    }

    void release(BehaviorInstance instance) {
        instances.remove(instance);
        synchronized (schedulerLock) {
            if (scheduler != null) {
                scheduler.cancel(instance);
            }
        }
    }

    @Override
    public void close() {
        for (var instance : instances.toArray(new BehaviorInstance[0])) {
            instance.close();
        }
        synchronized (schedulerLock) {
            if (scheduler != null) {
                scheduler.close();
                scheduler = null;
            }
        }
    }
}
