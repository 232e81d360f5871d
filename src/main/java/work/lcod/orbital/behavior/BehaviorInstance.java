package work.lcod.orbital.behavior;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.orbital.expr.Binding;
import work.lcod.orbital.runtime.BindingResolver;
import work.lcod.orbital.runtime.EffectHandlers;
import work.lcod.orbital.runtime.EvaluationContext;
import work.lcod.orbital.runtime.Futures;
import work.lcod.orbital.runtime.Values;
import work.lcod.orbital.shared.DurationParser;
import work.lcod.orbital.std.ObjectModule;

/**
 * Running copy of a {@link Behavior}: current state, live entity and event mailbox.
 *
 * <p>Events and ticks run one at a time under the instance lock. Events emitted while the lock is
 * held are queued and processed before the lock is released; events emitted from timer threads are
 * queued and processed by whichever thread holds the instance next.
 */
public final class BehaviorInstance implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BehaviorInstance.class);

    private final String id;
    private final Behavior behavior;
    private final BehaviorEngine engine;
    private final Map<String, Object> config;
    private final Map<String, Object> entity;
    private final EffectHandlers hostHandlers;
    private final EffectHandlers handlers;
    private final List<Tick> ticksByPriority;
    private final ReentrantLock lock = new ReentrantLock();
    private final Queue<Pending> mailbox = new ConcurrentLinkedQueue<>();
    private volatile String state;
    private volatile boolean closed;
    private Transaction current;

    private record Pending(String event, Object payload) {}

    private static final class Transaction {
        private final Transaction previous;
        private final List<TransitionResult.Emitted> emitted = new ArrayList<>();
        private final List<TransitionResult.ClientEffect> clientEffects = new ArrayList<>();
        private String guardError;

        private Transaction(Transaction previous) {
            this.previous = previous;
        }
    }

    /**
     * Point-in-time copy of an instance.
     */
    public record Snapshot(String behavior, String state, Map<String, Object> entity) {
        public Map<String, Object> toMap() {
            var map = new LinkedHashMap<String, Object>();
            map.put("behavior", behavior);
            map.put("state", state);
            map.put("entity", entity);
            return map;
        }
    }

    BehaviorInstance(
        String id,
        Behavior behavior,
        BehaviorEngine engine,
        Map<String, Object> config,
        Map<String, Object> entity,
        EffectHandlers hostHandlers
    ) {
        this.id = id;
        this.behavior = behavior;
        this.engine = engine;
        this.config = config;
        this.entity = entity;
        this.hostHandlers = Objects.requireNonNullElse(hostHandlers, EffectHandlers.NONE);
        this.handlers = this.hostHandlers.overlay(ownHandlers());
        this.ticksByPriority = behavior.ticks().stream()
            .sorted(Comparator.comparingInt(Tick::priority).reversed())
            .collect(Collectors.toList());
        this.state = behavior.stateMachine().initialState();
    }

    public String id() {
        return id;
    }

    public Behavior behavior() {
        return behavior;
    }

    public String state() {
        return state;
    }

    public Map<String, Object> config() {
        return config;
    }

    /**
     * Live view of the entity; it changes as effects run.
     */
    public Map<String, Object> entity() {
        return Collections.unmodifiableMap(entity);
    }

    public boolean isClosed() {
        return closed;
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            @SuppressWarnings("unchecked")
            var copy = (Map<String, Object>) Values.deepCopy(entity);
            return new Snapshot(behavior.name(), state, copy);
        } finally {
            lock.unlock();
        }
    }

    void start() {
        lock.lock();
        try {
            if (!behavior.initialEffects().isEmpty()) {
                var tx = begin();
                try {
                    runEffects(behavior.initialEffects(), context(Map.of(), handlers));
                } finally {
                    current = tx.previous;
                }
                drainMailbox(new ArrayList<>());
            }
        } finally {
            lock.unlock();
        }
        dispatchPending();
    }

    public TransitionResult send(String event) {
        return send(event, null);
    }

    /**
     * Delivers {@code event} and every event it causes the behavior to emit to itself.
     *
     * @throws RuntimeException the first failing effect; the state is left unchanged
     */
    public TransitionResult send(String event, Object payload) {
        Objects.requireNonNull(event, "event");
        ensureOpen();
        TransitionResult result;
        lock.lock();
        try {
            result = dispatch(event, payload);
            if (!mailbox.isEmpty()) {
                var followUps = new ArrayList<TransitionResult>();
                drainMailbox(followUps);
                result = new TransitionResult(
                    result.event(),
                    result.transitioned(),
                    result.fromState(),
                    result.toState(),
                    result.emitted(),
                    result.clientEffects(),
                    result.guardError(),
                    followUps
                );
            }
        } finally {
            lock.unlock();
        }
        dispatchPending();
        return result;
    }

    /**
     * Runs one tick if it applies to the current state and its guard passes.
     */
    public boolean runTick(Tick tick) {
        return runTicks(List.of(tick)) == 1;
    }

    /**
     * Runs every tick once, highest priority first; returns how many ran.
     */
    public int runTicks() {
        return runTicks(ticksByPriority);
    }

    int runTicks(List<Tick> ticks) {
        ensureOpen();
        int ran = 0;
        lock.lock();
        try {
            for (var tick : ticks) {
                if (tickOnce(tick)) {
                    ran++;
                }
            }
        } finally {
            lock.unlock();
        }
        dispatchPending();
        return ran;
    }

    List<Tick> ticksByPriority() {
        return ticksByPriority;
    }

    /**
     * Period of {@code tick}; empty when its interval resolves to nothing or to a non-positive value.
     */
    public Optional<Duration> tickInterval(Tick tick) {
        Object interval = tick.interval();
        if (interval == null || Tick.FRAME.equals(interval)) {
            return Optional.of(engine.settings().frameInterval());
        }
        if (Binding.isBinding(interval)) {
            interval = BindingResolver.resolve((String) interval, context(Map.of(), EffectHandlers.NONE));
        }
        return DurationParser.parse(interval).filter(duration -> !duration.isZero() && !duration.isNegative());
    }

    @Override
    public void close() {
        closed = true;
        mailbox.clear();
        engine.release(this);
    }

    private boolean tickOnce(Tick tick) {
        if (!tick.appliesTo(state)) {
            return false;
        }
        var tx = begin();
        try {
            if (!guardPasses(tick.guard(), Map.of(), tx, "tick " + tick.name())) {
                return false;
            }
            runEffects(tick.effects(), context(Map.of(), handlers));
        } finally {
            current = tx.previous;
        }
        drainMailbox(new ArrayList<>());
        return true;
    }

    private TransitionResult dispatch(String event, Object payload) {
        var tx = begin();
        try {
            var from = state;
            var eventPayload = payloadMap(payload);
            for (var transition : behavior.stateMachine().transitions()) {
                if (!event.equals(transition.event()) || !transition.matchesFrom(from)) {
                    continue;
                }
                if (!guardPasses(transition.guard(), eventPayload, tx, "transition " + event + " from " + from)) {
                    continue;
                }
                runEffects(transition.effects(), context(eventPayload, handlers));
                if (transition.changesState()) {
                    state = transition.to();
                }
                LOG.debug("{} {}: {} -> {}", id, event, from, state);
                return new TransitionResult(
                    event, true, from, state, tx.emitted, tx.clientEffects, tx.guardError, List.of());
            }
            LOG.debug("{} {}: no transition from {}", id, event, from);
            return new TransitionResult(
                event, false, from, from, tx.emitted, tx.clientEffects, tx.guardError, List.of());
        } finally {
            current = tx.previous;
        }
    }

    private void drainMailbox(List<TransitionResult> sink) {
        int processed = 0;
        Pending next;
        while ((next = mailbox.poll()) != null) {
            if (++processed > engine.settings().maxChainedEvents()) {
                mailbox.clear();
                throw new IllegalStateException(
                    "Event chain of " + id + " exceeded " + engine.settings().maxChainedEvents() + " events");
            }
            sink.add(dispatch(next.event(), next.payload()));
        }
    }

    /**
     * Processes events queued by timer threads. Returns immediately when another thread holds the
     * instance; that thread drains the mailbox before it lets go.
     */
    private void dispatchPending() {
        while (!closed && !mailbox.isEmpty()) {
            if (!lock.tryLock()) {
                return;
            }
            try {
                var results = new ArrayList<TransitionResult>();
                drainMailbox(results);
                results.forEach(result -> LOG.debug("{} processed queued {} (transitioned={})",
                    id, result.event(), result.transitioned()));
            } catch (RuntimeException ex) {
                LOG.error("Queued event processing failed for {}", id, ex);
            } finally {
                lock.unlock();
            }
        }
    }

    private boolean guardPasses(Object guard, Map<String, Object> payload, Transaction tx, String where) {
        if (guard == null) {
            return true;
        }
        try {
            var value = Futures.await(engine.evaluator().evaluate(guard, context(payload, EffectHandlers.NONE)));
            return Values.isTruthy(value);
        } catch (RuntimeException ex) {
            if (engine.settings().guardErrorPolicy() == GuardErrorPolicy.PROPAGATE) {
                throw ex;
            }
            LOG.warn("Guard of {} in {} failed: {}", where, id, ex.getMessage());
            tx.guardError = ex.getMessage();
            return false;
        }
    }

    private void runEffects(List<Object> effects, EvaluationContext ctx) {
        for (var effect : effects) {
            var value = engine.evaluator().evaluate(effect, ctx);
            if (value instanceof CompletableFuture<?> future) {
                if (engine.settings().awaitAsyncEffects()) {
                    Futures.await(future);
                } else {
                    future.whenComplete((ignored, error) -> {
                        if (error != null) {
                            LOG.warn("Async effect of {} failed: {}", id, Futures.unwrap(error).getMessage());
                        }
                    });
                }
            }
        }
    }

    private EvaluationContext context(Map<String, Object> payload, EffectHandlers effectHandlers) {
        return EvaluationContext.builder()
            .entity(entity)
            .payload(payload)
            .state(state)
            .now(engine.now())
            .singletons(engine.singletonsFor(config))
            .handlers(effectHandlers)
            .build();
    }

    private EffectHandlers ownHandlers() {
        return EffectHandlers.builder()
            .mutateEntity(this::applyChanges)
            .emit(this::onEmit)
            .navigate((route, params) -> {
                record("navigate", fields("route", route, "params", params));
                if (hostHandlers.navigate() != null) {
                    hostHandlers.navigate().navigate(route, params);
                }
            })
            .notifier((message, type) -> {
                record("notify", fields("message", message, "type", type));
                if (hostHandlers.notifier() != null) {
                    hostHandlers.notifier().show(message, type);
                }
            })
            .renderUi((slot, pattern, props, priority) -> {
                record("render-ui", fields("slot", slot, "pattern", pattern, "props", props));
                if (hostHandlers.renderUi() != null) {
                    hostHandlers.renderUi().render(slot, pattern, props, priority);
                }
            })
            .build();
    }

    private void applyChanges(Map<String, Object> changes) {
        changes.forEach((path, value) -> ObjectModule.setPath(entity, path, Values.deepCopy(value)));
        if (hostHandlers.mutateEntity() != null) {
            hostHandlers.mutateEntity().apply(changes);
        }
    }

    private void onEmit(String event, Object payload) {
        var tx = lock.isHeldByCurrentThread() ? current : null;
        if (tx != null) {
            tx.emitted.add(new TransitionResult.Emitted(event, payload));
        }
        if (hostHandlers.emit() != null) {
            hostHandlers.emit().emit(event, payload);
        }
        if (closed || !behavior.handles(event)) {
            return;
        }
        mailbox.offer(new Pending(event, payload));
        if (!lock.isHeldByCurrentThread()) {
            dispatchPending();
        }
    }

    private void record(String kind, Map<String, Object> data) {
        var tx = lock.isHeldByCurrentThread() ? current : null;
        if (tx != null) {
            tx.clientEffects.add(new TransitionResult.ClientEffect(kind, data));
        }
    }

    private Transaction begin() {
        current = new Transaction(current);
        return current;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Behavior instance " + id + " is closed");
        }
    }

    private static Map<String, Object> payloadMap(Object payload) {
        if (payload == null) {
            return Map.of();
        }
        var map = Values.castMap(payload);
        return map != null ? map : Map.of("value", payload);
    }

    private static Map<String, Object> fields(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
