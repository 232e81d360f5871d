package work.lcod.orbital.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Value bundle an expression is evaluated against. Instances are never mutated; scoping derives
 * new contexts that share everything except {@code locals}. The {@code entity} map itself may be
 * changed by the host through the mutate handler.
 */
public final class EvaluationContext {
    public static final String DEFAULT_STATE = "initial";

    private final Map<String, Object> entity;
    private final Map<String, Object> payload;
    private final String state;
    private final long now;
    private final Map<String, Object> user;
    private final Map<String, Map<String, Object>> singletons;
    private final Map<String, Object> locals;
    private final EffectHandlers handlers;

    private EvaluationContext(Builder builder) {
        this.entity = builder.entity == null ? new LinkedHashMap<>() : builder.entity;
        this.payload = builder.payload == null ? Map.of() : builder.payload;
        this.state = builder.state == null ? DEFAULT_STATE : builder.state;
        this.now = builder.now;
        this.user = builder.user;
        this.singletons = builder.singletons == null ? Map.of() : builder.singletons;
        this.locals = builder.locals == null || builder.locals.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.locals));
        this.handlers = builder.handlers == null ? EffectHandlers.NONE : builder.handlers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EvaluationContext minimal(Map<String, Object> entity, Map<String, Object> payload) {
        return minimal(entity, payload, DEFAULT_STATE);
    }

    public static EvaluationContext minimal(Map<String, Object> entity, Map<String, Object> payload, String state) {
        return builder().entity(entity).payload(payload).state(state).build();
    }

    public Map<String, Object> entity() {
        return entity;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public String state() {
        return state;
    }

    public long now() {
        return now;
    }

    public Map<String, Object> user() {
        return user;
    }

    public Map<String, Map<String, Object>> singletons() {
        return singletons;
    }

    public Map<String, Object> locals() {
        return locals;
    }

    public EffectHandlers handlers() {
        return handlers;
    }

    /**
     * Child scope: a copy of the current locals with {@code newLocals} laid over it.
     */
    public EvaluationContext child(Map<String, Object> newLocals) {
        var merged = new LinkedHashMap<String, Object>(locals);
        if (newLocals != null) {
            merged.putAll(newLocals);
        }
        return toBuilder().locals(merged).build();
    }

    public EvaluationContext withHandlers(EffectHandlers overlay) {
        return toBuilder().handlers(handlers.overlay(overlay)).build();
    }

    public EvaluationContext withPayload(Map<String, Object> newPayload) {
        return toBuilder().payload(newPayload).build();
    }

    public EvaluationContext withState(String newState) {
        return toBuilder().state(newState).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .entity(entity)
            .payload(payload)
            .state(state)
            .now(now)
            .user(user)
            .singletons(singletons)
            .locals(locals)
            .handlers(handlers);
    }

    public static final class Builder {
        private Map<String, Object> entity;
        private Map<String, Object> payload;
        private String state;
        private long now;
        private Map<String, Object> user;
        private Map<String, Map<String, Object>> singletons;
        private Map<String, Object> locals;
        private EffectHandlers handlers;

        public Builder entity(Map<String, Object> entity) {
            this.entity = entity;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder now(long now) {
            this.now = now;
            return this;
        }

        public Builder user(Map<String, Object> user) {
            this.user = user;
            return this;
        }

        public Builder singletons(Map<String, Map<String, Object>> singletons) {
            this.singletons = singletons;
            return this;
        }

        public Builder locals(Map<String, Object> locals) {
            this.locals = locals;
            return this;
        }

        public Builder handlers(EffectHandlers handlers) {
            this.handlers = Objects.requireNonNullElse(handlers, EffectHandlers.NONE);
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(this);
        }
    }
}
