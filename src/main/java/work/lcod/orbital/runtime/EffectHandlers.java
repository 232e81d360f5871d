package work.lcod.orbital.runtime;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Host callbacks invoked by effect operators. Every field is optional; an absent handler turns
 * the matching effect into a no-op.
 */
public record EffectHandlers(
    MutateEntity mutateEntity,
    Emit emit,
    Navigate navigate,
    Persist persist,
    Notify notifier,
    Spawn spawn,
    Despawn despawn,
    CallService callService,
    RenderUi renderUi
) {
    public static final EffectHandlers NONE = builder().build();

    @FunctionalInterface
    public interface MutateEntity {
        void apply(Map<String, Object> changes);
    }

    @FunctionalInterface
    public interface Emit {
        void emit(String event, Object payload);
    }

    @FunctionalInterface
    public interface Navigate {
        void navigate(String route, Object params);
    }

    @FunctionalInterface
    public interface Persist {
        CompletableFuture<Object> persist(String action, Object data);
    }

    @FunctionalInterface
    public interface Notify {
        void show(String message, String type);
    }

    @FunctionalInterface
    public interface Spawn {
        void spawn(String entityType, Object props);
    }

    @FunctionalInterface
    public interface Despawn {
        void despawn(Object entityId);
    }

    @FunctionalInterface
    public interface CallService {
        CompletableFuture<Object> call(String service, String method, Object params);
    }

    @FunctionalInterface
    public interface RenderUi {
        void render(String slot, Object pattern, Object props, Object priority);
    }

    public boolean isEmpty() {
        return mutateEntity == null && emit == null && navigate == null && persist == null
            && notifier == null && spawn == null && despawn == null && callService == null && renderUi == null;
    }

    /**
     * Returns these handlers with every non-null handler of {@code overlay} taking precedence.
     */
    public EffectHandlers overlay(EffectHandlers overlay) {
        if (overlay == null) {
            return this;
        }
        return new EffectHandlers(
            pick(overlay.mutateEntity, mutateEntity),
            pick(overlay.emit, emit),
            pick(overlay.navigate, navigate),
            pick(overlay.persist, persist),
            pick(overlay.notifier, notifier),
            pick(overlay.spawn, spawn),
            pick(overlay.despawn, despawn),
            pick(overlay.callService, callService),
            pick(overlay.renderUi, renderUi)
        );
    }

    public Builder toBuilder() {
        return new Builder()
            .mutateEntity(mutateEntity)
            .emit(emit)
            .navigate(navigate)
            .persist(persist)
            .notifier(notifier)
            .spawn(spawn)
            .despawn(despawn)
            .callService(callService)
            .renderUi(renderUi);
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MutateEntity mutateEntity;
        private Emit emit;
        private Navigate navigate;
        private Persist persist;
        private Notify notifier;
        private Spawn spawn;
        private Despawn despawn;
        private CallService callService;
        private RenderUi renderUi;

        public Builder mutateEntity(MutateEntity mutateEntity) {
            this.mutateEntity = mutateEntity;
            return this;
        }

        public Builder emit(Emit emit) {
            this.emit = emit;
            return this;
        }

        public Builder navigate(Navigate navigate) {
            this.navigate = navigate;
            return this;
        }

        public Builder persist(Persist persist) {
            this.persist = persist;
            return this;
        }

        public Builder notifier(Notify notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder spawn(Spawn spawn) {
            this.spawn = spawn;
            return this;
        }

        public Builder despawn(Despawn despawn) {
            this.despawn = despawn;
            return this;
        }

        public Builder callService(CallService callService) {
            this.callService = callService;
            return this;
        }

        public Builder renderUi(RenderUi renderUi) {
            this.renderUi = renderUi;
            return this;
        }

        public EffectHandlers build() {
            return new EffectHandlers(
                mutateEntity,
                emit,
                navigate,
                persist,
                notifier,
                spawn,
                despawn,
                callService,
                renderUi
            );
        }
    }
}
