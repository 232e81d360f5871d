package work.lcod.orbital.behavior;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable behavior template. One template is shared by every instance created from it.
 */
public record Behavior(
    String name,
    String category,
    String description,
    List<String> suggestedFor,
    List<DataEntity> dataEntities,
    StateMachine stateMachine,
    List<Tick> ticks,
    ConfigSchema configSchema,
    List<DataEntity.Field> requiredFields,
    List<String> listens,
    List<Object> initialEffects
) {
    public Behavior {
        suggestedFor = suggestedFor == null ? List.of() : List.copyOf(suggestedFor);
        dataEntities = dataEntities == null ? List.of() : List.copyOf(dataEntities);
        ticks = ticks == null ? List.of() : List.copyOf(ticks);
        configSchema = Objects.requireNonNullElse(configSchema, ConfigSchema.EMPTY);
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        listens = listens == null ? List.of() : List.copyOf(listens);
        initialEffects = expressions(initialEffects);
    }

    static List<Object> expressions(List<Object> effects) {
        return effects == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(effects));
    }

    public Optional<BehaviorCategory> knownCategory() {
        return BehaviorCategory.from(category);
    }

    /**
     * The data entity whose field defaults seed an instance's entity.
     */
    public Optional<DataEntity> primaryEntity() {
        return dataEntities.isEmpty() ? Optional.empty() : Optional.of(dataEntities.get(0));
    }

    /**
     * Whether an event emitted by this behavior's own effects is fed back into its state machine.
     */
    public boolean handles(String event) {
        return stateMachine != null && stateMachine.handles(event) || listens.contains(event);
    }
}
