package work.lcod.orbital.behavior;

import java.util.Optional;

public enum BehaviorCategory {
    UI_INTERACTION("ui-interaction"),
    DATA_MANAGEMENT("data-management"),
    ASYNC("async"),
    FEEDBACK("feedback"),
    GAME_CORE("game-core"),
    GAME_ENTITY("game-entity"),
    GAME_UI("game-ui");

    private final String id;

    BehaviorCategory(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<BehaviorCategory> from(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (var category : values()) {
            if (category.id.equals(value.trim())) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
