package work.lcod.orbital.runtime;

import work.lcod.orbital.core.CorePrimitives;
import work.lcod.orbital.flow.AsyncPrimitives;
import work.lcod.orbital.flow.TimerCoordinator;
import work.lcod.orbital.std.StdLibrary;

/**
 * Shared registry bootstrap so the engine, the CLI and tests evaluate with the same operator set.
 */
public final class OperatorLibrary {
    private OperatorLibrary() {}

    public static OperatorRegistry create() {
        return create(TimerCoordinator.global());
    }

    public static OperatorRegistry create(TimerCoordinator timers) {
        var registry = new OperatorRegistry();
        CorePrimitives.register(registry);
        StdLibrary.register(registry);
        AsyncPrimitives.register(registry, timers);
        return registry;
    }

    public static Evaluator evaluator() {
        return new Evaluator(create());
    }
}
