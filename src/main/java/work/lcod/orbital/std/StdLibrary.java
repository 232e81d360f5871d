package work.lcod.orbital.std;

import work.lcod.orbital.runtime.OperatorRegistry;

/**
 * Registers every namespaced standard library module.
 */
public final class StdLibrary {
    private StdLibrary() {}

    public static OperatorRegistry register(OperatorRegistry registry) {
        MathModule.register(registry);
        StringModule.register(registry);
        ArrayModule.register(registry);
        ObjectModule.register(registry);
        ValidateModule.register(registry);
        TimeModule.register(registry);
        FormatModule.register(registry);
        return registry;
    }
}
