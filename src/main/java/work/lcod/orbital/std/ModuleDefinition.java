package work.lcod.orbital.std;

import work.lcod.orbital.runtime.OperatorMetadata;
import work.lcod.orbital.runtime.OperatorRegistry;

/**
 * Registers the operators of one namespaced module ({@code module/name}) with their metadata.
 */
final class ModuleDefinition {
    @FunctionalInterface
    interface StdFunction {
        Object apply(Args args);
    }

    private final OperatorRegistry registry;
    private final String module;

    ModuleDefinition(OperatorRegistry registry, String module) {
        this.registry = registry;
        this.module = module;
    }

    ModuleDefinition define(String name, int minArity, int maxArity, String returnType, String description, StdFunction fn) {
        return add(name, new OperatorMetadata(module, category(), minArity, maxArity, description, returnType, false, false), fn);
    }

    ModuleDefinition lambda(String name, int minArity, int maxArity, String returnType, String description, StdFunction fn) {
        return add(name, new OperatorMetadata(module, category(), minArity, maxArity, description, returnType, false, true), fn);
    }

    private ModuleDefinition add(String name, OperatorMetadata metadata, StdFunction fn) {
        var id = module + "/" + name;
        registry.register(id, (args, evaluator, ctx) -> fn.apply(new Args(id, evaluator.evaluateAll(args, ctx), evaluator, ctx)), metadata);
        return this;
    }

    private String category() {
        return "std-" + module;
    }
}
