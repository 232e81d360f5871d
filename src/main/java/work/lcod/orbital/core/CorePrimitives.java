package work.lcod.orbital.core;

import static work.lcod.orbital.runtime.OperatorMetadata.VARIADIC;

import work.lcod.orbital.runtime.OperatorMetadata;
import work.lcod.orbital.runtime.OperatorRegistry;

/**
 * Registers the closed core operator families into the protected tier of a registry.
 */
public final class CorePrimitives {
    private CorePrimitives() {}

    public static OperatorRegistry register(OperatorRegistry registry) {
        for (var op : ArithmeticOperator.values()) {
            registry.registerCore(op.symbol(), op,
                OperatorMetadata.core("arithmetic", op.minArity(), op.maxArity(), op.description()));
        }
        for (var op : ComparisonOperator.values()) {
            registry.registerCore(op.symbol(), op,
                OperatorMetadata.core("comparison", 2, 2, op.description()));
        }
        for (var op : LogicOperator.values()) {
            int max = op == LogicOperator.NOT ? 1 : op == LogicOperator.IF ? 3 : VARIADIC;
            registry.registerCore(op.symbol(), op,
                OperatorMetadata.core("logic", op.minArity(), max, op.description()));
        }
        for (var op : ControlOperator.values()) {
            int max = op == ControlOperator.DO ? VARIADIC : 2;
            var metadata = OperatorMetadata.core("control", op.minArity(), max, op.description());
            registry.registerCore(op.symbol(), op, op == ControlOperator.FN ? metadata.withLambda() : metadata);
        }
        for (var op : CollectionOperator.values()) {
            var metadata = OperatorMetadata.core("collection", op.minArity(), VARIADIC, op.description());
            registry.registerCore(op.symbol(), op, metadata.withLambda());
        }
        for (var op : EffectOperator.values()) {
            registry.registerCore(op.symbol(), op,
                OperatorMetadata.core("effect", op.minArity(), VARIADIC, op.description()).withSideEffects());
        }
        return registry;
    }
}
