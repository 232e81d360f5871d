package work.lcod.orbital.runtime;

/**
 * Descriptive metadata for a registered operator.
 *
 * @param module       owning module ({@code core} or a std module name)
 * @param category     grouping used in listings, e.g. {@code std-math}
 * @param minArity     number of required arguments
 * @param maxArity     maximum number of arguments, {@code -1} for variadic
 * @param returnType   informal result type
 * @param hasSideEffects whether the operator calls effect handlers
 * @param acceptsLambda  whether an argument is expected to be an {@code fn} lambda
 */
public record OperatorMetadata(
    String module,
    String category,
    int minArity,
    int maxArity,
    String description,
    String returnType,
    boolean hasSideEffects,
    boolean acceptsLambda
) {
    public static final int VARIADIC = -1;

    public static OperatorMetadata core(String category, int minArity, int maxArity, String description) {
        return new OperatorMetadata("core", category, minArity, maxArity, description, "any", false, false);
    }

    public boolean isVariadic() {
        return maxArity == VARIADIC;
    }

    public OperatorMetadata withSideEffects() {
        return new OperatorMetadata(module, category, minArity, maxArity, description, returnType, true, acceptsLambda);
    }

    public OperatorMetadata withLambda() {
        return new OperatorMetadata(module, category, minArity, maxArity, description, returnType, hasSideEffects, true);
    }
}
