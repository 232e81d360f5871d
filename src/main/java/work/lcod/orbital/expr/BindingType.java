package work.lcod.orbital.expr;

/**
 * Distinguishes context roots from named singleton entities.
 */
public enum BindingType {
    CORE,
    ENTITY
}
