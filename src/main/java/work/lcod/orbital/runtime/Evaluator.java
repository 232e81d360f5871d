package work.lcod.orbital.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.lcod.orbital.expr.Binding;
import work.lcod.orbital.expr.SExpr;

/**
 * Recursive S-expression evaluator. Atoms evaluate to themselves (binding strings are resolved),
 * calls dispatch through the {@link OperatorRegistry}.
 */
public final class Evaluator {
    private final OperatorRegistry registry;

    public Evaluator(OperatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public OperatorRegistry registry() {
        return registry;
    }

    @SuppressWarnings("unchecked")
    public Object evaluate(Object expr, EvaluationContext ctx) {
        if (!SExpr.isCall(expr)) {
            if (Binding.isBinding(expr)) {
                return BindingResolver.resolve((String) expr, ctx);
            }
            return expr;
        }
        var call = (List<Object>) expr;
        var name = (String) call.get(0);
        var entry = registry.get(name);
        if (entry == null) {
            throw ExpressionException.unknownOperator(name);
        }
        var args = call.subList(1, call.size());
        var metadata = entry.metadata();
        if (metadata != null && args.size() < metadata.minArity()) {
            throw ExpressionException.missingArgument(name, args.size() + 1);
        }
        return entry.operator().apply(args, this, ctx);
    }

    /**
     * Evaluates the argument at {@code index}, or returns null when it was not supplied.
     */
    public Object arg(List<Object> args, int index, EvaluationContext ctx) {
        return index < args.size() ? evaluate(args.get(index), ctx) : null;
    }

    public List<Object> evaluateAll(List<Object> args, EvaluationContext ctx) {
        var values = new ArrayList<Object>(args.size());
        for (var arg : args) {
            values.add(evaluate(arg, ctx));
        }
        return values;
    }

    /**
     * Checks that an evaluated argument is a lambda built by {@code fn}.
     *
     * @throws ExpressionException with {@link ExpressionException#NOT_CALLABLE} for any other value
     */
    public Closure callable(Object value, String operator, int position) {
        if (value instanceof Closure closure) {
            return closure;
        }
        throw ExpressionException.notCallable(operator, position, value);
    }

    public Object invoke(Closure closure, Object... args) {
        return evaluate(closure.body(), closure.bind(asList(args)));
    }

    public boolean test(Closure closure, Object... args) {
        return Values.isTruthy(invoke(closure, args));
    }

    private static List<Object> asList(Object[] args) {
        var list = new ArrayList<Object>(args.length);
        for (var arg : args) {
            list.add(arg);
        }
        return list;
    }
}
