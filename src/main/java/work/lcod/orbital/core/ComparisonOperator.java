package work.lcod.orbital.core;

import java.util.List;
import java.util.function.IntPredicate;
import work.lcod.orbital.runtime.EvaluationContext;
import work.lcod.orbital.runtime.Evaluator;
import work.lcod.orbital.runtime.Operator;
import work.lcod.orbital.runtime.Values;

/**
 * Equality is deep and structural. Ordering coerces each side independently, so mixed-type
 * comparisons such as {@code true < "abc"} follow host semantics instead of failing.
 */
public enum ComparisonOperator implements Operator {
    EQ("=", "Deep structural equality"),
    NEQ("!=", "Negated deep equality"),
    LT("<", "Less than"),
    GT(">", "Greater than"),
    LTE("<=", "Less than or equal"),
    GTE(">=", "Greater than or equal");

    private final String symbol;
    private final String description;

    ComparisonOperator(String symbol, String description) {
        this.symbol = symbol;
        this.description = description;
    }

    @Override
    public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
        var left = evaluator.arg(args, 0, ctx);
        var right = evaluator.arg(args, 1, ctx);
        return test(left, right);
    }

    public boolean test(Object left, Object right) {
        return switch (this) {
            case EQ -> Values.deepEquals(left, right);
            case NEQ -> !Values.deepEquals(left, right);
            case LT -> ordered(left, right, c -> c < 0);
            case GT -> ordered(left, right, c -> c > 0);
            case LTE -> ordered(left, right, c -> c <= 0);
            case GTE -> ordered(left, right, c -> c >= 0);
        };
    }

    private static boolean ordered(Object left, Object right, IntPredicate check) {
        var cmp = Values.compare(left, right);
        return cmp != null && check.test(cmp);
    }

    public String symbol() {
        return symbol;
    }

    public String description() {
        return description;
    }
}
