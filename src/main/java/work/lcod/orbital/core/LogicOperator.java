package work.lcod.orbital.core;

import java.util.List;
import work.lcod.orbital.runtime.EvaluationContext;
import work.lcod.orbital.runtime.Evaluator;
import work.lcod.orbital.runtime.Operator;
import work.lcod.orbital.runtime.Values;

/**
 * Boolean operators. {@code and}/{@code or} stop at the deciding argument and {@code if} only
 * evaluates the branch it takes, so effects in skipped arguments never fire.
 */
public enum LogicOperator implements Operator {
    AND("and", 0, "True when every argument is truthy"),
    OR("or", 0, "True when any argument is truthy"),
    NOT("not", 1, "Negated truthiness"),
    IF("if", 2, "Conditional: (if cond then else?)");

    private final String symbol;
    private final int minArity;
    private final String description;

    LogicOperator(String symbol, int minArity, String description) {
        this.symbol = symbol;
        this.minArity = minArity;
        this.description = description;
    }

    @Override
    public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
        switch (this) {
            case AND -> {
                for (var arg : args) {
                    if (!Values.isTruthy(evaluator.evaluate(arg, ctx))) {
                        return false;
                    }
                }
                return true;
            }
            case OR -> {
                for (var arg : args) {
                    if (Values.isTruthy(evaluator.evaluate(arg, ctx))) {
                        return true;
                    }
                }
                return false;
            }
            case NOT -> {
                return !Values.isTruthy(evaluator.evaluate(args.get(0), ctx));
            }
            case IF -> {
                var condition = Values.isTruthy(evaluator.evaluate(args.get(0), ctx));
                return condition ? evaluator.evaluate(args.get(1), ctx) : evaluator.arg(args, 2, ctx);
            }
            default -> throw new IllegalStateException("Unhandled logic operator " + this);
        }
    }

    public String symbol() {
        return symbol;
    }

    public int minArity() {
        return minArity;
    }

    public String description() {
        return description;
    }
}
