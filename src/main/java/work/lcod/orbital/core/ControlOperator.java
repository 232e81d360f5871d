package work.lcod.orbital.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import work.lcod.orbital.runtime.Closure;
import work.lcod.orbital.runtime.EvaluationContext;
import work.lcod.orbital.runtime.Evaluator;
import work.lcod.orbital.runtime.ExpressionException;
import work.lcod.orbital.runtime.Futures;
import work.lcod.orbital.runtime.Operator;
import work.lcod.orbital.runtime.Values;

/**
 * Scoping and sequencing: {@code let}, {@code do}, {@code when} and {@code fn}.
 */
public enum ControlOperator implements Operator {
    LET("let", 2, "Bind names, then evaluate the body with them in scope") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            if (!(args.get(0) instanceof List<?> bindings)) {
                throw ExpressionException.invalidArgument(symbol(), 1, "expected a list of [name, value] pairs");
            }
            var locals = new LinkedHashMap<String, Object>();
            int index = 0;
            for (var binding : bindings) {
                index++;
                if (!(binding instanceof List<?> pair) || pair.size() < 2 || !(pair.get(0) instanceof String name)) {
                    throw ExpressionException.invalidArgument(symbol(), 1, "binding " + index + " must be [name, value]");
                }
                // every value sees the outer scope, never an earlier binding
                locals.put(name, Futures.await(evaluator.evaluate(pair.get(1), ctx)));
            }
            return evaluator.evaluate(args.get(1), ctx.child(locals));
        }
    },
    DO("do", 0, "Evaluate each argument in order and return the last value") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            Object last = null;
            for (var arg : args) {
                last = evaluator.evaluate(arg, ctx);
            }
            return last;
        }
    },
    WHEN("when", 2, "Evaluate the effect only when the condition is truthy") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            if (Values.isTruthy(evaluator.evaluate(args.get(0), ctx))) {
                evaluator.evaluate(args.get(1), ctx);
            }
            return null;
        }
    },
    FN("fn", 2, "Lambda: (fn param body) or (fn [params...] body)") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var params = new ArrayList<String>();
            var rawParams = args.get(0);
            if (rawParams instanceof String single) {
                params.add(single);
            } else if (rawParams instanceof List<?> names) {
                for (var name : names) {
                    if (!(name instanceof String str)) {
                        throw ExpressionException.invalidArgument(symbol(), 1, "parameter names must be strings");
                    }
                    params.add(str);
                }
            } else {
                throw ExpressionException.invalidArgument(symbol(), 1, "expected a parameter name or list of names");
            }
            return new Closure(params, args.get(1), ctx);
        }
    };

    private final String symbol;
    private final int minArity;
    private final String description;

    ControlOperator(String symbol, int minArity, String description) {
        this.symbol = symbol;
        this.minArity = minArity;
        this.description = description;
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
