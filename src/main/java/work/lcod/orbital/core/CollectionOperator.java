package work.lcod.orbital.core;

import java.util.ArrayList;
import java.util.List;
import work.lcod.orbital.runtime.Closure;
import work.lcod.orbital.runtime.EvaluationContext;
import work.lcod.orbital.runtime.Evaluator;
import work.lcod.orbital.runtime.Operator;
import work.lcod.orbital.runtime.Values;

/**
 * Operators over the list view of their first argument ({@code null} is empty, a scalar is a
 * one-element list). Lambdas run once per element, in index order.
 */
public enum CollectionOperator implements Operator {
    MAP("map", 2, "Transform each element") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var items = items(args, evaluator, ctx);
            var fn = lambda(args, evaluator, ctx, symbol());
            var result = new ArrayList<Object>(items.size());
            for (var item : items) {
                result.add(evaluator.invoke(fn, item));
            }
            return result;
        }
    },
    FILTER("filter", 2, "Keep elements matching the predicate") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var items = items(args, evaluator, ctx);
            var fn = lambda(args, evaluator, ctx, symbol());
            var result = new ArrayList<Object>();
            for (var item : items) {
                if (evaluator.test(fn, item)) {
                    result.add(item);
                }
            }
            return result;
        }
    },
    FIND("find", 2, "First element matching the predicate") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var items = items(args, evaluator, ctx);
            var fn = lambda(args, evaluator, ctx, symbol());
            for (var item : items) {
                if (evaluator.test(fn, item)) {
                    return item;
                }
            }
            return null;
        }
    },
    COUNT("count", 1, "Number of elements, or of elements matching an optional predicate") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var items = items(args, evaluator, ctx);
            if (args.size() < 2) {
                return (double) items.size();
            }
            var fn = lambda(args, evaluator, ctx, symbol());
            int count = 0;
            for (var item : items) {
                if (evaluator.test(fn, item)) {
                    count++;
                }
            }
            return (double) count;
        }
    },
    SUM("sum", 1, "Sum of elements, optionally mapped first") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var items = items(args, evaluator, ctx);
            var fn = args.size() > 1 ? lambda(args, evaluator, ctx, symbol()) : null;
            double total = 0d;
            for (var item : items) {
                total += Values.toNumber(fn == null ? item : evaluator.invoke(fn, item));
            }
            return total;
        }
    },
    FIRST("first", 1, "First element") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var items = items(args, evaluator, ctx);
            return items.isEmpty() ? null : items.get(0);
        }
    },
    LAST("last", 1, "Last element") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var items = items(args, evaluator, ctx);
            return items.isEmpty() ? null : items.get(items.size() - 1);
        }
    },
    NTH("nth", 2, "Element at a zero-based index") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var items = items(args, evaluator, ctx);
            double index = Values.toNumber(evaluator.evaluate(args.get(1), ctx));
            if (index < 0 || index >= items.size() || index != Math.floor(index)) {
                return null;
            }
            return items.get((int) index);
        }
    },
    CONCAT("concat", 0, "Concatenate lists") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var result = new ArrayList<Object>();
            for (var arg : args) {
                result.addAll(Values.toList(evaluator.evaluate(arg, ctx)));
            }
            return result;
        }
    },
    INCLUDES("includes", 2, "Whether the list contains the value") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var items = items(args, evaluator, ctx);
            var needle = evaluator.evaluate(args.get(1), ctx);
            for (var item : items) {
                if (Values.deepEquals(item, needle)) {
                    return true;
                }
            }
            return false;
        }
    },
    EMPTY("empty", 1, "Whether the list has no elements") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            return items(args, evaluator, ctx).isEmpty();
        }
    };

    private final String symbol;
    private final int minArity;
    private final String description;

    CollectionOperator(String symbol, int minArity, String description) {
        this.symbol = symbol;
        this.minArity = minArity;
        this.description = description;
    }

    static List<Object> items(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
        return Values.toList(evaluator.evaluate(args.get(0), ctx));
    }

    static Closure lambda(List<Object> args, Evaluator evaluator, EvaluationContext ctx, String operator) {
        return evaluator.callable(evaluator.evaluate(args.get(1), ctx), operator, 2);
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
