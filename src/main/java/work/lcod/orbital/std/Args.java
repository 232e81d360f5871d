package work.lcod.orbital.std;

import java.util.List;
import java.util.Map;
import work.lcod.orbital.runtime.Closure;
import work.lcod.orbital.runtime.EvaluationContext;
import work.lcod.orbital.runtime.Evaluator;
import work.lcod.orbital.runtime.ExpressionException;
import work.lcod.orbital.runtime.Values;

/**
 * Evaluated arguments of a standard library call with lenient typed accessors.
 */
final class Args {
    private final String operator;
    private final List<Object> values;
    private final Evaluator evaluator;
    private final EvaluationContext ctx;

    Args(String operator, List<Object> values, Evaluator evaluator, EvaluationContext ctx) {
        this.operator = operator;
        this.values = values;
        this.evaluator = evaluator;
        this.ctx = ctx;
    }

    String operator() {
        return operator;
    }

    EvaluationContext ctx() {
        return ctx;
    }

    int size() {
        return values.size();
    }

    boolean has(int index) {
        return index < values.size() && values.get(index) != null;
    }

    Object get(int index) {
        return index < values.size() ? values.get(index) : null;
    }

    List<Object> all() {
        return values;
    }

    double number(int index) {
        return Values.toNumber(get(index));
    }

    double number(int index, double fallback) {
        return has(index) ? Values.toNumber(get(index)) : fallback;
    }

    int integer(int index, int fallback) {
        return has(index) ? (int) Values.toNumber(get(index)) : fallback;
    }

    String string(int index) {
        var value = get(index);
        if (value == null) {
            return "";
        }
        return value instanceof String str ? str : Values.stringify(value);
    }

    String string(int index, String fallback) {
        return has(index) ? string(index) : fallback;
    }

    List<Object> list(int index) {
        return Values.toList(get(index));
    }

    Map<String, Object> map(int index) {
        var map = Values.castMap(get(index));
        return map == null ? Map.of() : map;
    }

    Map<String, Object> requireMap(int index) {
        var map = Values.castMap(get(index));
        if (map == null) {
            throw ExpressionException.invalidArgument(operator, index + 1, "expected an object");
        }
        return map;
    }

    Closure fn(int index) {
        return evaluator.callable(get(index), operator, index + 1);
    }

    Object call(Closure fn, Object... callArgs) {
        return evaluator.invoke(fn, callArgs);
    }

    boolean test(Closure fn, Object... callArgs) {
        return evaluator.test(fn, callArgs);
    }
}
