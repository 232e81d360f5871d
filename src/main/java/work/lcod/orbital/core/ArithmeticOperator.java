package work.lcod.orbital.core;

import static work.lcod.orbital.runtime.OperatorMetadata.VARIADIC;

import java.util.List;
import work.lcod.orbital.runtime.EvaluationContext;
import work.lcod.orbital.runtime.Evaluator;
import work.lcod.orbital.runtime.Operator;
import work.lcod.orbital.runtime.Values;

/**
 * Numeric operators. Operands are coerced with {@link Values#toNumber(Object)} and results are
 * always doubles.
 */
public enum ArithmeticOperator implements Operator {
    ADD("+", 0, VARIADIC, "Sum of all arguments") {
        @Override
        double compute(double[] n) {
            double sum = 0d;
            for (double v : n) {
                sum += v;
            }
            return sum;
        }
    },
    SUBTRACT("-", 1, VARIADIC, "Negates one argument or subtracts the rest from the first") {
        @Override
        double compute(double[] n) {
            if (n.length == 1) {
                return -n[0];
            }
            double result = n[0];
            for (int i = 1; i < n.length; i++) {
                result -= n[i];
            }
            return result;
        }
    },
    MULTIPLY("*", 0, VARIADIC, "Product of all arguments") {
        @Override
        double compute(double[] n) {
            double product = 1d;
            for (double v : n) {
                product *= v;
            }
            return product;
        }
    },
    DIVIDE("/", 2, 2, "Division; dividing by zero yields signed infinity") {
        @Override
        double compute(double[] n) {
            if (n[1] == 0d) {
                return n[0] >= 0d ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
            }
            return n[0] / n[1];
        }
    },
    MODULO("%", 2, 2, "Remainder of the first argument divided by the second") {
        @Override
        double compute(double[] n) {
            return n[0] % n[1];
        }
    },
    ABS("abs", 1, 1, "Absolute value") {
        @Override
        double compute(double[] n) {
            return Math.abs(n[0]);
        }
    },
    MIN("min", 0, VARIADIC, "Smallest argument") {
        @Override
        double compute(double[] n) {
            double min = Double.POSITIVE_INFINITY;
            for (double v : n) {
                min = Math.min(min, v);
            }
            return min;
        }
    },
    MAX("max", 0, VARIADIC, "Largest argument") {
        @Override
        double compute(double[] n) {
            double max = Double.NEGATIVE_INFINITY;
            for (double v : n) {
                max = Math.max(max, v);
            }
            return max;
        }
    },
    FLOOR("floor", 1, 1, "Round down") {
        @Override
        double compute(double[] n) {
            return Math.floor(n[0]);
        }
    },
    CEIL("ceil", 1, 1, "Round up") {
        @Override
        double compute(double[] n) {
            return Math.ceil(n[0]);
        }
    },
    ROUND("round", 1, 1, "Round half up") {
        @Override
        double compute(double[] n) {
            return roundHalfUp(n[0]);
        }
    },
    CLAMP("clamp", 3, 3, "Constrain a value to [min, max]") {
        @Override
        double compute(double[] n) {
            return Math.max(n[1], Math.min(n[2], n[0]));
        }
    };

    private final String symbol;
    private final int minArity;
    private final int maxArity;
    private final String description;

    ArithmeticOperator(String symbol, int minArity, int maxArity, String description) {
        this.symbol = symbol;
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.description = description;
    }

    abstract double compute(double[] operands);

    @Override
    public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
        var operands = new double[args.size()];
        for (int i = 0; i < operands.length; i++) {
            operands[i] = Values.toNumber(evaluator.evaluate(args.get(i), ctx));
        }
        return compute(operands);
    }

    public String symbol() {
        return symbol;
    }

    public int minArity() {
        return minArity;
    }

    public int maxArity() {
        return maxArity;
    }

    public String description() {
        return description;
    }

    static double roundHalfUp(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return Math.floor(value + 0.5d);
    }
}
