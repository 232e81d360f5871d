package work.lcod.orbital.std;

import static work.lcod.orbital.runtime.OperatorMetadata.VARIADIC;

import java.util.concurrent.ThreadLocalRandom;
import work.lcod.orbital.runtime.OperatorRegistry;

/**
 * {@code math/*}: numeric helpers beyond the core arithmetic operators.
 */
public final class MathModule {
    private MathModule() {}

    public static OperatorRegistry register(OperatorRegistry registry) {
        new ModuleDefinition(registry, "math")
            .define("abs", 1, 1, "number", "Absolute value", a -> Math.abs(a.number(0)))
            .define("min", 1, VARIADIC, "number", "Smallest argument", MathModule::min)
            .define("max", 1, VARIADIC, "number", "Largest argument", MathModule::max)
            .define("clamp", 3, 3, "number", "Constrain a value to [min, max]",
                a -> Math.max(a.number(1), Math.min(a.number(2), a.number(0))))
            .define("floor", 1, 1, "number", "Round down", a -> Math.floor(a.number(0)))
            .define("ceil", 1, 1, "number", "Round up", a -> Math.ceil(a.number(0)))
            .define("round", 1, 2, "number", "Round half up, optionally to a number of decimals",
                a -> round(a.number(0), a.integer(1, 0)))
            .define("pow", 2, 2, "number", "Base raised to exponent", a -> Math.pow(a.number(0), a.number(1)))
            .define("sqrt", 1, 1, "number", "Square root", a -> Math.sqrt(a.number(0)))
            .define("mod", 2, 2, "number", "Modulo with the sign of the divisor", a -> mod(a.number(0), a.number(1)))
            .define("sign", 1, 1, "number", "-1, 0 or 1", a -> Math.signum(a.number(0)))
            .define("lerp", 3, 3, "number", "Linear interpolation between a and b by t",
                a -> a.number(0) + (a.number(1) - a.number(0)) * a.number(2))
            .define("map", 5, 5, "number", "Map a value from one range onto another", MathModule::mapRange)
            .define("random", 0, 0, "number", "Random number in [0, 1)", a -> ThreadLocalRandom.current().nextDouble())
            .define("randomInt", 2, 2, "number", "Random integer in [min, max]", MathModule::randomInt)
            .define("default", 2, 2, "number", "Fallback when the value is null or NaN", MathModule::defaultValue);
        return registry;
    }

    private static Object min(Args a) {
        double min = Double.POSITIVE_INFINITY;
        for (int i = 0; i < a.size(); i++) {
            min = Math.min(min, a.number(i));
        }
        return min;
    }

    private static Object max(Args a) {
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < a.size(); i++) {
            max = Math.max(max, a.number(i));
        }
        return max;
    }

    static double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double factor = Math.pow(10, decimals);
        return Math.floor(value * factor + 0.5d) / factor;
    }

    static double mod(double a, double b) {
        return ((a % b) + b) % b;
    }

    private static Object mapRange(Args a) {
        double value = a.number(0);
        double inMin = a.number(1);
        double inMax = a.number(2);
        double outMin = a.number(3);
        double outMax = a.number(4);
        if (inMax == inMin) {
            return outMin;
        }
        return outMin + (value - inMin) * (outMax - outMin) / (inMax - inMin);
    }

    private static Object randomInt(Args a) {
        long lo = (long) Math.ceil(a.number(0));
        long hi = (long) Math.floor(a.number(1));
        if (hi < lo) {
            return (double) lo;
        }
        return (double) ThreadLocalRandom.current().nextLong(lo, hi + 1);
    }

    private static Object defaultValue(Args a) {
        var value = a.get(0);
        if (value == null || (value instanceof Number n && Double.isNaN(n.doubleValue()))) {
            return a.get(1);
        }
        return value;
    }
}
