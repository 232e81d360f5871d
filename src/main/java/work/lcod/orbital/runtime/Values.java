package work.lcod.orbital.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lenient coercions shared by every operator family. All functions are total: unusable input
 * falls back to {@code 0}, {@code false} or an empty list instead of failing.
 */
public final class Values {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INFINITY = Pattern.compile("[+-]?Infinity");

    private Values() {}

    public static double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String str) {
            double parsed = parseFloat(str);
            return Double.isNaN(parsed) ? 0d : parsed;
        }
        if (value instanceof Boolean bool) {
            return bool ? 1d : 0d;
        }
        return 0d;
    }

    /**
     * Parses the longest numeric prefix of {@code raw}; NaN when there is none.
     */
    public static double parseFloat(String raw) {
        var trimmed = raw.stripLeading();
        var infinity = INFINITY.matcher(trimmed);
        if (infinity.lookingAt()) {
            return trimmed.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        var matcher = DECIMAL.matcher(trimmed);
        if (!matcher.lookingAt()) {
            return Double.NaN;
        }
        return Double.parseDouble(matcher.group());
    }

    /**
     * Strict whole-string conversion used by mixed-type ordering: blank is 0, garbage is NaN.
     */
    public static double strictNumber(String raw) {
        var trimmed = raw.strip();
        if (trimmed.isEmpty()) {
            return 0d;
        }
        if (INFINITY.matcher(trimmed).matches()) {
            return trimmed.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (!DECIMAL.matcher(trimmed).matches()) {
            return Double.NaN;
        }
        return Double.parseDouble(trimmed);
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return d != 0d && !Double.isNaN(d);
        }
        if (value instanceof String str) {
            return !str.isEmpty();
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> toList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        return Collections.singletonList(value);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> castMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    public static boolean deepEquals(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            Iterator<?> itA = a.iterator();
            Iterator<?> itB = b.iterator();
            while (itA.hasNext()) {
                if (!deepEquals(itA.next(), itB.next())) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Map<?, ?> a && right instanceof Map<?, ?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            for (var entry : a.entrySet()) {
                if (!b.containsKey(entry.getKey()) || !deepEquals(entry.getValue(), b.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return left.equals(right);
    }

    /**
     * Ordering view of a value: numbers and strings pass through, booleans become 1/0, null becomes
     * 0 and anything else its string form.
     */
    public static Object toComparable(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String) {
            return value;
        }
        if (value instanceof Boolean bool) {
            return bool ? 1d : 0d;
        }
        if (value == null) {
            return 0d;
        }
        return stringify(value);
    }

    /**
     * Compares two comparables; strings order lexicographically, every other pairing numerically.
     * Returns null when either side is NaN, which makes every ordering test false.
     */
    public static Integer compare(Object left, Object right) {
        var a = toComparable(left);
        var b = toComparable(right);
        if (a instanceof String sa && b instanceof String sb) {
            return Integer.signum(sa.compareTo(sb));
        }
        double da = a instanceof String sa ? strictNumber(sa) : (Double) a;
        double db = b instanceof String sb ? strictNumber(sb) : (Double) b;
        if (Double.isNaN(da) || Double.isNaN(db)) {
            return null;
        }
        return Double.compare(da, db) == 0 ? 0 : (da < db ? -1 : 1);
    }

    public static String stringify(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number number) {
            return formatNumber(number.doubleValue());
        }
        if (value instanceof List<?> list) {
            var parts = new ArrayList<String>(list.size());
            for (var item : list) {
                parts.add(item == null ? "" : stringify(item));
            }
            return String.join(",", parts);
        }
        if (value instanceof Map<?, ?>) {
            return "[object Object]";
        }
        return String.valueOf(value);
    }

    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Recursive copy of lists and maps; other values are shared.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }
}
