package work.lcod.orbital.std;

import static work.lcod.orbital.runtime.OperatorMetadata.VARIADIC;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import work.lcod.orbital.runtime.OperatorRegistry;
import work.lcod.orbital.runtime.Values;

/**
 * {@code array/*}: list helpers. Inputs are never mutated; every transformation returns a new list.
 */
public final class ArrayModule {
    private ArrayModule() {}

    public static OperatorRegistry register(OperatorRegistry registry) {
        new ModuleDefinition(registry, "array")
            .define("len", 1, 1, "number", "Number of items", a -> (double) a.list(0).size())
            .define("empty?", 1, 1, "boolean", "True for null or an empty list", a -> a.list(0).isEmpty())
            .define("first", 1, 1, "any", "First item", a -> at(a.list(0), 0))
            .define("last", 1, 1, "any", "Last item", a -> at(a.list(0), a.list(0).size() - 1))
            .define("nth", 2, 2, "any", "Item at index", a -> at(a.list(0), a.integer(1, -1)))
            .define("slice", 2, 3, "array", "Sub-list with negative indexes counted from the end", ArrayModule::slice)
            .define("concat", 0, VARIADIC, "array", "Concatenate lists", ArrayModule::concat)
            .define("append", 2, 2, "array", "Copy with an item added at the end", ArrayModule::append)
            .define("prepend", 2, 2, "array", "Copy with an item added at the start", ArrayModule::prepend)
            .define("insert", 3, 3, "array", "Copy with an item inserted at index", ArrayModule::insert)
            .define("remove", 2, 2, "array", "Copy without the item at index", ArrayModule::removeAt)
            .define("removeItem", 2, 2, "array", "Copy without the first equal item", ArrayModule::removeItem)
            .define("reverse", 1, 1, "array", "Reversed copy", ArrayModule::reverse)
            .define("sort", 1, 3, "array", "Stable sort, optionally by key, direction asc or desc", ArrayModule::sort)
            .define("shuffle", 1, 1, "array", "Randomly ordered copy", ArrayModule::shuffle)
            .define("unique", 1, 1, "array", "Copy without duplicates, first occurrence kept", ArrayModule::unique)
            .define("flatten", 1, 1, "array", "Flatten one level of nesting", ArrayModule::flatten)
            .define("zip", 2, 2, "array", "Pairs of items, as long as the shorter list", ArrayModule::zip)
            .define("includes", 2, 2, "boolean", "Whether an equal item is present", a -> indexOf(a.list(0), a.get(1)) >= 0)
            .define("indexOf", 2, 2, "number", "Index of the first equal item or -1", a -> (double) indexOf(a.list(0), a.get(1)))
            .lambda("find", 2, 2, "any", "First item matching the predicate", ArrayModule::find)
            .lambda("findIndex", 2, 2, "number", "Index of the first match or -1", ArrayModule::findIndex)
            .lambda("filter", 2, 2, "array", "Items matching the predicate", a -> select(a, true))
            .lambda("reject", 2, 2, "array", "Items not matching the predicate", a -> select(a, false))
            .lambda("map", 2, 2, "array", "Transform every item", ArrayModule::map)
            .lambda("reduce", 3, 3, "any", "Fold items with (acc, item) from an initial value", ArrayModule::reduce)
            .lambda("every", 2, 2, "boolean", "True when all items match", ArrayModule::every)
            .lambda("some", 2, 2, "boolean", "True when any item matches", ArrayModule::some)
            .lambda("count", 1, 2, "number", "Number of items, or of matching items", ArrayModule::count)
            .define("sum", 1, 2, "number", "Sum of numeric items or of a numeric key", a -> sum(a.list(0), key(a, 1)))
            .define("avg", 1, 2, "number", "Mean of numeric items or of a numeric key", ArrayModule::avg)
            .define("min", 1, 2, "number", "Smallest numeric item or key", a -> extreme(a.list(0), key(a, 1), true))
            .define("max", 1, 2, "number", "Largest numeric item or key", a -> extreme(a.list(0), key(a, 1), false))
            .define("groupBy", 2, 2, "object", "Group items by the string form of a key", ArrayModule::groupBy)
            .lambda("partition", 2, 2, "array", "[matches, rest]", ArrayModule::partition)
            .define("take", 2, 2, "array", "First n items", a -> take(a.list(0), a.integer(1, 0)))
            .define("drop", 2, 2, "array", "All but the first n items", a -> drop(a.list(0), a.integer(1, 0)))
            .define("takeLast", 2, 2, "array", "Last n items", ArrayModule::takeLast)
            .define("dropLast", 2, 2, "array", "All but the last n items", ArrayModule::dropLast);
        return registry;
    }

    private static Object at(List<Object> items, int index) {
        return index >= 0 && index < items.size() ? items.get(index) : null;
    }

    private static Object slice(Args a) {
        var items = a.list(0);
        int size = items.size();
        int start = StringModule.relativeIndex(a.integer(1, 0), size);
        int end = a.has(2) ? StringModule.relativeIndex(a.integer(2, size), size) : size;
        return start >= end ? new ArrayList<>() : new ArrayList<>(items.subList(start, end));
    }

    private static Object concat(Args a) {
        var result = new ArrayList<Object>();
        for (var value : a.all()) {
            result.addAll(Values.toList(value));
        }
        return result;
    }

    private static Object append(Args a) {
        var result = new ArrayList<>(a.list(0));
        result.add(a.get(1));
        return result;
    }

    private static Object prepend(Args a) {
        var result = new ArrayList<Object>();
        result.add(a.get(1));
        result.addAll(a.list(0));
        return result;
    }

    private static Object insert(Args a) {
        var result = new ArrayList<>(a.list(0));
        int index = StringModule.relativeIndex(a.integer(1, 0), result.size());
        result.add(index, a.get(2));
        return result;
    }

    private static Object removeAt(Args a) {
        var result = new ArrayList<>(a.list(0));
        int index = a.integer(1, -1);
        if (index < 0) {
            index = result.size() + index;
        }
        if (index >= 0 && index < result.size()) {
            result.remove(index);
        }
        return result;
    }

    private static Object removeItem(Args a) {
        var result = new ArrayList<>(a.list(0));
        int index = indexOf(result, a.get(1));
        if (index >= 0) {
            result.remove(index);
        }
        return result;
    }

    private static Object reverse(Args a) {
        var result = new ArrayList<>(a.list(0));
        Collections.reverse(result);
        return result;
    }

    private static Object sort(Args a) {
        var result = new ArrayList<>(a.list(0));
        var key = key(a, 1);
        int direction = "desc".equalsIgnoreCase(a.string(2, "asc")) ? -1 : 1;
        result.sort((left, right) -> {
            var order = Values.compare(pluck(left, key), pluck(right, key));
            return order == null ? 0 : order * direction;
        });
        return result;
    }

    private static Object shuffle(Args a) {
        var result = new ArrayList<>(a.list(0));
        Collections.shuffle(result, ThreadLocalRandom.current());
        return result;
    }

    private static Object unique(Args a) {
        var result = new ArrayList<Object>();
        for (var item : a.list(0)) {
            if (indexOf(result, item) < 0) {
                result.add(item);
            }
        }
        return result;
    }

    private static Object flatten(Args a) {
        var result = new ArrayList<Object>();
        for (var item : a.list(0)) {
            if (item instanceof List<?> nested) {
                result.addAll(nested);
            } else {
                result.add(item);
            }
        }
        return result;
    }

    private static Object zip(Args a) {
        var left = a.list(0);
        var right = a.list(1);
        var result = new ArrayList<Object>();
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            result.add(new ArrayList<>(Arrays.asList(left.get(i), right.get(i))));
        }
        return result;
    }

    static int indexOf(List<Object> items, Object needle) {
        for (int i = 0; i < items.size(); i++) {
            if (Values.deepEquals(items.get(i), needle)) {
                return i;
            }
        }
        return -1;
    }

    private static Object find(Args a) {
        for (var item : a.list(0)) {
            if (a.test(a.fn(1), item)) {
                return item;
            }
        }
        return null;
    }

    private static Object findIndex(Args a) {
        var items = a.list(0);
        for (int i = 0; i < items.size(); i++) {
            if (a.test(a.fn(1), items.get(i))) {
                return (double) i;
            }
        }
        return -1d;
    }

    private static Object select(Args a, boolean keep) {
        var result = new ArrayList<Object>();
        for (var item : a.list(0)) {
            if (a.test(a.fn(1), item) == keep) {
                result.add(item);
            }
        }
        return result;
    }

    private static Object map(Args a) {
        var result = new ArrayList<Object>();
        for (var item : a.list(0)) {
            result.add(a.call(a.fn(1), item));
        }
        return result;
    }

    private static Object reduce(Args a) {
        var acc = a.get(2);
        for (var item : a.list(0)) {
            acc = a.call(a.fn(1), acc, item);
        }
        return acc;
    }

    private static Object every(Args a) {
        for (var item : a.list(0)) {
            if (!a.test(a.fn(1), item)) {
                return false;
            }
        }
        return true;
    }

    private static Object some(Args a) {
        for (var item : a.list(0)) {
            if (a.test(a.fn(1), item)) {
                return true;
            }
        }
        return false;
    }

    private static Object count(Args a) {
        if (a.size() < 2) {
            return (double) a.list(0).size();
        }
        int count = 0;
        for (var item : a.list(0)) {
            if (a.test(a.fn(1), item)) {
                count++;
            }
        }
        return (double) count;
    }

    private static String key(Args a, int index) {
        return a.has(index) ? a.string(index) : null;
    }

    private static Object pluck(Object item, String key) {
        if (key == null) {
            return item;
        }
        var map = Values.castMap(item);
        return map == null ? null : map.get(key);
    }

    static double sum(List<Object> items, String key) {
        double total = 0;
        for (var item : items) {
            if (pluck(item, key) instanceof Number number) {
                total += number.doubleValue();
            }
        }
        return total;
    }

    private static Object avg(Args a) {
        var items = a.list(0);
        if (items.isEmpty()) {
            return 0d;
        }
        return sum(items, key(a, 1)) / items.size();
    }

    private static double extreme(List<Object> items, String key, boolean min) {
        if (items.isEmpty()) {
            return 0d;
        }
        double result = min ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        for (var item : items) {
            if (pluck(item, key) instanceof Number number) {
                result = min ? Math.min(result, number.doubleValue()) : Math.max(result, number.doubleValue());
            }
        }
        return result;
    }

    private static Object groupBy(Args a) {
        var key = a.string(1);
        var groups = new LinkedHashMap<String, Object>();
        for (var item : a.list(0)) {
            var value = pluck(item, key);
            var group = value == null ? "undefined" : Values.stringify(value);
            castList(groups.computeIfAbsent(group, ignored -> new ArrayList<>())).add(item);
        }
        return groups;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> castList(Object value) {
        return (List<Object>) value;
    }

    private static Object partition(Args a) {
        var matches = new ArrayList<Object>();
        var rest = new ArrayList<Object>();
        for (var item : a.list(0)) {
            (a.test(a.fn(1), item) ? matches : rest).add(item);
        }
        var result = new ArrayList<Object>();
        result.add(matches);
        result.add(rest);
        return result;
    }

    static List<Object> take(List<Object> items, int n) {
        return new ArrayList<>(items.subList(0, Math.max(0, Math.min(n, items.size()))));
    }

    static List<Object> drop(List<Object> items, int n) {
        return new ArrayList<>(items.subList(Math.max(0, Math.min(n, items.size())), items.size()));
    }

    private static Object takeLast(Args a) {
        var items = a.list(0);
        int n = a.integer(1, 0);
        if (n <= 0) {
            return new ArrayList<>();
        }
        return drop(items, items.size() - n);
    }

    private static Object dropLast(Args a) {
        var items = a.list(0);
        int n = a.integer(1, 0);
        if (n <= 0) {
            return new ArrayList<>(items);
        }
        return take(items, items.size() - n);
    }
}
