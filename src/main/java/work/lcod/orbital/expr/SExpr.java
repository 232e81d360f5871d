package work.lcod.orbital.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural helpers over JSON-shaped S-expressions ({@code ["op", arg...]}).
 */
public final class SExpr {
    private SExpr() {}

    /**
     * Visitor invoked once per node during {@link #walk(Object, Visitor)}.
     */
    @FunctionalInterface
    public interface Visitor {
        void visit(Object node, List<?> parent, int index);
    }

    public static boolean isCall(Object value) {
        return value instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof String;
    }

    public static String operatorOf(Object value) {
        return isCall(value) ? (String) ((List<?>) value).get(0) : null;
    }

    public static List<Object> argsOf(Object value) {
        if (!isCall(value)) {
            return List.of();
        }
        var list = (List<?>) value;
        return Collections.unmodifiableList(new ArrayList<Object>(list.subList(1, list.size())));
    }

    public static List<Object> call(String operator, Object... args) {
        Objects.requireNonNull(operator, "operator");
        if (operator.isBlank()) {
            throw new IllegalArgumentException("Operator name must not be blank");
        }
        var list = new ArrayList<Object>(args.length + 1);
        list.add(operator);
        Collections.addAll(list, args);
        return Collections.unmodifiableList(list);
    }

    /**
     * Pre-order traversal of calls and literal arrays. Map literals are atoms and are not entered.
     */
    public static void walk(Object expr, Visitor visitor) {
        walk(expr, null, -1, visitor);
    }

    private static void walk(Object node, List<?> parent, int index, Visitor visitor) {
        visitor.visit(node, parent, index);
        if (node instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                walk(list.get(i), list, i, visitor);
            }
        }
    }

    public static Set<String> collectBindings(Object expr) {
        var bindings = new LinkedHashSet<String>();
        walk(expr, (node, parent, index) -> {
            if (Binding.isBinding(node)) {
                bindings.add((String) node);
            }
        });
        return bindings;
    }
}
