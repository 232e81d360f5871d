package work.lcod.orbital.runtime;

import java.util.List;
import java.util.Map;
import work.lcod.orbital.expr.Binding;

/**
 * Resolves {@code @root.path} strings against an {@link EvaluationContext}. Missing data yields
 * {@code null}; resolution never throws.
 */
public final class BindingResolver {
    private BindingResolver() {}

    public static Object resolve(String binding, EvaluationContext ctx) {
        var parsed = Binding.parse(binding);
        if (parsed.isEmpty()) {
            return null;
        }
        var root = parsed.get().root();
        var path = parsed.get().path();

        Object current;
        if (ctx.locals().containsKey(root)) {
            current = ctx.locals().get(root);
        } else {
            switch (root) {
                case "entity" -> current = ctx.entity();
                case "payload" -> current = ctx.payload();
                case "state" -> {
                    return path.isEmpty() ? ctx.state() : null;
                }
                case "now" -> {
                    return path.isEmpty() ? ctx.now() : null;
                }
                case "user" -> current = ctx.user();
                default -> current = ctx.singletons().get(root);
            }
        }
        return descend(current, path);
    }

    public static Object descend(Object current, List<String> path) {
        for (var segment : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }
}
