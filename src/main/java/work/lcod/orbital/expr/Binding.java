package work.lcod.orbital.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed form of an {@code @root.path} binding string.
 */
public record Binding(BindingType type, String root, List<String> path) {
    public static final String PREFIX = "@";

    /** Roots resolved directly against the evaluation context. */
    public static final Set<String> CORE_ROOTS = Set.of(
        "entity", "payload", "state", "now", "config", "computed", "trait"
    );

    private static final Set<String> PATHLESS_ROOTS = Set.of("state", "now");

    public Binding {
        path = List.copyOf(path);
    }

    public static boolean isBinding(Object value) {
        return value instanceof String str && str.startsWith(PREFIX);
    }

    /**
     * Splits a binding on {@code .}; empty when the value is not a binding or has an empty root.
     */
    public static Optional<Binding> parse(String raw) {
        if (raw == null || !raw.startsWith(PREFIX)) {
            return Optional.empty();
        }
        var body = raw.substring(1);
        if (body.isEmpty()) {
            return Optional.empty();
        }
        var parts = split(body);
        var root = parts.get(0);
        if (root.isEmpty()) {
            return Optional.empty();
        }
        var type = CORE_ROOTS.contains(root) ? BindingType.CORE : BindingType.ENTITY;
        return Optional.of(new Binding(type, root, parts.subList(1, parts.size())));
    }

    public static boolean isValid(String raw) {
        return parse(raw).map(Binding::isValid).orElse(false);
    }

    public boolean isValid() {
        if (PATHLESS_ROOTS.contains(root)) {
            return path.isEmpty();
        }
        if (type == BindingType.ENTITY) {
            return !path.isEmpty();
        }
        return true;
    }

    public String render() {
        var builder = new StringBuilder(PREFIX).append(root);
        for (var segment : path) {
            builder.append('.').append(segment);
        }
        return builder.toString();
    }

    static List<String> split(String body) {
        var parts = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            if (body.charAt(i) == '.') {
                parts.add(body.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(body.substring(start));
        return parts;
    }
}
