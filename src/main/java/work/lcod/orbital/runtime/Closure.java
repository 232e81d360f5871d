package work.lcod.orbital.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Lambda produced by {@code fn}. Holds the defining context, whose locals are an immutable
 * snapshot, so the closure stays valid after that scope is gone.
 */
public record Closure(List<String> params, Object body, EvaluationContext captured) {
    public Closure {
        params = params.stream()
            .map(name -> name.startsWith("@") ? name.substring(1) : name)
            .toList();
    }

    /**
     * Binds call arguments to parameter names. A single parameter takes the first argument; several
     * parameters destructure a list argument, or the lone argument when it is not a list.
     */
    public EvaluationContext bind(List<Object> args) {
        var locals = new LinkedHashMap<String, Object>();
        if (params.size() == 1) {
            locals.put(params.get(0), args.isEmpty() ? null : args.get(0));
        } else if (args.size() == 1 && params.size() > 1) {
            var values = args.get(0) instanceof List<?> list ? list : Collections.singletonList(args.get(0));
            for (int i = 0; i < params.size(); i++) {
                locals.put(params.get(i), i < values.size() ? values.get(i) : null);
            }
        } else {
            for (int i = 0; i < params.size(); i++) {
                locals.put(params.get(i), i < args.size() ? args.get(i) : null);
            }
        }
        return captured.child(locals);
    }
}
