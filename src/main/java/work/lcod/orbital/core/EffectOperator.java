package work.lcod.orbital.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.orbital.expr.Binding;
import work.lcod.orbital.runtime.BindingResolver;
import work.lcod.orbital.runtime.EvaluationContext;
import work.lcod.orbital.runtime.Evaluator;
import work.lcod.orbital.runtime.ExpressionException;
import work.lcod.orbital.runtime.Operator;
import work.lcod.orbital.runtime.Values;

/**
 * Operators that hand their evaluated arguments to exactly one host handler. A context without
 * the handler turns the effect into a no-op, so guards can be evaluated without side effects.
 */
public enum EffectOperator implements Operator {
    SET("set", 2, "Assign an entity field: (set @entity.path value op?)") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var target = args.get(0);
            var field = entityField(target);
            if (field == null) {
                LOG.warn("set ignored: target {} is not an @entity binding", target);
                return null;
            }
            var value = evaluator.evaluate(args.get(1), ctx);
            if (args.size() > 2) {
                var op = Values.stringify(evaluator.evaluate(args.get(2), ctx));
                value = combine(op, BindingResolver.resolve((String) target, ctx), value);
            }
            mutate(ctx, field, value);
            return null;
        }
    },
    SET_DYNAMIC("set-dynamic", 2, "Assign an entity field whose path is computed at runtime") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var rawPath = evaluator.evaluate(args.get(0), ctx);
            if (!(rawPath instanceof String path) || path.isBlank()) {
                throw ExpressionException.invalidArgument(symbol(), 1, "path must evaluate to a non-empty string");
            }
            var field = path;
            if (field.startsWith("@entity.")) {
                field = field.substring("@entity.".length());
            } else if (field.startsWith("entity.")) {
                field = field.substring("entity.".length());
            }
            mutate(ctx, field, evaluator.evaluate(args.get(1), ctx));
            return null;
        }
    },
    INCREMENT("increment", 1, "Add an amount (default 1) to a numeric entity field") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            return step(this, args, evaluator, ctx, 1d);
        }
    },
    DECREMENT("decrement", 1, "Subtract an amount (default 1) from a numeric entity field") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            return step(this, args, evaluator, ctx, -1d);
        }
    },
    EMIT("emit", 1, "Emit an event with an optional payload") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var event = requireString(this, 1, evaluator.evaluate(args.get(0), ctx));
            var payload = evaluator.arg(args, 1, ctx);
            var handler = ctx.handlers().emit();
            if (handler == null) {
                missing("emit");
                return null;
            }
            handler.emit(event, payload);
            return null;
        }
    },
    NAVIGATE("navigate", 1, "Navigate to a route") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var route = requireString(this, 1, evaluator.evaluate(args.get(0), ctx));
            var params = evaluator.arg(args, 1, ctx);
            var handler = ctx.handlers().navigate();
            if (handler == null) {
                missing("navigate");
                return null;
            }
            handler.navigate(route, params);
            return null;
        }
    },
    PERSIST("persist", 1, "Persist data (create, update or delete); asynchronous") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var action = requireString(this, 1, evaluator.evaluate(args.get(0), ctx));
            Object data = args.size() > 1 ? evaluator.evaluate(args.get(1), ctx) : ctx.payload();
            var handler = ctx.handlers().persist();
            if (handler == null) {
                missing("persist");
                return CompletableFuture.completedFuture(null);
            }
            return handler.persist(action, data);
        }
    },
    NOTIFY("notify", 1, "Show a notification: (notify message type?) or (notify {type, message})") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var first = evaluator.evaluate(args.get(0), ctx);
            String message;
            String type = "info";
            if (first instanceof Map<?, ?> notice) {
                message = Values.stringify(resolveField(notice.get("message"), ctx));
                var rawType = resolveField(notice.get("type"), ctx);
                if (rawType != null) {
                    type = Values.stringify(rawType);
                }
            } else {
                message = Values.stringify(first);
                var rawType = evaluator.arg(args, 1, ctx);
                if (rawType != null) {
                    type = Values.stringify(rawType);
                }
            }
            var handler = ctx.handlers().notifier();
            if (handler == null) {
                missing("notify");
                return null;
            }
            handler.show(message, type);
            return null;
        }
    },
    SPAWN("spawn", 1, "Spawn a new entity instance") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var type = requireString(this, 1, evaluator.evaluate(args.get(0), ctx));
            var props = evaluator.arg(args, 1, ctx);
            var handler = ctx.handlers().spawn();
            if (handler == null) {
                missing("spawn");
                return null;
            }
            handler.spawn(type, props);
            return null;
        }
    },
    DESPAWN("despawn", 0, "Remove an entity instance (the current one when no id is given)") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var id = evaluator.arg(args, 0, ctx);
            var handler = ctx.handlers().despawn();
            if (handler == null) {
                missing("despawn");
                return null;
            }
            handler.despawn(id);
            return null;
        }
    },
    CALL_SERVICE("call-service", 2, "Call an external service method; asynchronous") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var service = requireString(this, 1, evaluator.evaluate(args.get(0), ctx));
            var method = requireString(this, 2, evaluator.evaluate(args.get(1), ctx));
            var params = evaluator.arg(args, 2, ctx);
            var handler = ctx.handlers().callService();
            if (handler == null) {
                missing("callService");
                return CompletableFuture.completedFuture(null);
            }
            return handler.call(service, method, params);
        }
    },
    RENDER_UI("render-ui", 2, "Render a UI pattern into a slot; a null pattern clears it") {
        @Override
        public Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx) {
            var slot = requireString(this, 1, evaluator.evaluate(args.get(0), ctx));
            var pattern = evaluator.evaluate(args.get(1), ctx);
            if (pattern == null) {
                pattern = Map.of("type", "clear");
            }
            var props = evaluator.arg(args, 2, ctx);
            var priority = evaluator.arg(args, 3, ctx);
            var handler = ctx.handlers().renderUi();
            if (handler == null) {
                missing("renderUI");
                return null;
            }
            handler.render(slot, pattern, props, priority);
            return null;
        }
    };

    private static final Logger LOG = LoggerFactory.getLogger(EffectOperator.class);
    private static final String ENTITY_PREFIX = "@entity.";

    private final String symbol;
    private final int minArity;
    private final String description;

    EffectOperator(String symbol, int minArity, String description) {
        this.symbol = symbol;
        this.minArity = minArity;
        this.description = description;
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

    static String entityField(Object target) {
        if (target instanceof String str && str.startsWith(ENTITY_PREFIX) && str.length() > ENTITY_PREFIX.length()) {
            return str.substring(ENTITY_PREFIX.length());
        }
        return null;
    }

    static Object combine(String op, Object current, Object value) {
        return switch (op) {
            case "increment" -> Values.toNumber(current) + Values.toNumber(value);
            case "decrement" -> Values.toNumber(current) - Values.toNumber(value);
            case "multiply" -> Values.toNumber(current) * Values.toNumber(value);
            case "append" -> {
                var list = new ArrayList<Object>(Values.toList(current));
                list.add(value);
                yield list;
            }
            case "remove" -> {
                var list = new ArrayList<Object>();
                for (var item : Values.toList(current)) {
                    if (!Values.deepEquals(item, value)) {
                        list.add(item);
                    }
                }
                yield list;
            }
            default -> throw ExpressionException.invalidArgument("set", 3, "unknown set operation '" + op + "'");
        };
    }

    private static Object step(EffectOperator op, List<Object> args, Evaluator evaluator, EvaluationContext ctx, double sign) {
        var target = args.get(0);
        var field = entityField(target);
        if (field == null) {
            LOG.warn("{} ignored: target {} is not an @entity binding", op.symbol(), target);
            return null;
        }
        double amount = args.size() > 1 ? Values.toNumber(evaluator.evaluate(args.get(1), ctx)) : 1d;
        double current = Values.toNumber(BindingResolver.resolve((String) target, ctx));
        mutate(ctx, field, current + sign * amount);
        return null;
    }

    private static void mutate(EvaluationContext ctx, String field, Object value) {
        var handler = ctx.handlers().mutateEntity();
        if (handler == null) {
            missing("mutateEntity");
            return;
        }
        var changes = new LinkedHashMap<String, Object>();
        changes.put(field, value);
        handler.apply(changes);
    }

    private static Object resolveField(Object raw, EvaluationContext ctx) {
        return Binding.isBinding(raw) ? BindingResolver.resolve((String) raw, ctx) : raw;
    }

    private static String requireString(EffectOperator op, int position, Object value) {
        if (value == null) {
            throw ExpressionException.invalidArgument(op.symbol(), position, "value is null");
        }
        return value instanceof String str ? str : Values.stringify(value);
    }

    private static void missing(String handler) {
        LOG.debug("No {} handler in context; effect skipped", handler);
    }
}
