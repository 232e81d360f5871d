package work.lcod.orbital.runtime;

import java.util.List;

/**
 * Implementation of an operator. Receives its argument expressions unevaluated so it controls
 * evaluation order and short-circuiting.
 */
@FunctionalInterface
public interface Operator {
    Object apply(List<Object> args, Evaluator evaluator, EvaluationContext ctx);
}
