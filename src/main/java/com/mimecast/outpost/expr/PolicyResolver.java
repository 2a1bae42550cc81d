package com.mimecast.outpost.expr;

import java.util.List;
import java.util.Optional;

/**
 * Resolves conditional configuration values against message attributes.
 *
 * <p>Implementations have no side effects.
 */
public interface PolicyResolver {

    /**
     * Evaluates an IfBlock.
     *
     * @param block    Conditional chain.
     * @param resolver Variable values.
     * @return Optional of the selected value, empty when nothing matched and there is no default.
     */
    Optional<Object> evaluate(IfBlock block, VariableResolver resolver);

    /**
     * Evaluates a single expression as a condition.
     *
     * @param expression Expression.
     * @param resolver   Variable values.
     * @return Boolean, false when the expression has no value.
     */
    boolean test(Expression expression, VariableResolver resolver);

    /**
     * Resolves a strategy name or other string value.
     *
     * @param block    Conditional chain.
     * @param resolver Variable values.
     * @return Optional of String.
     */
    default Optional<String> resolve(IfBlock block, VariableResolver resolver) {
        return evaluate(block, resolver).map(Values::toString).filter(s -> !s.isEmpty());
    }

    /**
     * Resolves a list value, a single value yields a single item list.
     *
     * @param block    Conditional chain.
     * @param resolver Variable values.
     * @return List of String, empty if nothing matched.
     */
    default List<String> resolveList(IfBlock block, VariableResolver resolver) {
        Optional<Object> value = evaluate(block, resolver);
        if (value.isEmpty()) {
            return List.of();
        } else if (value.get() instanceof List) {
            return ((List<?>) value.get()).stream()
                    .map(Values::toString)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
        String single = Values.toString(value.get());
        return single.isEmpty() ? List.of() : List.of(single);
    }
}
