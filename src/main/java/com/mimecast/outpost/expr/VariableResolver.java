package com.mimecast.outpost.expr;

/**
 * Supplies variable values to expressions.
 *
 * <p>Values are {@link String}, {@link Long}, {@link Boolean} or a {@link java.util.List} of those.
 */
@FunctionalInterface
public interface VariableResolver {

    /**
     * Resolves a variable.
     *
     * @param variable Variable.
     * @return Value, empty string when not available.
     */
    Object resolve(Variable variable);
}
