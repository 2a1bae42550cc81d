/**
 * Policy expressions.
 *
 * <p>Small expression language used by the configuration if blocks.
 * <br>Expressions are parsed once by {@link com.mimecast.outpost.expr.ExpressionParser} and evaluated
 * <br>against a {@link com.mimecast.outpost.expr.VariableResolver} by the {@link com.mimecast.outpost.expr.PolicyResolver}.
 */
package com.mimecast.outpost.expr;
