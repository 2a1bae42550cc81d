package com.mimecast.outpost.expr;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed policy expression.
 *
 * <p>Parsing checks variables against an evaluation context and functions against the known set.
 * <p>Evaluation never throws, a value that cannot be computed yields an empty result.
 */
public final class Expression {
    private static final Logger log = LogManager.getLogger(Expression.class);

    /**
     * Expression without value.
     */
    public static final Expression EMPTY = new Expression("", null, Collections.emptySet());

    private final String text;
    private final ExpressionParser.Node root;
    private final Set<Variable> variables;

    private Expression(String text, ExpressionParser.Node root, Set<Variable> variables) {
        this.text = text;
        this.root = root;
        this.variables = variables;
    }

    /**
     * Parses an expression.
     *
     * @param text    Expression text.
     * @param context Evaluation context, null to allow every variable.
     * @return Expression instance.
     * @throws ExpressionException On syntax errors, unknown names or variables outside the context.
     */
    public static Expression parse(String text, VariableContext context) throws ExpressionException {
        ExpressionParser parser = new ExpressionParser(text, context);
        ExpressionParser.Node root = parser.parse();
        return new Expression(text, root, parser.getVariables());
    }

    /**
     * Creates an expression that always yields the given value.
     *
     * @param value String, Long, Boolean or List.
     * @return Expression instance.
     */
    public static Expression literal(Object value) {
        return new Expression(String.valueOf(value), ctx -> value, Collections.emptySet());
    }

    public String getText() {
        return text;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Gets the variables this expression reads.
     *
     * @return Set of Variable.
     */
    public Set<Variable> getVariables() {
        return variables;
    }

    /**
     * Checks if this expression reads any of the given variables.
     *
     * @param candidates Variables.
     * @return Boolean.
     */
    public boolean references(Variable... candidates) {
        for (Variable candidate : candidates) {
            if (variables.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluates the expression.
     *
     * @param resolver  Variable values.
     * @param functions Function hooks.
     * @return Optional of String, Long, Boolean or List; empty if empty or on evaluation error.
     */
    public Optional<Object> evaluate(VariableResolver resolver, ExpressionFunctions functions) {
        if (root == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(root.eval(new ExpressionParser.EvaluationContext(resolver, functions)));
        } catch (EvaluationException e) {
            log.debug("Expression [{}] has no value: {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
