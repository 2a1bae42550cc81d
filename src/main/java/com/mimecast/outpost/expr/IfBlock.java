package com.mimecast.outpost.expr;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Conditional chain of expressions.
 *
 * <p>The first branch whose condition holds supplies the value, otherwise the default does.
 * <p>Configuration form is either a single expression or a list:
 * <pre>
 *     [{if: "rcpt_domain == 'example.com'", then: "'relay'"}, {else: "'mx'"}]
 * </pre>
 */
public final class IfBlock {

    private final String key;
    private final ImmutableList<Branch> branches;
    private final Expression defaultValue;

    /**
     * Constructs a new IfBlock instance.
     *
     * @param key          Configuration key, used in messages.
     * @param branches     Conditional branches.
     * @param defaultValue Default expression, {@link Expression#EMPTY} for none.
     */
    public IfBlock(String key, List<Branch> branches, Expression defaultValue) {
        this.key = key;
        this.branches = ImmutableList.copyOf(branches);
        this.defaultValue = defaultValue != null ? defaultValue : Expression.EMPTY;
    }

    /**
     * Builds an IfBlock from expression source strings.
     *
     * @param key          Configuration key.
     * @param branches     Condition and value pairs.
     * @param defaultValue Default expression.
     * @return IfBlock instance.
     * @throws IllegalArgumentException When a built-in expression does not parse.
     */
    public static IfBlock of(String key, List<String[]> branches, String defaultValue) {
        try {
            List<Branch> list = new ArrayList<>();
            for (String[] branch : branches) {
                list.add(new Branch(Expression.parse(branch[0], null), Expression.parse(branch[1], null)));
            }
            return new IfBlock(key, list, Expression.parse(defaultValue, null));
        } catch (ExpressionException e) {
            throw new IllegalArgumentException("Invalid built-in expression for " + key + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a configuration value.
     *
     * @param key     Configuration key.
     * @param value   String, number, boolean or list as read from configuration.
     * @param context Evaluation context.
     * @return IfBlock instance.
     * @throws ExpressionException When any part fails to parse.
     */
    public static IfBlock parse(String key, Object value, VariableContext context) throws ExpressionException {
        if (value instanceof List && !((List<?>) value).isEmpty() && ((List<?>) value).get(0) instanceof Map) {
            List<Branch> list = new ArrayList<>();
            Expression defaultValue = Expression.EMPTY;
            for (Object item : (List<?>) value) {
                if (!(item instanceof Map)) {
                    throw new ExpressionException("Expected an object with 'if' and 'then' or 'else'");
                }
                Map<?, ?> map = (Map<?, ?>) item;
                if (map.containsKey("if")) {
                    if (!map.containsKey("then")) {
                        throw new ExpressionException("Missing 'then' for condition " + map.get("if"));
                    }
                    list.add(new Branch(
                            parseValue(map.get("if"), context),
                            parseValue(map.get("then"), context)));
                } else if (map.containsKey("else")) {
                    defaultValue = parseValue(map.get("else"), context);
                } else {
                    throw new ExpressionException("Expected 'if' or 'else'");
                }
            }
            return new IfBlock(key, list, defaultValue);
        }

        return new IfBlock(key, List.of(), parseValue(value, context));
    }

    private static Expression parseValue(Object value, VariableContext context) throws ExpressionException {
        if (value instanceof String) {
            return Expression.parse((String) value, context);
        } else if (value instanceof Boolean) {
            return Expression.literal(value);
        } else if (value instanceof Number) {
            return Expression.literal(((Number) value).longValue());
        } else if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<?>) value) {
                items.add(item instanceof Number ? (Object) ((Number) item).longValue() : String.valueOf(item));
            }
            return Expression.literal(items);
        }
        throw new ExpressionException("Unsupported value " + value);
    }

    public String getKey() {
        return key;
    }

    public List<Branch> getBranches() {
        return branches;
    }

    public Expression getDefault() {
        return defaultValue;
    }

    public boolean isEmpty() {
        return branches.isEmpty() && defaultValue.isEmpty();
    }

    @Override
    public String toString() {
        return key + branches + " else " + defaultValue;
    }

    /**
     * Condition and value pair.
     */
    public static final class Branch {
        private final Expression condition;
        private final Expression then;

        public Branch(Expression condition, Expression then) {
            this.condition = condition;
            this.then = then;
        }

        public Expression getCondition() {
            return condition;
        }

        public Expression getThen() {
            return then;
        }

        @Override
        public String toString() {
            return "{if " + condition + " then " + then + "}";
        }
    }
}
