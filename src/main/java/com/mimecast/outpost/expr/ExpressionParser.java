package com.mimecast.outpost.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recursive descent parser for policy expressions.
 *
 * <p>Grammar, lowest precedence first:
 * <pre>
 *     or      = and ( "||" and )*
 *     and     = compare ( "&amp;&amp;" compare )*
 *     compare = sum ( ( "==" | "!=" | "&gt;" | "&gt;=" | "&lt;" | "&lt;=" ) sum )?
 *     sum     = unary ( ( "+" | "-" ) unary )*
 *     unary   = ( "!" | "-" ) unary | primary
 *     primary = string | integer | true | false | variable | function "(" args ")" | "(" or ")" | "[" args "]"
 * </pre>
 */
class ExpressionParser {

    /**
     * Known functions and their arity.
     */
    static final Map<String, Integer> FUNCTIONS = Map.of(
            "is_local_domain", 2,
            "starts_with", 2,
            "ends_with", 2,
            "contains", 2,
            "lower", 1,
            "config_get", 1);

    private final String text;
    private final VariableContext context;
    private final Set<Variable> variables = EnumSet.noneOf(Variable.class);
    private List<String> tokens;
    private int pos;

    ExpressionParser(String text, VariableContext context) {
        this.text = text;
        this.context = context;
    }

    Node parse() throws ExpressionException {
        tokens = tokenize(text);
        pos = 0;
        if (tokens.isEmpty()) {
            throw new ExpressionException("Empty expression");
        }
        Node node = parseOr();
        if (pos < tokens.size()) {
            throw new ExpressionException("Unexpected token '" + tokens.get(pos) + "'");
        }
        return node;
    }

    Set<Variable> getVariables() {
        return Collections.unmodifiableSet(variables);
    }

    private Node parseOr() throws ExpressionException {
        Node left = parseAnd();
        while (accept("||")) {
            Node l = left;
            Node r = parseAnd();
            left = ctx -> Values.isTruthy(l.eval(ctx)) || Values.isTruthy(r.eval(ctx));
        }
        return left;
    }

    private Node parseAnd() throws ExpressionException {
        Node left = parseCompare();
        while (accept("&&")) {
            Node l = left;
            Node r = parseCompare();
            left = ctx -> Values.isTruthy(l.eval(ctx)) && Values.isTruthy(r.eval(ctx));
        }
        return left;
    }

    private Node parseCompare() throws ExpressionException {
        Node left = parseSum();
        String op = peek();
        if (op == null) {
            return left;
        }
        switch (op) {
            case "==":
            case "!=":
            case ">":
            case ">=":
            case "<":
            case "<=":
                pos++;
                return compare(op, left, parseSum());
            default:
                return left;
        }
    }

    private static Node compare(String op, Node left, Node right) {
        if (op.equals("==")) {
            return ctx -> Values.isEqual(left.eval(ctx), right.eval(ctx));
        } else if (op.equals("!=")) {
            return ctx -> !Values.isEqual(left.eval(ctx), right.eval(ctx));
        }
        return ctx -> {
            Object lv = left.eval(ctx);
            Object rv = right.eval(ctx);
            Long l = Values.toLong(lv);
            Long r = Values.toLong(rv);
            int cmp;
            if (l != null && r != null) {
                cmp = Long.compare(l, r);
            } else if (lv instanceof String && rv instanceof String) {
                cmp = ((String) lv).compareTo((String) rv);
            } else {
                throw new EvaluationException("Cannot compare " + lv + " and " + rv);
            }
            switch (op) {
                case ">":
                    return cmp > 0;
                case ">=":
                    return cmp >= 0;
                case "<":
                    return cmp < 0;
                default:
                    return cmp <= 0;
            }
        };
    }

    private Node parseSum() throws ExpressionException {
        Node left = parseUnary();
        while (true) {
            if (accept("+")) {
                Node l = left;
                Node r = parseUnary();
                left = ctx -> add(l.eval(ctx), r.eval(ctx));
            } else if (accept("-")) {
                Node l = left;
                Node r = parseUnary();
                left = ctx -> numeric(l.eval(ctx)) - numeric(r.eval(ctx));
            } else {
                return left;
            }
        }
    }

    private static Object add(Object left, Object right) {
        if (left instanceof List || right instanceof List) {
            List<Object> list = new ArrayList<>();
            addAll(list, left);
            addAll(list, right);
            return list;
        }
        if (left instanceof Long && right instanceof Long) {
            return (Long) left + (Long) right;
        }
        return Values.toString(left) + Values.toString(right);
    }

    private static void addAll(List<Object> list, Object value) {
        if (value instanceof List) {
            list.addAll((List<?>) value);
        } else {
            list.add(value);
        }
    }

    private static long numeric(Object value) {
        Long number = Values.toLong(value);
        if (number == null) {
            throw new EvaluationException("Not a number: " + value);
        }
        return number;
    }

    private Node parseUnary() throws ExpressionException {
        if (accept("!")) {
            Node operand = parseUnary();
            return ctx -> !Values.isTruthy(operand.eval(ctx));
        } else if (accept("-")) {
            Node operand = parseUnary();
            return ctx -> -numeric(operand.eval(ctx));
        }
        return parsePrimary();
    }

    private Node parsePrimary() throws ExpressionException {
        String token = next();
        if (token == null) {
            throw new ExpressionException("Unexpected end of expression");
        }

        if (token.equals("(")) {
            Node node = parseOr();
            expect(")");
            return node;
        } else if (token.equals("[")) {
            List<Node> items = parseArgs("]");
            return ctx -> {
                List<Object> list = new ArrayList<>(items.size());
                for (Node item : items) {
                    list.add(item.eval(ctx));
                }
                return list;
            };
        } else if (token.startsWith("'") || token.startsWith("\"")) {
            String value = token.substring(1);
            return ctx -> value;
        } else if (Character.isDigit(token.charAt(0))) {
            try {
                long value = Long.parseLong(token);
                return ctx -> value;
            } catch (NumberFormatException e) {
                throw new ExpressionException("Invalid number '" + token + "'");
            }
        } else if (token.equals("true") || token.equals("false")) {
            boolean value = token.equals("true");
            return ctx -> value;
        } else if (isIdentifier(token)) {
            if (accept("(")) {
                return function(token, parseArgs(")"));
            }
            return variable(token);
        }

        throw new ExpressionException("Unexpected token '" + token + "'");
    }

    private Node variable(String name) throws ExpressionException {
        Variable variable = Variable.byName(name)
                .orElseThrow(() -> new ExpressionException("Unknown variable '" + name + "'"));
        if (context != null && !context.allows(variable)) {
            throw new ExpressionException("Variable '" + name + "' is not available in this context");
        }
        variables.add(variable);
        return ctx -> {
            Object value = ctx.getResolver().resolve(variable);
            return value != null ? value : "";
        };
    }

    private Node function(String name, List<Node> args) throws ExpressionException {
        Integer arity = FUNCTIONS.get(name);
        if (arity == null) {
            throw new ExpressionException("Unknown function '" + name + "'");
        } else if (arity != args.size()) {
            throw new ExpressionException("Function '" + name + "' expects " + arity + " arguments");
        }

        switch (name) {
            case "is_local_domain":
                return ctx -> ctx.getFunctions().isLocalDomain(
                        Values.toString(args.get(0).eval(ctx)), Values.toString(args.get(1).eval(ctx)));
            case "starts_with":
                return ctx -> Values.toString(args.get(0).eval(ctx)).startsWith(Values.toString(args.get(1).eval(ctx)));
            case "ends_with":
                return ctx -> Values.toString(args.get(0).eval(ctx)).endsWith(Values.toString(args.get(1).eval(ctx)));
            case "contains":
                return ctx -> {
                    Object haystack = args.get(0).eval(ctx);
                    Object needle = args.get(1).eval(ctx);
                    if (haystack instanceof List) {
                        return ((List<?>) haystack).stream().anyMatch(item -> Values.isEqual(item, needle));
                    }
                    return Values.toString(haystack).contains(Values.toString(needle));
                };
            case "lower":
                return ctx -> Values.toString(args.get(0).eval(ctx)).toLowerCase(Locale.ROOT);
            default:
                return ctx -> ctx.getFunctions().configGet(Values.toString(args.get(0).eval(ctx)));
        }
    }

    private List<Node> parseArgs(String close) throws ExpressionException {
        List<Node> args = new ArrayList<>();
        if (accept(close)) {
            return args;
        }
        do {
            args.add(parseOr());
        } while (accept(","));
        expect(close);
        return args;
    }

    private String peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private String next() {
        return pos < tokens.size() ? tokens.get(pos++) : null;
    }

    private boolean accept(String token) {
        if (token.equals(peek())) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(String token) throws ExpressionException {
        if (!accept(token)) {
            throw new ExpressionException("Expected '" + token + "'");
        }
    }

    private static boolean isIdentifier(String token) {
        return Character.isLetter(token.charAt(0)) || token.charAt(0) == '_';
    }

    /**
     * Splits an expression into tokens.
     * <p>String literals keep their opening quote as a marker and lose the closing one.
     *
     * @param text Expression text.
     * @return List of tokens.
     * @throws ExpressionException On unterminated strings or unknown characters.
     */
    static List<String> tokenize(String text) throws ExpressionException {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '\'' || c == '"') {
                StringBuilder sb = new StringBuilder().append(c);
                int j = i + 1;
                while (j < text.length() && text.charAt(j) != c) {
                    if (text.charAt(j) == '\\' && j + 1 < text.length()) {
                        j++;
                    }
                    sb.append(text.charAt(j++));
                }
                if (j >= text.length()) {
                    throw new ExpressionException("Unterminated string");
                }
                tokens.add(sb.toString());
                i = j + 1;
            } else if (Character.isLetterOrDigit(c) || c == '_') {
                int j = i;
                while (j < text.length() && (Character.isLetterOrDigit(text.charAt(j)) || text.charAt(j) == '_')) {
                    j++;
                }
                tokens.add(text.substring(i, j));
                i = j;
            } else if (i + 1 < text.length() && isTwoCharOperator(text.substring(i, i + 2))) {
                tokens.add(text.substring(i, i + 2));
                i += 2;
            } else if ("()[],+-!<>".indexOf(c) >= 0) {
                tokens.add(String.valueOf(c));
                i++;
            } else {
                throw new ExpressionException("Unexpected character '" + c + "'");
            }
        }
        return tokens;
    }

    private static boolean isTwoCharOperator(String op) {
        switch (op) {
            case "==":
            case "!=":
            case ">=":
            case "<=":
            case "&&":
            case "||":
                return true;
            default:
                return false;
        }
    }

    /**
     * Parsed expression node.
     */
    @FunctionalInterface
    interface Node {
        Object eval(EvaluationContext ctx);
    }

    /**
     * Variable values and functions seen by nodes during evaluation.
     */
    static final class EvaluationContext {
        private final VariableResolver resolver;
        private final ExpressionFunctions functions;

        EvaluationContext(VariableResolver resolver, ExpressionFunctions functions) {
            this.resolver = resolver;
            this.functions = functions;
        }

        VariableResolver getResolver() {
            return resolver;
        }

        ExpressionFunctions getFunctions() {
            return functions;
        }
    }
}
