package com.mimecast.outpost.expr;

import com.mimecast.outpost.config.BasicConfig;
import com.mimecast.outpost.config.ConfigFoundation;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {

    private final DefaultPolicyResolver policy = new DefaultPolicyResolver(new BasicConfig(ConfigFoundation.parse(
            "{report: {domain: 'example.org'}, limits: {size: 100}}")))
            .addLocalDomains("internal", List.of("Example.org"));

    private static VariableResolver vars(Object... pairs) {
        Map<Variable, Object> map = new EnumMap<>(Variable.class);
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((Variable) pairs[i], pairs[i + 1]);
        }
        return variable -> map.getOrDefault(variable, "");
    }

    private Optional<Object> eval(String text, VariableResolver resolver) throws ExpressionException {
        return Expression.parse(text, null).evaluate(resolver, policy);
    }

    @Test
    void testLiterals() throws ExpressionException {
        VariableResolver none = vars();
        assertEquals("mx", eval("'mx'", none).orElseThrow());
        assertEquals("mx", eval("\"mx\"", none).orElseThrow());
        assertEquals(42L, eval("42", none).orElseThrow());
        assertEquals(true, eval("true", none).orElseThrow());
        assertEquals(List.of("a", 1L), eval("['a', 1]", none).orElseThrow());
    }

    @Test
    void testComparison() throws ExpressionException {
        VariableResolver resolver = vars(Variable.RCPT_DOMAIN, "example.com", Variable.PRIORITY, 2L, Variable.SIZE, 1200L);
        assertEquals(true, eval("rcpt_domain == 'example.com'", resolver).orElseThrow());
        assertEquals(false, eval("rcpt_domain != 'example.com'", resolver).orElseThrow());
        assertEquals(true, eval("priority > 0 && size >= 1200", resolver).orElseThrow());
        assertEquals(true, eval("priority < 0 || size <= 1200", resolver).orElseThrow());
        assertEquals(false, eval("!(priority == 2)", resolver).orElseThrow());
    }

    @Test
    void testArithmeticAndConcat() throws ExpressionException {
        VariableResolver none = vars();
        assertEquals(5L, eval("2 + 3", none).orElseThrow());
        assertEquals(-1L, eval("2 - 3", none).orElseThrow());
        assertEquals("MAILER-DAEMON@example.org", eval("'MAILER-DAEMON@' + config_get('report.domain')", none).orElseThrow());
        assertEquals("100", eval("config_get('limits.size')", none).orElseThrow());
        assertEquals("", eval("config_get('missing.key')", none).orElseThrow());
    }

    @Test
    void testFunctions() throws ExpressionException {
        VariableResolver resolver = vars(Variable.RCPT_DOMAIN, "EXAMPLE.org", Variable.SENDER, "Bob@Example.com");
        assertEquals(true, eval("is_local_domain('*', rcpt_domain)", resolver).orElseThrow());
        assertEquals(true, eval("is_local_domain('internal', rcpt_domain)", resolver).orElseThrow());
        assertEquals(false, eval("is_local_domain('other', rcpt_domain)", resolver).orElseThrow());
        assertEquals("bob@example.com", eval("lower(sender)", resolver).orElseThrow());
        assertEquals(true, eval("ends_with(lower(sender), '@example.com')", resolver).orElseThrow());
        assertEquals(true, eval("starts_with(sender, 'Bob')", resolver).orElseThrow());
        assertEquals(true, eval("contains(['a', 'b'], 'b')", resolver).orElseThrow());
        assertEquals(false, eval("contains(sender, 'alice')", resolver).orElseThrow());
    }

    @Test
    void testParseErrors() {
        assertThrows(ExpressionException.class, () -> Expression.parse("", null));
        assertThrows(ExpressionException.class, () -> Expression.parse("unknown_var == 1", null));
        assertThrows(ExpressionException.class, () -> Expression.parse("nope(1)", null));
        assertThrows(ExpressionException.class, () -> Expression.parse("lower(1, 2)", null));
        assertThrows(ExpressionException.class, () -> Expression.parse("(1 + 2", null));
        assertThrows(ExpressionException.class, () -> Expression.parse("'a' 'b'", null));
    }

    @Test
    void testContext() throws ExpressionException {
        assertThrows(ExpressionException.class, () -> Expression.parse("mx == 'a'", VariableContext.RECIPIENT));
        assertThrows(ExpressionException.class, () -> Expression.parse("rcpt == 'a'", VariableContext.SENDER));

        Expression expression = Expression.parse("mx == 'a' && rcpt_domain == 'b'", VariableContext.HOST);
        assertTrue(expression.references(Variable.MX));
        assertTrue(expression.references(Variable.SENDER, Variable.RCPT_DOMAIN));
        assertFalse(expression.references(Variable.SENDER));
    }

    @Test
    void testRuntimeErrorHasNoValue() throws ExpressionException {
        assertTrue(eval("'abc' - 1", vars()).isEmpty());
        assertTrue(Expression.EMPTY.evaluate(vars(), policy).isEmpty());
        assertTrue(Expression.EMPTY.isEmpty());
    }

    @Test
    void testIfBlock() throws ExpressionException {
        Object value = ConfigFoundation.parse("{v: [{if: \"rcpt_domain == 'relayed.com'\", then: \"'smarthost'\"}, {else: \"'mx'\"}]}").get("v");
        IfBlock block = IfBlock.parse("queue.strategy.route", value, VariableContext.RECIPIENT);

        assertEquals(Optional.of("smarthost"), policy.resolve(block, vars(Variable.RCPT_DOMAIN, "relayed.com")));
        assertEquals(Optional.of("mx"), policy.resolve(block, vars(Variable.RCPT_DOMAIN, "other.com")));
    }

    @Test
    void testIfBlockWithoutDefault() throws ExpressionException {
        Object value = ConfigFoundation.parse("{v: [{if: \"priority > 5\", then: \"'fast'\"}]}").get("v");
        IfBlock block = IfBlock.parse("queue.strategy.schedule", value, VariableContext.RECIPIENT);

        assertTrue(policy.resolve(block, vars(Variable.PRIORITY, 1L)).isEmpty());
        assertEquals(Optional.of("fast"), policy.resolve(block, vars(Variable.PRIORITY, 9L)));
    }

    @Test
    void testIfBlockErrors() {
        assertThrows(ExpressionException.class, () -> IfBlock.parse("k", List.of(Map.of("if", "true")), null));
        assertThrows(ExpressionException.class, () -> IfBlock.parse("k", List.of(Map.of("when", "true")), null));
    }

    @Test
    void testResolveList() throws ExpressionException {
        IfBlock list = IfBlock.parse("report.dsn.sign", List.of("rsa", "ed25519"), VariableContext.SENDER);
        assertEquals(List.of("rsa", "ed25519"), policy.resolveList(list, vars()));

        IfBlock single = IfBlock.parse("report.dsn.sign", "'rsa'", VariableContext.SENDER);
        assertEquals(List.of("rsa"), policy.resolveList(single, vars()));

        IfBlock none = IfBlock.parse("report.dsn.sign", "''", VariableContext.SENDER);
        assertTrue(policy.resolveList(none, vars()).isEmpty());
    }
}
