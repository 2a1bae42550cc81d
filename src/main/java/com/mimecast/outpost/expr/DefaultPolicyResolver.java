package com.mimecast.outpost.expr;

import com.mimecast.outpost.config.BasicConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Policy resolver backed by the expression interpreter.
 *
 * <p>Local domains are grouped by directory name; {@code is_local_domain('*', d)} matches any directory.
 * <p>{@code config_get} reads dotted keys from the configuration it was given.
 */
public class DefaultPolicyResolver implements PolicyResolver, ExpressionFunctions {
    private static final Logger log = LogManager.getLogger(DefaultPolicyResolver.class);

    private final Map<String, Set<String>> directories = new HashMap<>();
    private final BasicConfig config;

    /**
     * Constructs a new DefaultPolicyResolver instance.
     *
     * @param config Configuration for {@code config_get}, may be empty.
     */
    public DefaultPolicyResolver(BasicConfig config) {
        this.config = config != null ? config : new BasicConfig(Collections.emptyMap());
    }

    /**
     * Registers local domains under a directory.
     *
     * @param directory Directory name.
     * @param domains   Domains.
     * @return Self.
     */
    public DefaultPolicyResolver addLocalDomains(String directory, List<String> domains) {
        Set<String> set = directories.computeIfAbsent(directory, k -> new HashSet<>());
        for (String domain : domains) {
            set.add(domain.toLowerCase(Locale.ROOT));
        }
        return this;
    }

    @Override
    public Optional<Object> evaluate(IfBlock block, VariableResolver resolver) {
        for (IfBlock.Branch branch : block.getBranches()) {
            if (test(branch.getCondition(), resolver)) {
                Optional<Object> value = branch.getThen().evaluate(resolver, this);
                log.trace("{} matched [{}] -> {}", block.getKey(), branch.getCondition(), value.orElse(null));
                return value;
            }
        }
        return block.getDefault().evaluate(resolver, this);
    }

    @Override
    public boolean test(Expression expression, VariableResolver resolver) {
        return expression.evaluate(resolver, this).map(Values::isTruthy).orElse(false);
    }

    @Override
    public boolean isLocalDomain(String directory, String domain) {
        String lcase = domain.toLowerCase(Locale.ROOT);
        if ("*".equals(directory)) {
            return directories.values().stream().anyMatch(set -> set.contains(lcase));
        }
        Set<String> set = directories.get(directory);
        return set != null && set.contains(lcase);
    }

    @Override
    public String configGet(String key) {
        Object current = config.getMap();
        for (String part : key.split("\\.")) {
            if (!(current instanceof Map)) {
                return "";
            }
            current = ((Map<?, ?>) current).get(part);
        }
        if (current == null || current instanceof Map) {
            return "";
        }
        return current instanceof Double && ((Double) current) == Math.rint((Double) current)
                ? String.valueOf(((Double) current).longValue())
                : String.valueOf(current);
    }
}
