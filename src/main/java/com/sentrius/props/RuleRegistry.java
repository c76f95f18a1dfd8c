package com.sentrius.props;

import com.sentrius.props.model.NamedRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Catalog of named validation rules.
 * Names are normalized to PascalCase, so {@code date_format}, {@code dateFormat}
 * and {@code DateFormat} resolve to the same rule. Entries are never removed.
 * <p>
 * Registration is a write to shared state: callers registering from several
 * threads must serialize their registrations. Lookups are safe while no
 * registration is in progress.
 */
public class RuleRegistry {
    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private final Map<String, RulePredicate> rules = new ConcurrentHashMap<>();
    private final Map<String, Consumer<List<String>>> argumentChecks = new ConcurrentHashMap<>();

    /**
     * Register a rule, replacing any rule with the same normalized name.
     * @param name The rule name
     * @param predicate The rule predicate
     */
    public void register(String name, RulePredicate predicate) {
        register(name, predicate, arguments -> { });
    }

    /**
     * Register a rule together with a check of the arguments it is declared with.
     * @param name The rule name
     * @param predicate The rule predicate
     * @param argumentCheck Throws IllegalArgumentException for arguments the rule cannot use
     */
    public void register(String name, RulePredicate predicate, Consumer<List<String>> argumentCheck) {
        if (name == null || name.trim().isEmpty() || predicate == null) {
            throw new IllegalArgumentException("Rule name and predicate cannot be null");
        }
        if (argumentCheck == null) {
            throw new IllegalArgumentException("Argument check cannot be null");
        }

        String normalized = normalize(name);
        if (NamedRule.REQUIRED.equals(normalized) || NamedRule.NULLABLE.equals(normalized)) {
            throw new IllegalArgumentException("'" + name + "' is reserved and cannot be registered as a rule");
        }

        argumentChecks.put(normalized, argumentCheck);
        if (rules.put(normalized, predicate) != null) {
            log.debug("Replaced validation rule {}", normalized);
        } else {
            log.debug("Registered validation rule {}", normalized);
        }
    }

    /**
     * Check if a rule is registered.
     * @param name The rule name, in any supported casing
     * @return true if a rule exists
     */
    public boolean has(String name) {
        return name != null && rules.containsKey(normalize(name));
    }

    /**
     * Resolve a rule by name.
     * @param name The rule name, in any supported casing
     * @return The rule predicate
     * @throws UnknownRuleException if no rule is registered under the name
     */
    public RulePredicate resolve(String name) {
        RulePredicate predicate = name == null ? null : rules.get(normalize(name));
        if (predicate == null) {
            throw new UnknownRuleException(name);
        }
        return predicate;
    }

    /**
     * Check the arguments a rule is declared with.
     * @throws UnknownRuleException if no rule is registered under the name
     * @throws IllegalArgumentException if the rule cannot use the arguments
     */
    public void checkArguments(String name, List<String> arguments) {
        resolve(name);
        argumentChecks.get(normalize(name)).accept(arguments);
    }

    /**
     * Get all registered rule names, normalized.
     * @return A set of rule names
     */
    public Set<String> getRegisteredRules() {
        return new HashSet<>(rules.keySet());
    }

    public int size() {
        return rules.size();
    }

    public static String normalize(String name) {
        return NamingUtil.toPascal(name.trim());
    }
}
