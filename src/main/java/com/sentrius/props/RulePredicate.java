package com.sentrius.props;

import java.util.List;

/**
 * A named validation rule. Arguments are the raw strings from the rule
 * notation; the predicate does any coercion it needs.
 */
@FunctionalInterface
public interface RulePredicate {
    boolean test(Object value, List<String> arguments);
}
