package com.sentrius.props.model;

/**
 * One validation rule attached to a field: either a named rule with
 * arguments or an opaque predicate.
 */
public interface RuleSpec {
    /**
     * @return The label reported when this rule fails
     */
    String getName();
}
