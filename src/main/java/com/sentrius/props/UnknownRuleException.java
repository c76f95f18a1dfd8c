package com.sentrius.props;

/**
 * A declared rule name does not resolve in the rule registry.
 * This is a configuration error, not a validation failure.
 */
public class UnknownRuleException extends IllegalStateException {
    private final String rule;

    public UnknownRuleException(String rule) {
        super("No such rule: " + rule);
        this.rule = rule;
    }

    public String getRule() {
        return rule;
    }
}
