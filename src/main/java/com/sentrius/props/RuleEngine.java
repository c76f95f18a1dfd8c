package com.sentrius.props;

import com.sentrius.props.model.NamedRule;
import com.sentrius.props.model.PredicateRule;
import com.sentrius.props.model.RuleSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Validates incoming property data against a {@link RuleSet}.
 * <p>
 * A field is validated only if it is present in the data or marked
 * {@code required}. A required field that is absent fails unless it is also
 * {@code nullable}; a present null value skips the remaining rules when the
 * field is {@code nullable}. Evaluation stops at the first failing rule.
 */
public class RuleEngine {
    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final RuleRegistry registry;

    public RuleEngine(RuleRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Rule registry cannot be null");
        }
        this.registry = registry;
    }

    public RuleRegistry getRegistry() {
        return registry;
    }

    /**
     * Validate every declared field of a rule set, stopping at the first failing field.
     * @param rules The declared rules
     * @param data The incoming data
     * @return A ValidationResult indicating success or the first failure
     * @throws UnknownRuleException if a declared rule name is not registered
     */
    public ValidationResult validate(RuleSet rules, Map<String, ?> data) {
        checkRules(rules);

        for (String field : rules.getFields()) {
            ValidationResult result = validate(field, rules.getRules(field), data);
            if (!result.isValid()) {
                return result;
            }
        }

        return ValidationResult.success();
    }

    /**
     * Validate one field.
     * @param field The field name
     * @param specs The field's rules, in declaration order
     * @param data The incoming data
     * @return A ValidationResult indicating success or failure
     * @throws UnknownRuleException if a rule name is not registered
     */
    public ValidationResult validate(String field, List<RuleSpec> specs, Map<String, ?> data) {
        boolean required = false;
        boolean nullable = false;
        for (RuleSpec spec : specs) {
            if (spec instanceof NamedRule) {
                NamedRule named = (NamedRule) spec;
                required |= named.isRequired();
                nullable |= named.isNullable();
            }
        }

        if (!data.containsKey(field)) {
            if (required && !nullable) {
                log.debug("Required property {} is missing", field);
                return ValidationResult.requiredViolation(field);
            }
            return ValidationResult.success();
        }

        Object value = data.get(field);
        if (value == null && nullable) {
            return ValidationResult.success();
        }

        for (RuleSpec spec : specs) {
            if (spec instanceof NamedRule) {
                NamedRule named = (NamedRule) spec;
                if (named.isMarker()) {
                    continue;
                }
                RulePredicate predicate = registry.resolve(named.getName());
                if (!predicate.test(value, named.getArguments())) {
                    log.debug("Property {} failed rule {} with value {}", field, named.getName(), value);
                    return ValidationResult.ruleViolation(field, named.getName());
                }
            } else if (spec instanceof PredicateRule) {
                PredicateRule custom = (PredicateRule) spec;
                if (!custom.test(value)) {
                    log.debug("Property {} failed rule {} with value {}", field, custom.getName(), value);
                    return ValidationResult.ruleViolation(field, custom.getName());
                }
            } else {
                throw new IllegalStateException("Unsupported rule type: " + spec.getClass().getName());
            }
        }

        return ValidationResult.success();
    }

    /**
     * Resolve every named rule of a rule set and check its arguments, so a
     * misconfigured rule is reported even when the data does not reach it.
     * @throws UnknownRuleException if a rule name is not registered
     * @throws IllegalArgumentException if a rule is declared with arguments it cannot use
     */
    public void checkRules(RuleSet rules) {
        for (String field : rules.getFields()) {
            for (RuleSpec spec : rules.getRules(field)) {
                if (spec instanceof NamedRule && !((NamedRule) spec).isMarker()) {
                    NamedRule named = (NamedRule) spec;
                    try {
                        registry.checkArguments(named.getName(), named.getArguments());
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid rule for property " + field + ": " + e.getMessage(), e);
                    }
                }
            }
        }
    }

    /**
     * Result of a rule validation.
     */
    public static class ValidationResult {
        private static final ValidationResult SUCCESS = new ValidationResult(true, null, null, null);

        private final boolean valid;
        private final String errorCode;
        private final String propertyName;
        private final String rule;

        private ValidationResult(boolean valid, String errorCode, String propertyName, String rule) {
            this.valid = valid;
            this.errorCode = errorCode;
            this.propertyName = propertyName;
            this.rule = rule;
        }

        public static ValidationResult success() {
            return SUCCESS;
        }

        public static ValidationResult requiredViolation(String propertyName) {
            return new ValidationResult(false, PropertyValidationException.REQUIRED_VIOLATION, propertyName, "required");
        }

        public static ValidationResult ruleViolation(String propertyName, String rule) {
            return new ValidationResult(false, PropertyValidationException.RULE_VIOLATION, propertyName, rule);
        }

        public boolean isValid() {
            return valid;
        }

        public String getErrorCode() {
            return errorCode;
        }

        public String getPropertyName() {
            return propertyName;
        }

        public String getRule() {
            return rule;
        }

        public String getErrorMessage() {
            if (valid) {
                return null;
            }
            return "[" + propertyName + "] failed validation rule [" + rule + "]";
        }

        /**
         * Convert validation failure to an exception.
         * @return A PropertyValidationException if validation failed, null otherwise
         */
        public PropertyValidationException toException() {
            if (valid) {
                return null;
            }
            return new PropertyValidationException(errorCode, propertyName, rule);
        }

        @Override
        public String toString() {
            if (valid) {
                return "ValidationResult{valid=true}";
            }
            return "ValidationResult{valid=false, errorCode='" + errorCode +
                   "', errorMessage='" + getErrorMessage() + "'}";
        }
    }
}
