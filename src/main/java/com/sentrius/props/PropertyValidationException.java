package com.sentrius.props;

/**
 * A property failed validation while filling a container.
 */
public class PropertyValidationException extends IllegalArgumentException {
    public static final String REQUIRED_VIOLATION = "REQUIRED_VIOLATION";
    public static final String RULE_VIOLATION = "RULE_VIOLATION";

    private final String errorCode;
    private final String propertyName;
    private final String rule;

    public PropertyValidationException(String errorCode, String propertyName, String rule) {
        super("[" + propertyName + "] failed validation rule [" + rule + "]");
        this.errorCode = errorCode;
        this.propertyName = propertyName;
        this.rule = rule;
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

    public boolean isRequiredViolation() {
        return REQUIRED_VIOLATION.equals(errorCode);
    }
}
