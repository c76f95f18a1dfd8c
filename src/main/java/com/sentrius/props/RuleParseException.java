package com.sentrius.props;

/**
 * Thrown when a rule notation such as {@code in:a,b} cannot be parsed.
 */
public class RuleParseException extends Exception {
    private final String notation;

    public RuleParseException(String notation, String message, Throwable cause) {
        super(message, cause);
        this.notation = notation;
    }

    public String getNotation() {
        return notation;
    }
}
