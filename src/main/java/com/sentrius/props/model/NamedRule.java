package com.sentrius.props.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rule resolved by name through the rule registry, e.g. {@code in:a,b,c}.
 * The reserved names {@code required} and {@code nullable} are markers that
 * only affect whether a field is validated.
 */
public class NamedRule implements RuleSpec {
    public static final String REQUIRED = "Required";
    public static final String NULLABLE = "Nullable";

    private final String name;
    private final String normalizedName;
    private final List<String> arguments;

    public NamedRule(String name, String normalizedName, List<String> arguments) {
        this.name = name;
        this.normalizedName = normalizedName;
        this.arguments = new ArrayList<>(arguments);
    }

    @Override
    public String getName() {
        return name;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public List<String> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public boolean isRequired() {
        return REQUIRED.equals(normalizedName);
    }

    public boolean isNullable() {
        return NULLABLE.equals(normalizedName);
    }

    public boolean isMarker() {
        return isRequired() || isNullable();
    }

    @Override
    public String toString() {
        return "NamedRule{name='" + name + "', arguments=" + arguments + "}";
    }
}
