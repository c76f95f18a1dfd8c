package com.sentrius.props.model;

import java.util.function.Predicate;

public class PredicateRule implements RuleSpec {
    public static final String DEFAULT_NAME = "custom rule";

    private final String name;
    private final Predicate<Object> predicate;

    public PredicateRule(String name, Predicate<Object> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("Predicate cannot be null");
        }
        this.name = name == null ? DEFAULT_NAME : name;
        this.predicate = predicate;
    }

    public static PredicateRule of(Predicate<Object> predicate) {
        return new PredicateRule(DEFAULT_NAME, predicate);
    }

    @Override
    public String getName() {
        return name;
    }

    public boolean test(Object value) {
        return predicate.test(value);
    }

    @Override
    public String toString() {
        return "PredicateRule{name='" + name + "'}";
    }
}
