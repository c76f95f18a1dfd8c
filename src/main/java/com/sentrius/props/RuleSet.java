package com.sentrius.props;

import com.sentrius.props.model.NamedRule;
import com.sentrius.props.model.PredicateRule;
import com.sentrius.props.model.RuleSpec;

import java.util.*;
import java.util.function.Predicate;

/**
 * The validation rules of a container type, keyed by field name.
 * Rule notations are parsed when the set is built, not when it is evaluated.
 */
public class RuleSet {
    private static final RuleSet EMPTY = new Builder().build();

    private final Map<String, List<RuleSpec>> rules;

    private RuleSet(Builder builder) {
        Map<String, List<RuleSpec>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<RuleSpec>> entry : builder.rules.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.rules = Collections.unmodifiableMap(copy);
    }

    public static RuleSet empty() {
        return EMPTY;
    }

    /**
     * @return The declared field names, in declaration order
     */
    public Set<String> getFields() {
        return rules.keySet();
    }

    /**
     * @return The rules of a field, or an empty list if the field is not declared
     */
    public List<RuleSpec> getRules(String field) {
        List<RuleSpec> fieldRules = rules.get(field);
        return fieldRules == null ? Collections.emptyList() : fieldRules;
    }

    public boolean isRequired(String field) {
        for (RuleSpec spec : getRules(field)) {
            if (spec instanceof NamedRule && ((NamedRule) spec).isRequired()) {
                return true;
            }
        }
        return false;
    }

    public boolean isNullable(String field) {
        for (RuleSpec spec : getRules(field)) {
            if (spec instanceof NamedRule && ((NamedRule) spec).isNullable()) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public int size() {
        return rules.size();
    }

    /**
     * Builder for RuleSet.
     */
    public static class Builder {
        private final Map<String, List<RuleSpec>> rules = new LinkedHashMap<>();

        /**
         * Declare the rules of a field. Each spec is a rule notation string
         * ({@code "required"}, {@code "in:a,b,c"}), a {@link RuleSpec}, or a
         * {@link Predicate} over the candidate value.
         * @throws IllegalArgumentException if a notation cannot be parsed or a spec has an unsupported type
         */
        @SuppressWarnings("unchecked")
        public Builder field(String field, Object... specs) {
            if (field == null) {
                throw new IllegalArgumentException("Field name cannot be null");
            }

            List<RuleSpec> fieldRules = rules.computeIfAbsent(field, k -> new ArrayList<>());
            for (Object spec : specs) {
                if (spec instanceof String) {
                    fieldRules.add(parse((String) spec));
                } else if (spec instanceof RuleSpec) {
                    fieldRules.add((RuleSpec) spec);
                } else if (spec instanceof Predicate) {
                    fieldRules.add(PredicateRule.of((Predicate<Object>) spec));
                } else {
                    throw new IllegalArgumentException("Unsupported rule for field '" + field + "': " + spec);
                }
            }
            return this;
        }

        public RuleSet build() {
            return new RuleSet(this);
        }

        private static NamedRule parse(String notation) {
            try {
                return RuleSpecParser.parse(notation);
            } catch (RuleParseException e) {
                throw new IllegalArgumentException(e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "RuleSet{fields=" + rules.keySet() + "}";
    }
}
