package com.sentrius.props.profiles;

import com.sentrius.props.DateParser;
import com.sentrius.props.RuleRegistry;
import com.sentrius.props.Values;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The built-in validation rules.
 */
public class StandardRuleProfile {

    private static final List<String> RULES = List.of(
        "Numeric", "Int", "NotNull", "NotEmpty", "Date", "DateFormat", "String", "Email",
        "In", "GreaterThan", "GreaterThanEqual", "LessThan", "LessThanEqual", "Uuid"
    );

    private static final Pattern EMAIL = Pattern.compile(
        "[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+(\\.[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]+)*"
            + "@([A-Za-z0-9]([A-Za-z0-9-]{0,61}[A-Za-z0-9])?\\.)+[A-Za-z0-9]([A-Za-z0-9-]{0,61}[A-Za-z0-9])?");

    private static final Pattern UUID = Pattern.compile(
        "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    /**
     * Return a RuleRegistry pre-populated with the built-in rules, parsing dates in UTC.
     */
    public static RuleRegistry createRegistry() {
        return createRegistry(new DateParser());
    }

    /**
     * Return a RuleRegistry pre-populated with the built-in rules.
     * @param dateParser Used by the {@code date} and {@code dateFormat} rules
     */
    public static RuleRegistry createRegistry(DateParser dateParser) {
        RuleRegistry registry = new RuleRegistry();
        register(registry, dateParser);
        return registry;
    }

    /**
     * Install the built-in rules into an existing registry.
     */
    public static void register(RuleRegistry registry, DateParser dateParser) {
        registry.register("numeric", (value, args) -> Values.isNumeric(value));

        registry.register("int", (value, args) -> Values.isIntegral(value));

        registry.register("notNull", (value, args) -> value != null);

        registry.register("notEmpty", (value, args) -> value != null && !"".equals(value));

        registry.register("date", (value, args) -> dateParser.isParseable(value));

        registry.register("dateFormat", (value, args) ->
            dateParser.matchesFormat(value, requireArgument("dateFormat", args)),
            args -> DateParser.translateFormat(requireArgument("dateFormat", args)));

        registry.register("string", (value, args) -> value instanceof String);

        registry.register("email", (value, args) ->
            value instanceof String && EMAIL.matcher((String) value).matches());

        registry.register("in", (value, args) -> {
            for (String allowed : args) {
                if (Values.looseEquals(value, allowed)) {
                    return true;
                }
            }
            return false;
        });

        registry.register("greaterThan", (value, args) -> {
            Integer comparison = Values.compareNumbers(value, requireArgument("greaterThan", args));
            return comparison != null && comparison > 0;
        }, args -> requireArgument("greaterThan", args));

        registry.register("greaterThanEqual", (value, args) -> {
            Integer comparison = Values.compareNumbers(value, requireArgument("greaterThanEqual", args));
            return comparison != null && comparison >= 0;
        }, args -> requireArgument("greaterThanEqual", args));

        registry.register("lessThan", (value, args) -> {
            Integer comparison = Values.compareNumbers(value, requireArgument("lessThan", args));
            return comparison != null && comparison < 0;
        }, args -> requireArgument("lessThan", args));

        registry.register("lessThanEqual", (value, args) -> {
            Integer comparison = Values.compareNumbers(value, requireArgument("lessThanEqual", args));
            return comparison != null && comparison <= 0;
        }, args -> requireArgument("lessThanEqual", args));

        registry.register("uuid", (value, args) ->
            value instanceof String && UUID.matcher((String) value).matches());
    }

    /**
     * Get the normalized names of the built-in rules.
     */
    public static List<String> getRuleNames() {
        return RULES;
    }

    private static String requireArgument(String rule, List<String> args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException("Rule '" + rule + "' requires an argument");
        }
        return args.get(0);
    }
}
