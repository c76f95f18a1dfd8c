package com.sentrius.props;

/**
 * Name transformations shared by rule lookup and accessor resolution.
 */
public final class NamingUtil {
    private static final String ACCESSOR_PREFIX = "get";

    private NamingUtil() {
    }

    /**
     * Convert a snake, kebab or camel cased name to PascalCase.
     * {@code date_format}, {@code date-format}, {@code dateFormat} and
     * {@code DateFormat} all become {@code DateFormat}.
     * @param name The name to convert
     * @return The PascalCase name, or the input if it is null or empty
     */
    public static String toPascal(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }

        StringBuilder result = new StringBuilder(name.length());
        boolean upperNext = true;

        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_' || c == '-' || Character.isWhitespace(c)) {
                upperNext = true;
                continue;
            }
            if (upperNext) {
                result.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                result.append(c);
            }
        }

        return result.toString();
    }

    /**
     * The accessor method name for a property, e.g. {@code some_mutator} -> {@code getSomeMutator}.
     */
    public static String accessorName(String property) {
        return ACCESSOR_PREFIX + toPascal(property);
    }
}
