package com.sentrius.props;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Answers property reads. The first match wins:
 * <ol>
 *   <li>a computed accessor declared by the container type,</li>
 *   <li>a macro named like the accessor ({@code get} + PascalCase name),</li>
 *   <li>null if the property is not stored,</li>
 *   <li>the stored value parsed as a date, for declared date properties,</li>
 *   <li>the stored value.</li>
 * </ol>
 * Reads never modify the container.
 */
public class AccessorResolver {
    private static final Logger log = LoggerFactory.getLogger(AccessorResolver.class);

    private final MacroRegistry macros;
    private final DateParser dateParser;

    public AccessorResolver(MacroRegistry macros, DateParser dateParser) {
        this.macros = macros;
        this.dateParser = dateParser;
    }

    public Object resolve(PropertyContainer container, String property) {
        String method = NamingUtil.accessorName(property);

        Supplier<?> accessor = findAccessor(container, method);
        if (accessor != null) {
            log.trace("Resolved {} through computed accessor {}", property, method);
            return accessor.get();
        }

        if (macros.has(method)) {
            log.trace("Resolved {} through macro {}", property, method);
            return macros.invoke(container, method);
        }

        if (container.doesNotHave(property)) {
            return null;
        }

        Object raw = container.getRaw(property);
        if (container.dateProperties().contains(property)) {
            return dateParser.parse(raw);
        }

        return raw;
    }

    /**
     * Find the computed accessor whose {@code get} + PascalCase name equals the given method name.
     * @return The accessor, or null if the container type declares none
     */
    public Supplier<?> findAccessor(PropertyContainer container, String method) {
        for (Map.Entry<String, Supplier<?>> entry : container.accessors().entrySet()) {
            if (NamingUtil.accessorName(entry.getKey()).equals(method)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
