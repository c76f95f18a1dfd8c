package com.sentrius.props;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Methods registered at runtime and callable on any container, whatever its type.
 * <p>
 * {@link #global()} is the process-wide registry used by containers built with
 * the default environment. It lives until the JVM exits; entries are never
 * removed. Concurrent registrations must be serialized by the caller.
 */
public class MacroRegistry {
    private static final Logger log = LoggerFactory.getLogger(MacroRegistry.class);

    private static final MacroRegistry GLOBAL = new MacroRegistry();

    private final Map<String, Macro> macros = new ConcurrentHashMap<>();

    public static MacroRegistry global() {
        return GLOBAL;
    }

    /**
     * Register a macro. Registering the same name again replaces the previous macro.
     * @param name The method name
     * @param macro The method body
     */
    public void register(String name, Macro macro) {
        if (name == null || macro == null) {
            throw new IllegalArgumentException("Macro name and body cannot be null");
        }
        if (macros.put(name, macro) != null) {
            log.warn("Replaced macro {}", name);
        } else {
            log.debug("Registered macro {}", name);
        }
    }

    public boolean has(String name) {
        return name != null && macros.containsKey(name);
    }

    /**
     * Invoke a macro with the container as its first argument.
     * @throws UnknownMethodException if no macro is registered under the name
     */
    public Object invoke(PropertyContainer container, String name, Object... arguments) {
        Macro macro = name == null ? null : macros.get(name);
        if (macro == null) {
            throw new UnknownMethodException(name, container.getClass().getSimpleName());
        }
        return macro.invoke(container, arguments);
    }

    public Set<String> getRegisteredMacros() {
        return new HashSet<>(macros.keySet());
    }

    public int size() {
        return macros.size();
    }
}
