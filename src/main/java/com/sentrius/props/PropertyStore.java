package com.sentrius.props;

import java.util.Map;

/**
 * Storage for the properties of one container. No validation happens here.
 */
public interface PropertyStore {
    /**
     * Get the stored value of a property.
     * @param name The property name
     * @return The stored value, or null if not stored
     */
    Object get(String name);

    /**
     * Check if a property holds a non-null value.
     * @param name The property name
     * @return true if the property is stored and not null
     */
    boolean has(String name);

    /**
     * Create or overwrite a property.
     * @param name The property name
     * @param value The value to store, possibly null
     */
    void set(String name, Object value);

    /**
     * Remove a property. Removing an absent property does nothing.
     * @param name The property name
     */
    void forget(String name);

    /**
     * Get all stored properties as a map.
     * @return A copy of the stored properties
     */
    Map<String, Object> asMap();
}
