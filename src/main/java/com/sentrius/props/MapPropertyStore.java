package com.sentrius.props;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A simple Map-based implementation of PropertyStore.
 */
public class MapPropertyStore implements PropertyStore {
    private final Map<String, Object> data;

    public MapPropertyStore() {
        this.data = new LinkedHashMap<>();
    }

    public MapPropertyStore(Map<String, ?> data) {
        this.data = new LinkedHashMap<>(data);
    }

    @Override
    public Object get(String name) {
        if (name == null) {
            return null;
        }
        return data.get(name);
    }

    @Override
    public boolean has(String name) {
        return get(name) != null;
    }

    @Override
    public void set(String name, Object value) {
        if (name == null) {
            throw new IllegalArgumentException("Property name cannot be null");
        }
        data.put(name, value);
    }

    @Override
    public void forget(String name) {
        if (name != null) {
            data.remove(name);
        }
    }

    @Override
    public Map<String, Object> asMap() {
        return new LinkedHashMap<>(data);
    }
}
