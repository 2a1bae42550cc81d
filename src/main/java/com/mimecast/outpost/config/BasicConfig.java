package com.mimecast.outpost.config;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Basic configuration container.
 *
 * <p>Wraps a configuration sub map for typed access.
 */
public class BasicConfig extends ConfigFoundation {

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets a nested configuration section.
     *
     * @param name Property name.
     * @return BasicConfig instance, empty if missing.
     */
    public BasicConfig getSection(String name) {
        return new BasicConfig(getMapProperty(name));
    }

    /**
     * Gets the keys of this section in insertion order.
     *
     * @return Set of keys.
     */
    public Set<String> getKeys() {
        return new LinkedHashSet<>(map.keySet());
    }
}
