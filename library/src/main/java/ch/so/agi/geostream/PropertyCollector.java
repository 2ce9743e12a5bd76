package ch.so.agi.geostream;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects every property of a feature as text, in delivery order. Never stops early: {@link #property} returns
 * {@code false}.
 */
public class PropertyCollector implements PropertyProcessor {
    private final Map<String, String> properties = new LinkedHashMap<>();

    @Override
    public boolean property(int idx, String name, ColumnValue value) {
        properties.put(name, value.toString());
        return false;
    }

    public Map<String, String> properties() {
        return properties;
    }
}
