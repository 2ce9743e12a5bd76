package ch.so.agi.geostream;

import java.util.Map;

/**
 * Property access of a single feature.
 */
public interface FeatureProperties {
    /**
     * Stream the properties into {@code processor} until it asks to stop.
     *
     * @return {@code true} if the processor stopped the stream early
     */
    boolean processProperties(PropertyProcessor processor) throws GeoStreamException;

    default <T> T property(String name, Class<T> javaType) throws GeoStreamException {
        PropertyLookup<T> lookup = PropertyLookup.byName(name, javaType);
        processProperties(lookup);
        return lookup.value();
    }

    default <T> T property(int index, Class<T> javaType) throws GeoStreamException {
        PropertyLookup<T> lookup = PropertyLookup.byIndex(index, javaType);
        processProperties(lookup);
        return lookup.value();
    }

    default Map<String, String> properties() throws GeoStreamException {
        PropertyCollector collector = new PropertyCollector();
        processProperties(collector);
        return collector.properties();
    }
}
