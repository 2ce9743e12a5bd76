package ch.so.agi.geostream;

/**
 * Receives the property values of a feature.
 */
public interface PropertyProcessor {
    /**
     * Process a property value. The value is only valid for the duration of the call.
     *
     * @return {@code true} to stop receiving further properties of the current feature. The default implementation
     *         needs nothing and returns {@code true}; consumers that collect values override it to return
     *         {@code false}.
     */
    default boolean property(int idx, String name, ColumnValue value) throws GeoStreamException {
        return true;
    }
}
