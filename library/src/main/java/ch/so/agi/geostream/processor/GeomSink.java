package ch.so.agi.geostream.processor;

import ch.so.agi.geostream.ColumnValue;
import ch.so.agi.geostream.FeatureProcessor;

/**
 * Discards every event. {@link #property} returns {@code true}, a sink never needs further properties.
 */
public final class GeomSink implements FeatureProcessor {
    @Override
    public boolean property(int idx, String name, ColumnValue value) {
        return true;
    }
}
