package ch.so.agi.geostream;

/**
 * Receives a dataset of features. Per feature a producer emits
 * {@code featureBegin, propertiesBegin, property*, propertiesEnd, geometryBegin, <geometry>, geometryEnd,
 * featureEnd}. {@code datasetBegin} precedes and {@code datasetEnd} follows all features of a dataset.
 */
public interface FeatureProcessor extends GeomProcessor, PropertyProcessor {
    /**
     * @param name dataset name, may be {@code null}
     */
    default void datasetBegin(String name) throws GeoStreamException {
    }

    default void datasetEnd() throws GeoStreamException {
    }

    /**
     * @param idx positional row index within the dataset
     */
    default void featureBegin(long idx) throws GeoStreamException {
    }

    default void featureEnd(long idx) throws GeoStreamException {
    }

    default void propertiesBegin() throws GeoStreamException {
    }

    default void propertiesEnd() throws GeoStreamException {
    }

    default void geometryBegin() throws GeoStreamException {
    }

    default void geometryEnd() throws GeoStreamException {
    }
}
