package ch.so.agi.geostream;

/**
 * A dataset whose features are pushed, in record order, into a {@link FeatureProcessor}.
 */
public interface FeatureSource {
    void process(FeatureProcessor processor) throws GeoStreamException;
}
