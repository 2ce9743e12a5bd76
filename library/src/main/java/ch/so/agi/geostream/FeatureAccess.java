package ch.so.agi.geostream;

/**
 * A feature offering both its properties and its geometry.
 */
public interface FeatureAccess extends FeatureProperties, GeometrySource {
    /**
     * Emit the complete event bracket of this feature. Property delivery stops when the processor asks for it, the
     * remaining brackets are emitted regardless.
     */
    default void process(FeatureProcessor processor, long idx) throws GeoStreamException {
        processor.featureBegin(idx);
        processor.propertiesBegin();
        processProperties(processor);
        processor.propertiesEnd();
        processor.geometryBegin();
        process(processor);
        processor.geometryEnd();
        processor.featureEnd(idx);
    }
}
