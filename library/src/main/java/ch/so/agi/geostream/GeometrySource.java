package ch.so.agi.geostream;

/**
 * A single geometry that can be streamed into a {@link GeomProcessor}.
 */
@FunctionalInterface
public interface GeometrySource {
    void process(GeomProcessor processor) throws GeoStreamException;
}
