package ch.so.agi.geostream;

/**
 * A dimension promised by {@link GeomProcessor#dimensions()} is missing from the delivered coordinate.
 */
public class CoordinateAccessException extends GeoStreamException {
    public CoordinateAccessException(String message) {
        super(message);
    }
}
