package ch.so.agi.geostream;

/**
 * Malformed or unsupported binary layout: bad markers, unknown type codes, inconsistent counts, truncated input.
 */
public class GeometryFormatException extends GeoStreamException {
    public GeometryFormatException(String message) {
        super(message);
    }

    public GeometryFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
