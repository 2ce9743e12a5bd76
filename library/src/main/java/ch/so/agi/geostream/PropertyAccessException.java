package ch.so.agi.geostream;

public class PropertyAccessException extends GeoStreamException {
    public PropertyAccessException(String message) {
        super(message);
    }

    public PropertyAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
