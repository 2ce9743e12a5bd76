package ch.so.agi.geostream;

/**
 * Root of all faults raised while producing or consuming a geometry stream. Any processor method may throw it;
 * the producer stops its traversal and lets the same instance reach the caller.
 */
public class GeoStreamException extends Exception {
    public GeoStreamException(String message) {
        super(message);
    }

    public GeoStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
