package ch.so.agi.geostream;

/**
 * The byte sink or the record source underneath a processor failed.
 */
public class GeoStreamIoException extends GeoStreamException {
    public GeoStreamIoException(String message, Throwable cause) {
        super(message, cause);
    }

    public GeoStreamIoException(String message) {
        super(message);
    }
}
