package ch.so.agi.geostream;

public class GeometryProcessingException extends GeoStreamException {
    public GeometryProcessingException(String message) {
        super("processing geometry `" + message + "`");
    }

    public GeometryProcessingException(String message, Throwable cause) {
        super("processing geometry `" + message + "`", cause);
    }
}
