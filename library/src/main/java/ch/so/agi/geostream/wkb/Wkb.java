package ch.so.agi.geostream.wkb;

import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;
import ch.so.agi.geostream.GeometrySource;
import java.io.ByteArrayOutputStream;
import java.io.OutputStream;

/**
 * Entry points of the WKB codec.
 */
public final class Wkb {

    private Wkb() {
    }

    /**
     * Drives {@code processor} with the geometry encoded in {@code wkb}.
     *
     * @return the reader, for access to the SRID and envelope of the geometry
     */
    public static WkbReader decode(byte[] wkb, WkbDialect dialect, GeomProcessor processor)
            throws GeoStreamException {
        WkbReader reader = new WkbReader(dialect);
        reader.process(wkb, processor);
        return reader;
    }

    public static byte[] encode(GeometrySource source, WkbDialect dialect, WkbWriteOptions options)
            throws GeoStreamException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        source.process(writer(out, dialect, options));
        return out.toByteArray();
    }

    public static byte[] encode(GeometrySource source, WkbDialect dialect) throws GeoStreamException {
        return encode(source, dialect, WkbWriteOptions.defaults());
    }

    public static WkbWriter writer(OutputStream out, WkbDialect dialect, WkbWriteOptions options) {
        return new WkbWriter(out, dialect, options);
    }

    /**
     * A source replaying the geometry encoded in {@code wkb}.
     */
    public static GeometrySource source(byte[] wkb, WkbDialect dialect) {
        return processor -> new WkbReader(dialect).process(wkb, processor);
    }
}
