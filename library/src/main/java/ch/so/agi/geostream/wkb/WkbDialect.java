package ch.so.agi.geostream.wkb;

import ch.so.agi.geostream.GeometryFormatException;
import java.nio.ByteOrder;

/**
 * Byte layout variants of well-known binary. Each constant carries the layout rules the shared reader and writer
 * branch on; coordinate and recursion handling is the same for all of them.
 */
public enum WkbDialect {
    /** OGC WKB with ISO type codes. */
    WKB(TypeCodes.ISO, Preamble.NONE, false, false),
    /** PostGIS extended WKB with Z/M/SRID flag bits. */
    EWKB(TypeCodes.EXTENDED, Preamble.NONE, false, false),
    /** GeoPackage binary: {@code GP} header with SRS id and optional envelope in front of ISO WKB. */
    GEOPACKAGE(TypeCodes.ISO, Preamble.GEOPACKAGE, false, false),
    /** SpatiaLite blob geometry with MBR header, entity markers and end marker. */
    SPATIALITE(TypeCodes.ISO, Preamble.SPATIALITE, true, false),
    /** MySQL internal format: little-endian SRID prefix in front of two-dimensional OGC WKB. */
    MYSQL(TypeCodes.ISO, Preamble.MYSQL, false, true);

    static final int EWKB_Z_FLAG = 0x80000000;
    static final int EWKB_M_FLAG = 0x40000000;
    static final int EWKB_SRID_FLAG = 0x20000000;
    static final int SPATIALITE_COMPRESSED_OFFSET = 1_000_000;
    static final byte SPATIALITE_START = 0x00;
    static final byte SPATIALITE_MBR_END = 0x7C;
    static final byte SPATIALITE_ENTITY = 0x69;
    static final byte SPATIALITE_END = (byte) 0xFE;
    static final byte SPATIALITE_TINY_POINT = (byte) 0x80;
    static final byte GEOPACKAGE_EMPTY = 0x10;
    static final byte GEOPACKAGE_EXTENDED = 0x20;

    enum TypeCodes {
        ISO,
        EXTENDED
    }

    enum Preamble {
        NONE,
        GEOPACKAGE,
        SPATIALITE,
        MYSQL
    }

    private final TypeCodes typeCodes;
    private final Preamble preamble;
    private final boolean entityMarker;
    private final boolean restricted;

    WkbDialect(TypeCodes typeCodes, Preamble preamble, boolean entityMarker, boolean restricted) {
        this.typeCodes = typeCodes;
        this.preamble = preamble;
        this.entityMarker = entityMarker;
        this.restricted = restricted;
    }

    Preamble preamble() {
        return preamble;
    }

    /**
     * Whether nested members start with the SpatiaLite entity marker instead of a byte order byte.
     */
    boolean entityMarker() {
        return entityMarker;
    }

    /**
     * Whether only two-dimensional, little-endian bodies are valid.
     */
    public boolean xyOnly() {
        return restricted;
    }

    public boolean littleEndianOnly() {
        return restricted;
    }

    /**
     * Whether the SRID is written right after the top-level type code.
     */
    boolean sridAfterTypeCode() {
        return typeCodes == TypeCodes.EXTENDED;
    }

    int typeCode(WkbGeometryType type, boolean z, boolean m, boolean withSrid) {
        int code = type.code();
        if (typeCodes == TypeCodes.EXTENDED) {
            if (z) {
                code |= EWKB_Z_FLAG;
            }
            if (m) {
                code |= EWKB_M_FLAG;
            }
            if (withSrid) {
                code |= EWKB_SRID_FLAG;
            }
            return code;
        }
        if (z) {
            code += 1000;
        }
        if (m) {
            code += 2000;
        }
        return code;
    }

    /**
     * Decodes a type code. ISO dimension offsets and EWKB flag bits are both accepted; the SRID flag only where the
     * dialect places an SRID after the type code.
     */
    WkbHeader decodeTypeCode(int rawCode, ByteOrder byteOrder) throws GeometryFormatException {
        boolean z = (rawCode & EWKB_Z_FLAG) != 0;
        boolean m = (rawCode & EWKB_M_FLAG) != 0;
        boolean srid = (rawCode & EWKB_SRID_FLAG) != 0;
        if (srid && !sridAfterTypeCode()) {
            throw new GeometryFormatException("SRID flag is not valid in " + this + " type code: "
                    + Integer.toHexString(rawCode));
        }
        int code = rawCode & 0x0FFFFFFF;
        boolean compressed = false;
        if (preamble == Preamble.SPATIALITE && code > SPATIALITE_COMPRESSED_OFFSET) {
            compressed = true;
            code -= SPATIALITE_COMPRESSED_OFFSET;
        }
        int dimensions = code / 1000;
        if (dimensions > 3) {
            throw new GeometryFormatException("Unsupported WKB geometry type code: " + rawCode);
        }
        z |= dimensions == 1 || dimensions == 3;
        m |= dimensions == 2 || dimensions == 3;
        WkbGeometryType type = WkbGeometryType.fromCode(code % 1000);
        return new WkbHeader(type, z, m, srid, compressed, byteOrder);
    }
}
