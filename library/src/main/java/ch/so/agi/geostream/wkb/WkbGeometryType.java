package ch.so.agi.geostream.wkb;

import ch.so.agi.geostream.GeometryFormatException;

/**
 * OGC simple feature geometry types with their base WKB type codes. The abstract types Curve (13) and Surface (14)
 * never appear in an encoded geometry and are not listed.
 */
public enum WkbGeometryType {
    POINT(1),
    LINE_STRING(2),
    POLYGON(3),
    MULTI_POINT(4),
    MULTI_LINE_STRING(5),
    MULTI_POLYGON(6),
    GEOMETRY_COLLECTION(7),
    CIRCULAR_STRING(8),
    COMPOUND_CURVE(9),
    CURVE_POLYGON(10),
    MULTI_CURVE(11),
    MULTI_SURFACE(12),
    POLYHEDRAL_SURFACE(15),
    TIN(16),
    TRIANGLE(17);

    private final int code;

    WkbGeometryType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static WkbGeometryType fromCode(int code) throws GeometryFormatException {
        return switch (code) {
            case 1 -> POINT;
            case 2 -> LINE_STRING;
            case 3 -> POLYGON;
            case 4 -> MULTI_POINT;
            case 5 -> MULTI_LINE_STRING;
            case 6 -> MULTI_POLYGON;
            case 7 -> GEOMETRY_COLLECTION;
            case 8 -> CIRCULAR_STRING;
            case 9 -> COMPOUND_CURVE;
            case 10 -> CURVE_POLYGON;
            case 11 -> MULTI_CURVE;
            case 12 -> MULTI_SURFACE;
            case 15 -> POLYHEDRAL_SURFACE;
            case 16 -> TIN;
            case 17 -> TRIANGLE;
            default -> throw new GeometryFormatException("Unsupported WKB geometry type code: " + code);
        };
    }
}
