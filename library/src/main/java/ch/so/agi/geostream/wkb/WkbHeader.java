package ch.so.agi.geostream.wkb;

import java.nio.ByteOrder;

/**
 * Decoded type code of one encoded shape. Nested SpatiaLite entities inherit the dimensions of their parent.
 */
record WkbHeader(WkbGeometryType type, boolean z, boolean m, boolean srid, boolean compressed, ByteOrder byteOrder) {

    WkbHeader withDimensionsOf(WkbHeader parent) {
        return new WkbHeader(type, parent.z, parent.m, srid, compressed, byteOrder);
    }

    int coordinateBytes() {
        return (2 + (z ? 1 : 0) + (m ? 1 : 0)) * Double.BYTES;
    }

    /**
     * Size of a coordinate stored as float deltas in a compressed SpatiaLite geometry. M stays a double.
     */
    int compressedCoordinateBytes() {
        return (2 + (z ? 1 : 0)) * Float.BYTES + (m ? Double.BYTES : 0);
    }
}
