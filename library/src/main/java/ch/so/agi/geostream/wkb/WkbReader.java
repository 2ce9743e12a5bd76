package ch.so.agi.geostream.wkb;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;
import ch.so.agi.geostream.GeometryFormatException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Decodes WKB of one dialect into geometry events.
 *
 * <p>SRID and envelope are header metadata and are not delivered as events; they describe the geometry of the
 * last {@code process} call. Faults of the processor propagate unchanged and stop decoding.
 */
public class WkbReader {
    private static final double[] NO_ENVELOPE = new double[0];
    private static final int NESTED_HEADER_BYTES = 1 + Integer.BYTES;
    private static final int RING_BYTES = Integer.BYTES;

    private final WkbDialect dialect;
    private Integer srid;
    private double[] envelope = NO_ENVELOPE;

    public WkbReader(WkbDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    public WkbDialect dialect() {
        return dialect;
    }

    /**
     * SRID of the last geometry. A stored 0 counts as no SRID in the dialects with a fixed SRID field.
     */
    public OptionalInt srid() {
        return srid == null ? OptionalInt.empty() : OptionalInt.of(srid);
    }

    /**
     * Envelope stored in the header of the last geometry, in the order of the dialect: GeoPackage
     * {@code [minx, maxx, miny, maxy, ...]}, SpatiaLite {@code [minx, miny, maxx, maxy]}. Empty if there is none.
     */
    public double[] envelope() {
        return envelope.clone();
    }

    public void process(byte[] wkb, GeomProcessor processor) throws GeoStreamException {
        process(ByteBuffer.wrap(wkb), processor);
    }

    /**
     * Decodes one geometry starting at the position of {@code wkb} and advances the position past it. The byte order
     * of {@code wkb} is left unchanged.
     */
    public void process(ByteBuffer wkb, GeomProcessor processor) throws GeoStreamException {
        ByteBuffer buffer = wkb.duplicate();
        srid = null;
        envelope = NO_ENVELOPE;
        try {
            switch (dialect.preamble()) {
                case NONE -> readGeometry(buffer, readHeader(buffer, true), 0, processor);
                case GEOPACKAGE -> readGeoPackage(buffer, processor);
                case SPATIALITE -> readSpatiaLite(buffer, processor);
                case MYSQL -> readMySql(buffer, processor);
            }
        } catch (BufferUnderflowException e) {
            throw new GeometryFormatException("Truncated " + dialect + " geometry at byte " + buffer.position(), e);
        }
        wkb.position(buffer.position());
    }

    private void readGeoPackage(ByteBuffer buffer, GeomProcessor processor) throws GeoStreamException {
        if (buffer.get() != 'G' || buffer.get() != 'P') {
            throw new GeometryFormatException("Invalid GeoPackage geometry blob magic bytes");
        }
        buffer.get(); // version
        int flags = buffer.get() & 0xFF;
        if ((flags & WkbDialect.GEOPACKAGE_EXTENDED) != 0) {
            throw new GeometryFormatException("Extended GeoPackage geometries are not supported");
        }
        int envelopeIndicator = (flags >> 1) & 0x07;
        int envelopeValues = switch (envelopeIndicator) {
            case 0 -> 0;
            case 1 -> 4;
            case 2, 3 -> 6;
            case 4 -> 8;
            default -> throw new GeometryFormatException("Unsupported GeoPackage envelope indicator: "
                    + envelopeIndicator);
        };
        buffer.order((flags & 0x01) != 0 ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN);
        srid = sridOrNull(buffer.getInt());
        envelope = readDoubles(buffer, envelopeValues);
        readGeometry(buffer, readHeader(buffer, true), 0, processor);
    }

    private void readSpatiaLite(ByteBuffer buffer, GeomProcessor processor) throws GeoStreamException {
        if (buffer.get() != WkbDialect.SPATIALITE_START) {
            throw new GeometryFormatException("Invalid SpatiaLite geometry start marker");
        }
        byte flags = buffer.get();
        ByteOrder byteOrder = (flags & 0x01) != 0 ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
        buffer.order(byteOrder);
        srid = sridOrNull(buffer.getInt());
        if ((flags & WkbDialect.SPATIALITE_TINY_POINT) != 0) {
            byte kind = buffer.get();
            WkbHeader header = switch (kind) {
                case 1 -> new WkbHeader(WkbGeometryType.POINT, false, false, false, false, byteOrder);
                case 2 -> new WkbHeader(WkbGeometryType.POINT, true, false, false, false, byteOrder);
                case 3 -> new WkbHeader(WkbGeometryType.POINT, false, true, false, false, byteOrder);
                case 4 -> new WkbHeader(WkbGeometryType.POINT, true, true, false, false, byteOrder);
                default -> throw new GeometryFormatException("Unsupported SpatiaLite TinyPoint type: " + kind);
            };
            readPoint(buffer, header, 0, processor);
        } else {
            envelope = readDoubles(buffer, 4);
            if (buffer.get() != WkbDialect.SPATIALITE_MBR_END) {
                throw new GeometryFormatException("Invalid SpatiaLite MBR end marker");
            }
            readGeometry(buffer, dialect.decodeTypeCode(buffer.getInt(), byteOrder), 0, processor);
        }
        if (buffer.get() != WkbDialect.SPATIALITE_END) {
            throw new GeometryFormatException("Invalid SpatiaLite geometry end marker");
        }
        if (buffer.hasRemaining()) {
            throw new GeometryFormatException(buffer.remaining() + " trailing bytes after SpatiaLite end marker");
        }
    }

    private void readMySql(ByteBuffer buffer, GeomProcessor processor) throws GeoStreamException {
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        int value = buffer.getInt();
        if (value < 0) {
            throw new GeometryFormatException("Invalid MySQL SRID: " + Integer.toUnsignedString(value));
        }
        srid = sridOrNull(value);
        WkbHeader header = readHeader(buffer, true);
        if (header.byteOrder() != ByteOrder.LITTLE_ENDIAN) {
            throw new GeometryFormatException("MySQL geometries must be little-endian");
        }
        if (header.z() || header.m()) {
            throw new GeometryFormatException("MySQL geometries must be two-dimensional");
        }
        readGeometry(buffer, header, 0, processor);
    }

    private WkbHeader readHeader(ByteBuffer buffer, boolean topLevel) throws GeometryFormatException {
        byte order = buffer.get();
        ByteOrder byteOrder = switch (order) {
            case 0 -> ByteOrder.BIG_ENDIAN;
            case 1 -> ByteOrder.LITTLE_ENDIAN;
            default -> throw new GeometryFormatException("Invalid WKB byte order: " + order);
        };
        buffer.order(byteOrder);
        WkbHeader header = dialect.decodeTypeCode(buffer.getInt(), byteOrder);
        if (header.srid()) {
            int value = buffer.getInt();
            if (topLevel) {
                srid = value;
            }
        }
        return header;
    }

    private WkbHeader readNestedHeader(ByteBuffer buffer, WkbHeader parent) throws GeometryFormatException {
        if (!dialect.entityMarker()) {
            return readHeader(buffer, false);
        }
        if (buffer.get() != WkbDialect.SPATIALITE_ENTITY) {
            throw new GeometryFormatException("Invalid SpatiaLite entity marker");
        }
        buffer.order(parent.byteOrder());
        return dialect.decodeTypeCode(buffer.getInt(), parent.byteOrder()).withDimensionsOf(parent);
    }

    private void readGeometry(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        switch (header.type()) {
            case POINT -> readPoint(buffer, header, idx, processor);
            case LINE_STRING -> readLineString(buffer, header, true, idx, processor);
            case POLYGON -> readPolygon(buffer, header, true, idx, processor);
            case TRIANGLE -> readTriangle(buffer, header, true, idx, processor);
            case MULTI_POINT -> readMultiPoint(buffer, header, idx, processor);
            case MULTI_LINE_STRING -> readMultiLineString(buffer, header, idx, processor);
            case MULTI_POLYGON -> readMultiPolygon(buffer, header, idx, processor);
            case GEOMETRY_COLLECTION -> readGeometryCollection(buffer, header, idx, processor);
            case CIRCULAR_STRING -> readCircularString(buffer, header, idx, processor);
            case COMPOUND_CURVE -> readCompoundCurve(buffer, header, idx, processor);
            case CURVE_POLYGON -> readCurvePolygon(buffer, header, idx, processor);
            case MULTI_CURVE -> readMultiCurve(buffer, header, idx, processor);
            case MULTI_SURFACE -> readMultiSurface(buffer, header, idx, processor);
            case POLYHEDRAL_SURFACE -> readPolyhedralSurface(buffer, header, idx, processor);
            case TIN -> readTin(buffer, header, idx, processor);
        }
    }

    private void readPoint(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        double x = buffer.getDouble();
        double y = buffer.getDouble();
        double z = header.z() ? buffer.getDouble() : Double.NaN;
        double m = header.m() ? buffer.getDouble() : Double.NaN;
        processor.pointBegin(idx);
        if (!(Double.isNaN(x) && Double.isNaN(y) && Double.isNaN(z) && Double.isNaN(m))) {
            emit(processor, processor.multiDim(), processor.dimensions(), header, x, y, z, m, 0);
        }
        processor.pointEnd(idx);
    }

    private void readMultiPoint(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, NESTED_HEADER_BYTES + 2 * Double.BYTES);
        processor.multiPointBegin(count, idx);
        boolean multiDim = processor.multiDim();
        CoordDimensions requested = processor.dimensions();
        for (int i = 0; i < count; i++) {
            WkbHeader member = expect(readNestedHeader(buffer, header), WkbGeometryType.POINT);
            double x = buffer.getDouble();
            double y = buffer.getDouble();
            double z = member.z() ? buffer.getDouble() : Double.NaN;
            double m = member.m() ? buffer.getDouble() : Double.NaN;
            emit(processor, multiDim, requested, member, x, y, z, m, i);
        }
        processor.multiPointEnd(idx);
    }

    private void readLineString(ByteBuffer buffer, WkbHeader header, boolean tagged, int idx,
                                GeomProcessor processor) throws GeoStreamException {
        int count = readCount(buffer, minCoordinateBytes(header));
        processor.lineStringBegin(tagged, count, idx);
        readCoordinates(buffer, header, count, processor);
        processor.lineStringEnd(tagged, idx);
    }

    private void readCircularString(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, minCoordinateBytes(header));
        processor.circularStringBegin(count, idx);
        readCoordinates(buffer, header, count, processor);
        processor.circularStringEnd(idx);
    }

    private void readPolygon(ByteBuffer buffer, WkbHeader header, boolean tagged, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, RING_BYTES);
        processor.polygonBegin(tagged, count, idx);
        for (int i = 0; i < count; i++) {
            readLineString(buffer, header, false, i, processor);
        }
        processor.polygonEnd(tagged, idx);
    }

    private void readTriangle(ByteBuffer buffer, WkbHeader header, boolean tagged, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, RING_BYTES);
        processor.triangleBegin(tagged, count, idx);
        for (int i = 0; i < count; i++) {
            readLineString(buffer, header, false, i, processor);
        }
        processor.triangleEnd(tagged, idx);
    }

    private void readMultiLineString(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, NESTED_HEADER_BYTES);
        processor.multiLineStringBegin(count, idx);
        for (int i = 0; i < count; i++) {
            WkbHeader member = expect(readNestedHeader(buffer, header), WkbGeometryType.LINE_STRING);
            readLineString(buffer, member, false, i, processor);
        }
        processor.multiLineStringEnd(idx);
    }

    private void readMultiPolygon(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, NESTED_HEADER_BYTES);
        processor.multiPolygonBegin(count, idx);
        for (int i = 0; i < count; i++) {
            WkbHeader member = expect(readNestedHeader(buffer, header), WkbGeometryType.POLYGON);
            readPolygon(buffer, member, false, i, processor);
        }
        processor.multiPolygonEnd(idx);
    }

    private void readPolyhedralSurface(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, NESTED_HEADER_BYTES);
        processor.polyhedralSurfaceBegin(count, idx);
        for (int i = 0; i < count; i++) {
            WkbHeader member = expect(readNestedHeader(buffer, header), WkbGeometryType.POLYGON);
            readPolygon(buffer, member, false, i, processor);
        }
        processor.polyhedralSurfaceEnd(idx);
    }

    private void readTin(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, NESTED_HEADER_BYTES);
        processor.tinBegin(count, idx);
        for (int i = 0; i < count; i++) {
            WkbHeader member = expect(readNestedHeader(buffer, header), WkbGeometryType.TRIANGLE);
            readTriangle(buffer, member, false, i, processor);
        }
        processor.tinEnd(idx);
    }

    private void readGeometryCollection(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, NESTED_HEADER_BYTES);
        processor.geometryCollectionBegin(count, idx);
        for (int i = 0; i < count; i++) {
            readGeometry(buffer, readNestedHeader(buffer, header), i, processor);
        }
        processor.geometryCollectionEnd(idx);
    }

    private void readCompoundCurve(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, NESTED_HEADER_BYTES);
        processor.compoundCurveBegin(count, idx);
        for (int i = 0; i < count; i++) {
            WkbHeader member = expect(readNestedHeader(buffer, header),
                    WkbGeometryType.CIRCULAR_STRING, WkbGeometryType.LINE_STRING);
            readCurve(buffer, member, i, processor);
        }
        processor.compoundCurveEnd(idx);
    }

    private void readCurvePolygon(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, NESTED_HEADER_BYTES);
        processor.curvePolygonBegin(count, idx);
        for (int i = 0; i < count; i++) {
            readCurve(buffer, readCurveHeader(buffer, header), i, processor);
        }
        processor.curvePolygonEnd(idx);
    }

    private void readMultiCurve(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, NESTED_HEADER_BYTES);
        processor.multiCurveBegin(count, idx);
        for (int i = 0; i < count; i++) {
            readCurve(buffer, readCurveHeader(buffer, header), i, processor);
        }
        processor.multiCurveEnd(idx);
    }

    private void readMultiSurface(ByteBuffer buffer, WkbHeader header, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int count = readCount(buffer, NESTED_HEADER_BYTES);
        processor.multiSurfaceBegin(count, idx);
        for (int i = 0; i < count; i++) {
            WkbHeader member = expect(readNestedHeader(buffer, header),
                    WkbGeometryType.CURVE_POLYGON, WkbGeometryType.POLYGON);
            if (member.type() == WkbGeometryType.CURVE_POLYGON) {
                readCurvePolygon(buffer, member, i, processor);
            } else {
                readPolygon(buffer, member, false, i, processor);
            }
        }
        processor.multiSurfaceEnd(idx);
    }

    private WkbHeader readCurveHeader(ByteBuffer buffer, WkbHeader parent) throws GeometryFormatException {
        return expect(readNestedHeader(buffer, parent),
                WkbGeometryType.CIRCULAR_STRING, WkbGeometryType.LINE_STRING, WkbGeometryType.COMPOUND_CURVE);
    }

    private void readCurve(ByteBuffer buffer, WkbHeader member, int idx, GeomProcessor processor)
            throws GeoStreamException {
        switch (member.type()) {
            case CIRCULAR_STRING -> readCircularString(buffer, member, idx, processor);
            case COMPOUND_CURVE -> readCompoundCurve(buffer, member, idx, processor);
            default -> readLineString(buffer, member, false, idx, processor);
        }
    }

    /**
     * Compressed SpatiaLite coordinates store the first and last vertex as doubles and the vertices in between as
     * float offsets to their predecessor. M is always a double.
     */
    private static void readCoordinates(ByteBuffer buffer, WkbHeader header, int count, GeomProcessor processor)
            throws GeoStreamException {
        boolean multiDim = processor.multiDim();
        CoordDimensions requested = processor.dimensions();
        double x = 0;
        double y = 0;
        double z = Double.NaN;
        for (int i = 0; i < count; i++) {
            if (header.compressed() && i > 0 && i < count - 1) {
                x += buffer.getFloat();
                y += buffer.getFloat();
                if (header.z()) {
                    z += buffer.getFloat();
                }
            } else {
                x = buffer.getDouble();
                y = buffer.getDouble();
                if (header.z()) {
                    z = buffer.getDouble();
                }
            }
            double m = header.m() ? buffer.getDouble() : Double.NaN;
            emit(processor, multiDim, requested, header, x, y, z, m, i);
        }
    }

    private static void emit(GeomProcessor processor, boolean multiDim, CoordDimensions requested, WkbHeader header,
                             double x, double y, double z, double m, int idx) throws GeoStreamException {
        if (multiDim) {
            Double zValue = header.z() && requested.z() ? z : null;
            Double mValue = header.m() && requested.m() ? m : null;
            processor.coordinate(x, y, zValue, mValue, null, null, idx);
        } else {
            processor.xy(x, y, idx);
        }
    }

    private static int readCount(ByteBuffer buffer, int minElementBytes) throws GeometryFormatException {
        long count = Integer.toUnsignedLong(buffer.getInt());
        if (count * minElementBytes > buffer.remaining()) {
            throw new GeometryFormatException("Element count " + count + " exceeds the remaining "
                    + buffer.remaining() + " bytes");
        }
        return (int) count;
    }

    private static int minCoordinateBytes(WkbHeader header) {
        return header.compressed() ? header.compressedCoordinateBytes() : header.coordinateBytes();
    }

    private static WkbHeader expect(WkbHeader member, WkbGeometryType... allowed) throws GeometryFormatException {
        for (WkbGeometryType type : allowed) {
            if (member.type() == type) {
                return member;
            }
        }
        throw new GeometryFormatException("Unexpected member type " + member.type() + ", expected one of "
                + Arrays.toString(allowed));
    }

    private static double[] readDoubles(ByteBuffer buffer, int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = buffer.getDouble();
        }
        return values;
    }

    private static Integer sridOrNull(int value) {
        return value == 0 ? null : value;
    }
}
