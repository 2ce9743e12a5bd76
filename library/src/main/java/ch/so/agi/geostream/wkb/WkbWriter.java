package ch.so.agi.geostream.wkb;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.CoordinateAccessException;
import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeoStreamIoException;
import ch.so.agi.geostream.GeomProcessor;
import ch.so.agi.geostream.GeometryProcessingException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes the geometry events it receives as WKB of the given dialect.
 *
 * <p>Every top-level geometry is assembled in memory and written to the sink on its final end event, so
 * consecutive geometries can be encoded with the same writer. Polygon and triangle rings are written without a
 * header, all other nested shapes with a member header. A fault raised by the writer discards the geometry being
 * assembled; nothing of it reaches the sink.
 */
public class WkbWriter implements GeomProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(WkbWriter.class);

    private final OutputStream out;
    private final WkbDialect dialect;
    private final WkbWriteOptions options;
    private final CoordDimensions dimensions;
    private final ByteOrder byteOrder;
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private final ByteBuffer scratch;
    private final Deque<WkbGeometryType> shapes = new ArrayDeque<>();
    private boolean pointCoordinateWritten;
    private boolean hasCoordinates;
    private double minX;
    private double minY;
    private double maxX;
    private double maxY;

    public WkbWriter(OutputStream out, WkbDialect dialect) {
        this(out, dialect, WkbWriteOptions.defaults());
    }

    public WkbWriter(OutputStream out, WkbDialect dialect, WkbWriteOptions options) {
        this.out = Objects.requireNonNull(out, "out");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.options = Objects.requireNonNull(options, "options");
        if (dialect.littleEndianOnly() && options.byteOrder() != ByteOrder.LITTLE_ENDIAN) {
            throw new IllegalArgumentException(dialect + " geometries must be little-endian");
        }
        this.dimensions = dialect.xyOnly() ? CoordDimensions.xy() : options.dimensions();
        this.byteOrder = options.byteOrder();
        this.scratch = ByteBuffer.allocate(Double.BYTES).order(byteOrder);
    }

    @Override
    public CoordDimensions dimensions() {
        return dimensions;
    }

    @Override
    public void xy(double x, double y, int idx) throws GeoStreamException {
        if (dimensions.z() || dimensions.m()) {
            throw discard(new CoordinateAccessException("Coordinate " + idx
                    + " has no Z/M values but the writer requires " + axes()));
        }
        beginCoordinate();
        writeDouble(x);
        writeDouble(y);
        include(x, y);
    }

    @Override
    public void coordinate(double x, double y, Double z, Double m, Double t, Long tm, int idx)
            throws GeoStreamException {
        if (dimensions.z() && z == null) {
            throw discard(new CoordinateAccessException("Z value missing in coordinate " + idx));
        }
        if (dimensions.m() && m == null) {
            throw discard(new CoordinateAccessException("M value missing in coordinate " + idx));
        }
        beginCoordinate();
        writeDouble(x);
        writeDouble(y);
        if (dimensions.z()) {
            writeDouble(z);
        }
        if (dimensions.m()) {
            writeDouble(m);
        }
        include(x, y);
    }

    @Override
    public void pointBegin(int idx) {
        beginShape(WkbGeometryType.POINT);
        pointCoordinateWritten = false;
    }

    @Override
    public void pointEnd(int idx) throws GeoStreamException {
        if (!pointCoordinateWritten) {
            int values = 2 + (dimensions.z() ? 1 : 0) + (dimensions.m() ? 1 : 0);
            for (int i = 0; i < values; i++) {
                writeDouble(Double.NaN);
            }
            pointCoordinateWritten = true;
        }
        endShape();
    }

    @Override
    public void multiPointBegin(int size, int idx) {
        beginShape(WkbGeometryType.MULTI_POINT, size);
    }

    @Override
    public void multiPointEnd(int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void lineStringBegin(boolean tagged, int size, int idx) {
        if (isRingContainer(shapes.peek())) {
            writeInt(size);
            shapes.push(WkbGeometryType.LINE_STRING);
        } else {
            beginShape(WkbGeometryType.LINE_STRING, size);
        }
    }

    @Override
    public void lineStringEnd(boolean tagged, int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void multiLineStringBegin(int size, int idx) {
        beginShape(WkbGeometryType.MULTI_LINE_STRING, size);
    }

    @Override
    public void multiLineStringEnd(int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void polygonBegin(boolean tagged, int size, int idx) {
        beginShape(WkbGeometryType.POLYGON, size);
    }

    @Override
    public void polygonEnd(boolean tagged, int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void multiPolygonBegin(int size, int idx) {
        beginShape(WkbGeometryType.MULTI_POLYGON, size);
    }

    @Override
    public void multiPolygonEnd(int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void geometryCollectionBegin(int size, int idx) {
        beginShape(WkbGeometryType.GEOMETRY_COLLECTION, size);
    }

    @Override
    public void geometryCollectionEnd(int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void circularStringBegin(int size, int idx) {
        beginShape(WkbGeometryType.CIRCULAR_STRING, size);
    }

    @Override
    public void circularStringEnd(int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void compoundCurveBegin(int size, int idx) {
        beginShape(WkbGeometryType.COMPOUND_CURVE, size);
    }

    @Override
    public void compoundCurveEnd(int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void curvePolygonBegin(int size, int idx) {
        beginShape(WkbGeometryType.CURVE_POLYGON, size);
    }

    @Override
    public void curvePolygonEnd(int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void multiCurveBegin(int size, int idx) {
        beginShape(WkbGeometryType.MULTI_CURVE, size);
    }

    @Override
    public void multiCurveEnd(int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void multiSurfaceBegin(int size, int idx) {
        beginShape(WkbGeometryType.MULTI_SURFACE, size);
    }

    @Override
    public void multiSurfaceEnd(int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void triangleBegin(boolean tagged, int size, int idx) {
        beginShape(WkbGeometryType.TRIANGLE, size);
    }

    @Override
    public void triangleEnd(boolean tagged, int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void polyhedralSurfaceBegin(int size, int idx) {
        beginShape(WkbGeometryType.POLYHEDRAL_SURFACE, size);
    }

    @Override
    public void polyhedralSurfaceEnd(int idx) throws GeoStreamException {
        endShape();
    }

    @Override
    public void tinBegin(int size, int idx) {
        beginShape(WkbGeometryType.TIN, size);
    }

    @Override
    public void tinEnd(int idx) throws GeoStreamException {
        endShape();
    }

    private static boolean isRingContainer(WkbGeometryType type) {
        return type == WkbGeometryType.POLYGON || type == WkbGeometryType.TRIANGLE;
    }

    private void beginShape(WkbGeometryType type) {
        writeHeader(type);
        shapes.push(type);
    }

    private void beginShape(WkbGeometryType type, int size) {
        writeHeader(type);
        writeInt(size);
        shapes.push(type);
    }

    private void endShape() throws GeoStreamException {
        if (shapes.isEmpty()) {
            throw discard(new GeometryProcessingException("end event without matching begin event"));
        }
        shapes.pop();
        if (shapes.isEmpty()) {
            flush();
        }
    }

    private void beginCoordinate() throws GeometryProcessingException {
        WkbGeometryType current = shapes.peek();
        if (current == null) {
            throw discard(new GeometryProcessingException("coordinate outside of a geometry"));
        }
        if (current == WkbGeometryType.MULTI_POINT) {
            writeHeader(WkbGeometryType.POINT);
        } else if (current == WkbGeometryType.POINT) {
            pointCoordinateWritten = true;
        }
    }

    /**
     * Drops the partially assembled geometry, so the next begin event starts a new top-level geometry.
     */
    private <E extends GeoStreamException> E discard(E fault) {
        shapes.clear();
        body.reset();
        hasCoordinates = false;
        pointCoordinateWritten = false;
        return fault;
    }

    private void writeHeader(WkbGeometryType type) {
        boolean z = dimensions.z();
        boolean m = dimensions.m();
        if (shapes.isEmpty()) {
            if (dialect.preamble() != WkbDialect.Preamble.SPATIALITE) {
                writeByteOrder();
            }
            boolean withSrid = dialect.sridAfterTypeCode() && options.srid() != null;
            writeInt(dialect.typeCode(type, z, m, withSrid));
            if (withSrid) {
                writeInt(options.srid());
            }
        } else if (dialect.entityMarker()) {
            body.write(WkbDialect.SPATIALITE_ENTITY);
            writeInt(dialect.typeCode(type, z, m, false));
        } else {
            writeByteOrder();
            writeInt(dialect.typeCode(type, z, m, false));
        }
    }

    private void writeByteOrder() {
        body.write(byteOrder == ByteOrder.LITTLE_ENDIAN ? 1 : 0);
    }

    private void writeInt(int value) {
        scratch.clear();
        scratch.putInt(value);
        body.write(scratch.array(), 0, Integer.BYTES);
    }

    private void writeDouble(double value) {
        scratch.clear();
        scratch.putDouble(value);
        body.write(scratch.array(), 0, Double.BYTES);
    }

    private void include(double x, double y) {
        if (Double.isNaN(x) || Double.isNaN(y)) {
            return;
        }
        if (!hasCoordinates) {
            minX = maxX = x;
            minY = maxY = y;
            hasCoordinates = true;
            return;
        }
        minX = Math.min(minX, x);
        minY = Math.min(minY, y);
        maxX = Math.max(maxX, x);
        maxY = Math.max(maxY, y);
    }

    private void flush() throws GeoStreamIoException {
        try {
            ByteBuffer preamble = switch (dialect.preamble()) {
                case NONE -> null;
                case GEOPACKAGE -> geoPackageHeader();
                case SPATIALITE -> spatiaLiteHeader();
                case MYSQL -> mySqlHeader();
            };
            int size = body.size();
            if (preamble != null) {
                out.write(preamble.array(), 0, preamble.position());
                size += preamble.position();
            }
            body.writeTo(out);
            if (dialect.preamble() == WkbDialect.Preamble.SPATIALITE) {
                out.write(WkbDialect.SPATIALITE_END);
                size++;
            }
            LOGGER.trace("Wrote {} geometry of {} bytes", dialect, size);
        } catch (IOException e) {
            throw new GeoStreamIoException("Unable to write " + dialect + " geometry", e);
        } finally {
            body.reset();
            hasCoordinates = false;
        }
    }

    private ByteBuffer geoPackageHeader() {
        int envelopeValues = options.envelope().length;
        ByteBuffer header = ByteBuffer.allocate(8 + envelopeValues * Double.BYTES).order(byteOrder);
        header.put((byte) 'G');
        header.put((byte) 'P');
        header.put((byte) 0);
        int envelopeKind = switch (envelopeValues) {
            case 4 -> 1;
            case 6 -> dimensions.z() ? 2 : 3;
            case 8 -> 4;
            default -> 0;
        };
        int flags = envelopeKind << 1;
        if (!hasCoordinates) {
            flags |= WkbDialect.GEOPACKAGE_EMPTY;
        }
        if (byteOrder == ByteOrder.LITTLE_ENDIAN) {
            flags |= 0x01;
        }
        header.put((byte) flags);
        header.putInt(srid());
        for (int i = 0; i < envelopeValues; i++) {
            header.putDouble(options.envelopeValue(i));
        }
        return header;
    }

    private ByteBuffer spatiaLiteHeader() {
        ByteBuffer header = ByteBuffer.allocate(6 + 4 * Double.BYTES + 1).order(byteOrder);
        header.put(WkbDialect.SPATIALITE_START);
        header.put((byte) (byteOrder == ByteOrder.LITTLE_ENDIAN ? 1 : 0));
        header.putInt(srid());
        if (options.hasEnvelope()) {
            header.putDouble(options.envelopeValue(0));
            header.putDouble(options.envelopeValue(2));
            header.putDouble(options.envelopeValue(1));
            header.putDouble(options.envelopeValue(3));
        } else if (hasCoordinates) {
            header.putDouble(minX);
            header.putDouble(minY);
            header.putDouble(maxX);
            header.putDouble(maxY);
        } else {
            for (int i = 0; i < 4; i++) {
                header.putDouble(0.0);
            }
        }
        header.put(WkbDialect.SPATIALITE_MBR_END);
        return header;
    }

    private ByteBuffer mySqlHeader() {
        ByteBuffer header = ByteBuffer.allocate(Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(srid());
        return header;
    }

    private int srid() {
        return options.srid() == null ? 0 : options.srid();
    }

    private String axes() {
        if (dimensions.z() && dimensions.m()) {
            return "Z and M";
        }
        return dimensions.z() ? "Z" : "M";
    }
}
