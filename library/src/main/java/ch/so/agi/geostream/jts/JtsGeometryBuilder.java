package ch.so.agi.geostream.jts;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;
import ch.so.agi.geostream.GeometryProcessingException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.CoordinateXYM;
import org.locationtech.jts.geom.CoordinateXYZM;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Builds JTS geometries from geometry events. Curve and surface types have no JTS counterpart and are rejected.
 */
public class JtsGeometryBuilder implements GeomProcessor {
    private final GeometryFactory factory;
    private final CoordDimensions dimensions;
    private final Deque<Part> parts = new ArrayDeque<>();
    private Geometry geometry;

    public JtsGeometryBuilder(GeometryFactory factory) {
        this(factory, CoordDimensions.xy());
    }

    public JtsGeometryBuilder(GeometryFactory factory, CoordDimensions dimensions) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.dimensions = Objects.requireNonNull(dimensions, "dimensions");
    }

    /**
     * The last completed top-level geometry, {@code null} if none was built yet.
     */
    public Geometry geometry() {
        return geometry;
    }

    @Override
    public CoordDimensions dimensions() {
        return dimensions;
    }

    @Override
    public void xy(double x, double y, int idx) throws GeoStreamException {
        current().coordinates.add(new CoordinateXY(x, y));
    }

    @Override
    public void coordinate(double x, double y, Double z, Double m, Double t, Long tm, int idx)
            throws GeoStreamException {
        double zValue = z == null ? Double.NaN : z;
        double mValue = m == null ? Double.NaN : m;
        Coordinate coordinate;
        if (dimensions.z() && dimensions.m()) {
            coordinate = new CoordinateXYZM(x, y, zValue, mValue);
        } else if (dimensions.m()) {
            coordinate = new CoordinateXYM(x, y, mValue);
        } else if (dimensions.z()) {
            coordinate = new Coordinate(x, y, zValue);
        } else {
            coordinate = new CoordinateXY(x, y);
        }
        current().coordinates.add(coordinate);
    }

    @Override
    public void pointBegin(int idx) {
        begin(Kind.POINT);
    }

    @Override
    public void pointEnd(int idx) throws GeoStreamException {
        Part part = end(Kind.POINT);
        complete(part.coordinates.isEmpty() ? factory.createPoint() : factory.createPoint(part.coordinates.get(0)));
    }

    @Override
    public void multiPointBegin(int size, int idx) {
        begin(Kind.MULTI_POINT);
    }

    @Override
    public void multiPointEnd(int idx) throws GeoStreamException {
        Part part = end(Kind.MULTI_POINT);
        Point[] points = new Point[part.coordinates.size()];
        for (int i = 0; i < points.length; i++) {
            Coordinate coordinate = part.coordinates.get(i);
            points[i] = Double.isNaN(coordinate.getX()) ? factory.createPoint() : factory.createPoint(coordinate);
        }
        complete(factory.createMultiPoint(points));
    }

    @Override
    public void lineStringBegin(boolean tagged, int size, int idx) {
        begin(Kind.LINE_STRING);
    }

    @Override
    public void lineStringEnd(boolean tagged, int idx) throws GeoStreamException {
        Part part = end(Kind.LINE_STRING);
        Coordinate[] coordinates = part.coordinates.toArray(new Coordinate[0]);
        Part parent = parts.peek();
        try {
            if (parent != null && parent.kind == Kind.POLYGON) {
                complete(factory.createLinearRing(coordinates));
            } else {
                complete(factory.createLineString(coordinates));
            }
        } catch (IllegalArgumentException e) {
            throw new GeometryProcessingException(e.getMessage(), e);
        }
    }

    @Override
    public void multiLineStringBegin(int size, int idx) {
        begin(Kind.MULTI_LINE_STRING);
    }

    @Override
    public void multiLineStringEnd(int idx) throws GeoStreamException {
        Part part = end(Kind.MULTI_LINE_STRING);
        complete(factory.createMultiLineString(part.children.toArray(new LineString[0])));
    }

    @Override
    public void polygonBegin(boolean tagged, int size, int idx) {
        begin(Kind.POLYGON);
    }

    @Override
    public void polygonEnd(boolean tagged, int idx) throws GeoStreamException {
        Part part = end(Kind.POLYGON);
        if (part.children.isEmpty()) {
            complete(factory.createPolygon());
            return;
        }
        LinearRing shell = (LinearRing) part.children.get(0);
        LinearRing[] holes = part.children.subList(1, part.children.size()).toArray(new LinearRing[0]);
        complete(factory.createPolygon(shell, holes));
    }

    @Override
    public void multiPolygonBegin(int size, int idx) {
        begin(Kind.MULTI_POLYGON);
    }

    @Override
    public void multiPolygonEnd(int idx) throws GeoStreamException {
        Part part = end(Kind.MULTI_POLYGON);
        complete(factory.createMultiPolygon(part.children.toArray(new Polygon[0])));
    }

    @Override
    public void geometryCollectionBegin(int size, int idx) {
        begin(Kind.GEOMETRY_COLLECTION);
    }

    @Override
    public void geometryCollectionEnd(int idx) throws GeoStreamException {
        Part part = end(Kind.GEOMETRY_COLLECTION);
        complete(factory.createGeometryCollection(part.children.toArray(new Geometry[0])));
    }

    @Override
    public void circularStringBegin(int size, int idx) throws GeoStreamException {
        throw unsupported("CircularString");
    }

    @Override
    public void compoundCurveBegin(int size, int idx) throws GeoStreamException {
        throw unsupported("CompoundCurve");
    }

    @Override
    public void curvePolygonBegin(int size, int idx) throws GeoStreamException {
        throw unsupported("CurvePolygon");
    }

    @Override
    public void multiCurveBegin(int size, int idx) throws GeoStreamException {
        throw unsupported("MultiCurve");
    }

    @Override
    public void multiSurfaceBegin(int size, int idx) throws GeoStreamException {
        throw unsupported("MultiSurface");
    }

    @Override
    public void triangleBegin(boolean tagged, int size, int idx) throws GeoStreamException {
        throw unsupported("Triangle");
    }

    @Override
    public void polyhedralSurfaceBegin(int size, int idx) throws GeoStreamException {
        throw unsupported("PolyhedralSurface");
    }

    @Override
    public void tinBegin(int size, int idx) throws GeoStreamException {
        throw unsupported("TIN");
    }

    private static GeometryProcessingException unsupported(String type) {
        return new GeometryProcessingException(type + " is not supported by JTS");
    }

    private void begin(Kind kind) {
        parts.push(new Part(kind));
    }

    private Part end(Kind kind) throws GeometryProcessingException {
        Part part = parts.poll();
        if (part == null || part.kind != kind) {
            throw new GeometryProcessingException("unbalanced " + kind + " end event");
        }
        return part;
    }

    private Part current() throws GeometryProcessingException {
        Part part = parts.peek();
        if (part == null) {
            throw new GeometryProcessingException("coordinate outside of a geometry");
        }
        return part;
    }

    private void complete(Geometry built) {
        Part parent = parts.peek();
        if (parent == null) {
            geometry = built;
        } else {
            parent.children.add(built);
        }
    }

    private enum Kind {
        POINT,
        MULTI_POINT,
        LINE_STRING,
        MULTI_LINE_STRING,
        POLYGON,
        MULTI_POLYGON,
        GEOMETRY_COLLECTION
    }

    private static final class Part {
        private final Kind kind;
        private final List<Coordinate> coordinates = new ArrayList<>();
        private final List<Geometry> children = new ArrayList<>();

        private Part(Kind kind) {
            this.kind = kind;
        }
    }
}
