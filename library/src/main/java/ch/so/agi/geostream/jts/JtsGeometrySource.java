package ch.so.agi.geostream.jts;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;
import ch.so.agi.geostream.GeometryProcessingException;
import ch.so.agi.geostream.GeometrySource;
import java.util.Objects;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * Streams a JTS geometry. Z and M are delivered when the processor requests them and the coordinate carries a
 * value.
 */
public class JtsGeometrySource implements GeometrySource {
    private final Geometry geometry;

    public JtsGeometrySource(Geometry geometry) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
    }

    @Override
    public void process(GeomProcessor processor) throws GeoStreamException {
        processGeometry(geometry, 0, processor);
    }

    private static void processGeometry(Geometry geometry, int idx, GeomProcessor processor)
            throws GeoStreamException {
        if (geometry instanceof Point point) {
            processor.pointBegin(idx);
            if (!point.isEmpty()) {
                processCoordinates(point.getCoordinateSequence(), processor);
            }
            processor.pointEnd(idx);
        } else if (geometry instanceof LineString lineString) {
            processLineString(lineString, true, idx, processor);
        } else if (geometry instanceof Polygon polygon) {
            processPolygon(polygon, true, idx, processor);
        } else if (geometry instanceof MultiPoint multiPoint) {
            processMultiPoint(multiPoint, idx, processor);
        } else if (geometry instanceof MultiLineString multiLineString) {
            processor.multiLineStringBegin(multiLineString.getNumGeometries(), idx);
            for (int i = 0; i < multiLineString.getNumGeometries(); i++) {
                processLineString((LineString) multiLineString.getGeometryN(i), false, i, processor);
            }
            processor.multiLineStringEnd(idx);
        } else if (geometry instanceof MultiPolygon multiPolygon) {
            processor.multiPolygonBegin(multiPolygon.getNumGeometries(), idx);
            for (int i = 0; i < multiPolygon.getNumGeometries(); i++) {
                processPolygon((Polygon) multiPolygon.getGeometryN(i), false, i, processor);
            }
            processor.multiPolygonEnd(idx);
        } else if (geometry instanceof GeometryCollection collection) {
            processor.geometryCollectionBegin(collection.getNumGeometries(), idx);
            for (int i = 0; i < collection.getNumGeometries(); i++) {
                processGeometry(collection.getGeometryN(i), i, processor);
            }
            processor.geometryCollectionEnd(idx);
        } else {
            throw new GeometryProcessingException("unsupported JTS geometry " + geometry.getGeometryType());
        }
    }

    private static void processMultiPoint(MultiPoint multiPoint, int idx, GeomProcessor processor)
            throws GeoStreamException {
        int size = multiPoint.getNumGeometries();
        processor.multiPointBegin(size, idx);
        boolean multiDim = processor.multiDim();
        CoordDimensions requested = processor.dimensions();
        for (int i = 0; i < size; i++) {
            Point point = (Point) multiPoint.getGeometryN(i);
            if (point.isEmpty()) {
                emit(processor, multiDim, requested, Double.NaN, Double.NaN, Double.NaN, Double.NaN, i);
            } else {
                CoordinateSequence sequence = point.getCoordinateSequence();
                emit(processor, multiDim, requested, sequence.getX(0), sequence.getY(0), sequence.getZ(0),
                        sequence.getM(0), i);
            }
        }
        processor.multiPointEnd(idx);
    }

    private static void processLineString(LineString lineString, boolean tagged, int idx, GeomProcessor processor)
            throws GeoStreamException {
        CoordinateSequence sequence = lineString.getCoordinateSequence();
        processor.lineStringBegin(tagged, sequence.size(), idx);
        processCoordinates(sequence, processor);
        processor.lineStringEnd(tagged, idx);
    }

    private static void processPolygon(Polygon polygon, boolean tagged, int idx, GeomProcessor processor)
            throws GeoStreamException {
        if (polygon.isEmpty()) {
            processor.polygonBegin(tagged, 0, idx);
            processor.polygonEnd(tagged, idx);
            return;
        }
        int holes = polygon.getNumInteriorRing();
        processor.polygonBegin(tagged, holes + 1, idx);
        processLineString(polygon.getExteriorRing(), false, 0, processor);
        for (int i = 0; i < holes; i++) {
            processLineString(polygon.getInteriorRingN(i), false, i + 1, processor);
        }
        processor.polygonEnd(tagged, idx);
    }

    private static void processCoordinates(CoordinateSequence sequence, GeomProcessor processor)
            throws GeoStreamException {
        boolean multiDim = processor.multiDim();
        CoordDimensions requested = processor.dimensions();
        for (int i = 0; i < sequence.size(); i++) {
            emit(processor, multiDim, requested, sequence.getX(i), sequence.getY(i), sequence.getZ(i),
                    sequence.getM(i), i);
        }
    }

    private static void emit(GeomProcessor processor, boolean multiDim, CoordDimensions requested,
                             double x, double y, double z, double m, int idx) throws GeoStreamException {
        if (multiDim) {
            Double zValue = requested.z() && !Double.isNaN(z) ? z : null;
            Double mValue = requested.m() && !Double.isNaN(m) ? m : null;
            processor.coordinate(x, y, zValue, mValue, null, null, idx);
        } else {
            processor.xy(x, y, idx);
        }
    }
}
