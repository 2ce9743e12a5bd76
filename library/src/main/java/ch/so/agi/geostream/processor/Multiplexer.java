package ch.so.agi.geostream.processor;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;

/**
 * Delivers every event to two processors, first to {@code primary}, then to {@code secondary}. Both receive
 * coordinates in the union of their requested dimensions.
 */
public class Multiplexer extends ForwardingGeomProcessor {
    private final GeomProcessor secondary;

    public Multiplexer(GeomProcessor primary, GeomProcessor secondary) {
        super(primary);
        this.secondary = secondary;
    }

    @Override
    public CoordDimensions dimensions() {
        return inner().dimensions().union(secondary.dimensions());
    }

    @Override
    public boolean multiDim() {
        return inner().multiDim() || secondary.multiDim();
    }

    @Override
    public void xy(double x, double y, int idx) throws GeoStreamException {
        super.xy(x, y, idx);
        secondary.xy(x, y, idx);
    }

    @Override
    public void coordinate(double x, double y, Double z, Double m, Double t, Long tm, int idx)
            throws GeoStreamException {
        super.coordinate(x, y, z, m, t, tm, idx);
        secondary.coordinate(x, y, z, m, t, tm, idx);
    }

    @Override
    public void pointBegin(int idx) throws GeoStreamException {
        super.pointBegin(idx);
        secondary.pointBegin(idx);
    }

    @Override
    public void pointEnd(int idx) throws GeoStreamException {
        super.pointEnd(idx);
        secondary.pointEnd(idx);
    }

    @Override
    public void multiPointBegin(int size, int idx) throws GeoStreamException {
        super.multiPointBegin(size, idx);
        secondary.multiPointBegin(size, idx);
    }

    @Override
    public void multiPointEnd(int idx) throws GeoStreamException {
        super.multiPointEnd(idx);
        secondary.multiPointEnd(idx);
    }

    @Override
    public void lineStringBegin(boolean tagged, int size, int idx) throws GeoStreamException {
        super.lineStringBegin(tagged, size, idx);
        secondary.lineStringBegin(tagged, size, idx);
    }

    @Override
    public void lineStringEnd(boolean tagged, int idx) throws GeoStreamException {
        super.lineStringEnd(tagged, idx);
        secondary.lineStringEnd(tagged, idx);
    }

    @Override
    public void multiLineStringBegin(int size, int idx) throws GeoStreamException {
        super.multiLineStringBegin(size, idx);
        secondary.multiLineStringBegin(size, idx);
    }

    @Override
    public void multiLineStringEnd(int idx) throws GeoStreamException {
        super.multiLineStringEnd(idx);
        secondary.multiLineStringEnd(idx);
    }

    @Override
    public void polygonBegin(boolean tagged, int size, int idx) throws GeoStreamException {
        super.polygonBegin(tagged, size, idx);
        secondary.polygonBegin(tagged, size, idx);
    }

    @Override
    public void polygonEnd(boolean tagged, int idx) throws GeoStreamException {
        super.polygonEnd(tagged, idx);
        secondary.polygonEnd(tagged, idx);
    }

    @Override
    public void multiPolygonBegin(int size, int idx) throws GeoStreamException {
        super.multiPolygonBegin(size, idx);
        secondary.multiPolygonBegin(size, idx);
    }

    @Override
    public void multiPolygonEnd(int idx) throws GeoStreamException {
        super.multiPolygonEnd(idx);
        secondary.multiPolygonEnd(idx);
    }

    @Override
    public void geometryCollectionBegin(int size, int idx) throws GeoStreamException {
        super.geometryCollectionBegin(size, idx);
        secondary.geometryCollectionBegin(size, idx);
    }

    @Override
    public void geometryCollectionEnd(int idx) throws GeoStreamException {
        super.geometryCollectionEnd(idx);
        secondary.geometryCollectionEnd(idx);
    }

    @Override
    public void circularStringBegin(int size, int idx) throws GeoStreamException {
        super.circularStringBegin(size, idx);
        secondary.circularStringBegin(size, idx);
    }

    @Override
    public void circularStringEnd(int idx) throws GeoStreamException {
        super.circularStringEnd(idx);
        secondary.circularStringEnd(idx);
    }

    @Override
    public void compoundCurveBegin(int size, int idx) throws GeoStreamException {
        super.compoundCurveBegin(size, idx);
        secondary.compoundCurveBegin(size, idx);
    }

    @Override
    public void compoundCurveEnd(int idx) throws GeoStreamException {
        super.compoundCurveEnd(idx);
        secondary.compoundCurveEnd(idx);
    }

    @Override
    public void curvePolygonBegin(int size, int idx) throws GeoStreamException {
        super.curvePolygonBegin(size, idx);
        secondary.curvePolygonBegin(size, idx);
    }

    @Override
    public void curvePolygonEnd(int idx) throws GeoStreamException {
        super.curvePolygonEnd(idx);
        secondary.curvePolygonEnd(idx);
    }

    @Override
    public void multiCurveBegin(int size, int idx) throws GeoStreamException {
        super.multiCurveBegin(size, idx);
        secondary.multiCurveBegin(size, idx);
    }

    @Override
    public void multiCurveEnd(int idx) throws GeoStreamException {
        super.multiCurveEnd(idx);
        secondary.multiCurveEnd(idx);
    }

    @Override
    public void multiSurfaceBegin(int size, int idx) throws GeoStreamException {
        super.multiSurfaceBegin(size, idx);
        secondary.multiSurfaceBegin(size, idx);
    }

    @Override
    public void multiSurfaceEnd(int idx) throws GeoStreamException {
        super.multiSurfaceEnd(idx);
        secondary.multiSurfaceEnd(idx);
    }

    @Override
    public void triangleBegin(boolean tagged, int size, int idx) throws GeoStreamException {
        super.triangleBegin(tagged, size, idx);
        secondary.triangleBegin(tagged, size, idx);
    }

    @Override
    public void triangleEnd(boolean tagged, int idx) throws GeoStreamException {
        super.triangleEnd(tagged, idx);
        secondary.triangleEnd(tagged, idx);
    }

    @Override
    public void polyhedralSurfaceBegin(int size, int idx) throws GeoStreamException {
        super.polyhedralSurfaceBegin(size, idx);
        secondary.polyhedralSurfaceBegin(size, idx);
    }

    @Override
    public void polyhedralSurfaceEnd(int idx) throws GeoStreamException {
        super.polyhedralSurfaceEnd(idx);
        secondary.polyhedralSurfaceEnd(idx);
    }

    @Override
    public void tinBegin(int size, int idx) throws GeoStreamException {
        super.tinBegin(size, idx);
        secondary.tinBegin(size, idx);
    }

    @Override
    public void tinEnd(int idx) throws GeoStreamException {
        super.tinEnd(idx);
        secondary.tinEnd(idx);
    }
}
