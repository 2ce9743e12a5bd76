package ch.so.agi.geostream.processor;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;
import java.util.Objects;

/**
 * Decorator base that owns an inner processor and forwards every event to it unchanged. Subclasses override the
 * events they transform or observe.
 */
public abstract class ForwardingGeomProcessor implements GeomProcessor {
    private final GeomProcessor inner;

    protected ForwardingGeomProcessor(GeomProcessor inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    protected GeomProcessor inner() {
        return inner;
    }

    @Override
    public CoordDimensions dimensions() {
        return inner.dimensions();
    }

    @Override
    public boolean multiDim() {
        return inner.multiDim();
    }

    @Override
    public void xy(double x, double y, int idx) throws GeoStreamException {
        inner.xy(x, y, idx);
    }

    @Override
    public void coordinate(double x, double y, Double z, Double m, Double t, Long tm, int idx)
            throws GeoStreamException {
        inner.coordinate(x, y, z, m, t, tm, idx);
    }

    @Override
    public void pointBegin(int idx) throws GeoStreamException {
        inner.pointBegin(idx);
    }

    @Override
    public void pointEnd(int idx) throws GeoStreamException {
        inner.pointEnd(idx);
    }

    @Override
    public void multiPointBegin(int size, int idx) throws GeoStreamException {
        inner.multiPointBegin(size, idx);
    }

    @Override
    public void multiPointEnd(int idx) throws GeoStreamException {
        inner.multiPointEnd(idx);
    }

    @Override
    public void lineStringBegin(boolean tagged, int size, int idx) throws GeoStreamException {
        inner.lineStringBegin(tagged, size, idx);
    }

    @Override
    public void lineStringEnd(boolean tagged, int idx) throws GeoStreamException {
        inner.lineStringEnd(tagged, idx);
    }

    @Override
    public void multiLineStringBegin(int size, int idx) throws GeoStreamException {
        inner.multiLineStringBegin(size, idx);
    }

    @Override
    public void multiLineStringEnd(int idx) throws GeoStreamException {
        inner.multiLineStringEnd(idx);
    }

    @Override
    public void polygonBegin(boolean tagged, int size, int idx) throws GeoStreamException {
        inner.polygonBegin(tagged, size, idx);
    }

    @Override
    public void polygonEnd(boolean tagged, int idx) throws GeoStreamException {
        inner.polygonEnd(tagged, idx);
    }

    @Override
    public void multiPolygonBegin(int size, int idx) throws GeoStreamException {
        inner.multiPolygonBegin(size, idx);
    }

    @Override
    public void multiPolygonEnd(int idx) throws GeoStreamException {
        inner.multiPolygonEnd(idx);
    }

    @Override
    public void geometryCollectionBegin(int size, int idx) throws GeoStreamException {
        inner.geometryCollectionBegin(size, idx);
    }

    @Override
    public void geometryCollectionEnd(int idx) throws GeoStreamException {
        inner.geometryCollectionEnd(idx);
    }

    @Override
    public void circularStringBegin(int size, int idx) throws GeoStreamException {
        inner.circularStringBegin(size, idx);
    }

    @Override
    public void circularStringEnd(int idx) throws GeoStreamException {
        inner.circularStringEnd(idx);
    }

    @Override
    public void compoundCurveBegin(int size, int idx) throws GeoStreamException {
        inner.compoundCurveBegin(size, idx);
    }

    @Override
    public void compoundCurveEnd(int idx) throws GeoStreamException {
        inner.compoundCurveEnd(idx);
    }

    @Override
    public void curvePolygonBegin(int size, int idx) throws GeoStreamException {
        inner.curvePolygonBegin(size, idx);
    }

    @Override
    public void curvePolygonEnd(int idx) throws GeoStreamException {
        inner.curvePolygonEnd(idx);
    }

    @Override
    public void multiCurveBegin(int size, int idx) throws GeoStreamException {
        inner.multiCurveBegin(size, idx);
    }

    @Override
    public void multiCurveEnd(int idx) throws GeoStreamException {
        inner.multiCurveEnd(idx);
    }

    @Override
    public void multiSurfaceBegin(int size, int idx) throws GeoStreamException {
        inner.multiSurfaceBegin(size, idx);
    }

    @Override
    public void multiSurfaceEnd(int idx) throws GeoStreamException {
        inner.multiSurfaceEnd(idx);
    }

    @Override
    public void triangleBegin(boolean tagged, int size, int idx) throws GeoStreamException {
        inner.triangleBegin(tagged, size, idx);
    }

    @Override
    public void triangleEnd(boolean tagged, int idx) throws GeoStreamException {
        inner.triangleEnd(tagged, idx);
    }

    @Override
    public void polyhedralSurfaceBegin(int size, int idx) throws GeoStreamException {
        inner.polyhedralSurfaceBegin(size, idx);
    }

    @Override
    public void polyhedralSurfaceEnd(int idx) throws GeoStreamException {
        inner.polyhedralSurfaceEnd(idx);
    }

    @Override
    public void tinBegin(int size, int idx) throws GeoStreamException {
        inner.tinBegin(size, idx);
    }

    @Override
    public void tinEnd(int idx) throws GeoStreamException {
        inner.tinEnd(idx);
    }
}
