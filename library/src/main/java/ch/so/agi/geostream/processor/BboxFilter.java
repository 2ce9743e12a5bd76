package ch.so.agi.geostream.processor;

import ch.so.agi.geostream.CoordDimensions;
import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;
import ch.so.agi.geostream.GeometryProcessingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Forwards only geometries whose bounds intersect a filter rectangle.
 *
 * <p>The events of each top-level geometry are held back until its final end event, then replayed downstream if
 * the geometry passes. Geometries without coordinates have no bounds and never pass. Buffering replaces forwarding
 * here, so unlike the other decorators this class does not extend {@link ForwardingGeomProcessor}.
 *
 * <p>A fault raised by the filter or by the downstream processor during replay discards the buffered geometry.
 * When a producer aborts in the middle of a geometry, call {@link #reset()} before sending the next one.
 */
public class BboxFilter implements GeomProcessor {
    private final Bounds filter;
    private final GeomProcessor downstream;
    private final BoundsProcessor boundsProcessor = new BoundsProcessor();
    private final List<BufferedEvent> buffered = new ArrayList<>();
    private int depth;
    private long passed;
    private long rejected;

    public BboxFilter(Bounds filter, GeomProcessor downstream) {
        this.filter = Objects.requireNonNull(filter, "filter");
        this.downstream = Objects.requireNonNull(downstream, "downstream");
    }

    public long passed() {
        return passed;
    }

    public long rejected() {
        return rejected;
    }

    /**
     * Drops any partially buffered geometry. The passed and rejected counters are kept.
     */
    public void reset() {
        depth = 0;
        buffered.clear();
        boundsProcessor.reset();
    }

    @Override
    public CoordDimensions dimensions() {
        return downstream.dimensions();
    }

    @Override
    public boolean multiDim() {
        return downstream.multiDim();
    }

    @Override
    public void xy(double x, double y, int idx) throws GeoStreamException {
        requireOpenGeometry();
        boundsProcessor.xy(x, y, idx);
        buffered.add(p -> p.xy(x, y, idx));
    }

    @Override
    public void coordinate(double x, double y, Double z, Double m, Double t, Long tm, int idx)
            throws GeoStreamException {
        requireOpenGeometry();
        boundsProcessor.xy(x, y, idx);
        buffered.add(p -> p.coordinate(x, y, z, m, t, tm, idx));
    }

    @Override
    public void pointBegin(int idx) {
        begin(p -> p.pointBegin(idx));
    }

    @Override
    public void pointEnd(int idx) throws GeoStreamException {
        end(p -> p.pointEnd(idx));
    }

    @Override
    public void multiPointBegin(int size, int idx) {
        begin(p -> p.multiPointBegin(size, idx));
    }

    @Override
    public void multiPointEnd(int idx) throws GeoStreamException {
        end(p -> p.multiPointEnd(idx));
    }

    @Override
    public void lineStringBegin(boolean tagged, int size, int idx) {
        begin(p -> p.lineStringBegin(tagged, size, idx));
    }

    @Override
    public void lineStringEnd(boolean tagged, int idx) throws GeoStreamException {
        end(p -> p.lineStringEnd(tagged, idx));
    }

    @Override
    public void multiLineStringBegin(int size, int idx) {
        begin(p -> p.multiLineStringBegin(size, idx));
    }

    @Override
    public void multiLineStringEnd(int idx) throws GeoStreamException {
        end(p -> p.multiLineStringEnd(idx));
    }

    @Override
    public void polygonBegin(boolean tagged, int size, int idx) {
        begin(p -> p.polygonBegin(tagged, size, idx));
    }

    @Override
    public void polygonEnd(boolean tagged, int idx) throws GeoStreamException {
        end(p -> p.polygonEnd(tagged, idx));
    }

    @Override
    public void multiPolygonBegin(int size, int idx) {
        begin(p -> p.multiPolygonBegin(size, idx));
    }

    @Override
    public void multiPolygonEnd(int idx) throws GeoStreamException {
        end(p -> p.multiPolygonEnd(idx));
    }

    @Override
    public void geometryCollectionBegin(int size, int idx) {
        begin(p -> p.geometryCollectionBegin(size, idx));
    }

    @Override
    public void geometryCollectionEnd(int idx) throws GeoStreamException {
        end(p -> p.geometryCollectionEnd(idx));
    }

    @Override
    public void circularStringBegin(int size, int idx) {
        begin(p -> p.circularStringBegin(size, idx));
    }

    @Override
    public void circularStringEnd(int idx) throws GeoStreamException {
        end(p -> p.circularStringEnd(idx));
    }

    @Override
    public void compoundCurveBegin(int size, int idx) {
        begin(p -> p.compoundCurveBegin(size, idx));
    }

    @Override
    public void compoundCurveEnd(int idx) throws GeoStreamException {
        end(p -> p.compoundCurveEnd(idx));
    }

    @Override
    public void curvePolygonBegin(int size, int idx) {
        begin(p -> p.curvePolygonBegin(size, idx));
    }

    @Override
    public void curvePolygonEnd(int idx) throws GeoStreamException {
        end(p -> p.curvePolygonEnd(idx));
    }

    @Override
    public void multiCurveBegin(int size, int idx) {
        begin(p -> p.multiCurveBegin(size, idx));
    }

    @Override
    public void multiCurveEnd(int idx) throws GeoStreamException {
        end(p -> p.multiCurveEnd(idx));
    }

    @Override
    public void multiSurfaceBegin(int size, int idx) {
        begin(p -> p.multiSurfaceBegin(size, idx));
    }

    @Override
    public void multiSurfaceEnd(int idx) throws GeoStreamException {
        end(p -> p.multiSurfaceEnd(idx));
    }

    @Override
    public void triangleBegin(boolean tagged, int size, int idx) {
        begin(p -> p.triangleBegin(tagged, size, idx));
    }

    @Override
    public void triangleEnd(boolean tagged, int idx) throws GeoStreamException {
        end(p -> p.triangleEnd(tagged, idx));
    }

    @Override
    public void polyhedralSurfaceBegin(int size, int idx) {
        begin(p -> p.polyhedralSurfaceBegin(size, idx));
    }

    @Override
    public void polyhedralSurfaceEnd(int idx) throws GeoStreamException {
        end(p -> p.polyhedralSurfaceEnd(idx));
    }

    @Override
    public void tinBegin(int size, int idx) {
        begin(p -> p.tinBegin(size, idx));
    }

    @Override
    public void tinEnd(int idx) throws GeoStreamException {
        end(p -> p.tinEnd(idx));
    }

    private void begin(BufferedEvent event) {
        if (depth == 0) {
            buffered.clear();
            boundsProcessor.reset();
        }
        depth++;
        buffered.add(event);
    }

    private void end(BufferedEvent event) throws GeoStreamException {
        if (depth == 0) {
            reset();
            throw new GeometryProcessingException("end event without matching begin event");
        }
        buffered.add(event);
        depth--;
        if (depth == 0) {
            flush();
        }
    }

    private void flush() throws GeoStreamException {
        Optional<Bounds> bounds = boundsProcessor.bounds();
        if (bounds.isPresent() && bounds.get().intersects(filter)) {
            passed++;
            try {
                for (BufferedEvent event : buffered) {
                    event.replay(downstream);
                }
            } finally {
                reset();
            }
        } else {
            rejected++;
            reset();
        }
    }

    private void requireOpenGeometry() throws GeometryProcessingException {
        if (depth == 0) {
            reset();
            throw new GeometryProcessingException("coordinate outside of a geometry");
        }
    }

    @FunctionalInterface
    private interface BufferedEvent {
        void replay(GeomProcessor processor) throws GeoStreamException;
    }
}
