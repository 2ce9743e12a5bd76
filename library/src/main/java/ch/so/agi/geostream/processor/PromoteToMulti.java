package ch.so.agi.geostream.processor;

import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;

/**
 * Rewrites single geometries into multi geometries with one member. Points become MultiPoints, tagged LineStrings
 * become MultiLineStrings and tagged Polygons become MultiPolygons; everything else passes unchanged.
 *
 * <p>The MultiPoint begin event is held back until the point's coordinate arrives, so an empty point becomes an empty
 * MultiPoint.
 */
public class PromoteToMulti extends ForwardingGeomProcessor {
    private boolean pointPending;
    private int pointIdx;

    public PromoteToMulti(GeomProcessor inner) {
        super(inner);
    }

    @Override
    public void xy(double x, double y, int idx) throws GeoStreamException {
        beginPendingPoint(1);
        super.xy(x, y, idx);
    }

    @Override
    public void coordinate(double x, double y, Double z, Double m, Double t, Long tm, int idx)
            throws GeoStreamException {
        beginPendingPoint(1);
        super.coordinate(x, y, z, m, t, tm, idx);
    }

    @Override
    public void pointBegin(int idx) {
        pointPending = true;
        pointIdx = idx;
    }

    @Override
    public void pointEnd(int idx) throws GeoStreamException {
        beginPendingPoint(0);
        super.multiPointEnd(idx);
    }

    @Override
    public void lineStringBegin(boolean tagged, int size, int idx) throws GeoStreamException {
        if (tagged) {
            super.multiLineStringBegin(1, idx);
            super.lineStringBegin(false, size, 0);
        } else {
            super.lineStringBegin(false, size, idx);
        }
    }

    @Override
    public void lineStringEnd(boolean tagged, int idx) throws GeoStreamException {
        if (tagged) {
            super.lineStringEnd(false, 0);
            super.multiLineStringEnd(idx);
        } else {
            super.lineStringEnd(false, idx);
        }
    }

    @Override
    public void polygonBegin(boolean tagged, int size, int idx) throws GeoStreamException {
        if (tagged) {
            super.multiPolygonBegin(1, idx);
            super.polygonBegin(false, size, 0);
        } else {
            super.polygonBegin(false, size, idx);
        }
    }

    @Override
    public void polygonEnd(boolean tagged, int idx) throws GeoStreamException {
        if (tagged) {
            super.polygonEnd(false, 0);
            super.multiPolygonEnd(idx);
        } else {
            super.polygonEnd(false, idx);
        }
    }

    private void beginPendingPoint(int size) throws GeoStreamException {
        if (pointPending) {
            pointPending = false;
            super.multiPointBegin(size, pointIdx);
        }
    }
}
