package ch.so.agi.geostream.processor;

import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;
import ch.so.agi.geostream.GeometryProcessingException;
import java.util.Objects;

/**
 * Transforms X/Y of every coordinate before forwarding it. Other axes and structural events pass unchanged.
 */
public class Reprojection extends ForwardingGeomProcessor {
    private final CoordinateTransform transform;

    public Reprojection(CoordinateTransform transform, GeomProcessor inner) {
        super(inner);
        this.transform = Objects.requireNonNull(transform, "transform");
    }

    @Override
    public void xy(double x, double y, int idx) throws GeoStreamException {
        CoordinateTransform.Transformed result = transform(x, y);
        super.xy(result.x(), result.y(), idx);
    }

    @Override
    public void coordinate(double x, double y, Double z, Double m, Double t, Long tm, int idx)
            throws GeoStreamException {
        CoordinateTransform.Transformed result = transform(x, y);
        super.coordinate(result.x(), result.y(), z, m, t, tm, idx);
    }

    private CoordinateTransform.Transformed transform(double x, double y) throws GeometryProcessingException {
        CoordinateTransform.Transformed result;
        try {
            result = transform.apply(x, y);
        } catch (RuntimeException e) {
            throw new GeometryProcessingException("transforming coordinate (" + x + " " + y + ")", e);
        }
        if (result == null || !Double.isFinite(result.x()) || !Double.isFinite(result.y())) {
            throw new GeometryProcessingException("coordinate (" + x + " " + y + ") cannot be transformed");
        }
        return result;
    }
}
