package ch.so.agi.geostream.processor;

import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeomProcessor;
import java.util.Optional;

/**
 * Accumulates the X/Y bounds of all coordinates it sees. Used either as terminal consumer or as a transparent
 * decorator that forwards every event to its inner processor.
 */
public class BoundsProcessor extends ForwardingGeomProcessor {
    private double minX;
    private double minY;
    private double maxX;
    private double maxY;
    private boolean empty = true;

    public BoundsProcessor() {
        this(new GeomSink());
    }

    public BoundsProcessor(GeomProcessor inner) {
        super(inner);
    }

    /**
     * Bounds of the coordinates seen since construction or the last {@link #reset()}; empty when no coordinate was
     * seen.
     */
    public Optional<Bounds> bounds() {
        if (empty) {
            return Optional.empty();
        }
        return Optional.of(new Bounds(minX, minY, maxX, maxY));
    }

    public void reset() {
        empty = true;
    }

    @Override
    public void xy(double x, double y, int idx) throws GeoStreamException {
        extend(x, y);
        super.xy(x, y, idx);
    }

    @Override
    public void coordinate(double x, double y, Double z, Double m, Double t, Long tm, int idx)
            throws GeoStreamException {
        extend(x, y);
        super.coordinate(x, y, z, m, t, tm, idx);
    }

    private void extend(double x, double y) {
        if (Double.isNaN(x) || Double.isNaN(y)) {
            return;
        }
        if (empty) {
            minX = x;
            minY = y;
            maxX = x;
            maxY = y;
            empty = false;
            return;
        }
        if (x < minX) {
            minX = x;
        }
        if (x > maxX) {
            maxX = x;
        }
        if (y < minY) {
            minY = y;
        }
        if (y > maxY) {
            maxY = y;
        }
    }
}
