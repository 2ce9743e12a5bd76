package ch.so.agi.geostream.wkb;

import ch.so.agi.geostream.CoordDimensions;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Encoding settings of a {@link WkbWriter}.
 *
 * @param dimensions axes written per coordinate, T and TM are never written
 * @param srid       spatial reference id or {@code null}
 * @param envelope   {@code [minx, maxx, miny, maxy(, minz, maxz)(, minm, maxm)]} or empty
 * @param byteOrder  byte order of all written numbers
 */
public record WkbWriteOptions(CoordDimensions dimensions, Integer srid, double[] envelope, ByteOrder byteOrder) {
    private static final double[] NO_ENVELOPE = new double[0];

    public WkbWriteOptions {
        Objects.requireNonNull(dimensions, "dimensions");
        Objects.requireNonNull(byteOrder, "byteOrder");
        envelope = envelope == null ? NO_ENVELOPE : envelope.clone();
        if (envelope.length != 0 && envelope.length != 4 && envelope.length != 6 && envelope.length != 8) {
            throw new IllegalArgumentException("envelope must have 0, 4, 6 or 8 values, got " + envelope.length);
        }
    }

    @Override
    public double[] envelope() {
        return envelope.clone();
    }

    boolean hasEnvelope() {
        return envelope.length > 0;
    }

    double envelopeValue(int index) {
        return envelope[index];
    }

    public static WkbWriteOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CoordDimensions dimensions;
        private Integer srid;
        private double[] envelope;
        private ByteOrder byteOrder;

        public Builder dimensions(CoordDimensions dimensions) {
            this.dimensions = Objects.requireNonNull(dimensions, "dimensions");
            return this;
        }

        public Builder srid(int srid) {
            this.srid = srid;
            return this;
        }

        public Builder envelope(double... envelope) {
            this.envelope = envelope;
            return this;
        }

        public Builder byteOrder(ByteOrder byteOrder) {
            this.byteOrder = Objects.requireNonNull(byteOrder, "byteOrder");
            return this;
        }

        public WkbWriteOptions build() {
            CoordDimensions resolvedDimensions = dimensions == null ? CoordDimensions.xy() : dimensions;
            ByteOrder resolvedOrder = byteOrder == null ? ByteOrder.LITTLE_ENDIAN : byteOrder;
            return new WkbWriteOptions(resolvedDimensions, srid, envelope, resolvedOrder);
        }
    }
}
