package ch.so.agi.geostream;

/**
 * Optional coordinate axes carried by a geometry stream. X and Y are always present.
 *
 * @param z  height
 * @param m  measurement
 * @param t  geodetic decimal year time
 * @param tm time nanosecond measurement, requires {@code t}
 */
public record CoordDimensions(boolean z, boolean m, boolean t, boolean tm) {
    private static final CoordDimensions XY = new CoordDimensions(false, false, false, false);
    private static final CoordDimensions XYZ = new CoordDimensions(true, false, false, false);
    private static final CoordDimensions XYM = new CoordDimensions(false, true, false, false);
    private static final CoordDimensions XYZM = new CoordDimensions(true, true, false, false);

    public CoordDimensions {
        if (tm && !t) {
            throw new IllegalArgumentException("Time measure (tm) requires time dimension (t)");
        }
    }

    public static CoordDimensions xy() {
        return XY;
    }

    public static CoordDimensions xyz() {
        return XYZ;
    }

    public static CoordDimensions xym() {
        return XYM;
    }

    public static CoordDimensions xyzm() {
        return XYZM;
    }

    public boolean isMultiDim() {
        return z || m || t || tm;
    }

    public CoordDimensions union(CoordDimensions other) {
        return new CoordDimensions(z || other.z, m || other.m, t || other.t, tm || other.tm);
    }
}
