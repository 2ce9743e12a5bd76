package ch.so.agi.geostream;

/**
 * Receives the events of a geometry stream. All methods have a no-op default, so an implementation only overrides
 * what it consumes.
 *
 * <p>Begin/end pairs nest strictly and carry the same {@code idx}, which is the zero-based position of the shape
 * within its immediate parent (ring within polygon, member within multi geometry or collection). Coordinates are only
 * delivered between a begin event and its matching end event. Throwing from any method aborts the producer.
 */
public interface GeomProcessor {
    /**
     * Additional dimensions requested when processing coordinates.
     */
    default CoordDimensions dimensions() {
        return CoordDimensions.xy();
    }

    /**
     * Whether producers should call {@link #coordinate} instead of {@link #xy}.
     */
    default boolean multiDim() {
        return dimensions().isMultiDim();
    }

    default void xy(double x, double y, int idx) throws GeoStreamException {
    }

    /**
     * Coordinate with all requested dimensions. Axes the source does not carry are {@code null}.
     */
    default void coordinate(double x, double y, Double z, Double m, Double t, Long tm, int idx)
            throws GeoStreamException {
    }

    /**
     * Next: xy/coordinate, or nothing for an empty point.
     */
    default void pointBegin(int idx) throws GeoStreamException {
    }

    default void pointEnd(int idx) throws GeoStreamException {
    }

    /**
     * Next: size * xy/coordinate.
     */
    default void multiPointBegin(int size, int idx) throws GeoStreamException {
    }

    default void multiPointEnd(int idx) throws GeoStreamException {
    }

    /**
     * An untagged LineString is either a polygon ring or a member of a MultiLineString.
     *
     * <p>Next: size * xy/coordinate.
     */
    default void lineStringBegin(boolean tagged, int size, int idx) throws GeoStreamException {
    }

    default void lineStringEnd(boolean tagged, int idx) throws GeoStreamException {
    }

    /**
     * Next: size * LineString (untagged).
     */
    default void multiLineStringBegin(int size, int idx) throws GeoStreamException {
    }

    default void multiLineStringEnd(int idx) throws GeoStreamException {
    }

    /**
     * An untagged Polygon is a member of a MultiPolygon or PolyhedralSurface.
     *
     * <p>Next: size * LineString (untagged) = rings.
     */
    default void polygonBegin(boolean tagged, int size, int idx) throws GeoStreamException {
    }

    default void polygonEnd(boolean tagged, int idx) throws GeoStreamException {
    }

    /**
     * Next: size * Polygon (untagged).
     */
    default void multiPolygonBegin(int size, int idx) throws GeoStreamException {
    }

    default void multiPolygonEnd(int idx) throws GeoStreamException {
    }

    /**
     * Next: size * tagged geometry of any type.
     */
    default void geometryCollectionBegin(int size, int idx) throws GeoStreamException {
    }

    default void geometryCollectionEnd(int idx) throws GeoStreamException {
    }

    /**
     * Next: size * xy/coordinate.
     */
    default void circularStringBegin(int size, int idx) throws GeoStreamException {
    }

    default void circularStringEnd(int idx) throws GeoStreamException {
    }

    /**
     * Next: size * CircularString or LineString (untagged).
     */
    default void compoundCurveBegin(int size, int idx) throws GeoStreamException {
    }

    default void compoundCurveEnd(int idx) throws GeoStreamException {
    }

    /**
     * Next: size * CircularString, CompoundCurve or LineString (untagged) = rings.
     */
    default void curvePolygonBegin(int size, int idx) throws GeoStreamException {
    }

    default void curvePolygonEnd(int idx) throws GeoStreamException {
    }

    /**
     * Next: size * CircularString, CompoundCurve or LineString (untagged).
     */
    default void multiCurveBegin(int size, int idx) throws GeoStreamException {
    }

    default void multiCurveEnd(int idx) throws GeoStreamException {
    }

    /**
     * Next: size * CurvePolygon or Polygon (untagged).
     */
    default void multiSurfaceBegin(int size, int idx) throws GeoStreamException {
    }

    default void multiSurfaceEnd(int idx) throws GeoStreamException {
    }

    /**
     * An untagged Triangle is a member of a TIN.
     *
     * <p>Next: size * LineString (untagged) = rings.
     */
    default void triangleBegin(boolean tagged, int size, int idx) throws GeoStreamException {
    }

    default void triangleEnd(boolean tagged, int idx) throws GeoStreamException {
    }

    /**
     * Next: size * Polygon (untagged).
     */
    default void polyhedralSurfaceBegin(int size, int idx) throws GeoStreamException {
    }

    default void polyhedralSurfaceEnd(int idx) throws GeoStreamException {
    }

    /**
     * Next: size * Triangle (untagged).
     */
    default void tinBegin(int size, int idx) throws GeoStreamException {
    }

    default void tinEnd(int idx) throws GeoStreamException {
    }
}
