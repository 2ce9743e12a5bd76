package ch.so.agi.geostream.processor;

/**
 * Caller-supplied X/Y transformation applied by {@link Reprojection}.
 */
@FunctionalInterface
public interface CoordinateTransform {
    double EARTH_RADIUS = 6378137.0;

    Transformed apply(double x, double y);

    /**
     * Longitude/latitude in degrees to spherical Web Mercator in meters.
     */
    static CoordinateTransform lonLatToMercator() {
        return (lon, lat) -> new Transformed(
                EARTH_RADIUS * Math.toRadians(lon),
                EARTH_RADIUS * Math.log(Math.tan(Math.PI * 0.25 + 0.5 * Math.toRadians(lat))));
    }

    record Transformed(double x, double y) {
    }
}
