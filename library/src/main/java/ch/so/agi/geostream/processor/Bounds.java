package ch.so.agi.geostream.processor;

/**
 * Axis-aligned rectangle in X/Y.
 */
public record Bounds(double minX, double minY, double maxX, double maxY) {
    public Bounds {
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException("Invalid bounds: min must not exceed max");
        }
    }

    public static Bounds of(double x, double y) {
        return new Bounds(x, y, x, y);
    }

    public Bounds expand(double x, double y) {
        return new Bounds(Math.min(minX, x), Math.min(minY, y), Math.max(maxX, x), Math.max(maxY, y));
    }

    public Bounds expand(Bounds other) {
        return new Bounds(Math.min(minX, other.minX), Math.min(minY, other.minY),
                Math.max(maxX, other.maxX), Math.max(maxY, other.maxY));
    }

    /**
     * Shared boundaries count as intersection.
     */
    public boolean intersects(Bounds other) {
        return maxX >= other.minX && maxY >= other.minY && minX <= other.maxX && minY <= other.maxY;
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }
}
