package ch.so.agi.geostream.gpkg;

import java.util.Objects;

public final class GeoPackageTable {
    private final String tableName;
    private final String geometryColumn;
    private final int srid;
    private final String geometryTypeName;

    public GeoPackageTable(String tableName, String geometryColumn, int srid, String geometryTypeName) {
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.geometryColumn = geometryColumn;
        this.srid = srid;
        this.geometryTypeName = geometryTypeName;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Name of the geometry column, {@code null} for attribute tables.
     */
    public String geometryColumn() {
        return geometryColumn;
    }

    public boolean hasGeometry() {
        return geometryColumn != null && !geometryColumn.isBlank();
    }

    public int srid() {
        return srid;
    }

    public String geometryTypeName() {
        return geometryTypeName;
    }

    public static GeoPackageTable attributes(String tableName) {
        return new GeoPackageTable(tableName, null, 0, null);
    }

    @Override
    public String toString() {
        return hasGeometry() ? tableName + "(" + geometryColumn + " " + geometryTypeName + ", " + srid + ")"
                : tableName;
    }
}
