package ch.so.agi.geostream.gpkg;

import ch.so.agi.geostream.GeoStreamIoException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the feature and attribute tables of a GeoPackage together with their geometry column.
 */
public class GeoPackageTableProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeoPackageTableProvider.class);

    private static final String TABLE_QUERY = """
            SELECT table_name
              FROM gpkg_contents
             WHERE data_type IN ('features', 'attributes')
            """;

    private static final String GEOMETRY_QUERY = """
            SELECT table_name,
                   column_name,
                   geometry_type_name,
                   srs_id
              FROM gpkg_geometry_columns
            """;

    private final List<String> tables;

    /**
     * @param tables tables to list, all tables if {@code null} or empty
     */
    public GeoPackageTableProvider(List<String> tables) {
        this.tables = tables == null ? Collections.emptyList() : List.copyOf(tables);
    }

    public List<GeoPackageTable> listTables(Connection connection) throws GeoStreamIoException {
        try {
            List<String> tableNames = loadTableNames(connection);
            validateTables(Set.copyOf(tableNames));

            Map<String, GeometryInfo> geometryInfo = loadGeometryInfo(connection, tableNames);
            List<GeoPackageTable> result = new ArrayList<>();
            for (String tableName : tableNames) {
                GeometryInfo info = geometryInfo.get(tableName);
                if (info == null) {
                    result.add(GeoPackageTable.attributes(tableName));
                } else {
                    result.add(new GeoPackageTable(tableName, info.columnName(), info.srid(), info.geometryType()));
                }
            }
            LOGGER.debug("Found GeoPackage tables {}", result);
            return result;
        } catch (SQLException e) {
            throw new GeoStreamIoException("Unable to read GeoPackage table metadata", e);
        }
    }

    private List<String> loadTableNames(Connection connection) throws SQLException {
        List<String> tableNames = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(buildTableQuery())) {
            bindTableNames(statement, tables);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    tableNames.add(resultSet.getString("table_name"));
                }
            }
        }
        return tableNames;
    }

    private Map<String, GeometryInfo> loadGeometryInfo(Connection connection, List<String> tableNames)
            throws SQLException {
        if (tableNames.isEmpty()) {
            return Map.of();
        }
        Map<String, GeometryInfo> geometryInfo = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(buildGeometryQuery(tableNames))) {
            bindTableNames(statement, tableNames);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    geometryInfo.put(resultSet.getString("table_name"), new GeometryInfo(
                            resultSet.getString("column_name"),
                            resultSet.getString("geometry_type_name"),
                            resultSet.getInt("srs_id")));
                }
            }
        }
        return geometryInfo;
    }

    private String buildTableQuery() {
        if (tables.isEmpty()) {
            return TABLE_QUERY;
        }
        return TABLE_QUERY + " AND table_name IN (" + placeholders(tables) + ")";
    }

    private static String buildGeometryQuery(List<String> tableNames) {
        return GEOMETRY_QUERY + " WHERE table_name IN (" + placeholders(tableNames) + ")";
    }

    private static String placeholders(List<String> names) {
        return names.stream().map(value -> "?").collect(Collectors.joining(", "));
    }

    private static void bindTableNames(PreparedStatement statement, List<String> names) throws SQLException {
        for (int index = 0; index < names.size(); index++) {
            statement.setString(index + 1, names.get(index));
        }
    }

    private void validateTables(Set<String> foundTables) throws GeoStreamIoException {
        if (tables.isEmpty()) {
            return;
        }
        List<String> missing = tables.stream().filter(table -> !foundTables.contains(table)).toList();
        if (!missing.isEmpty()) {
            throw new GeoStreamIoException("Unknown table(s) requested: " + String.join(", ", missing));
        }
    }

    private record GeometryInfo(String columnName, String geometryType, int srid) {
    }
}
