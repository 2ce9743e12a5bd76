package ch.so.agi.geostream.gpkg;

import ch.so.agi.geostream.ColumnType;
import ch.so.agi.geostream.ColumnValue;
import ch.so.agi.geostream.FeatureAccess;
import ch.so.agi.geostream.FeatureProcessor;
import ch.so.agi.geostream.FeatureSource;
import ch.so.agi.geostream.GeoStreamException;
import ch.so.agi.geostream.GeoStreamIoException;
import ch.so.agi.geostream.GeomProcessor;
import ch.so.agi.geostream.PropertyProcessor;
import ch.so.agi.geostream.wkb.WkbDialect;
import ch.so.agi.geostream.wkb.WkbReader;
import java.sql.Blob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams the rows of a GeoPackage table as features. Every non-geometry column becomes a property, SQL NULL values
 * are skipped. The geometry is decoded from GeoPackage binary; a NULL geometry yields an empty geometry bracket.
 */
public class GeoPackageFeatureSource implements FeatureSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeoPackageFeatureSource.class);

    private final Connection connection;
    private final GeoPackageTable table;
    private final WkbReader wkbReader = new WkbReader(WkbDialect.GEOPACKAGE);

    public GeoPackageFeatureSource(Connection connection, GeoPackageTable table) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.table = Objects.requireNonNull(table, "table");
    }

    @Override
    public void process(FeatureProcessor processor) throws GeoStreamException {
        LOGGER.debug("Reading features of table {}", table.tableName());
        try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM " + quote(table.tableName()));
             ResultSet resultSet = statement.executeQuery()) {
            List<ColumnSpec> columns = buildColumns(resultSet.getMetaData(), table.geometryColumn());
            int geometryIndex = table.hasGeometry() ? resultSet.findColumn(table.geometryColumn()) : -1;
            processor.datasetBegin(table.tableName());
            RowFeature row = new RowFeature(resultSet, columns, geometryIndex);
            long rowIndex = 0;
            while (resultSet.next()) {
                row.process(processor, rowIndex);
                rowIndex++;
            }
            processor.datasetEnd();
            LOGGER.debug("Read {} features of table {}", rowIndex, table.tableName());
        } catch (SQLException e) {
            throw new GeoStreamIoException("Unable to read table " + table.tableName(), e);
        }
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static List<ColumnSpec> buildColumns(ResultSetMetaData metaData, String geometryColumn)
            throws SQLException {
        List<ColumnSpec> columns = new ArrayList<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            String name = metaData.getColumnName(i);
            if (name.equalsIgnoreCase(geometryColumn)) {
                continue;
            }
            int sqlType = metaData.getColumnType(i);
            columns.add(new ColumnSpec(i, name, sqlType, mapColumnType(sqlType)));
        }
        return columns;
    }

    /**
     * GeoPackage INTEGER is a 64-bit and REAL a double precision value.
     */
    static ColumnType mapColumnType(int sqlType) {
        return switch (sqlType) {
            case Types.TINYINT -> ColumnType.BYTE;
            case Types.SMALLINT -> ColumnType.SHORT;
            case Types.INTEGER, Types.BIGINT -> ColumnType.LONG;
            case Types.FLOAT, Types.REAL, Types.DOUBLE, Types.NUMERIC, Types.DECIMAL -> ColumnType.DOUBLE;
            case Types.BOOLEAN, Types.BIT -> ColumnType.BOOL;
            case Types.DATE, Types.TIME, Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> ColumnType.DATETIME;
            case Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB -> ColumnType.BINARY;
            default -> ColumnType.STRING;
        };
    }

    static ColumnValue toColumnValue(ColumnType type, Object value) throws SQLException {
        return switch (type) {
            case BYTE -> value instanceof Number n ? ColumnValue.ofByte(n.byteValue()) : asString(value);
            case SHORT -> value instanceof Number n ? ColumnValue.ofShort(n.shortValue()) : asString(value);
            case LONG -> value instanceof Number n ? ColumnValue.ofLong(n.longValue()) : asString(value);
            case DOUBLE -> value instanceof Number n ? ColumnValue.ofDouble(n.doubleValue()) : asString(value);
            case BOOL -> ColumnValue.ofBool(toBoolean(value));
            case DATETIME -> ColumnValue.ofDateTime(normalizeDateTime(value));
            case BINARY -> ColumnValue.ofBinary(asBinary(value));
            default -> asString(value);
        };
    }

    // SQLite columns are dynamically typed, a declared numeric column may hold text.
    private static ColumnValue asString(Object value) {
        return ColumnValue.ofString(value.toString());
    }

    private static String normalizeDateTime(Object value) {
        if (value instanceof java.sql.Timestamp timestamp) {
            return timestamp.toInstant().atOffset(ZoneOffset.UTC).toString();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        }
        if (value instanceof java.sql.Time time) {
            return time.toLocalTime().toString();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toString();
        }
        if (value instanceof java.util.Date date) {
            return Instant.ofEpochMilli(date.getTime()).atOffset(ZoneOffset.UTC).toString();
        }
        return value.toString();
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean booleanValue) {
            return booleanValue;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        return !value.toString().equalsIgnoreCase("false");
    }

    private static byte[] asBinary(Object value) throws SQLException {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof Blob blob) {
            return blob.getBytes(1, (int) blob.length());
        }
        throw new SQLException("Unsupported binary value: " + value.getClass());
    }

    private final class RowFeature implements FeatureAccess {
        private final ResultSet resultSet;
        private final List<ColumnSpec> columns;
        private final int geometryIndex;

        private RowFeature(ResultSet resultSet, List<ColumnSpec> columns, int geometryIndex) {
            this.resultSet = resultSet;
            this.columns = columns;
            this.geometryIndex = geometryIndex;
        }

        @Override
        public boolean processProperties(PropertyProcessor processor) throws GeoStreamException {
            try {
                for (int i = 0; i < columns.size(); i++) {
                    ColumnSpec column = columns.get(i);
                    Object value = resultSet.getObject(column.index());
                    if (value == null || resultSet.wasNull()) {
                        continue;
                    }
                    if (processor.property(i, column.name(), toColumnValue(column.columnType(), value))) {
                        return true;
                    }
                }
                return false;
            } catch (SQLException e) {
                throw new GeoStreamIoException("Unable to read properties of table " + table.tableName(), e);
            }
        }

        @Override
        public void process(GeomProcessor processor) throws GeoStreamException {
            if (geometryIndex < 0) {
                return;
            }
            byte[] bytes;
            try {
                bytes = resultSet.getBytes(geometryIndex);
            } catch (SQLException e) {
                throw new GeoStreamIoException("Unable to read geometry of table " + table.tableName(), e);
            }
            if (bytes != null) {
                wkbReader.process(bytes, processor);
            }
        }
    }

    record ColumnSpec(int index, String name, int sqlType, ColumnType columnType) {
    }
}
