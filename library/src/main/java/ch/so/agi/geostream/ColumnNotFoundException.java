package ch.so.agi.geostream;

public class ColumnNotFoundException extends PropertyAccessException {
    public ColumnNotFoundException(String column) {
        super("column not found or null: " + column);
    }
}
