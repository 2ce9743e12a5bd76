package ch.so.agi.geostream;

public class ColumnTypeException extends PropertyAccessException {
    private final ColumnType expected;
    private final ColumnType actual;

    public ColumnTypeException(ColumnType expected, ColumnValue actual) {
        super("expected a `" + expected + "` value but found `" + actual.type() + "(" + actual + ")`");
        this.expected = expected;
        this.actual = actual.type();
    }

    public ColumnType expected() {
        return expected;
    }

    public ColumnType actual() {
        return actual;
    }
}
