package ch.so.agi.geostream;

/**
 * Picks a single property, selected by name or by column index, and retains a copy of it as {@code T}. Stops the
 * property stream as soon as the column was seen: {@link #property} returns {@code true} for the matching column and
 * {@code false} for all others.
 */
public class PropertyLookup<T> implements PropertyProcessor {
    private final String name;
    private final int index;
    private final Class<T> javaType;
    private T value;
    private boolean found;

    private PropertyLookup(String name, int index, Class<T> javaType) {
        this.name = name;
        this.index = index;
        this.javaType = javaType;
    }

    public static <T> PropertyLookup<T> byName(String name, Class<T> javaType) {
        return new PropertyLookup<>(name, -1, javaType);
    }

    public static <T> PropertyLookup<T> byIndex(int index, Class<T> javaType) {
        return new PropertyLookup<>(null, index, javaType);
    }

    @Override
    public boolean property(int idx, String columnName, ColumnValue columnValue) throws GeoStreamException {
        boolean matches = name != null ? name.equals(columnName) : idx == index;
        if (!matches) {
            return false;
        }
        value = columnValue.as(javaType);
        found = true;
        return true;
    }

    public boolean found() {
        return found;
    }

    public T value() throws ColumnNotFoundException {
        if (!found) {
            throw new ColumnNotFoundException(name != null ? name : "#" + index);
        }
        return value;
    }
}
