package ch.so.agi.geostream;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Feature property value.
 *
 * <p>Values are handed to {@link PropertyProcessor#property} and are only valid during that call. Binary values
 * are read-only views on the producer's buffer; use {@link #binaryCopy()} to retain them.
 */
public final class ColumnValue {
    private final ColumnType type;
    private final Object value;

    private ColumnValue(ColumnType type, Object value) {
        this.type = type;
        this.value = Objects.requireNonNull(value, "value");
    }

    public static ColumnValue ofByte(byte value) {
        return new ColumnValue(ColumnType.BYTE, value);
    }

    public static ColumnValue ofUByte(int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("UByte out of range: " + value);
        }
        return new ColumnValue(ColumnType.UBYTE, value);
    }

    public static ColumnValue ofBool(boolean value) {
        return new ColumnValue(ColumnType.BOOL, value);
    }

    public static ColumnValue ofShort(short value) {
        return new ColumnValue(ColumnType.SHORT, value);
    }

    public static ColumnValue ofUShort(int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException("UShort out of range: " + value);
        }
        return new ColumnValue(ColumnType.USHORT, value);
    }

    public static ColumnValue ofInt(int value) {
        return new ColumnValue(ColumnType.INT, value);
    }

    public static ColumnValue ofUInt(long value) {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("UInt out of range: " + value);
        }
        return new ColumnValue(ColumnType.UINT, value);
    }

    public static ColumnValue ofLong(long value) {
        return new ColumnValue(ColumnType.LONG, value);
    }

    /**
     * @param value unsigned 64-bit value in two's complement representation
     */
    public static ColumnValue ofULong(long value) {
        return new ColumnValue(ColumnType.ULONG, value);
    }

    public static ColumnValue ofFloat(float value) {
        return new ColumnValue(ColumnType.FLOAT, value);
    }

    public static ColumnValue ofDouble(double value) {
        return new ColumnValue(ColumnType.DOUBLE, value);
    }

    public static ColumnValue ofString(String value) {
        return new ColumnValue(ColumnType.STRING, value);
    }

    public static ColumnValue ofJson(String value) {
        return new ColumnValue(ColumnType.JSON, value);
    }

    /**
     * @param value ISO-8601 date/time text
     */
    public static ColumnValue ofDateTime(String value) {
        return new ColumnValue(ColumnType.DATETIME, value);
    }

    public static ColumnValue ofBinary(ByteBuffer value) {
        return new ColumnValue(ColumnType.BINARY, value.asReadOnlyBuffer());
    }

    public static ColumnValue ofBinary(byte[] value) {
        return ofBinary(ByteBuffer.wrap(value));
    }

    public ColumnType type() {
        return type;
    }

    public byte asByte() throws ColumnTypeException {
        return (Byte) expect(ColumnType.BYTE);
    }

    public int asUByte() throws ColumnTypeException {
        return (Integer) expect(ColumnType.UBYTE);
    }

    public boolean asBool() throws ColumnTypeException {
        return (Boolean) expect(ColumnType.BOOL);
    }

    public short asShort() throws ColumnTypeException {
        return (Short) expect(ColumnType.SHORT);
    }

    public int asUShort() throws ColumnTypeException {
        return (Integer) expect(ColumnType.USHORT);
    }

    public int asInt() throws ColumnTypeException {
        return (Integer) expect(ColumnType.INT);
    }

    public long asUInt() throws ColumnTypeException {
        return (Long) expect(ColumnType.UINT);
    }

    public long asLong() throws ColumnTypeException {
        return (Long) expect(ColumnType.LONG);
    }

    public long asULong() throws ColumnTypeException {
        return (Long) expect(ColumnType.ULONG);
    }

    public float asFloat() throws ColumnTypeException {
        return (Float) expect(ColumnType.FLOAT);
    }

    public double asDouble() throws ColumnTypeException {
        return (Double) expect(ColumnType.DOUBLE);
    }

    /**
     * Text of a {@code STRING}, {@code JSON} or {@code DATETIME} value.
     */
    public String asText() throws ColumnTypeException {
        if (type == ColumnType.JSON || type == ColumnType.DATETIME) {
            return (String) value;
        }
        return (String) expect(ColumnType.STRING);
    }

    /**
     * Read-only view on the producer's buffer, valid only during the current property call.
     */
    public ByteBuffer binary() throws ColumnTypeException {
        return ((ByteBuffer) expect(ColumnType.BINARY)).duplicate();
    }

    public byte[] binaryCopy() throws ColumnTypeException {
        ByteBuffer view = binary();
        byte[] bytes = new byte[view.remaining()];
        view.get(bytes);
        return bytes;
    }

    /**
     * Retained copy of the value as the given Java type. {@code String} accepts every variant, numeric wrapper types
     * require the matching signed variant and {@code byte[]} requires a binary value.
     */
    public <T> T as(Class<T> javaType) throws ColumnTypeException {
        if (javaType == String.class) {
            return javaType.cast(toString());
        }
        if (javaType == byte[].class) {
            return javaType.cast(binaryCopy());
        }
        ColumnType expected = expectedType(javaType);
        return javaType.cast(expect(expected));
    }

    private static ColumnType expectedType(Class<?> javaType) {
        if (javaType == Byte.class) {
            return ColumnType.BYTE;
        }
        if (javaType == Boolean.class) {
            return ColumnType.BOOL;
        }
        if (javaType == Short.class) {
            return ColumnType.SHORT;
        }
        if (javaType == Integer.class) {
            return ColumnType.INT;
        }
        if (javaType == Long.class) {
            return ColumnType.LONG;
        }
        if (javaType == Float.class) {
            return ColumnType.FLOAT;
        }
        if (javaType == Double.class) {
            return ColumnType.DOUBLE;
        }
        throw new IllegalArgumentException("Unsupported property type: " + javaType.getName());
    }

    private Object expect(ColumnType expected) throws ColumnTypeException {
        if (type != expected) {
            throw new ColumnTypeException(expected, this);
        }
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ColumnValue that)) {
            return false;
        }
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return switch (type) {
            case ULONG -> Long.toUnsignedString((Long) value);
            case BINARY -> "[BINARY]";
            default -> value.toString();
        };
    }
}
