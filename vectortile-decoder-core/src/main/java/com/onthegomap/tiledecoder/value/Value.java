package com.onthegomap.tiledecoder.value;

/**
 * A decoded feature property value from a layer's value dictionary.
 * <p>
 * Single-precision floats on the wire are promoted to {@link DoubleValue}, and zigzag-encoded {@code sint_value}
 * entries become {@link Int64Value}. Switch over {@link #kind()} to handle every variant.
 */
public sealed interface Value
  permits Value.StringValue, Value.DoubleValue, Value.Int64Value, Value.UInt64Value, Value.BoolValue,
  Value.NullValue {

  /** The singleton returned when a property is absent or a value message carries no recognised field. */
  Value NULL = NullValue.INSTANCE;

  enum Kind {
    STRING,
    DOUBLE,
    INT64,
    UINT64,
    BOOL,
    NULL
  }

  Kind kind();

  /**
   * Returns this value as a plain boxed java object: {@link String}, {@link Double}, {@link Long}, {@link Boolean} or
   * {@code null}. Unsigned 64-bit values are returned as the {@link Long} holding the same bits.
   */
  Object asObject();

  default boolean isNull() {
    return kind() == Kind.NULL;
  }

  static Value of(String value) {
    return new StringValue(value);
  }

  static Value of(double value) {
    return new DoubleValue(value);
  }

  static Value of(long value) {
    return new Int64Value(value);
  }

  static Value ofUnsigned(long bits) {
    return new UInt64Value(bits);
  }

  static Value of(boolean value) {
    return value ? BoolValue.TRUE : BoolValue.FALSE;
  }

  record StringValue(String value) implements Value {

    public StringValue {
      if (value == null) {
        throw new IllegalArgumentException("string value can not be null, use Value.NULL");
      }
    }

    @Override
    public Kind kind() {
      return Kind.STRING;
    }

    @Override
    public Object asObject() {
      return value;
    }

    @Override
    public String toString() {
      return '"' + value + '"';
    }
  }

  record DoubleValue(double value) implements Value {

    @Override
    public Kind kind() {
      return Kind.DOUBLE;
    }

    @Override
    public Object asObject() {
      return value;
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  record Int64Value(long value) implements Value {

    @Override
    public Kind kind() {
      return Kind.INT64;
    }

    @Override
    public Object asObject() {
      return value;
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  /** An unsigned 64-bit integer; {@code bits} is interpreted as unsigned. */
  record UInt64Value(long bits) implements Value {

    @Override
    public Kind kind() {
      return Kind.UINT64;
    }

    @Override
    public Object asObject() {
      return bits;
    }

    @Override
    public String toString() {
      return Long.toUnsignedString(bits);
    }
  }

  record BoolValue(boolean value) implements Value {

    private static final BoolValue TRUE = new BoolValue(true);
    private static final BoolValue FALSE = new BoolValue(false);

    @Override
    public Kind kind() {
      return Kind.BOOL;
    }

    @Override
    public Object asObject() {
      return value;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  final class NullValue implements Value {

    private static final NullValue INSTANCE = new NullValue();

    private NullValue() {}

    @Override
    public Kind kind() {
      return Kind.NULL;
    }

    @Override
    public Object asObject() {
      return null;
    }

    @Override
    public String toString() {
      return "null";
    }
  }
}
