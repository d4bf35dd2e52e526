/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;


import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * A leaf value. Instances are immutable (opaque values excepted: these are
 * held by reference).
 * 
 * <h2>Number Equality</h2>
 * <p>
 * Integral numbers compare by value regardless of boxed type (so {@code 1}
 * equals {@code 1L}, and a {@code BigDecimal} with no fractional part, such as
 * {@code 1E+18}, counts as integral); likewise floating point numbers
 * ({@code 1.5f} equals {@code 1.5d}). An integral number never equals a
 * floating point one.
 * </p>
 */
public final class Scalar implements Value {
  
  /** The null value. */
  public final static Scalar NULL = new Scalar(ValueType.NULL, null);
  /** Boolean {@code true}. */
  public final static Scalar TRUE = new Scalar(ValueType.BOOLEAN, Boolean.TRUE);
  /** Boolean {@code false}. */
  public final static Scalar FALSE = new Scalar(ValueType.BOOLEAN, Boolean.FALSE);
  
  
  public static Scalar of(String value) {
    return new Scalar(ValueType.STRING, Objects.requireNonNull(value, "null string"));
  }
  
  
  public static Scalar of(Number value) {
    return new Scalar(ValueType.NUMBER, Objects.requireNonNull(value, "null number"));
  }
  
  
  public static Scalar of(long value) {
    return of(Long.valueOf(value));
  }
  
  
  public static Scalar of(boolean value) {
    return value ? TRUE : FALSE;
  }
  
  
  /**
   * Returns an opaque instance wrapping the given object.
   * 
   * @param value not {@code null}, and not itself a {@code Value}
   */
  public static Scalar opaque(Object value) {
    Objects.requireNonNull(value, "null opaque value");
    if (value instanceof Value)
      throw new IllegalArgumentException("not opaque: " + value);
    return new Scalar(ValueType.OPAQUE, value);
  }
  
  
  
  private final ValueType type;
  private final Object value;
  
  
  private Scalar(ValueType type, Object value) {
    this.type = type;
    this.value = value;
  }
  

  @Override
  public ValueType getType() {
    return type;
  }
  
  
  /**
   * Returns the wrapped Java value.
   * 
   * @return {@code null}, iff this is {@linkplain #NULL}
   */
  public Object getValue() {
    return value;
  }
  
  
  /**
   * Returns the string value, if this is a string.
   * 
   * @throws ClassCastException if not a string
   */
  public String stringValue() throws ClassCastException {
    return (String) value;
  }
  
  
  /**
   * Returns the numeric value, if this is a number.
   * 
   * @throws ClassCastException if not a number
   */
  public Number numberValue() throws ClassCastException {
    return (Number) value;
  }
  
  
  /**
   * Returns the boolean value, if this is a boolean.
   * 
   * @throws ClassCastException if not a boolean
   */
  public boolean booleanValue() throws ClassCastException {
    return (Boolean) value;
  }
  
  
  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (!(o instanceof Scalar other) || other.type != type)
      return false;
    
    return switch (type) {
    case NUMBER   -> numberKey((Number) value).equals(numberKey((Number) other.value));
    case OPAQUE   -> Objects.deepEquals(value, other.value);
    default       -> Objects.equals(value, other.value);
    };
  }
  
  
  @Override
  public int hashCode() {
    int hash = type.hashCode();
    return switch (type) {
    case NUMBER   -> hash * 31 + numberKey((Number) value).hashCode();
    case OPAQUE   ->
        hash * 31 +
        (value instanceof byte[] bytes ? Arrays.hashCode(bytes) : value.hashCode());
    default       -> hash * 31 + Objects.hashCode(value);
    };
  }
  
  
  /**
   * Normalizes the boxed type so that equal numbers compare equal.
   */
  private static Object numberKey(Number num) {
    if (num instanceof Long || num instanceof Integer ||
        num instanceof Short || num instanceof Byte)
      return num.longValue();
    
    if (num instanceof Double || num instanceof Float)
      return num.doubleValue();
    
    if (num instanceof BigDecimal dec) {
      dec = dec.stripTrailingZeros();
      if (dec.scale() > 0)
        return dec;
      // integral: normalize as a BigInteger, below
      num = dec.toBigIntegerExact();
    }
    
    if (num instanceof BigInteger big)
      return big.bitLength() < 64 ? (Object) big.longValue() : big;
    
    return num;
  }
  
  
  
  /**
   * Returns a JSON-like rendering. Not meant for serialization.
   */
  @Override
  public String toString() {
    return switch (type) {
    case STRING   -> quote((String) value);
    case NULL     -> "null";
    case OPAQUE   ->
        value instanceof byte[] bytes ?
            "<" + bytes.length + " bytes>" : "<" + value + ">";
    default       -> value.toString();
    };
  }
  
  
  static String quote(String str) {
    var out = new StringBuilder(str.length() + 2).append('"');
    for (int index = 0; index < str.length(); ++index) {
      char c = str.charAt(index);
      switch (c) {
      case '"':   out.append("\\\""); break;
      case '\\':  out.append("\\\\"); break;
      case '\n':  out.append("\\n");  break;
      default:    out.append(c);
      }
    }
    return out.append('"').toString();
  }

}
