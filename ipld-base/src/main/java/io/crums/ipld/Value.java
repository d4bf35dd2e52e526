/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;


import java.lang.System.Logger.Level;
import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;

/**
 * A value in a document tree. The hierarchy is closed: a value is
 * either a {@linkplain Node}, a {@linkplain ListValue}, or a {@linkplain Scalar}.
 * Code that dispatches on the kind of value switches on {@linkplain #getType()}.
 */
public sealed interface Value permits Node, ListValue, Scalar {
  
  
  /**
   * Converts and returns the given object as a value. If the object is already
   * an instance of this class, then it is returned as-is.
   * 
   * <h4>Supported Object Types</h4>
   * <ul>
   * <li>{@code null}. Mapped to {@linkplain Scalar#NULL}.</li>
   * <li>{@code Map}. Keys must be strings. Converted to a {@linkplain Node}.</li>
   * <li>{@code Collection} or array (other than {@code byte[]}). Converted to a
   * {@linkplain ListValue}.</li>
   * <li>{@code CharSequence}, {@code Number}, {@code Boolean}. Converted to the
   * corresponding {@linkplain Scalar}.</li>
   * <li>Anything else (including {@code byte[]}) is wrapped as an
   * {@linkplain ValueType#OPAQUE opaque} scalar.</li>
   * </ul>
   * <p>
   * Conversion is deep (nested maps and collections are also converted), and
   * bounded by {@linkplain IpldConstants#DEFAULT_MAX_DEPTH}.
   * </p>
   * 
   * @throws IllegalArgumentException if a map has a non-string key
   * @throws DepthLimitException if {@code obj} is nested too deep (or is cyclic)
   */
  public static Value toInstance(Object obj)
      throws IllegalArgumentException, DepthLimitException {
    return toInstance(obj, 1);
  }
  
  
  private static Value toInstance(Object obj, int depth) {
    if (obj == null)
      return Scalar.NULL;
    
    else if (obj instanceof Value value)
      return value;
    
    else if (depth > IpldConstants.DEFAULT_MAX_DEPTH && isContainer(obj)) {
      IpldConstants.sysLogger().log(
          Level.WARNING,
          "conversion aborted: max depth " + IpldConstants.DEFAULT_MAX_DEPTH + " exceeded");
      throw new DepthLimitException(IpldConstants.DEFAULT_MAX_DEPTH);
    
    } else if (obj instanceof Map<?,?> map) {
      Node node = new Node();
      for (var e : map.entrySet()) {
        if (!(e.getKey() instanceof String key))
          throw new IllegalArgumentException("non-string map key: " + e.getKey());
        node.put(key, toInstance(e.getValue(), depth + 1));
      }
      return node;
    
    } else if (obj instanceof Collection<?> col) {
      ListValue list = new ListValue();
      for (var o : col)
        list.add(toInstance(o, depth + 1));
      return list;
    
    } else if (obj.getClass().isArray() && !(obj instanceof byte[])) {
      int len = Array.getLength(obj);
      ListValue list = new ListValue();
      for (int index = 0; index < len; ++index)
        list.add(toInstance(Array.get(obj, index), depth + 1));
      return list;
    
    } else if (obj instanceof CharSequence str)
      return Scalar.of(str.toString());
    
    else if (obj instanceof Number num)
      return Scalar.of(num);
    
    else if (obj instanceof Boolean bool)
      return Scalar.of(bool.booleanValue());
    
    else
      return Scalar.opaque(obj);
  }
  
  
  private static boolean isContainer(Object obj) {
    return
        obj instanceof Map || obj instanceof Collection ||
        obj.getClass().isArray() && !(obj instanceof byte[]);
  }
  
  
  /**
   * Returns the type of value.
   */
  ValueType getType();
  
  
  /**
   * Returns this value as a node, if it is one.
   * 
   * @throws ClassCastException if {@code !getType().isNode()}
   */
  default Node asNode() throws ClassCastException {
    return (Node) this;
  }
  
  
  /**
   * Returns this value as a list, if it is one.
   * 
   * @throws ClassCastException if {@code !getType().isList()}
   */
  default ListValue asList() throws ClassCastException {
    return (ListValue) this;
  }
  
  
  /**
   * Returns this value as a scalar, if it is one.
   * 
   * @throws ClassCastException if {@code !getType().isScalar()}
   */
  default Scalar asScalar() throws ClassCastException {
    return (Scalar) this;
  }

}
