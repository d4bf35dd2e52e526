/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;


/**
 * The closed set of value types in a document tree. Containers are
 * {@linkplain #NODE} and {@linkplain #LIST}; all others are scalars (leaves).
 * 
 * @see Value#getType()
 */
public enum ValueType {
  
  /**
   * String-keyed map. Modeled by {@linkplain Node}.
   */
  NODE,
  /**
   * Ordered sequence of values. Modeled by {@linkplain ListValue}.
   */
  LIST,
  /**
   * Text.
   */
  STRING,
  /**
   * Integral or floating point number.
   */
  NUMBER,
  /**
   * {@code true} or {@code false}.
   */
  BOOLEAN,
  /**
   * A null value is specially marked.
   */
  NULL,
  /**
   * Any other leaf value a decoder may produce (for eg, a byte string).
   * Traversals pass these through without inspecting them.
   */
  OPAQUE;
  
  
  public boolean isNode() {
    return this == NODE;
  }
  
  public boolean isList() {
    return this == LIST;
  }
  
  /**
   * Determines whether this is a leaf type.
   * 
   * @return {@code !isNode() && !isList()}
   */
  public boolean isScalar() {
    return this != NODE && this != LIST;
  }
  
  public boolean isString() {
    return this == STRING;
  }
  
  public boolean isNull() {
    return this == NULL;
  }

}
