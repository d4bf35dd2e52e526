/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered sequence of values. Mutable; not thread-safe.
 */
public final class ListValue implements Value {
  
  /**
   * Returns a new instance with the given elements, each converted
   * per {@linkplain Value#toInstance(Object)}.
   */
  public static ListValue of(Object... elements) {
    var list = new ListValue();
    for (var e : elements)
      list.add(Value.toInstance(e));
    return list;
  }
  
  
  private final List<Value> elements = new ArrayList<>();
  
  
  public ListValue() {  }
  

  @Override
  public ValueType getType() {
    return ValueType.LIST;
  }
  
  
  /**
   * Appends the given value.
   * 
   * @return {@code this}
   */
  public ListValue add(Value value) {
    elements.add(Objects.requireNonNull(value, "null value"));
    return this;
  }
  
  
  /**
   * Appends the given object, converted per {@linkplain Value#toInstance(Object)}.
   * 
   * @return {@code this}
   */
  public ListValue add(Object value) {
    return add(Value.toInstance(value));
  }
  
  
  /**
   * Replaces the element at the given index.
   * 
   * @return the replaced element
   */
  public Value set(int index, Value value) {
    return elements.set(index, Objects.requireNonNull(value, "null value"));
  }
  
  
  public Value remove(int index) {
    return elements.remove(index);
  }
  
  
  /**
   * Returns the element at the given index.
   * 
   * @throws IndexOutOfBoundsException
   */
  public Value get(int index) throws IndexOutOfBoundsException {
    return elements.get(index);
  }
  
  
  /**
   * Returns the element at the given index, if in bounds.
   */
  public Optional<Value> getValue(int index) {
    return
        index >= 0 && index < elements.size() ?
            Optional.of(elements.get(index)) :
            Optional.empty();
  }
  
  
  public int size() {
    return elements.size();
  }
  
  
  public boolean isEmpty() {
    return elements.isEmpty();
  }
  
  
  /**
   * Returns a read-only view of the elements, in stored order.
   */
  public List<Value> values() {
    return Collections.unmodifiableList(elements);
  }
  
  
  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof ListValue other && other.elements.equals(elements);
  }
  
  
  @Override
  public int hashCode() {
    return elements.hashCode();
  }
  
  
  @Override
  public String toString() {
    return elements.toString();
  }

}
