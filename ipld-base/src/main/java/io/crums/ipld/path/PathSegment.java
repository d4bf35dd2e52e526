/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.path;


import java.util.Objects;

/**
 * A step in a {@linkplain NodePath}: either a map key, or a sequence index.
 */
public sealed interface PathSegment permits PathSegment.Key, PathSegment.Index {
  
  
  public static PathSegment key(String name) {
    return new Key(name);
  }
  
  
  public static PathSegment index(int position) {
    return new Index(position);
  }
  
  
  /**
   * Returns the raw (unescaped) text of this segment. For an index,
   * this is its decimal representation.
   */
  String text();
  
  
  
  /**
   * A map key. Any string, including the empty string, is legal.
   */
  public record Key(String name) implements PathSegment {
    
    public Key {
      Objects.requireNonNull(name, "null name");
    }

    @Override
    public String text() {
      return name;
    }
    
    @Override
    public String toString() {
      return NodePath.escape(name);
    }
  }
  
  
  /**
   * A sequence index.
   */
  public record Index(int position) implements PathSegment {
    
    public Index {
      if (position < 0)
        throw new IllegalArgumentException("negative position: " + position);
    }

    @Override
    public String text() {
      return Integer.toString(position);
    }
    
    @Override
    public String toString() {
      return text();
    }
  }

}
