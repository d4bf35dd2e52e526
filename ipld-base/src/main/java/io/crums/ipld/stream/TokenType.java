/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.stream;


/**
 * Token types emitted by a {@linkplain NodeReader}. The payload handed to
 * the {@linkplain TokenHandler} depends on the type.
 */
public enum TokenType {
  
  /** Start of a map (node). No payload. */
  START_MAP,
  /** Map key. Payload is the key {@code String}. */
  KEY,
  /** End of a map. No payload. */
  END_MAP,
  /** Start of an array (list). No payload. */
  START_ARRAY,
  /** Array index. Payload is the {@code Integer} position. */
  INDEX,
  /** End of an array. No payload. */
  END_ARRAY,
  /** A leaf value. Payload is the {@linkplain io.crums.ipld.Scalar Scalar}. */
  VALUE;
  
  
  /**
   * Determines whether a {@linkplain ReadControl#SKIP SKIP} on this token type
   * suppresses anything.
   * 
   * @return {@code true} for {@code START_MAP, KEY, START_ARRAY, INDEX}
   */
  public boolean isSkippable() {
    return this == START_MAP || this == KEY || this == START_ARRAY || this == INDEX;
  }
  
  
  public boolean isStart() {
    return this == START_MAP || this == START_ARRAY;
  }
  
  public boolean isEnd() {
    return this == END_MAP || this == END_ARRAY;
  }

}
