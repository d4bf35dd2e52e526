/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.stream;

/**
 * Control outcome returned by a {@linkplain TokenHandler}. These are not errors:
 * errors are thrown.
 */
public enum ReadControl {
  
  /** Carry on. */
  CONTINUE,
  /**
   * On a {@linkplain TokenType#KEY KEY} or {@linkplain TokenType#INDEX INDEX} token,
   * skip the associated value. On a {@linkplain TokenType#START_MAP START_MAP} or
   * {@linkplain TokenType#START_ARRAY START_ARRAY} token, skip its children (the
   * matching end token is still emitted). On any other token, same as
   * {@linkplain #CONTINUE}.
   */
  SKIP,
  /**
   * Stop the entire traversal. No further tokens are emitted.
   */
  ABORT;

}
