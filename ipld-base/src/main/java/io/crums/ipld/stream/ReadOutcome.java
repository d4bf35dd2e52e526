/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.stream;

/**
 * How a successful {@linkplain NodeReader#read(io.crums.ipld.Value, TokenHandler) read}
 * ended.
 */
public enum ReadOutcome {
  
  /** Every value was closed. (Skipped values count as closed.) */
  COMPLETED,
  /** The handler returned {@linkplain ReadControl#ABORT ABORT}. */
  ABORTED;
  
  
  public boolean isCompleted() {
    return this == COMPLETED;
  }

}
