/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;


/**
 * Base exception in the <code>ipld</code> modules. Mostly thrown
 * as a result of malformed input.
 */
@SuppressWarnings("serial")
public class IpldException extends RuntimeException {

  public IpldException(String message) {
    super(message);
  }

  public IpldException(Throwable cause) {
    super(cause);
  }

  public IpldException(String message, Throwable cause) {
    super(message, cause);
  }

  public IpldException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
    super(message, cause, enableSuppression, writableStackTrace);
  }

}
