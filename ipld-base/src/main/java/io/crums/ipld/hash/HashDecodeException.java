/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.hash;

import io.crums.ipld.IpldException;

/**
 * Indicates a content-identifier string (or its bytes) is malformed.
 * Note an <em>absent</em> identifier is not malformed.
 */
@SuppressWarnings("serial")
public class HashDecodeException extends IpldException {

  public HashDecodeException(String message) {
    super(message);
  }

  public HashDecodeException(Throwable cause) {
    super(cause);
  }

  public HashDecodeException(String message, Throwable cause) {
    super(message, cause);
  }

}
