/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.json;


import io.crums.ipld.IpldException;

/**
 * Thrown on malformed JSON, or JSON that does not map to a document
 * (for example, a top-level array where an object is expected).
 */
@SuppressWarnings("serial")
public class JsonParsingException extends IpldException {

  public JsonParsingException(String message) {
    super(message);
  }

  public JsonParsingException(Throwable cause) {
    super(cause);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
