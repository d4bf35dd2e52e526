/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.json;


import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.function.Predicate;

import org.json.simple.JSONValue;

import io.crums.ipld.Scalar;
import io.crums.ipld.Value;
import io.crums.ipld.path.NodePath;
import io.crums.ipld.stream.NodeReader;
import io.crums.ipld.stream.ReadControl;
import io.crums.ipld.stream.TokenHandler;
import io.crums.ipld.stream.TokenType;

/**
 * Writes compact JSON from a {@linkplain NodeReader} token stream. Since the reader
 * emits keys in a fixed order, equal documents always encode to the same text.
 * 
 * <h2>Exclusions</h2>
 * <p>
 * An instance may be configured to exclude paths from the output (for eg, to
 * redact fields). Excluded map entries and array elements are
 * {@linkplain ReadControl#SKIP skipped}: nothing is written for them, and the
 * output remains well-formed.
 * </p>
 * <p>
 * Instances are single-use: one per document.
 * </p>
 */
public class JsonNodeWriter implements TokenHandler<IOException> {
  
  
  /**
   * Returns the given value as compact JSON.
   * 
   * @throws IllegalArgumentException if the value contains an opaque, or non-finite value
   */
  public static String toJson(Value value) {
    var out = new StringBuilder();
    try {
      new NodeReader().read(value, new JsonNodeWriter(out));
    } catch (IOException iox) {
      // StringBuilder does not throw
      throw new UncheckedIOException(iox);
    }
    return out.toString();
  }
  
  
  
  private final Appendable out;
  private final Predicate<NodePath> exclude;
  /** One entry per open container: whether a member has been written yet. */
  private final ArrayDeque<Boolean> members = new ArrayDeque<>();
  
  
  /**
   * Creates an instance that writes everything.
   */
  public JsonNodeWriter(Appendable out) {
    this(out, path -> false);
  }
  
  
  /**
   * @param out       the output
   * @param exclude   paths (of map entries, or array elements) to leave out
   */
  public JsonNodeWriter(Appendable out, Predicate<NodePath> exclude) {
    this.out = Objects.requireNonNull(out, "null out");
    this.exclude = Objects.requireNonNull(exclude, "null exclude");
  }
  
  

  @Override
  public ReadControl onToken(NodePath path, TokenType type, Object payload) throws IOException {
    switch (type) {
    case START_MAP:
      out.append('{');
      members.push(false);
      break;
    case KEY:
      String key = (String) payload;
      if (exclude.test(path.append(key)))
        return ReadControl.SKIP;
      separate();
      out.append('"').append(escape(key)).append("\":");
      break;
    case END_MAP:
      members.pop();
      out.append('}');
      break;
    case START_ARRAY:
      out.append('[');
      members.push(false);
      break;
    case INDEX:
      if (exclude.test(path.append((Integer) payload)))
        return ReadControl.SKIP;
      separate();
      break;
    case END_ARRAY:
      members.pop();
      out.append(']');
      break;
    case VALUE:
      writeScalar((Scalar) payload);
      break;
    }
    return ReadControl.CONTINUE;
  }
  
  
  private void separate() throws IOException {
    if (members.pop())
      out.append(',');
    members.push(true);
  }
  
  
  /**
   * Escapes per {@code json.simple}, minus its escaping of {@code '/'}
   * (which would litter every link key).
   */
  static String escape(String s) {
    return JSONValue.escape(s).replace("\\/", "/");
  }
  
  
  private void writeScalar(Scalar value) throws IOException {
    switch (value.getType()) {
    case STRING:
      out.append('"').append(escape(value.stringValue())).append('"');
      break;
    case NUMBER:
      out.append(NodeParser.checkFinite(value.numberValue()).toString());
      break;
    case BOOLEAN:
    case NULL:
      out.append(value.toString());
      break;
    default:
      throw new IllegalArgumentException("not representable in JSON: " + value);
    }
  }

}
