/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.path;


import java.util.Objects;
import java.util.Optional;

import io.crums.ipld.Value;

/**
 * Resolves paths against document values.
 * 
 * <h2>Resolution Rules</h2>
 * <p>
 * Resolution proceeds segment by segment from the root:
 * </p>
 * <ul>
 * <li>On a node, the segment's text is looked up as a key.</li>
 * <li>On a list, the segment must be an unsigned decimal index, in bounds.</li>
 * <li>On a scalar, there is nothing left to descend into.</li>
 * </ul>
 * <p>
 * Any miss resolves to an empty result, never an exception.
 * </p>
 * <h2>Links Are Not Special</h2>
 * <p>
 * A link met mid-path is an ordinary map: its {@code "/"} key is descended into
 * like any other. Note this means a document that (illegally) nests a
 * {@code "/"}-keyed map directly under another {@code "/"} key, e.g.
 * </p>
 * <pre>
 *    { "test": { "/": { "/": "Qm..." } } }
 * </pre>
 * <p>
 * exposes the inner link at {@code "test/\/"}, one segment short of where it
 * appears to be. This ambiguity is inherent in the format and is left as-is.
 * </p>
 */
public class PathResolver {
  
  // never
  private PathResolver() {  }
  
  
  /**
   * Resolves the given slash-delimited path against {@code root}.
   * 
   * @param path  parsed per {@linkplain NodePath#parse(String)}
   * @return empty, if there is no value at the given path
   */
  public static Optional<Value> get(Value root, String path) {
    return get(root, NodePath.parse(path));
  }
  
  
  /**
   * Resolves the given path against {@code root}.
   * 
   * @return empty, if there is no value at the given path;
   *         {@code root}, if the path is empty
   */
  public static Optional<Value> get(Value root, NodePath path) {
    Value curr = Objects.requireNonNull(root, "null root");
    for (var seg : path.segments()) {
      var next = step(curr, seg);
      if (next.isEmpty())
        return next;
      curr = next.get();
    }
    return Optional.of(curr);
  }
  
  
  /**
   * Returns the value one step down from {@code curr}, if any.
   */
  public static Optional<Value> step(Value curr, PathSegment seg) {
    return switch (curr.getType()) {
    case NODE   -> curr.asNode().getValue(seg.text());
    case LIST   -> toIndex(seg).flatMap(curr.asList()::getValue);
    case STRING, NUMBER, BOOLEAN, NULL, OPAQUE
                -> Optional.empty();
    };
  }
  
  
  /**
   * Returns the segment as a sequence index, if it is one.
   */
  static Optional<Integer> toIndex(PathSegment seg) {
    if (seg instanceof PathSegment.Index index)
      return Optional.of(index.position());
    
    String text = seg.text();
    final int len = text.length();
    if (len == 0 || len > 10)
      return Optional.empty();
    for (int i = 0; i < len; ++i) {
      char c = text.charAt(i);
      if (c < '0' || c > '9')
        return Optional.empty();
    }
    long position = Long.parseLong(text);
    return
        position > Integer.MAX_VALUE ?
            Optional.empty() : Optional.of((int) position);
  }

}
