/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;


import static io.crums.ipld.IpldConstants.LINK_KEY;

import java.util.Map;
import java.util.Optional;

import io.crums.ipld.walk.LinkExtractor;

/**
 * Link recognition and extraction.
 */
public class Links {
  
  // never
  private Links() {  }
  
  
  /**
   * Checks whether a value is a link. For now we assume all links follow
   * <pre>
   *    { "/": "&lt;multihash&gt;" }
   * </pre>
   * 
   * @return {@code true} iff {@code v} is a node with exactly one entry, whose key
   *         is {@code "/"} and whose value is a string
   */
  public static boolean isLink(Value v) {
    if (v == null || !v.getType().isNode())
      return false;
    Node node = v.asNode();
    return
        node.size() == 1 &&
        node.getValue(LINK_KEY).filter(s -> s.getType().isString()).isPresent();
  }
  
  
  /**
   * Returns the given value as a link, if it is one. The returned instance
   * is a copy.
   * 
   * @see #isLink(Value)
   */
  public static Optional<Link> linkCast(Value v) {
    if (!isLink(v))
      return Optional.empty();
    
    return Optional.of(new Link(Map.of(LINK_KEY, v.asNode().getValue(LINK_KEY).get())));
  }
  
  
  /**
   * Walks the given node and returns all links found, in a flattened map.
   * The map keys use path notation, made up of the intervening keys. For example:
   * <pre>
   *    {
   *      "foo": {
   *        "quux": { "/": "Qmaaaa..." }
   *      },
   *      "bar": {
   *        "baz": { "/": "Qmbbbb..." }
   *      }
   *    }
   * </pre>
   * <p>would produce links:</p>
   * <pre>
   *    {
   *      "bar/baz": { "/": "Qmbbbb..." },
   *      "foo/quux": { "/": "Qmaaaa..." }
   *    }
   * </pre>
   * <p>
   * Keys are joined as-is (no escaping).
   * </p>
   * 
   * @return read-only map, sorted by path
   * @see LinkExtractor
   */
  public static Map<String, Link> extract(Node node) {
    return new LinkExtractor().extract(node);
  }

}
