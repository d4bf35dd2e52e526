/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;


import static io.crums.ipld.IpldConstants.LINK_KEY;

import java.util.Map;

import io.crums.ipld.hash.HashDecodeException;
import io.crums.ipld.hash.Multihash;

/**
 * A merkle-link to a target block. A link is represented by a JSON style map:
 * <pre>
 *    { "/": &lt;multihash&gt; }
 * </pre>
 * <p>
 * Links must have only a single entry (the link itself). To associate additional
 * properties with the link, nest the link inside a larger structure. Looking at a
 * whole filesystem node, for example, we might see something like:
 * </p>
 * <pre>
 *    {
 *      "foo": {
 *        "unixType": "dir",
 *        "unixMode": "0777",
 *        "link": { "/": &lt;multihash&gt; }
 *      },
 *      "bar": {
 *        "unixType": "file",
 *        "unixMode": "0755",
 *        "link": { "/": &lt;multihash&gt; }
 *      }
 *    }
 * </pre>
 * <p>
 * Instances are immutable copies of the node they were cast from
 * (see {@linkplain Links#linkCast(Value)}).
 * </p>
 */
public final class Link {
  
  /**
   * Creates and returns a new instance with the given link string.
   * 
   * @param linkString  the textual content-identifier (not {@code null})
   */
  public static Link of(String linkString) {
    return new Link(Map.of(LINK_KEY, Scalar.of(linkString)));
  }
  
  
  private final Map<String, Value> body;
  
  
  /**
   * Copies the given entries.
   */
  Link(Map<String, Value> body) {
    this.body = Map.copyOf(body);
  }
  
  
  /**
   * Returns the string value under the link key, which is the value we use
   * to store hashes.
   * 
   * @return the empty string, if the link key is absent or not a string
   */
  public String linkString() {
    Value value = body.get(LINK_KEY);
    return
        value != null && value.getType().isString() ?
            value.asScalar().stringValue() : "";
  }
  
  
  /**
   * Decodes and returns the {@linkplain #linkString() link string} as a
   * Base58-encoded multihash.
   * 
   * @throws HashDecodeException
   *         if the link string is empty, or is not a valid multihash encoding
   */
  public Multihash hash() throws HashDecodeException {
    String s = linkString();
    if (s.isEmpty())
      throw new HashDecodeException("no hash in link");
    return Multihash.fromB58String(s);
  }
  
  
  /**
   * Returns the link's entries.
   * 
   * @return read-only map
   */
  public Map<String, Value> body() {
    return body;
  }
  
  
  /**
   * Returns a new node with this link's entries.
   */
  public Node toNode() {
    var node = new Node();
    body.forEach(node::put);
    return node;
  }
  
  
  /**
   * Instances are equal if their entries are equal, irrespective of order.
   * Comparison is cheap, since a valid link holds a single scalar.
   */
  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Link other && other.body.equals(body);
  }
  

  @Override
  public int hashCode() {
    return body.hashCode();
  }
  
  
  @Override
  public String toString() {
    return toNode().toString();
  }

}
