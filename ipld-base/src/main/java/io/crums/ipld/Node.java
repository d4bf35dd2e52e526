/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;


import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.crums.ipld.path.PathResolver;
import io.crums.ipld.stream.NodeReader;
import io.crums.ipld.stream.ReadOutcome;
import io.crums.ipld.stream.TokenHandler;

/**
 * A document node: a mapping of string keys to {@linkplain Value}s. This is
 * the generic, schema-less tree value a decoder produces from (say) JSON or
 * CBOR. For example,
 * <pre>
 *    {
 *      "name": "foo",
 *      "size": 1024,
 *      "data": { "/": "QmZku7P7KeeHAnwMr6c4HveYfMzmtVinNXzibkiNbfDbPo" }
 *    }
 * </pre>
 * <p>
 * The {@code "/"} key denotes a merkle-link: the map containing it must consist
 * of only that one entry, and its value must be a string. (See {@linkplain Link}
 * and {@linkplain Links#isLink(Value)}.) To associate other properties with a link,
 * nest the link inside a larger structure, as with {@code "data"} above.
 * </p>
 * <h2>Ordering</h2>
 * <p>
 * The iteration order of a node's keys is incidental and must not be relied on.
 * Traversals that need a deterministic order (notably {@linkplain #read(TokenHandler)})
 * sort the keys themselves.
 * </p>
 * <h2>Mutability</h2>
 * <p>
 * Instances are mutable and not thread-safe. Java {@code null}s are never stored;
 * use {@linkplain Scalar#NULL}.
 * </p>
 */
public final class Node implements Value {
  
  
  /**
   * Converts the given map to a node.
   * 
   * @see Value#toInstance(Object)
   */
  public static Node of(Map<String, ?> map) {
    return (Node) Value.toInstance(Objects.requireNonNull(map, "null map"));
  }
  
  
  /**
   * Key order used wherever a deterministic order is needed. Strings are compared
   * code point by code point, which is the same as comparing their UTF-8 bytes.
   * (This differs from {@linkplain String#compareTo(String)} only for characters
   * outside the Basic Multilingual Plane.)
   */
  public final static Comparator<String> KEY_ORDER = Node::compareKeys;
  
  
  private static int compareKeys(String a, String b) {
    int i = 0, j = 0;
    while (i < a.length() && j < b.length()) {
      int ca = a.codePointAt(i);
      int cb = b.codePointAt(j);
      if (ca != cb)
        return Integer.compare(ca, cb);
      i += Character.charCount(ca);
      j += Character.charCount(cb);
    }
    return Integer.compare(a.length() - i, b.length() - j);
  }
  
  
  
  private final Map<String, Value> entries = new HashMap<>();
  
  
  /**
   * Creates an empty instance.
   */
  public Node() {  }
  

  @Override
  public ValueType getType() {
    return ValueType.NODE;
  }
  
  
  /**
   * Puts the given entry, replacing any existing one.
   * 
   * @param key     not {@code null}
   * @param value   not {@code null}
   * @return {@code this}
   */
  public Node put(String key, Value value) {
    entries.put(
        Objects.requireNonNull(key, "null key"),
        Objects.requireNonNull(value, "null value"));
    return this;
  }
  
  
  /**
   * Puts the given entry, replacing any existing one. The value
   * is converted per {@linkplain Value#toInstance(Object)}.
   * 
   * @return {@code this}
   */
  public Node put(String key, Object value) {
    return put(key, Value.toInstance(value));
  }
  
  
  /**
   * Puts a link entry. Equivalent to {@code put(key, Link.of(linkString).toNode())}.
   * 
   * @return {@code this}
   */
  public Node putLink(String key, String linkString) {
    return put(key, Link.of(linkString).toNode());
  }
  
  
  /**
   * Returns the value directly under the given key. This is a plain map
   * lookup: the key is not interpreted as a path.
   * 
   * @see #get(String)
   */
  public Optional<Value> getValue(String key) {
    return Optional.ofNullable(entries.get(key));
  }
  
  
  /**
   * Removes and returns the value under the given key, if any.
   */
  public Optional<Value> remove(String key) {
    return Optional.ofNullable(entries.remove(key));
  }
  
  
  public boolean containsKey(String key) {
    return entries.containsKey(key);
  }
  
  
  /** Returns the number of entries. */
  public int size() {
    return entries.size();
  }
  
  
  public boolean isEmpty() {
    return entries.isEmpty();
  }
  
  
  /**
   * Returns a read-only view of the keys, in no particular order.
   */
  public Set<String> keys() {
    return Collections.unmodifiableSet(entries.keySet());
  }
  
  
  /**
   * Returns the keys in ascending {@linkplain #KEY_ORDER key order}.
   * 
   * @return a new, modifiable list
   */
  public List<String> sortedKeys() {
    var keys = new ArrayList<>(entries.keySet());
    keys.sort(KEY_ORDER);
    return keys;
  }
  
  
  /**
   * Returns a snapshot of the entries in ascending {@linkplain #KEY_ORDER key order}.
   * 
   * @return a new, read-only list
   */
  public List<Map.Entry<String, Value>> sortedEntries() {
    var list = new ArrayList<Map.Entry<String, Value>>(entries.size());
    for (var key : sortedKeys())
      list.add(Map.entry(key, entries.get(key)));
    return Collections.unmodifiableList(list);
  }
  
  
  /**
   * Returns a read-only view of the entries, in no particular order.
   */
  public Set<Map.Entry<String, Value>> entries() {
    return Collections.unmodifiableMap(entries).entrySet();
  }
  
  
  
  /**
   * Resolves and returns the value at the given slash-delimited path.
   * 
   * @param path  e.g. {@code "foo/bar/0"}; use {@code '\'} to escape literal
   *              {@code '/'} characters in keys
   * @return empty, if there's no value at the given path
   * @see PathResolver#get(Value, String)
   */
  public Optional<Value> get(String path) {
    return PathResolver.get(this, path);
  }
  
  
  /**
   * Returns all the merkle-links in this document, in a flattened map. The map
   * keys are the slash-joined keys leading to each link. The entire document is
   * walked.
   * 
   * @return {@code Links.extract(this)}
   * @see Links#extract(Node)
   */
  public Map<String, Link> links() {
    return Links.extract(this);
  }
  
  
  /**
   * Streams this document's tokens to the given {@code handler} in
   * deterministic order.
   * 
   * @return {@code new NodeReader().read(this, handler)}
   * @see NodeReader
   */
  public <X extends Exception> ReadOutcome read(TokenHandler<X> handler) throws X {
    return new NodeReader().read(this, handler);
  }
  
  
  /**
   * Determines whether this node is a link.
   * 
   * @see Links#isLink(Value)
   */
  public boolean isLink() {
    return Links.isLink(this);
  }
  
  
  /**
   * Returns this node as a link, if it is one.
   * 
   * @see Links#linkCast(Value)
   */
  public Optional<Link> asLink() {
    return Links.linkCast(this);
  }
  
  
  
  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Node other && other.entries.equals(entries);
  }
  
  
  @Override
  public int hashCode() {
    return entries.hashCode();
  }
  
  
  /**
   * Returns a JSON-like rendering with sorted keys. Not meant for serialization.
   */
  @Override
  public String toString() {
    var out = new StringBuilder().append('{');
    boolean first = true;
    for (var key : sortedKeys()) {
      if (first)
        first = false;
      else
        out.append(", ");
      out.append(Scalar.quote(key)).append(": ").append(entries.get(key));
    }
    return out.append('}').toString();
  }

}
