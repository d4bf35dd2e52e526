/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.path;


import static io.crums.ipld.IpldConstants.ESCAPE_CHAR;
import static io.crums.ipld.IpldConstants.PATH_SEPARATOR;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An address into a document: an ordered sequence of {@linkplain PathSegment}s.
 * 
 * <h2>Immutability</h2>
 * <p>
 * Instances are immutable. Appending returns a new instance that shares its
 * prefix with the receiver; the receiver is unaffected. So paths handed to
 * sibling branches of a traversal never observe each other's segments.
 * </p>
 * <h2>String Form</h2>
 * <p>
 * The string form joins segments with {@code '/'}. Within a segment, the
 * character immediately following a {@code '\'} is taken literally; so
 * {@code "a\/b/c"} has 2 segments, {@code "a/b"} and {@code "c"}.
 * </p>
 * 
 * @see #parse(String)
 * @see PathResolver
 */
public final class NodePath {
  
  /**
   * The empty path. Resolves to the root.
   */
  public final static NodePath ROOT = new NodePath(null, null);
  
  
  
  /**
   * Parses and returns the given slash-delimited path. Escaping rules:
   * <ul>
   * <li>A {@code '\'} makes the character that follows it literal (not a delimiter).</li>
   * <li>A trailing lone {@code '\'} is a literal backslash.</li>
   * <li>Empty segments are dropped: leading, trailing, and repeated
   * separators are ignored.</li>
   * </ul>
   * <p>
   * Every parsed segment is a {@linkplain PathSegment.Key Key}; on a sequence,
   * a key that is an unsigned decimal number is taken as an index.
   * </p>
   */
  public static NodePath parse(String path) {
    NodePath out = ROOT;
    final int len = path.length();
    var seg = new StringBuilder();
    for (int index = 0; index < len; ++index) {
      char c = path.charAt(index);
      if (c == ESCAPE_CHAR)
        seg.append(index + 1 < len ? path.charAt(++index) : c);
      
      else if (c == PATH_SEPARATOR) {
        if (seg.length() > 0) {
          out = out.append(seg.toString());
          seg.setLength(0);
        }
      } else
        seg.append(c);
    }
    if (seg.length() > 0)
      out = out.append(seg.toString());
    return out;
  }
  
  
  /**
   * Escapes the given key so that it parses as a single segment.
   * Separator and escape characters are prefixed with the escape character.
   */
  public static String escape(String key) {
    if (key.indexOf(PATH_SEPARATOR) == -1 && key.indexOf(ESCAPE_CHAR) == -1)
      return key;
    var out = new StringBuilder(key.length() + 4);
    for (int index = 0; index < key.length(); ++index) {
      char c = key.charAt(index);
      if (c == PATH_SEPARATOR || c == ESCAPE_CHAR)
        out.append(ESCAPE_CHAR);
      out.append(c);
    }
    return out.toString();
  }
  
  
  /**
   * Returns a path with the given segments.
   */
  public static NodePath of(PathSegment... segments) {
    return ROOT.append(Arrays.asList(segments));
  }
  
  
  
  
  private final NodePath parent;
  private final PathSegment last;
  private final int size;
  
  
  private NodePath(NodePath parent, PathSegment last) {
    this.parent = parent;
    this.last = last;
    this.size = parent == null ? 0 : parent.size + 1;
  }
  
  
  /**
   * Returns a new path with the given segment appended.
   */
  public NodePath append(PathSegment segment) {
    return new NodePath(this, Objects.requireNonNull(segment, "null segment"));
  }
  
  
  /**
   * Returns a new path with the given key appended.
   */
  public NodePath append(String key) {
    return append(new PathSegment.Key(key));
  }
  
  
  /**
   * Returns a new path with the given index appended.
   */
  public NodePath append(int index) {
    return append(new PathSegment.Index(index));
  }
  
  
  /**
   * Returns a new path with the given segments appended.
   */
  public NodePath append(List<PathSegment> segments) {
    NodePath out = this;
    for (var seg : segments)
      out = out.append(seg);
    return out;
  }
  
  
  /** Returns the number of segments. */
  public int size() {
    return size;
  }
  
  
  public boolean isRoot() {
    return size == 0;
  }
  
  
  /**
   * Returns the last segment, if any.
   */
  public Optional<PathSegment> last() {
    return Optional.ofNullable(last);
  }
  
  
  /**
   * Returns the path minus its last segment, if any.
   */
  public Optional<NodePath> parent() {
    return Optional.ofNullable(parent);
  }
  
  
  /**
   * Returns the segments, in order.
   * 
   * @return read-only list
   */
  public List<PathSegment> segments() {
    if (size == 0)
      return List.of();
    var list = new ArrayList<PathSegment>(size);
    for (NodePath p = this; p.size > 0; p = p.parent)
      list.add(p.last);
    Collections.reverse(list);
    return Collections.unmodifiableList(list);
  }
  
  
  
  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (!(o instanceof NodePath other) || other.size != size)
      return false;
    NodePath a = this, b = other;
    for (; a.size > 0; a = a.parent, b = b.parent) {
      if (a == b)
        return true;
      if (!a.last.equals(b.last))
        return false;
    }
    return true;
  }
  
  
  @Override
  public int hashCode() {
    return segments().hashCode();
  }
  
  
  /**
   * Returns the escaped, slash-joined form. {@linkplain #parse(String) Parsing}
   * the returned string yields an equal path, except that indexes parse as keys.
   */
  @Override
  public String toString() {
    if (size == 0)
      return "";
    var out = new StringBuilder();
    boolean first = true;
    for (var seg : segments()) {
      if (first)
        first = false;
      else
        out.append(PATH_SEPARATOR);
      out.append(seg);
    }
    return out.toString();
  }

}
