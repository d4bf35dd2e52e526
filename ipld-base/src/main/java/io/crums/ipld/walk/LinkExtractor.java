/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.walk;


import java.lang.System.Logger.Level;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import io.crums.ipld.IpldConstants;
import io.crums.ipld.Link;
import io.crums.ipld.Links;
import io.crums.ipld.Node;

/**
 * Walks a whole document and indexes its links by path.
 * 
 * <h2>Link Bodies</h2>
 * <p>
 * The walk does not stop at links: it need not, since a valid link's only value is
 * a string, so there are no nodes below it. A node with a {@code "/"} key and any
 * other key is not a link, and is walked like any other node.
 * </p>
 * 
 * @see Links#extract(Node)
 */
public class LinkExtractor {
  
  private final Walker walker;
  
  
  /**
   * Creates an instance using a default {@linkplain Walker}.
   */
  public LinkExtractor() {
    this(new Walker());
  }
  
  
  public LinkExtractor(Walker walker) {
    this.walker = Objects.requireNonNull(walker, "null walker");
  }
  
  
  /**
   * Returns the links in the given document, keyed by the raw keys leading to
   * them, joined with {@code '/'}. Keys are not escaped: a key {@code "\@foo"}
   * under {@code "bar"} yields the path {@code "bar/\@foo"}. A root that is itself
   * a link is keyed by the empty string.
   * 
   * @return read-only map, sorted by path
   */
  public SortedMap<String, Link> extract(Node node) {
    var links = new TreeMap<String, Link>();
    walker.walk(node, (root, curr, path) -> {
      Links.linkCast(curr).ifPresent(link -> links.put(path, link));
      return null;
    });
    IpldConstants.sysLogger().log(
        Level.TRACE, () -> "extracted " + links.size() + " link(s)");
    return Collections.unmodifiableSortedMap(links);
  }

}
