/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;


import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * Library constants.
 */
public class IpldConstants {
  
  // never
  private IpldConstants() {  }
  
  
  /**
   * Logger name.
   */
  public final static String LOG_NAME = "ipld";
  
  /**
   * Returns the library's system logger.
   * 
   * @return {@code System.getLogger(LOG_NAME)}
   */
  public static Logger sysLogger() {
    return System.getLogger(LOG_NAME);
  }
  
  
  /**
   * The reserved map key for merkle-links. A link is a map with exactly
   * this key, whose value is a string:
   * <pre>
   *    { "/": "QmZku7P7KeeHAnwMr6c4HveYfMzmtVinNXzibkiNbfDbPo" }
   * </pre>
   */
  public final static String LINK_KEY = "/";
  
  /**
   * Path segment separator.
   */
  public final static char PATH_SEPARATOR = '/';
  
  /**
   * Path escape character. The character immediately following it
   * is taken literally.
   */
  public final static char ESCAPE_CHAR = '\\';
  
  
  /**
   * System property name for overriding {@linkplain #DEFAULT_MAX_DEPTH}.
   */
  public final static String MAX_DEPTH_PROPERTY = "io.crums.ipld.maxDepth";
  
  /**
   * Built-in nesting limit, absent a {@linkplain #MAX_DEPTH_PROPERTY} override.
   */
  public final static int BUILTIN_MAX_DEPTH = 1024;
  
  /**
   * Default maximum nesting depth for traversals. Documents may come from
   * untrusted input, so the depth of any traversal is bounded.
   * 
   * @see #MAX_DEPTH_PROPERTY
   */
  public final static int DEFAULT_MAX_DEPTH = loadMaxDepth();
  
  
  private static int loadMaxDepth() {
    String prop = System.getProperty(MAX_DEPTH_PROPERTY);
    if (prop == null || prop.isBlank())
      return BUILTIN_MAX_DEPTH;
    try {
      int depth = Integer.parseInt(prop.trim());
      if (depth > 0)
        return depth;
    } catch (NumberFormatException ignore) {  }
    
    sysLogger().log(
        Level.WARNING,
        "ignoring illegal %s value '%s'; using %d"
        .formatted(MAX_DEPTH_PROPERTY, prop, BUILTIN_MAX_DEPTH));
    return BUILTIN_MAX_DEPTH;
  }
  
  
  /**
   * Checks the given max depth argument.
   * 
   * @return {@code maxDepth}
   * @throws IllegalArgumentException if {@code maxDepth < 1}
   */
  public static int checkMaxDepth(int maxDepth) {
    if (maxDepth < 1)
      throw new IllegalArgumentException("maxDepth " + maxDepth);
    return maxDepth;
  }

}
