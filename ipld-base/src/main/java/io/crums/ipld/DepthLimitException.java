/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;

/**
 * Indicates a document is nested deeper than a traversal is allowed to go.
 * 
 * @see IpldConstants#DEFAULT_MAX_DEPTH
 */
@SuppressWarnings("serial")
public class DepthLimitException extends IpldException {
  
  private final int maxDepth;

  public DepthLimitException(int maxDepth) {
    super("nesting exceeds max depth " + maxDepth);
    this.maxDepth = maxDepth;
  }

  public DepthLimitException(int maxDepth, String path) {
    super("nesting exceeds max depth " + maxDepth + " at path '" + path + "'");
    this.maxDepth = maxDepth;
  }
  
  
  /**
   * Returns the depth limit that was exceeded.
   */
  public int maxDepth() {
    return maxDepth;
  }

}
