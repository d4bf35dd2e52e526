/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.walk;


import static io.crums.ipld.IpldConstants.PATH_SEPARATOR;

import java.lang.System.Logger.Level;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;

import io.crums.ipld.DepthLimitException;
import io.crums.ipld.IpldConstants;
import io.crums.ipld.Node;
import io.crums.ipld.Value;

/**
 * Depth-first, pre-order walk over every {@linkplain Node} reachable from a root
 * node, including those inside lists. Children are visited in ascending key
 * (or index) order, but callers should not depend on the order.
 * 
 * <h2>Depth</h2>
 * <p>
 * The walk is driven off an explicit stack (not recursion), and nesting is bounded
 * by a configured {@linkplain #maxDepth() max depth}: the root is at depth 1.
 * </p>
 * 
 * @see NodeVisitor
 */
public class Walker {
  
  private final int maxDepth;
  
  
  /**
   * Creates an instance with {@linkplain IpldConstants#DEFAULT_MAX_DEPTH}.
   */
  public Walker() {
    this(IpldConstants.DEFAULT_MAX_DEPTH);
  }
  
  
  /**
   * @param maxDepth &ge; 1
   */
  public Walker(int maxDepth) {
    this.maxDepth = IpldConstants.checkMaxDepth(maxDepth);
  }
  
  
  /** Returns the maximum nesting depth. */
  public int maxDepth() {
    return maxDepth;
  }
  
  
  /**
   * Walks the given {@code root} node, visiting it first.
   * 
   * @return the first non-null result returned by the {@code visitor}, if any
   * @throws DepthLimitException if the document is nested deeper than {@linkplain #maxDepth()}
   */
  public <R> Optional<R> walk(Node root, NodeVisitor<R> visitor) throws DepthLimitException {
    Objects.requireNonNull(root, "null root");
    Objects.requireNonNull(visitor, "null visitor");
    
    var stack = new ArrayDeque<Frame>();
    stack.push(new Frame(root, "", 1));
    
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      
      switch (frame.value.getType()) {
      case NODE -> {
        Node node = frame.value.asNode();
        R result = visitor.visit(root, node, frame.path);
        if (result != null) {
          IpldConstants.sysLogger().log(
              Level.DEBUG, () -> "walk stopped at '" + frame.path + "'");
          return Optional.of(result);
        }
        // pushed in reverse, so they pop in order
        var keys = node.sortedKeys();
        for (int index = keys.size(); index-- > 0; ) {
          String key = keys.get(index);
          pushChild(stack, frame, key, node.getValue(key).get());
        }
      }
      case LIST -> {
        var elements = frame.value.asList().values();
        for (int index = elements.size(); index-- > 0; )
          pushChild(stack, frame, Integer.toString(index), elements.get(index));
      }
      case STRING, NUMBER, BOOLEAN, NULL, OPAQUE ->
          // scalars are never pushed
          throw new IllegalStateException("scalar frame at '" + frame.path + "'");
      }
    }
    return Optional.empty();
  }
  
  
  private void pushChild(ArrayDeque<Frame> stack, Frame parent, String segment, Value child) {
    if (child.getType().isScalar())
      return;
    
    String path =
        parent.path.isEmpty() ? segment : parent.path + PATH_SEPARATOR + segment;
    int depth = parent.depth + 1;
    if (depth > maxDepth) {
      IpldConstants.sysLogger().log(
          Level.WARNING, "walk aborted: max depth " + maxDepth + " exceeded");
      throw new DepthLimitException(maxDepth, path);
    }
    stack.push(new Frame(child, path, depth));
  }
  
  
  private record Frame(Value value, String path, int depth) {  }

}
