/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.stream;


import static io.crums.ipld.stream.ReadControl.ABORT;
import static io.crums.ipld.stream.ReadControl.SKIP;

import java.lang.System.Logger.Level;
import java.util.List;
import java.util.Objects;

import io.crums.ipld.DepthLimitException;
import io.crums.ipld.IpldConstants;
import io.crums.ipld.ListValue;
import io.crums.ipld.Node;
import io.crums.ipld.Value;
import io.crums.ipld.path.NodePath;

/**
 * Streams a document as a sequence of {@linkplain TokenType tokens}, in the
 * order an encoder needs them. The traversal is depth-first, pre-order:
 * <ul>
 * <li>A {@linkplain Node} emits {@code START_MAP}, then for each key
 * {@code KEY(k)} followed by the value's tokens, then {@code END_MAP}.
 * Keys are emitted in {@linkplain Node#KEY_ORDER key order}, never in the node's
 * incidental iteration order; so the same logical document always streams the
 * same way.</li>
 * <li>A {@linkplain ListValue} emits {@code START_ARRAY}, then for each element
 * {@code INDEX(i)} followed by the element's tokens, then {@code END_ARRAY}.
 * Elements are emitted in stored order.</li>
 * <li>Anything else emits a single {@code VALUE}.</li>
 * </ul>
 * <h2>Control</h2>
 * <p>
 * The handler steers the traversal with its {@linkplain ReadControl return value}:
 * {@linkplain ReadControl#SKIP SKIP} suppresses a subtree,
 * {@linkplain ReadControl#ABORT ABORT} ends the traversal. Neither is an error:
 * both end in a normal return. An exception thrown by the handler propagates as-is.
 * </p>
 * <h2>Depth</h2>
 * <p>
 * Recursion is bounded by a configured {@linkplain #maxDepth() max depth} (the
 * root is at depth 1), since documents may come from untrusted input.
 * </p>
 */
public class NodeReader {
  
  private final int maxDepth;
  
  
  /**
   * Creates an instance with {@linkplain IpldConstants#DEFAULT_MAX_DEPTH}.
   */
  public NodeReader() {
    this(IpldConstants.DEFAULT_MAX_DEPTH);
  }
  
  
  /**
   * @param maxDepth &ge; 1
   */
  public NodeReader(int maxDepth) {
    this.maxDepth = IpldConstants.checkMaxDepth(maxDepth);
  }
  
  
  /** Returns the maximum nesting depth. */
  public int maxDepth() {
    return maxDepth;
  }
  
  
  /**
   * Streams the given value's tokens to the given handler.
   * 
   * @param root      the document (or any value)
   * @param handler   token consumer
   * 
   * @return how the read ended; both outcomes are successful
   * 
   * @throws X  if the handler throws it
   * @throws DepthLimitException if the document is nested deeper than {@linkplain #maxDepth()}
   */
  public <X extends Exception> ReadOutcome read(Value root, TokenHandler<X> handler)
      throws X, DepthLimitException {
    
    Objects.requireNonNull(root, "null root");
    Objects.requireNonNull(handler, "null handler");
    
    return
        read(root, handler, NodePath.ROOT, 1) ?
            ReadOutcome.COMPLETED : ReadOutcome.ABORTED;
  }
  
  
  /**
   * Returns the given value's tokens.
   */
  public List<Token> readAll(Value root) {
    var recorder = new TokenRecorder();
    read(root, recorder);
    return recorder.tokens();
  }
  
  
  
  /**
   * @return {@code false} iff aborted
   */
  private <X extends Exception> boolean read(
      Value curr, TokenHandler<X> handler, NodePath path, int depth) throws X {
    
    if (depth > maxDepth) {
      IpldConstants.sysLogger().log(
          Level.WARNING, "read aborted: max depth " + maxDepth + " exceeded");
      throw new DepthLimitException(maxDepth, path.toString());
    }
    
    return switch (curr.getType()) {
    case NODE   -> readNode(curr.asNode(), handler, path, depth);
    case LIST   -> readList(curr.asList(), handler, path, depth);
    case STRING, NUMBER, BOOLEAN, NULL, OPAQUE
                -> emit(handler, path, TokenType.VALUE, curr) != ABORT;
    };
  }
  
  
  private <X extends Exception> boolean readNode(
      Node node, TokenHandler<X> handler, NodePath path, int depth) throws X {
    
    var control = emit(handler, path, TokenType.START_MAP, null);
    if (control == ABORT)
      return false;
    
    if (control != SKIP) {
      // snapshot, in case the handler modifies the node
      for (var entry : node.sortedEntries()) {
        String key = entry.getKey();
        control = emit(handler, path, TokenType.KEY, key);
        if (control == ABORT)
          return false;
        if (control == SKIP)
          continue;
        if (!read(entry.getValue(), handler, path.append(key), depth + 1))
          return false;
      }
    }
    return emit(handler, path, TokenType.END_MAP, null) != ABORT;
  }
  
  
  private <X extends Exception> boolean readList(
      ListValue list, TokenHandler<X> handler, NodePath path, int depth) throws X {
    
    var control = emit(handler, path, TokenType.START_ARRAY, null);
    if (control == ABORT)
      return false;
    
    if (control != SKIP) {
      var elements = List.copyOf(list.values());
      for (int index = 0; index < elements.size(); ++index) {
        control = emit(handler, path, TokenType.INDEX, index);
        if (control == ABORT)
          return false;
        if (control == SKIP)
          continue;
        if (!read(elements.get(index), handler, path.append(index), depth + 1))
          return false;
      }
    }
    return emit(handler, path, TokenType.END_ARRAY, null) != ABORT;
  }
  
  
  private <X extends Exception> ReadControl emit(
      TokenHandler<X> handler, NodePath path, TokenType type, Object payload) throws X {
    
    var control = handler.onToken(path, type, payload);
    if (control == null)
      throw new NullPointerException("null control from handler on " + type + " at /" + path);
    if (control == ABORT)
      IpldConstants.sysLogger().log(
          Level.DEBUG, () -> "read aborted on " + type + " at /" + path);
    return control;
  }

}
