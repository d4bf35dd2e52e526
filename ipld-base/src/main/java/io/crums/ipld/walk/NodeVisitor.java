/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.walk;


import io.crums.ipld.Node;

/**
 * Callback for {@linkplain Walker#walk(Node, NodeVisitor)}.
 * 
 * @param <R> the type of result that stops the walk
 */
@FunctionalInterface
public interface NodeVisitor<R> {
  
  /**
   * Visits a node.
   * 
   * @param root    the node the walk started from
   * @param current the node being visited (the root, on the first visit)
   * @param path    the raw keys (and indexes) from {@code root} to {@code current},
   *                joined with {@code '/'}; empty for the root
   * 
   * @return {@code null} to continue the walk; otherwise the walk stops, and the
   *         returned value becomes its result
   */
  R visit(Node root, Node current, String path);

}
