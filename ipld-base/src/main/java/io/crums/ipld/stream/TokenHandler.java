/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.stream;


import io.crums.ipld.path.NodePath;

/**
 * Consumer of the token stream a {@linkplain NodeReader} emits, typically
 * an encoder.
 * 
 * @param <X> the type of exception the handler may throw. It propagates,
 *            as-is, out of the read.
 */
@FunctionalInterface
public interface TokenHandler<X extends Exception> {
  
  
  /**
   * Handles the next token.
   * 
   * @param path    path to the map or array for {@code KEY}, {@code INDEX},
   *                and start/end tokens; path to the value itself for {@code VALUE}
   * @param type    the token type
   * @param payload per {@linkplain TokenType type}; {@code null} for start/end tokens
   * 
   * @return not {@code null}
   */
  ReadControl onToken(NodePath path, TokenType type, Object payload) throws X;

}
