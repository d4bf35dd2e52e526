/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.stream;


import java.util.Objects;

import io.crums.ipld.Scalar;
import io.crums.ipld.path.NodePath;

/**
 * A recorded token.
 * 
 * @param path    the path prefix at emission time
 * @param type    the token type
 * @param payload per {@linkplain TokenType type}
 * 
 * @see TokenRecorder
 */
public record Token(NodePath path, TokenType type, Object payload) {
  
  public Token {
    Objects.requireNonNull(path, "null path");
    Objects.requireNonNull(type, "null type");
  }
  
  
  public static Token startMap(NodePath path) {
    return new Token(path, TokenType.START_MAP, null);
  }
  
  public static Token key(NodePath path, String key) {
    return new Token(path, TokenType.KEY, key);
  }
  
  public static Token endMap(NodePath path) {
    return new Token(path, TokenType.END_MAP, null);
  }
  
  public static Token startArray(NodePath path) {
    return new Token(path, TokenType.START_ARRAY, null);
  }
  
  public static Token index(NodePath path, int index) {
    return new Token(path, TokenType.INDEX, index);
  }
  
  public static Token endArray(NodePath path) {
    return new Token(path, TokenType.END_ARRAY, null);
  }
  
  public static Token value(NodePath path, Scalar value) {
    return new Token(path, TokenType.VALUE, value);
  }
  
  
  @Override
  public String toString() {
    return
        payload == null ?
            type + "@/" + path :
            type + "(" + payload + ")@/" + path;
  }

}
