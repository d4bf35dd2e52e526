/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.stream;


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import io.crums.ipld.path.NodePath;

/**
 * Records the tokens it is handed. The control returned for each token
 * is configurable (defaults to {@linkplain ReadControl#CONTINUE CONTINUE}).
 */
public class TokenRecorder implements TokenHandler<RuntimeException> {
  
  private final List<Token> tokens = new ArrayList<>();
  private final Function<Token, ReadControl> control;
  
  
  public TokenRecorder() {
    this(token -> ReadControl.CONTINUE);
  }
  
  
  /**
   * @param control decides the control returned for each recorded token
   */
  public TokenRecorder(Function<Token, ReadControl> control) {
    this.control = Objects.requireNonNull(control, "null control");
  }
  

  @Override
  public ReadControl onToken(NodePath path, TokenType type, Object payload) {
    var token = new Token(path, type, payload);
    tokens.add(token);
    return control.apply(token);
  }
  
  
  /**
   * Returns the tokens recorded so far.
   * 
   * @return read-only view
   */
  public List<Token> tokens() {
    return Collections.unmodifiableList(tokens);
  }

}
