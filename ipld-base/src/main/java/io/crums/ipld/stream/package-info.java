/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Token streaming. A {@linkplain io.crums.ipld.stream.NodeReader NodeReader} walks
 * a document and hands each structural event to a
 * {@linkplain io.crums.ipld.stream.TokenHandler TokenHandler}, which steers the
 * walk via {@linkplain io.crums.ipld.stream.ReadControl ReadControl}. Encoders are
 * built on this.
 */
package io.crums.ipld.stream;
