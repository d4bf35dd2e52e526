/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Document data model for merkle-linked data. A document is a tree of
 * {@linkplain io.crums.ipld.Value Value}s rooted at a
 * {@linkplain io.crums.ipld.Node Node}; a node of the form
 * <code>{ "/": "&lt;multihash&gt;" }</code> is a {@linkplain io.crums.ipld.Link Link}
 * to another block.
 * 
 * @see io.crums.ipld.Links
 */
package io.crums.ipld;
