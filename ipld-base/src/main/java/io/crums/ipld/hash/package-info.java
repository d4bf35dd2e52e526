/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Content identifiers: multihashes and their Base58 text form.
 */
package io.crums.ipld.hash;
