/*
 * Copyright 2026 Babak Farhang
 */
/**
 * Paths into documents, and their resolution.
 */
package io.crums.ipld.path;
