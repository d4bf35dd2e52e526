/*
 * Copyright 2026 Babak Farhang
 */
/**
 * JSON encoding and decoding of documents. Parsing is done with {@code json.simple};
 * writing is driven off the document's token stream.
 */
package io.crums.ipld.json;
