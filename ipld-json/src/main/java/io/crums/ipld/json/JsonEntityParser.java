/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.json;


/**
 * A two-way {@code json.simple} codec for an entity type. {@linkplain NodeParser}
 * implements it for whole documents.
 * 
 * @param <T> the entity type
 * @see JsonNodeWriter streaming, key-sorted output
 */
public interface JsonEntityParser<T> extends JsonEntityWriter<T>, JsonEntityReader<T> {

}
