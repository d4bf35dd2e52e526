/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.json;


import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JSON read-interface for an entity.
 * 
 * @param <T> the entity type
 */
public interface JsonEntityReader<T> {

  
  /**
   * Returns the given JSON as the typed instance.
   * 
   * @throws JsonParsingException if the given object is malformed, or breaks the entity's grammar
   */
  T toEntity(JSONObject jObj) throws JsonParsingException;
  
  
  /**
   * Returns the given JSON input as a typed entity.
   * Invokes {@linkplain #toEntity(JSONObject)} after constructing a {@code JSONObject}
   * using the {@code json.simple} library.
   * 
   * @throws JsonParsingException if the given object is malformed, or if the given
   * JSON is not a single object and is in fact an array
   */
  default T toEntity(String json) throws JsonParsingException {
    try {
      return toEntity((JSONObject) new JSONParser().parse(json));
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + json, px);
    } catch (NumberFormatException nfx) {
      throw new JsonParsingException("numeral out of range: " + nfx.getMessage(), nfx);
    } catch (ClassCastException ccx) {
      throw new JsonParsingException(
          "not a JSON object: " + json.substring(0, Math.min(20, json.length())) + "...", ccx);
    }
  }
  

  /**
   * Returns the given JSON input as a typed entity.
   * Invokes {@linkplain #toEntity(JSONObject)} after constructing a {@code JSONObject}
   * using the {@code json.simple} library.
   * 
   * @throws JsonParsingException if the given object is malformed, or if the given
   * JSON is not a single object and is in fact an array
   * 
   * @throws UncheckedIOException {@code IOException}s are unchecked
   */
  default T toEntity(Reader reader) throws JsonParsingException, UncheckedIOException {
    try {
      return toEntity((JSONObject) new JSONParser().parse(reader));
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json", px);
    } catch (NumberFormatException nfx) {
      throw new JsonParsingException("numeral out of range: " + nfx.getMessage(), nfx);
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("not a JSON object", ccx);
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
  }
  
  
  default T toEntity(File file) throws JsonParsingException, UncheckedIOException {
    try (var reader = new FileReader(file, StandardCharsets.UTF_8)) {
      return toEntity(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException("on toEntity(file=" + file + "): " + iox , iox);
    }
  }
  
}
