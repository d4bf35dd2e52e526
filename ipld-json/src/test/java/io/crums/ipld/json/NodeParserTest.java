/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.json;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.ipld.DepthLimitException;
import io.crums.ipld.Link;
import io.crums.ipld.ListValue;
import io.crums.ipld.Node;
import io.crums.ipld.Scalar;
import io.crums.ipld.ValueType;

/**
 * 
 */
public class NodeParserTest {
  
  private final static String JSON =
      "{\"b\":[1,2.5,\"x\",null,true],\"a\":{\"/\":\"Qm\"},\"c\":{\"d\":{}}}";
  
  
  @Test
  public void testParse() {
    Node doc = NodeParser.INSTANCE.toEntity(JSON);
    
    assertEquals(3, doc.size());
    assertEquals(ValueType.LIST, doc.get("b").get().getType());
    assertEquals(Optional.of(Scalar.of(1)), doc.get("b/0"));
    assertEquals(Optional.of(Scalar.of(2.5)), doc.get("b/1"));
    assertEquals(Optional.of(Scalar.of("x")), doc.get("b/2"));
    assertEquals(Optional.of(Scalar.NULL), doc.get("b/3"));
    assertEquals(Optional.of(Scalar.TRUE), doc.get("b/4"));
    assertEquals(Optional.of(new Node()), doc.get("c/d"));
    
    var links = doc.links();
    assertEquals(1, links.size());
    assertEquals(Link.of("Qm"), links.get("a"));
  }
  
  
  @Test
  public void testToValue() {
    assertEquals(Scalar.NULL, NodeParser.INSTANCE.toValue(null));
    assertEquals(
        ListValue.of("a", 1L),
        NodeParser.INSTANCE.toValue(java.util.List.of("a", 1L)));
    assertThrows(
        JsonParsingException.class,
        () -> NodeParser.INSTANCE.toValue(new Object()));
  }
  
  
  @Test
  public void testNotAnObject() {
    assertThrows(JsonParsingException.class, () -> NodeParser.INSTANCE.toEntity("[1,2]"));
    assertThrows(JsonParsingException.class, () -> NodeParser.INSTANCE.toEntity("\"x\""));
  }
  
  
  @Test
  public void testMalformed() {
    assertThrows(JsonParsingException.class, () -> NodeParser.INSTANCE.toEntity("{"));
    assertThrows(JsonParsingException.class, () -> NodeParser.INSTANCE.toEntity("{\"a\":}"));
  }
  
  
  @Test
  public void testJsonObjectRoundTrip() {
    Node doc = NodeParser.INSTANCE.toEntity(JSON);
    var jObj = NodeParser.INSTANCE.toJsonObject(doc);
    assertEquals(doc, NodeParser.INSTANCE.toEntity(jObj));
    assertEquals(doc, NodeParser.INSTANCE.toEntity(jObj.toJSONString()));
  }
  
  
  @Test
  public void testDeeplyNested() {
    int depth = 100_000;
    String json = "{\"a\":" + "[".repeat(depth) + "]".repeat(depth) + "}";
    var x = assertThrows(JsonParsingException.class, () -> NodeParser.INSTANCE.toEntity(json));
    var cause = assertInstanceOf(DepthLimitException.class, x.getCause());
    assertEquals(NodeParser.INSTANCE.maxDepth(), cause.maxDepth());
  }
  
  
  @Test
  public void testMaxDepth() {
    var parser = new NodeParser(3);
    // object, list, list: 3 levels
    Node doc = parser.toEntity("{\"a\":[[1]]}");
    assertEquals(Optional.of(Scalar.of(1)), doc.get("a/0/0"));
    
    assertThrows(JsonParsingException.class, () -> parser.toEntity("{\"a\":[[[1]]]}"));
    assertThrows(JsonParsingException.class, () -> parser.toEntity("{\"a\":[{\"b\":{}}]}"));
    assertThrows(IllegalArgumentException.class, () -> new NodeParser(0));
  }
  
  
  @Test
  public void testReader() {
    Node doc = NodeParser.INSTANCE.toEntity(new StringReader(JSON));
    assertEquals(NodeParser.INSTANCE.toEntity(JSON), doc);
    
    assertThrows(
        JsonParsingException.class,
        () -> NodeParser.INSTANCE.toEntity(new StringReader("{\"a\":")));
    assertThrows(
        JsonParsingException.class,
        () -> NodeParser.INSTANCE.toEntity(new StringReader("[]")));
  }
  
  
  @Test
  public void testFileIsUtf8(@TempDir Path dir) throws IOException {
    String text = "\u00fcn\u00efc\u00f6d\u00e9 \u2713 \uD83D\uDE00";
    String json = "{\"" + text + "\":\"" + text + "\"}";
    Path file = dir.resolve("doc.json");
    Files.writeString(file, json, StandardCharsets.UTF_8);
    
    Node doc = NodeParser.INSTANCE.toEntity(file.toFile());
    assertEquals(new Node().put(text, text), doc);
  }
  
  
  @Test
  public void testMissingFile(@TempDir Path dir) {
    File missing = dir.resolve("missing.json").toFile();
    assertThrows(UncheckedIOException.class, () -> NodeParser.INSTANCE.toEntity(missing));
  }
  
  
  @Test
  public void testUnrepresentable() {
    var opaque = new Node().put("x", Scalar.opaque(new StringBuilder("?")));
    assertThrows(
        IllegalArgumentException.class,
        () -> NodeParser.INSTANCE.toJsonObject(opaque));
    
    var nan = new Node().put("x", Scalar.of(Double.NaN));
    assertThrows(
        IllegalArgumentException.class,
        () -> NodeParser.INSTANCE.toJsonObject(nan));
  }

}
