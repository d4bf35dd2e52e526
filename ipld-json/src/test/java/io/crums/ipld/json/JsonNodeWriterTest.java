/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.json;


import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.crums.ipld.ListValue;
import io.crums.ipld.Node;
import io.crums.ipld.Scalar;
import io.crums.ipld.path.NodePath;
import io.crums.ipld.stream.NodeReader;

/**
 * 
 */
public class JsonNodeWriterTest {
  
  
  @Test
  public void testSortedKeys() {
    var map = new LinkedHashMap<String, Object>();
    map.put("b", 2);
    map.put("a", 1);
    map.put("c", ListValue.of("x", true, null));
    assertEquals(
        "{\"a\":1,\"b\":2,\"c\":[\"x\",true,null]}",
        JsonNodeWriter.toJson(Node.of(map)));
  }
  
  
  @Test
  public void testEmpty() {
    assertEquals("{}", JsonNodeWriter.toJson(new Node()));
    assertEquals("{\"a\":[]}", JsonNodeWriter.toJson(new Node().put("a", new ListValue())));
  }
  
  
  @Test
  public void testLink() {
    var doc = new Node().putLink("foo", "QmZku");
    assertEquals("{\"foo\":{\"/\":\"QmZku\"}}", JsonNodeWriter.toJson(doc));
  }
  
  
  @Test
  public void testEscapes() {
    var doc = new Node().put("a\"b", "c\\d/e\n");
    assertEquals("{\"a\\\"b\":\"c\\\\d/e\\n\"}", JsonNodeWriter.toJson(doc));
    assertEquals(doc, NodeParser.INSTANCE.toEntity(JsonNodeWriter.toJson(doc)));
  }
  
  
  @Test
  public void testParsedRoundTrip() {
    String json = "{\"a\":{\"/\":\"Qm\"},\"b\":[1,2.5,{\"c\":false}],\"d\":null}";
    assertEquals(json, JsonNodeWriter.toJson(NodeParser.INSTANCE.toEntity(json)));
  }
  
  
  @Test
  public void testExclude() throws IOException {
    var doc = new Node()
        .put("a", 1)
        .put("b", new Node().put("x", 2))
        .put("list", ListValue.of(1, 2, 3));
    var excluded = Set.of(
        NodePath.parse("b"),
        NodePath.ROOT.append("list").append(1));
    
    var out = new StringBuilder();
    new NodeReader().read(doc, new JsonNodeWriter(out, excluded::contains));
    assertEquals("{\"a\":1,\"list\":[1,3]}", out.toString());
  }
  
  
  @Test
  public void testExcludeFirst() throws IOException {
    var doc = new Node().put("a", 1).put("b", 2);
    var out = new StringBuilder();
    new NodeReader().read(doc, new JsonNodeWriter(out, NodePath.parse("a")::equals));
    assertEquals("{\"b\":2}", out.toString());
  }
  
  
  @Test
  public void testUnrepresentable() {
    assertThrows(
        IllegalArgumentException.class,
        () -> JsonNodeWriter.toJson(new Node().put("x", Scalar.opaque(new Object()))));
    assertThrows(
        IllegalArgumentException.class,
        () -> JsonNodeWriter.toJson(new Node().put("x", Double.POSITIVE_INFINITY)));
  }

}
