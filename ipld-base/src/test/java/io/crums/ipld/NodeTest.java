/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld;


import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class NodeTest {
  
  
  @Test
  public void testToInstance() {
    var map = new LinkedHashMap<String, Object>();
    map.put("s", "text");
    map.put("n", 7);
    map.put("b", false);
    map.put("nil", null);
    map.put("list", List.of(1, List.of()));
    map.put("arr", new int[] { 4, 5 });
    map.put("bytes", new byte[] { 9 });
    map.put("node", Map.of("k", "v"));
    
    Node node = Node.of(map);
    assertEquals(map.size(), node.size());
    assertEquals(Scalar.of("text"), node.getValue("s").get());
    assertEquals(ValueType.NUMBER, node.getValue("n").get().getType());
    assertEquals(Scalar.FALSE, node.getValue("b").get());
    assertEquals(Scalar.NULL, node.getValue("nil").get());
    assertEquals(ListValue.of(1, new ListValue()), node.getValue("list").get());
    assertEquals(ListValue.of(4, 5), node.getValue("arr").get());
    assertEquals(ValueType.OPAQUE, node.getValue("bytes").get().getType());
    assertEquals(new Node().put("k", "v"), node.getValue("node").get());
  }
  
  
  @Test
  public void testNonStringKey() {
    assertThrows(IllegalArgumentException.class, () -> Value.toInstance(Map.of(1, "one")));
  }
  
  
  @Test
  public void testNoJavaNulls() {
    var node = new Node();
    assertThrows(NullPointerException.class, () -> node.put(null, "x"));
    assertThrows(NullPointerException.class, () -> node.put("x", (Value) null));
    node.put("x", (Object) null);
    assertEquals(Scalar.NULL, node.getValue("x").get());
  }
  
  
  @Test
  public void testEqualsIgnoresOrder() {
    var a = new Node().put("x", 1).put("y", 2).put("z", 3);
    var b = new Node().put("z", 3).put("x", 1).put("y", 2);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, b.put("z", 4));
  }
  
  
  @Test
  public void testNumberEquality() {
    assertEquals(Scalar.of(1), Scalar.of(1L));
    assertEquals(Scalar.of(1).hashCode(), Scalar.of(1L).hashCode());
    assertEquals(Scalar.of(1.5f), Scalar.of(1.5d));
    assertEquals(Scalar.of(BigInteger.TEN), Scalar.of(10));
    assertEquals(Scalar.of(new BigDecimal("10.00")), Scalar.of(10L));
    assertNotEquals(Scalar.of(1), Scalar.of(1.0));
    assertNotEquals(Scalar.of(1), Scalar.of("1"));
  }
  
  
  @Test
  public void testIntegralBigDecimalEquality() {
    var big = new BigDecimal("1E+18");
    assertEquals(Scalar.of(big), Scalar.of(1_000_000_000_000_000_000L));
    assertEquals(Scalar.of(big).hashCode(), Scalar.of(1_000_000_000_000_000_000L).hashCode());
    assertEquals(Scalar.of(big), Scalar.of(BigInteger.TEN.pow(18)));
    
    // beyond the long range
    assertEquals(Scalar.of(new BigDecimal("1E+20")), Scalar.of(BigInteger.TEN.pow(20)));
    assertEquals(
        Scalar.of(new BigDecimal("1E+20")).hashCode(),
        Scalar.of(BigInteger.TEN.pow(20)).hashCode());
    
    assertEquals(Scalar.of(new BigDecimal("2.50")), Scalar.of(new BigDecimal("2.5")));
    assertNotEquals(Scalar.of(new BigDecimal("2.5")), Scalar.of(2L));
  }
  
  
  @Test
  public void testToInstanceDepthLimit() {
    var deepest = Value.toInstance(nestedLists(IpldConstants.DEFAULT_MAX_DEPTH));
    assertEquals(ValueType.LIST, deepest.getType());
    
    var x = assertThrows(
        DepthLimitException.class,
        () -> Value.toInstance(nestedLists(IpldConstants.DEFAULT_MAX_DEPTH + 1)));
    assertEquals(IpldConstants.DEFAULT_MAX_DEPTH, x.maxDepth());
    
    assertThrows(DepthLimitException.class, () -> Value.toInstance(nestedLists(100_000)));
  }
  
  
  @Test
  public void testToInstanceCyclic() {
    var map = new LinkedHashMap<String, Object>();
    map.put("a", 1);
    map.put("self", map);
    assertThrows(DepthLimitException.class, () -> Node.of(map));
  }
  
  
  /** Returns lists nested {@code depth} levels deep (the outermost is at level 1). */
  private static List<Object> nestedLists(int depth) {
    List<Object> root = new ArrayList<>();
    List<Object> curr = root;
    for (int level = 1; level < depth; ++level) {
      List<Object> next = new ArrayList<>();
      curr.add(next);
      curr = next;
    }
    curr.add("leaf");
    return root;
  }
  
  
  @Test
  public void testOpaqueEquality() {
    assertEquals(Scalar.opaque(new byte[] { 1, 2 }), Scalar.opaque(new byte[] { 1, 2 }));
    assertEquals(
        Scalar.opaque(new byte[] { 1, 2 }).hashCode(),
        Scalar.opaque(new byte[] { 1, 2 }).hashCode());
    assertNotEquals(Scalar.opaque(new byte[] { 1, 2 }), Scalar.opaque(new byte[] { 2, 1 }));
    assertThrows(IllegalArgumentException.class, () -> Scalar.opaque(Scalar.TRUE));
  }
  
  
  @Test
  public void testSortedKeys() {
    var node = new Node();
    for (var key : List.of("b", "a", "", "B", "ab", "aa"))
      node.put(key, key);
    assertEquals(List.of("", "B", "a", "aa", "ab", "b"), node.sortedKeys());
  }
  
  
  @Test
  public void testKeyOrderIsByteOrder() {
    // U+FF21 (fullwidth 'A') sorts before U+1F600 (an emoji) in UTF-8,
    // but after it in UTF-16
    String fullwidth = "\uFF21";
    String emoji = new String(Character.toChars(0x1F600));
    assertTrue(fullwidth.compareTo(emoji) > 0);
    
    var node = new Node().put(emoji, 1).put(fullwidth, 2);
    assertEquals(List.of(fullwidth, emoji), node.sortedKeys());
    
    var keys = new ArrayList<>(List.of(emoji, "z", fullwidth));
    keys.sort(Node.KEY_ORDER);
    assertEquals(List.of("z", fullwidth, emoji), keys);
  }
  
  
  @Test
  public void testToString() {
    var node = new Node()
        .put("b", ListValue.of(1, "x", null))
        .put("a", new Node().put("/", "Qm1"));
    assertEquals("{\"a\": {\"/\": \"Qm1\"}, \"b\": [1, \"x\", null]}", node.toString());
  }
  
  
  @Test
  public void testRemove() {
    var node = new Node().put("a", 1);
    assertEquals(Scalar.of(1), node.remove("a").get());
    assertTrue(node.isEmpty());
    assertTrue(node.remove("a").isEmpty());
  }

}
