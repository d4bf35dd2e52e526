/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.hash;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class Base58Test {
  
  
  @Test
  public void testEmpty() {
    assertEquals("", Base58.encode(new byte[0]));
    assertEquals(0, Base58.decode("").length);
  }
  
  
  @Test
  public void testText() {
    byte[] hello = "Hello World!".getBytes(StandardCharsets.US_ASCII);
    assertEquals("2NEpo7TZRRrLZSi2U", Base58.encode(hello));
    assertArrayEquals(hello, Base58.decode("2NEpo7TZRRrLZSi2U"));
  }
  
  
  @Test
  public void testLeadingZeroes() {
    assertEquals("1", Base58.encode(new byte[1]));
    assertEquals("112", Base58.encode(new byte[] { 0, 0, 1 }));
    
    byte[] bytes = HexFormat.of().parseHex("0000287fb4cd");
    assertEquals("11233QC4", Base58.encode(bytes));
    assertArrayEquals(bytes, Base58.decode("11233QC4"));
  }
  
  
  @Test
  public void testIllegalChars() {
    for (var bad : new String[] { "0", "O", "I", "l", "abc+", "Qmé" })
      assertThrows(IllegalArgumentException.class, () -> Base58.decode(bad), bad);
  }

}
