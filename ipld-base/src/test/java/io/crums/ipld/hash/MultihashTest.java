/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.hash;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class MultihashTest {
  
  private final static byte[] ABC = "abc".getBytes(StandardCharsets.US_ASCII);
  
  private final static String SHA256_ABC_HEX =
      "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";
  
  private final static String SHA256_ABC_B58 =
      "QmatYkNGZnELf8cAGdyJpUca2PyY4szai3RHyyWofNY1pY";
  
  
  @Test
  public void testSum() {
    var hash = Multihash.sum(HashType.SHA2_256, ABC);
    assertEquals(0x12, hash.code());
    assertEquals(Optional.of(HashType.SHA2_256), hash.type());
    assertEquals(32, hash.length());
    assertEquals(SHA256_ABC_HEX, HexFormat.of().formatHex(hash.digest()));
    assertEquals(SHA256_ABC_B58, hash.toB58String());
    assertEquals(SHA256_ABC_B58, hash.toString());
  }
  
  
  @Test
  public void testOtherTypes() {
    assertEquals(
        "5dt9TFNEH6mE4xDvoJqUouGqeXTbKr",
        Multihash.sum(HashType.SHA1, ABC).toB58String());
    assertEquals(
        "8VxDbq4MtJpdapHPC2SxLkUEJVMxZBxmgg176BpaBtsVFnqsQNoYyrgdJ2W7WgTfX2W8iWjjcvPd49wGeXCybtrX8z",
        Multihash.sum(HashType.SHA2_512, ABC).toB58String());
  }
  
  
  @Test
  public void testFromB58String() {
    var hash = Multihash.fromB58String(SHA256_ABC_B58);
    assertEquals(Multihash.sum(HashType.SHA2_256, ABC), hash);
    assertEquals(
        Multihash.sum(HashType.SHA2_256, ABC).hashCode(), hash.hashCode());
    assertTrue(hash.verify(ABC));
    assertFalse(hash.verify(new byte[0]));
  }
  
  
  @Test
  public void testBytesRoundTrip() {
    var hash = Multihash.sum(HashType.SHA3_256, ABC);
    byte[] bytes = hash.toBytes();
    assertEquals(0x16, bytes[0]);
    assertEquals(32, bytes[1]);
    assertEquals(34, bytes.length);
    assertEquals(hash, Multihash.fromBytes(bytes));
  }
  
  
  @Test
  public void testMultiByteVarint() {
    var hash = new Multihash(HashType.BLAKE2B_256.code(), new byte[32]);
    byte[] bytes = hash.toBytes();
    // 0xb220 takes 3 varint bytes
    assertEquals(3 + 1 + 32, bytes.length);
    assertEquals(hash, Multihash.fromBytes(bytes));
    assertThrows(UnsupportedOperationException.class, () -> hash.verify(ABC));
  }
  
  
  @Test
  public void testUnlistedCode() {
    var hash = new Multihash(0x99, new byte[] { 1, 2, 3 });
    assertTrue(hash.type().isEmpty());
    assertEquals(hash, Multihash.fromB58String(hash.toB58String()));
  }
  
  
  @Test
  public void testDigestCopied() {
    var hash = Multihash.sum(HashType.SHA2_256, ABC);
    hash.digest()[0] ^= 1;
    assertEquals(SHA256_ABC_B58, hash.toB58String());
  }
  
  
  @Test
  public void testMalformed() {
    assertThrows(HashDecodeException.class, () -> Multihash.fromB58String(""));
    assertThrows(HashDecodeException.class, () -> Multihash.fromB58String("Qm0"));
    assertThrows(HashDecodeException.class, () -> Multihash.fromB58String("Qm1"));
    assertThrows(
        HashDecodeException.class,
        () -> Multihash.fromB58String(SHA256_ABC_B58.substring(0, 30)));
    // trailing byte
    byte[] bytes = Multihash.sum(HashType.SHA2_256, ABC).toBytes();
    byte[] longer = java.util.Arrays.copyOf(bytes, bytes.length + 1);
    assertThrows(HashDecodeException.class, () -> Multihash.fromBytes(longer));
    // truncated varint
    assertThrows(
        HashDecodeException.class,
        () -> Multihash.fromBytes(new byte[] { (byte) 0x80, (byte) 0x80 }));
  }
  
  
  @Test
  public void testWrongWidth() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new Multihash(HashType.SHA2_256.code(), new byte[31]));
    assertThrows(
        HashDecodeException.class,
        () -> Multihash.fromBytes(new byte[] { 0x12, 2, 7, 7 }));
  }

}
