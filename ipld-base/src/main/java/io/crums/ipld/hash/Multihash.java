/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.hash;


import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A self-describing hash: a function code, followed by the digest length,
 * followed by the digest itself. The code and length are unsigned varints.
 * <pre>
 *    &lt;code&gt;&lt;length&gt;&lt;digest&gt;
 * </pre>
 * <p>
 * In links, multihashes are written in {@linkplain Base58}; e.g.
 * {@code QmZku7P7KeeHAnwMr6c4HveYfMzmtVinNXzibkiNbfDbPo} is a SHA2-256 multihash.
 * </p>
 */
public final class Multihash {
  
  /**
   * Maximum digest length accepted on decoding.
   */
  public final static int MAX_DIGEST_LENGTH = 1024;
  
  
  /**
   * Computes and returns the multihash of the given {@code data}.
   * 
   * @throws UnsupportedOperationException if the JDK does not implement {@code type}
   */
  public static Multihash sum(HashType type, byte[] data) {
    byte[] digest = type.newDigest().digest(data);
    return new Multihash(type.code(), digest, false);
  }
  
  
  /**
   * Decodes and returns the given Base58 multihash string.
   * 
   * @throws HashDecodeException if {@code b58} is not valid Base58, or is not a
   *         well-framed multihash
   */
  public static Multihash fromB58String(String b58) throws HashDecodeException {
    byte[] bytes;
    try {
      bytes = Base58.decode(b58);
    } catch (IllegalArgumentException iax) {
      throw new HashDecodeException("malformed Base58 '" + b58 + "': " + iax.getMessage(), iax);
    }
    return fromBytes(bytes);
  }
  
  
  /**
   * Loads and returns an instance from its binary representation.
   * 
   * @param bytes {@code <code><length><digest>}, with nothing trailing
   * 
   * @throws HashDecodeException if malformed
   */
  public static Multihash fromBytes(byte[] bytes) throws HashDecodeException {
    if (bytes.length < 2)
      throw new HashDecodeException("too short for a multihash: " + bytes.length + " bytes");
    
    int[] pos = { 0 };
    long code = readUvarint(bytes, pos);
    long length = readUvarint(bytes, pos);
    
    if (code > Integer.MAX_VALUE)
      throw new HashDecodeException("function code out of bounds: " + code);
    if (length > MAX_DIGEST_LENGTH)
      throw new HashDecodeException("digest length out of bounds: " + length);
    
    int remaining = bytes.length - pos[0];
    if (remaining != length)
      throw new HashDecodeException(
          "digest length " + length + " does not match remaining bytes " + remaining);
    
    var type = HashType.forCode((int) code);
    if (type.isPresent() && type.get().hashWidth() != length)
      throw new HashDecodeException(
          type.get() + " digest length must be " + type.get().hashWidth() + "; actual: " + length);
    
    return new Multihash(
        (int) code, Arrays.copyOfRange(bytes, pos[0], bytes.length), false);
  }
  
  
  private static long readUvarint(byte[] bytes, int[] pos) {
    long value = 0;
    for (int shift = 0; shift < 63; shift += 7) {
      if (pos[0] == bytes.length)
        throw new HashDecodeException("truncated varint at offset " + pos[0]);
      int b = bytes[pos[0]++] & 0xff;
      value |= (long) (b & 0x7f) << shift;
      if ((b & 0x80) == 0)
        return value;
    }
    throw new HashDecodeException("varint overflow at offset " + pos[0]);
  }
  
  
  private static void writeUvarint(ByteArrayOutputStream out, long value) {
    while ((value & ~0x7fL) != 0) {
      out.write((int) ((value & 0x7f) | 0x80));
      value >>>= 7;
    }
    out.write((int) value);
  }
  
  
  
  
  private final int code;
  private final byte[] digest;
  
  
  /**
   * Creates an instance with the given code and digest.
   * 
   * @param code    non-negative function code
   * @param digest  the raw hash (copied); if {@code code} is
   *                {@linkplain HashType listed}, its length must match
   */
  public Multihash(int code, byte[] digest) {
    this(code, digest.clone(), true);
  }
  
  
  private Multihash(int code, byte[] digest, boolean check) {
    this.code = code;
    this.digest = digest;
    if (check) {
      if (code < 0)
        throw new IllegalArgumentException("negative code: " + code);
      if (digest.length > MAX_DIGEST_LENGTH)
        throw new IllegalArgumentException("digest too long: " + digest.length);
      var type = HashType.forCode(code);
      if (type.isPresent() && type.get().hashWidth() != digest.length)
        throw new IllegalArgumentException(
            type.get() + " digest length must be " + type.get().hashWidth() +
            "; actual: " + digest.length);
    }
  }
  
  
  /** Returns the multihash function code. */
  public int code() {
    return code;
  }
  
  
  /**
   * Returns the hash type, if the code is listed.
   */
  public Optional<HashType> type() {
    return HashType.forCode(code);
  }
  
  
  /**
   * Returns a copy of the raw digest.
   */
  public byte[] digest() {
    return digest.clone();
  }
  
  
  /**
   * Returns the digest length in bytes.
   */
  public int length() {
    return digest.length;
  }
  
  
  /**
   * Returns the binary representation.
   */
  public byte[] toBytes() {
    var out = new ByteArrayOutputStream(digest.length + 4);
    writeUvarint(out, code);
    writeUvarint(out, digest.length);
    out.writeBytes(digest);
    return out.toByteArray();
  }
  
  
  /**
   * Returns the Base58 encoding of the {@linkplain #toBytes() binary representation}.
   */
  public String toB58String() {
    return Base58.encode(toBytes());
  }
  
  
  /**
   * Determines whether this is the multihash of the given {@code data}.
   * 
   * @throws UnsupportedOperationException if the code is unlisted, or not implemented
   */
  public boolean verify(byte[] data) {
    var type = type().orElseThrow(
        () -> new UnsupportedOperationException("unlisted code: " + code));
    return Arrays.equals(digest, type.newDigest().digest(Objects.requireNonNull(data)));
  }
  
  
  @Override
  public boolean equals(Object o) {
    return
        o == this ||
        o instanceof Multihash other &&
        other.code == code &&
        Arrays.equals(other.digest, digest);
  }
  
  
  @Override
  public int hashCode() {
    return code * 31 + Arrays.hashCode(digest);
  }
  
  
  /**
   * @return {@code toB58String()}
   */
  @Override
  public String toString() {
    return toB58String();
  }

}
