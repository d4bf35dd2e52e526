/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.hash;


import java.util.Optional;

/**
 * Multihash function codes. Only the more common ones are listed; a
 * {@linkplain Multihash} with an unlisted code is still legal.
 */
public enum HashType implements Digest {
  
  SHA1(0x11, 20, "SHA-1"),
  SHA2_256(0x12, 32, "SHA-256"),
  SHA2_512(0x13, 64, "SHA-512"),
  SHA3_512(0x14, 64, "SHA3-512"),
  SHA3_384(0x15, 48, "SHA3-384"),
  SHA3_256(0x16, 32, "SHA3-256"),
  SHA3_224(0x17, 28, "SHA3-224"),
  /** Not implemented by the JDK. */
  BLAKE2B_256(0xb220, 32, null),
  /** Not implemented by the JDK. */
  BLAKE2B_512(0xb240, 64, null);
  
  
  /**
   * Returns the type with the given multihash code, if listed.
   */
  public static Optional<HashType> forCode(int code) {
    for (var type : values())
      if (type.code == code)
        return Optional.of(type);
    return Optional.empty();
  }
  
  
  private final int code;
  private final int width;
  private final String algo;
  
  private HashType(int code, int width, String algo) {
    this.code = code;
    this.width = width;
    this.algo = algo;
  }
  
  
  /** Returns the multihash function code. */
  public int code() {
    return code;
  }

  @Override
  public int hashWidth() {
    return width;
  }

  @Override
  public String hashAlgo() {
    return algo;
  }

}
