/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.hash;


import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Specifies a hashing method.
 */
public interface Digest {
  
  
  /**
   * Returns the number of bytes used to form a hash.
   * 
   * @see MessageDigest#getDigestLength()
   */
  int hashWidth();
  
  
  /**
   * Returns the JCA name of the hashing algorithm, or {@code null} if
   * the JDK does not implement it.
   * 
   * @see MessageDigest#getAlgorithm()
   */
  String hashAlgo();
  
  
  /**
   * Determines whether {@linkplain #newDigest()} is supported.
   * 
   * @return {@code hashAlgo() != null}
   */
  default boolean isSupported() {
    return hashAlgo() != null;
  }
  
  
  /**
   * Creates and returns a new <code>MessageDigest</code>. The
   * returned instance matches this digest's algorithm and width.
   * 
   * @throws UnsupportedOperationException if {@code !isSupported()}
   */
  default MessageDigest newDigest() throws UnsupportedOperationException {
    String algo = hashAlgo();
    if (algo == null)
      throw new UnsupportedOperationException("no JDK implementation for " + this);
    try {
      
      MessageDigest digest = MessageDigest.getInstance(algo);
      assert digest.getDigestLength() == hashWidth();
      
      return digest;
      
    } catch (NoSuchAlgorithmException nsax) {
      throw new RuntimeException("on creating digest with algo " + algo, nsax);
    }
  }

}
