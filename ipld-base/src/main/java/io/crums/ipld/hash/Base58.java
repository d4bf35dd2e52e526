/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.ipld.hash;


import java.util.Arrays;

/**
 * Base58 encoding using the Bitcoin alphabet. Leading zero bytes
 * are encoded as leading {@code '1'} characters.
 * <p>
 * Adapted from bitcoinj's {@code org.bitcoinj.core.Base58} (Apache License 2.0),
 * whose {@code divmod}-based encoder and decoder this class follows.
 * </p>
 */
public class Base58 {
  
  // never
  private Base58() {  }
  
  
  public final static String ALPHABET =
      "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
  
  private final static char ENCODED_ZERO = ALPHABET.charAt(0);
  
  private final static int[] INDEXES = new int[128];
  static {
    Arrays.fill(INDEXES, -1);
    for (int index = 0; index < ALPHABET.length(); ++index)
      INDEXES[ALPHABET.charAt(index)] = index;
  }
  
  
  /**
   * Returns the given bytes in Base58.
   */
  public static String encode(byte[] input) {
    if (input.length == 0)
      return "";
    
    int zeros = 0;
    while (zeros < input.length && input[zeros] == 0)
      ++zeros;
    
    // divmod below is destructive
    input = Arrays.copyOf(input, input.length);
    char[] encoded = new char[input.length * 2];
    int outputStart = encoded.length;
    for (int inputStart = zeros; inputStart < input.length; ) {
      encoded[--outputStart] = ALPHABET.charAt(divmod(input, inputStart, 256, 58));
      if (input[inputStart] == 0)
        ++inputStart;
    }
    while (outputStart < encoded.length && encoded[outputStart] == ENCODED_ZERO)
      ++outputStart;
    while (--zeros >= 0)
      encoded[--outputStart] = ENCODED_ZERO;
    
    return new String(encoded, outputStart, encoded.length - outputStart);
  }
  
  
  /**
   * Decodes and returns the given Base58 string.
   * 
   * @throws IllegalArgumentException if {@code input} contains a character not in the alphabet
   */
  public static byte[] decode(CharSequence input) throws IllegalArgumentException {
    final int len = input.length();
    if (len == 0)
      return new byte[0];
    
    byte[] input58 = new byte[len];
    for (int index = 0; index < len; ++index) {
      char c = input.charAt(index);
      int digit = c < 128 ? INDEXES[c] : -1;
      if (digit < 0)
        throw new IllegalArgumentException(
            "illegal Base58 char '" + c + "' at index " + index);
      input58[index] = (byte) digit;
    }
    
    int zeros = 0;
    while (zeros < len && input58[zeros] == 0)
      ++zeros;
    
    byte[] decoded = new byte[len];
    int outputStart = len;
    for (int inputStart = zeros; inputStart < len; ) {
      decoded[--outputStart] = (byte) divmod(input58, inputStart, 58, 256);
      if (input58[inputStart] == 0)
        ++inputStart;
    }
    while (outputStart < len && decoded[outputStart] == 0)
      ++outputStart;
    
    return Arrays.copyOfRange(decoded, outputStart - zeros, len);
  }
  
  
  /**
   * Divides the big-endian {@code number} (in the given {@code base}) by
   * {@code divisor} in place, starting at {@code firstDigit}.
   * 
   * @return the remainder
   */
  private static int divmod(byte[] number, int firstDigit, int base, int divisor) {
    int remainder = 0;
    for (int index = firstDigit; index < number.length; ++index) {
      int digit = number[index] & 0xff;
      int temp = remainder * base + digit;
      number[index] = (byte) (temp / divisor);
      remainder = temp % divisor;
    }
    return remainder;
  }

}
