package com.codeheadsystems.secagg.masking;

/**
 * Deterministically expands a key and nonce into a pseudorandom byte string.
 */
public interface PseudorandomExpander {

  /**
   * Required nonce length in bytes.
   *
   * @return the nonce length
   */
  int nonceLength();

  /**
   * Expands the key into {@code length} bytes. Equal inputs always give equal outputs.
   *
   * @param key    the key material
   * @param nonce  the nonce, {@link #nonceLength()} bytes
   * @param length number of bytes to produce
   * @return the keystream
   */
  byte[] expand(byte[] key, byte[] nonce, int length);
}
