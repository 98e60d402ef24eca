package com.codeheadsystems.ring.sampling;

import java.security.SecureRandom;

/**
 * Samples residues uniformly from [0, q).
 */
public class UniformSampler {

  private final SecureRandom random;

  /**
   * Instantiates a new sampler.
   *
   * @param random the random source
   */
  public UniformSampler(SecureRandom random) {
    this.random = random;
  }

  /**
   * Draws {@code length} residues uniformly modulo q.
   *
   * @param length number of residues
   * @param q      modulus, below 2^31
   * @return the residues
   */
  public long[] sample(int length, long q) {
    if (q < 2 || q > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Modulus out of range: " + q);
    }
    long[] out = new long[length];
    for (int i = 0; i < length; i++) {
      out[i] = random.nextInt((int) q);
    }
    return out;
  }
}
