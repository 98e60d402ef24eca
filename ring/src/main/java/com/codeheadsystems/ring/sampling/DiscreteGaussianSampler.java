package com.codeheadsystems.ring.sampling;

import java.security.SecureRandom;

/**
 * Samples integer vectors from a rounded Gaussian distribution centered at zero.
 */
public class DiscreteGaussianSampler {

  private final SecureRandom random;

  /**
   * Instantiates a new sampler.
   *
   * @param random the random source
   */
  public DiscreteGaussianSampler(SecureRandom random) {
    this.random = random;
  }

  /**
   * Draws {@code length} signed integers with the given standard deviation.
   *
   * @param length            number of samples
   * @param standardDeviation the standard deviation, positive
   * @return the samples
   */
  public long[] sample(int length, double standardDeviation) {
    if (!(standardDeviation > 0) || Double.isInfinite(standardDeviation)) {
      throw new IllegalArgumentException("Standard deviation must be positive and finite: " + standardDeviation);
    }
    long[] out = new long[length];
    for (int i = 0; i < length; i++) {
      out[i] = Math.round(random.nextGaussian() * standardDeviation);
    }
    return out;
  }
}
