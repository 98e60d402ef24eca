package com.codeheadsystems.secagg.mkckks;

import com.codeheadsystems.ring.RingParameters;

/**
 * Noise parameters of the multi-key CKKS layer.
 *
 * @param keyStandardDeviation      standard deviation of secrets, key noise and encryption noise
 * @param smudgingStandardDeviation standard deviation of the noise added to the partial decryption
 */
public record MkCkksParameters(double keyStandardDeviation, double smudgingStandardDeviation) {

  /**
   * Default smudging deviation, larger than the key deviation.
   */
  public static final double DEFAULT_SMUDGING_STANDARD_DEVIATION = 4.0;

  /**
   * The defaults.
   */
  public static final MkCkksParameters DEFAULT =
      new MkCkksParameters(RingParameters.DEFAULT_STANDARD_DEVIATION, DEFAULT_SMUDGING_STANDARD_DEVIATION);

  /**
   * Validates both deviations.
   */
  public MkCkksParameters {
    if (!(keyStandardDeviation > 0) || Double.isInfinite(keyStandardDeviation)) {
      throw new IllegalArgumentException("Key standard deviation must be positive: " + keyStandardDeviation);
    }
    if (!(smudgingStandardDeviation > 0) || Double.isInfinite(smudgingStandardDeviation)) {
      throw new IllegalArgumentException("Smudging standard deviation must be positive: " + smudgingStandardDeviation);
    }
  }

  public MkCkksParameters withSmudgingStandardDeviation(double smudgingStandardDeviation) {
    return new MkCkksParameters(keyStandardDeviation, smudgingStandardDeviation);
  }

  public MkCkksParameters withKeyStandardDeviation(double keyStandardDeviation) {
    return new MkCkksParameters(keyStandardDeviation, smudgingStandardDeviation);
  }
}
