package com.codeheadsystems.ring;

import com.codeheadsystems.ring.ntt.ModularArithmetic;

/**
 * Parameters of a residue-number-system polynomial ring Z_Q[X]/(X^N + 1) with a CKKS packing.
 *
 * @param ringDimension             N, a power of two
 * @param towerCount                number of prime moduli ("towers") whose product is Q
 * @param modulusBits               bit size bound of every tower modulus
 * @param scalingFactorBits         log2 of the CKKS scaling factor
 * @param batchSize                 number of packed slots, a power of two no larger than N/2
 * @param gaussianStandardDeviation default standard deviation of the error distribution
 */
public record RingParameters(int ringDimension,
                             int towerCount,
                             int modulusBits,
                             int scalingFactorBits,
                             int batchSize,
                             double gaussianStandardDeviation) {

  /**
   * Default standard deviation of the error distribution used throughout RLWE schemes.
   */
  public static final double DEFAULT_STANDARD_DEVIATION = 3.19;

  /**
   * Validates the combination.
   */
  public RingParameters {
    if (ringDimension < 8 || Integer.bitCount(ringDimension) != 1) {
      throw new IllegalArgumentException("Ring dimension must be a power of two >= 8: " + ringDimension);
    }
    if (towerCount < 1) {
      throw new IllegalArgumentException("At least one tower is required: " + towerCount);
    }
    if (modulusBits < 20 || modulusBits > ModularArithmetic.MAX_MODULUS_BITS) {
      throw new IllegalArgumentException("Modulus bits must be in [20, " + ModularArithmetic.MAX_MODULUS_BITS + "]: " + modulusBits);
    }
    if (batchSize < 1 || Integer.bitCount(batchSize) != 1 || batchSize > ringDimension / 2) {
      throw new IllegalArgumentException("Batch size must be a power of two <= " + (ringDimension / 2) + ": " + batchSize);
    }
    if (scalingFactorBits < 1 || scalingFactorBits > 60) {
      throw new IllegalArgumentException("Scaling factor bits must be in [1, 60]: " + scalingFactorBits);
    }
    // leave at least 10 bits of headroom above the scaling factor for the encoded values and noise
    if ((long) towerCount * (modulusBits - 1) < scalingFactorBits + 10L) {
      throw new IllegalArgumentException("Total modulus of " + towerCount + "x" + modulusBits
          + " bits is too small for a " + scalingFactorBits + "-bit scaling factor");
    }
    if (!(gaussianStandardDeviation > 0)) {
      throw new IllegalArgumentException("Standard deviation must be positive: " + gaussianStandardDeviation);
    }
  }

  /**
   * Number of slots the ring could pack at most.
   *
   * @return N / 2
   */
  public int maxSlots() {
    return ringDimension / 2;
  }

  /**
   * Starts a builder with the default parameters.
   *
   * @return the builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder with defaults: N = 4096, four 30-bit towers, 40-bit scaling factor, full packing.
   */
  public static class Builder {
    private int ringDimension = 4096;
    private int towerCount = 4;
    private int modulusBits = 30;
    private int scalingFactorBits = 40;
    private Integer batchSize;
    private double gaussianStandardDeviation = DEFAULT_STANDARD_DEVIATION;

    public Builder withRingDimension(int ringDimension) {
      this.ringDimension = ringDimension;
      return this;
    }

    public Builder withTowerCount(int towerCount) {
      this.towerCount = towerCount;
      return this;
    }

    public Builder withModulusBits(int modulusBits) {
      this.modulusBits = modulusBits;
      return this;
    }

    public Builder withScalingFactorBits(int scalingFactorBits) {
      this.scalingFactorBits = scalingFactorBits;
      return this;
    }

    public Builder withBatchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder withGaussianStandardDeviation(double gaussianStandardDeviation) {
      this.gaussianStandardDeviation = gaussianStandardDeviation;
      return this;
    }

    /**
     * Builds the parameters; the batch size defaults to N / 2 when unset.
     *
     * @return the ring parameters
     */
    public RingParameters build() {
      int slots = batchSize == null ? ringDimension / 2 : batchSize;
      return new RingParameters(ringDimension, towerCount, modulusBits, scalingFactorBits, slots,
          gaussianStandardDeviation);
    }
  }
}
