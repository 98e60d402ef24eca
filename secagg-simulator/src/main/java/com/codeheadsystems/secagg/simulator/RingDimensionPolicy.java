package com.codeheadsystems.secagg.simulator;

/**
 * Chooses the CKKS batch size and ring dimension for a data size. The batch size is the next power
 * of two holding the data; the ring dimension is twice the batch size, but never below the minimum.
 *
 * @param minimumRingDimension the smallest ring dimension to use, a power of two
 */
public record RingDimensionPolicy(int minimumRingDimension) {

  /**
   * The default minimum ring dimension.
   */
  public static final int DEFAULT_MINIMUM_RING_DIMENSION = 16384;

  public RingDimensionPolicy {
    if (minimumRingDimension < 8 || Integer.bitCount(minimumRingDimension) != 1) {
      throw new IllegalArgumentException("Minimum ring dimension must be a power of two >= 8: " + minimumRingDimension);
    }
  }

  public RingDimensionPolicy() {
    this(DEFAULT_MINIMUM_RING_DIMENSION);
  }

  /**
   * Smallest power of two greater than or equal to n.
   *
   * @param n a positive value no larger than 2^30
   * @return the power of two
   */
  public static int nextPowerOfTwo(int n) {
    if (n < 1 || n > (1 << 30)) {
      throw new IllegalArgumentException("Out of range: " + n);
    }
    return n == 1 ? 1 : Integer.highestOneBit(n - 1) << 1;
  }

  public int batchSize(int dataSize) {
    return nextPowerOfTwo(dataSize);
  }

  public int ringDimension(int dataSize) {
    return Math.max(minimumRingDimension, 2 * batchSize(dataSize));
  }
}
