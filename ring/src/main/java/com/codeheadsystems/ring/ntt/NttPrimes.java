package com.codeheadsystems.ring.ntt;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Finds primes that support a negacyclic number-theoretic transform of a given length, and the
 * primitive roots of unity the transform needs.
 */
public class NttPrimes {

  private static final int CERTAINTY = 64;

  private NttPrimes() {
  }

  /**
   * Returns {@code count} distinct primes q with q = 1 (mod 2N) and q < 2^bits, searching downward
   * from 2^bits so the largest candidates come first. The search is deterministic: the same
   * arguments always produce the same moduli.
   *
   * @param ringDimension N, a power of two
   * @param bits          bit size bound of each prime
   * @param count         number of primes
   * @return the primes, in descending order
   */
  public static long[] generate(int ringDimension, int bits, int count) {
    if (bits < 2 || bits > ModularArithmetic.MAX_MODULUS_BITS) {
      throw new IllegalArgumentException("Modulus bits must be in [2, " + ModularArithmetic.MAX_MODULUS_BITS + "]: " + bits);
    }
    long step = 2L * ringDimension;
    long upper = 1L << bits;
    // largest candidate below 2^bits of the form k*2N + 1
    long candidate = ((upper - 2) / step) * step + 1;
    long[] primes = new long[count];
    int found = 0;
    while (found < count) {
      if (candidate <= step) {
        throw new IllegalArgumentException("Not enough " + bits + "-bit NTT primes for ring dimension "
            + ringDimension + " (found " + found + " of " + count + ")");
      }
      if (BigInteger.valueOf(candidate).isProbablePrime(CERTAINTY)) {
        primes[found++] = candidate;
      }
      candidate -= step;
    }
    return primes;
  }

  /**
   * Finds a primitive 2N-th root of unity modulo q, i.e. psi with psi^N = -1 (mod q).
   * Deterministic: the smallest generator candidate that works is used.
   *
   * @param ringDimension N
   * @param q             prime with q = 1 (mod 2N)
   * @return psi
   */
  public static long primitiveRoot(int ringDimension, long q) {
    long order = 2L * ringDimension;
    if ((q - 1) % order != 0) {
      throw new IllegalArgumentException("Modulus " + q + " does not support a transform of length " + ringDimension);
    }
    long cofactor = (q - 1) / order;
    for (long g = 2; g < q; g++) {
      long psi = ModularArithmetic.powMod(g, cofactor, q);
      if (ModularArithmetic.powMod(psi, ringDimension, q) == q - 1) {
        return psi;
      }
    }
    throw new IllegalStateException("No primitive " + order + "-th root of unity modulo " + q);
  }

  /**
   * Product of the moduli as a BigInteger.
   *
   * @param moduli the moduli
   * @return Q
   */
  public static BigInteger product(long[] moduli) {
    return Arrays.stream(moduli)
        .mapToObj(BigInteger::valueOf)
        .reduce(BigInteger.ONE, BigInteger::multiply);
  }
}
