package com.codeheadsystems.ring.ntt;

import static com.codeheadsystems.ring.ntt.ModularArithmetic.addMod;
import static com.codeheadsystems.ring.ntt.ModularArithmetic.mulMod;
import static com.codeheadsystems.ring.ntt.ModularArithmetic.subMod;

/**
 * Number-theoretic transform over Z_q[X]/(X^N + 1) for a single prime modulus.
 * <p>
 * The input is twisted by powers of a primitive 2N-th root psi, so that a cyclic transform with
 * omega = psi^2 yields the negacyclic convolution. Twiddle tables are precomputed once per modulus.
 */
public class NegacyclicNtt {

  private final int n;
  private final long q;
  private final int[] bitReverse;
  private final long[] psiPowers;
  private final long[] psiInversePowers;
  private final long[] omegaPowers;
  private final long[] omegaInversePowers;
  private final long nInverse;

  /**
   * Builds the tables for one modulus.
   *
   * @param ringDimension N, a power of two
   * @param q             prime with q = 1 (mod 2N)
   */
  public NegacyclicNtt(int ringDimension, long q) {
    this.n = ringDimension;
    this.q = q;
    long psi = NttPrimes.primitiveRoot(ringDimension, q);
    long psiInverse = ModularArithmetic.invMod(psi, q);
    long omega = mulMod(psi, psi, q);
    long omegaInverse = ModularArithmetic.invMod(omega, q);

    this.psiPowers = powers(psi, n);
    this.psiInversePowers = powers(psiInverse, n);
    this.omegaPowers = powers(omega, n / 2);
    this.omegaInversePowers = powers(omegaInverse, n / 2);
    this.nInverse = ModularArithmetic.invMod(n, q);
    this.bitReverse = bitReverseTable(n);
  }

  private long[] powers(long base, int count) {
    long[] out = new long[Math.max(count, 1)];
    out[0] = 1;
    for (int i = 1; i < count; i++) {
      out[i] = mulMod(out[i - 1], base, q);
    }
    return out;
  }

  private static int[] bitReverseTable(int n) {
    int bits = Integer.numberOfTrailingZeros(n);
    int[] table = new int[n];
    for (int i = 0; i < n; i++) {
      table[i] = bits == 0 ? 0 : Integer.reverse(i) >>> (32 - bits);
    }
    return table;
  }

  /**
   * Modulus these tables belong to.
   *
   * @return q
   */
  public long modulus() {
    return q;
  }

  /**
   * Forward transform of coefficients into evaluation form. Returns a new array.
   *
   * @param coefficients N residues in [0, q)
   * @return N evaluations
   */
  public long[] forward(long[] coefficients) {
    long[] a = new long[n];
    for (int i = 0; i < n; i++) {
      a[bitReverse[i]] = mulMod(coefficients[i], psiPowers[i], q);
    }
    butterflies(a, omegaPowers);
    return a;
  }

  /**
   * Inverse transform of evaluations back into coefficients. Returns a new array.
   *
   * @param evaluations N residues in evaluation form
   * @return N coefficients in [0, q)
   */
  public long[] inverse(long[] evaluations) {
    long[] a = new long[n];
    for (int i = 0; i < n; i++) {
      a[bitReverse[i]] = evaluations[i];
    }
    butterflies(a, omegaInversePowers);
    for (int i = 0; i < n; i++) {
      a[i] = mulMod(mulMod(a[i], nInverse, q), psiInversePowers[i], q);
    }
    return a;
  }

  /**
   * Negacyclic product of two coefficient vectors.
   *
   * @param a first polynomial
   * @param b second polynomial
   * @return a * b mod (X^N + 1, q)
   */
  public long[] multiply(long[] a, long[] b) {
    long[] fa = forward(a);
    long[] fb = forward(b);
    for (int i = 0; i < n; i++) {
      fa[i] = mulMod(fa[i], fb[i], q);
    }
    return inverse(fa);
  }

  // Iterative Cooley-Tukey over bit-reversed input.
  private void butterflies(long[] a, long[] twiddles) {
    for (int len = 2; len <= n; len <<= 1) {
      int half = len >> 1;
      int stride = n / len;
      for (int start = 0; start < n; start += len) {
        for (int j = 0; j < half; j++) {
          long w = twiddles[j * stride];
          long u = a[start + j];
          long v = mulMod(a[start + j + half], w, q);
          a[start + j] = addMod(u, v, q);
          a[start + j + half] = subMod(u, v, q);
        }
      }
    }
  }
}
