package com.codeheadsystems.ring.encoding;

import com.codeheadsystems.ring.ntt.NttPrimes;
import java.math.BigInteger;

/**
 * Chinese-Remainder reconstruction of a single coefficient from its residues.
 */
public class CrtReconstructor {

  private final long[] moduli;
  private final BigInteger modulus;
  private final BigInteger halfModulus;
  private final BigInteger[] cofactors;
  private final long[] cofactorInverses;

  /**
   * Precomputes Q / q_i and its inverse modulo q_i for every tower.
   *
   * @param moduli pairwise coprime moduli
   */
  public CrtReconstructor(long[] moduli) {
    this.moduli = moduli.clone();
    this.modulus = NttPrimes.product(moduli);
    this.halfModulus = modulus.shiftRight(1);
    this.cofactors = new BigInteger[moduli.length];
    this.cofactorInverses = new long[moduli.length];
    for (int i = 0; i < moduli.length; i++) {
      BigInteger qi = BigInteger.valueOf(moduli[i]);
      cofactors[i] = modulus.divide(qi);
      cofactorInverses[i] = cofactors[i].mod(qi).modInverse(qi).longValueExact();
    }
  }

  /**
   * The product of all moduli.
   *
   * @return Q
   */
  public BigInteger modulus() {
    return modulus;
  }

  /**
   * Reconstructs the value in (-Q/2, Q/2] congruent to every residue.
   *
   * @param residues one residue per modulus
   * @return the centered representative
   */
  public BigInteger reconstructCentered(long[] residues) {
    if (residues.length != moduli.length) {
      throw new IllegalArgumentException("Expected " + moduli.length + " residues, got " + residues.length);
    }
    BigInteger x = BigInteger.ZERO;
    for (int i = 0; i < moduli.length; i++) {
      long term = (residues[i] * cofactorInverses[i]) % moduli[i];
      x = x.add(cofactors[i].multiply(BigInteger.valueOf(term)));
    }
    x = x.mod(modulus);
    return x.compareTo(halfModulus) > 0 ? x.subtract(modulus) : x;
  }
}
