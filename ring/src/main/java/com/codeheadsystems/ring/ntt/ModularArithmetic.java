package com.codeheadsystems.ring.ntt;

/**
 * Arithmetic modulo word-sized primes. Every modulus is below 2^31 so a product of two residues
 * fits in a signed long without overflow.
 */
public class ModularArithmetic {

  /**
   * Largest modulus bit size supported by the single-word arithmetic.
   */
  public static final int MAX_MODULUS_BITS = 31;

  private ModularArithmetic() {
  }

  /**
   * (a * b) mod q for residues already reduced into [0, q).
   *
   * @param a first residue
   * @param b second residue
   * @param q modulus
   * @return the product residue
   */
  public static long mulMod(long a, long b, long q) {
    return (a * b) % q;
  }

  /**
   * (a + b) mod q for residues already reduced into [0, q).
   *
   * @param a first residue
   * @param b second residue
   * @param q modulus
   * @return the sum residue
   */
  public static long addMod(long a, long b, long q) {
    long r = a + b;
    return r >= q ? r - q : r;
  }

  /**
   * (a - b) mod q for residues already reduced into [0, q).
   *
   * @param a first residue
   * @param b second residue
   * @param q modulus
   * @return the difference residue
   */
  public static long subMod(long a, long b, long q) {
    long r = a - b;
    return r < 0 ? r + q : r;
  }

  /**
   * Reduces any signed value into [0, q).
   *
   * @param value the value
   * @param q     the modulus
   * @return the canonical residue
   */
  public static long reduce(long value, long q) {
    return Math.floorMod(value, q);
  }

  /**
   * base^exponent mod q by square and multiply.
   *
   * @param base     the base
   * @param exponent non-negative exponent
   * @param q        the modulus
   * @return the power residue
   */
  public static long powMod(long base, long exponent, long q) {
    if (exponent < 0) {
      throw new IllegalArgumentException("Negative exponent: " + exponent);
    }
    long result = 1 % q;
    long b = reduce(base, q);
    long e = exponent;
    while (e > 0) {
      if ((e & 1) == 1) {
        result = mulMod(result, b, q);
      }
      b = mulMod(b, b, q);
      e >>= 1;
    }
    return result;
  }

  /**
   * Multiplicative inverse modulo a prime q (Fermat).
   *
   * @param a non-zero residue
   * @param q prime modulus
   * @return a^-1 mod q
   */
  public static long invMod(long a, long q) {
    long r = reduce(a, q);
    if (r == 0) {
      throw new ArithmeticException("Zero has no inverse modulo " + q);
    }
    return powMod(r, q - 2, q);
  }
}
