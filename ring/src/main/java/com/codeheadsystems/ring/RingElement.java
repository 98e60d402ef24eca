package com.codeheadsystems.ring;

import static com.codeheadsystems.ring.ntt.ModularArithmetic.addMod;
import static com.codeheadsystems.ring.ntt.ModularArithmetic.subMod;

import java.util.Arrays;

/**
 * An immutable element of a {@link Ring}: one residue vector per tower, in coefficient form.
 * Equality is exact over every residue.
 */
public final class RingElement {

  private final Ring ring;
  private final long[][] residues;

  RingElement(Ring ring, long[][] residues) {
    this.ring = ring;
    this.residues = residues;
  }

  public Ring ring() {
    return ring;
  }

  /**
   * Copy of one tower's residues.
   *
   * @param tower the tower index
   * @return the residues, each in [0, q_tower)
   */
  public long[] residue(int tower) {
    return residues[tower].clone();
  }

  long[][] residues() {
    return residues;
  }

  public RingElement add(RingElement other) {
    ring.requireCompatible(other);
    long[][] out = new long[residues.length][];
    for (int t = 0; t < residues.length; t++) {
      long q = ring.modulusOf(t);
      long[] a = residues[t];
      long[] b = other.residues[t];
      long[] r = new long[a.length];
      for (int j = 0; j < a.length; j++) {
        r[j] = addMod(a[j], b[j], q);
      }
      out[t] = r;
    }
    return new RingElement(ring, out);
  }

  public RingElement subtract(RingElement other) {
    ring.requireCompatible(other);
    long[][] out = new long[residues.length][];
    for (int t = 0; t < residues.length; t++) {
      long q = ring.modulusOf(t);
      long[] a = residues[t];
      long[] b = other.residues[t];
      long[] r = new long[a.length];
      for (int j = 0; j < a.length; j++) {
        r[j] = subMod(a[j], b[j], q);
      }
      out[t] = r;
    }
    return new RingElement(ring, out);
  }

  public RingElement negate() {
    long[][] out = new long[residues.length][];
    for (int t = 0; t < residues.length; t++) {
      long q = ring.modulusOf(t);
      long[] a = residues[t];
      long[] r = new long[a.length];
      for (int j = 0; j < a.length; j++) {
        r[j] = a[j] == 0 ? 0 : q - a[j];
      }
      out[t] = r;
    }
    return new RingElement(ring, out);
  }

  /**
   * Product in Z_Q[X]/(X^N + 1), computed tower by tower through the negacyclic NTT.
   *
   * @param other the other factor
   * @return the product
   */
  public RingElement multiply(RingElement other) {
    ring.requireCompatible(other);
    long[][] out = new long[residues.length][];
    for (int t = 0; t < residues.length; t++) {
      out[t] = ring.transform(t).multiply(residues[t], other.residues[t]);
    }
    return new RingElement(ring, out);
  }

  /**
   * Whether every residue is zero.
   *
   * @return true for the additive identity
   */
  public boolean isZero() {
    for (long[] tower : residues) {
      for (long value : tower) {
        if (value != 0) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RingElement)) {
      return false;
    }
    RingElement that = (RingElement) o;
    return ring.isCompatible(that.ring) && Arrays.deepEquals(residues, that.residues);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(residues);
  }

  @Override
  public String toString() {
    return "RingElement(N=" + ring.dimension() + ", towers=" + residues.length + ")";
  }
}
