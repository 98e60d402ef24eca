package com.codeheadsystems.ring.encoding;

import com.codeheadsystems.ring.RingParameters;
import java.math.BigInteger;

/**
 * CKKS encoder for real vectors using the canonical embedding with sparse packing.
 * <p>
 * A vector of at most {@code batchSize} values is interpreted as complex slots, mapped through the
 * inverse special FFT onto the coefficients X^(i*gap) (real parts) and X^(N/2 + i*gap) (imaginary
 * parts), and scaled by 2^scalingFactorBits. Decoding reverses the process from the centered CRT
 * representatives of those coefficients.
 */
public class CkksEncoder {

  private final int ringDimension;
  private final int halfDimension;
  private final int slots;
  private final int gap;
  private final double scale;
  private final int[] rotationGroup;
  private final double[] ksiReal;
  private final double[] ksiImag;
  private final CrtReconstructor crt;

  /**
   * Instantiates a new encoder.
   *
   * @param parameters the ring parameters
   * @param moduli     the tower moduli, for decoding
   */
  public CkksEncoder(RingParameters parameters, long[] moduli) {
    this.ringDimension = parameters.ringDimension();
    this.halfDimension = ringDimension / 2;
    this.slots = parameters.batchSize();
    this.gap = halfDimension / slots;
    this.scale = Math.scalb(1.0, parameters.scalingFactorBits());
    this.crt = new CrtReconstructor(moduli);

    int m = 2 * ringDimension;
    this.rotationGroup = new int[halfDimension];
    long five = 1;
    for (int j = 0; j < halfDimension; j++) {
      rotationGroup[j] = (int) five;
      five = (five * 5) % m;
    }
    this.ksiReal = new double[m + 1];
    this.ksiImag = new double[m + 1];
    for (int j = 0; j <= m; j++) {
      double angle = 2.0 * Math.PI * j / m;
      ksiReal[j] = Math.cos(angle);
      ksiImag[j] = Math.sin(angle);
    }
  }

  /**
   * Number of packed slots.
   *
   * @return the slot count
   */
  public int slots() {
    return slots;
  }

  /**
   * Encodes real values into signed integer coefficients of length N.
   *
   * @param values at most {@link #slots()} finite values; missing slots are zero
   * @return the scaled integer coefficients
   */
  public long[] encode(double[] values) {
    if (values.length > slots) {
      throw new IllegalArgumentException("Cannot pack " + values.length + " values into " + slots + " slots");
    }
    double[] re = new double[slots];
    double[] im = new double[slots];
    for (int i = 0; i < values.length; i++) {
      if (!Double.isFinite(values[i])) {
        throw new IllegalArgumentException("Value at index " + i + " is not finite");
      }
      re[i] = values[i];
    }
    embedInverse(re, im);

    long[] coefficients = new long[ringDimension];
    for (int i = 0, idx = 0; i < slots; i++, idx += gap) {
      coefficients[idx] = scaleUp(re[i]);
      coefficients[idx + halfDimension] = scaleUp(im[i]);
    }
    return coefficients;
  }

  /**
   * Decodes the real parts of the slots from the residues of a ring element.
   *
   * @param residues residues[tower][coefficient]
   * @param length   number of values wanted; positions past the slot count are zero
   * @return the decoded values
   */
  public double[] decode(long[][] residues, int length) {
    if (length < 0) {
      throw new IllegalArgumentException("Negative length: " + length);
    }
    double[] re = new double[slots];
    double[] im = new double[slots];
    long[] column = new long[residues.length];
    for (int i = 0, idx = 0; i < slots; i++, idx += gap) {
      re[i] = scaleDown(coefficient(residues, idx, column));
      im[i] = scaleDown(coefficient(residues, idx + halfDimension, column));
    }
    embed(re, im);

    double[] out = new double[length];
    System.arraycopy(re, 0, out, 0, Math.min(length, slots));
    return out;
  }

  private BigInteger coefficient(long[][] residues, int index, long[] column) {
    for (int t = 0; t < residues.length; t++) {
      column[t] = residues[t][index];
    }
    return crt.reconstructCentered(column);
  }

  private long scaleUp(double value) {
    double scaled = value * scale;
    if (Math.abs(scaled) >= 0x1p62) {
      throw new IllegalArgumentException("Value " + value + " overflows the scaling factor");
    }
    return Math.round(scaled);
  }

  private double scaleDown(BigInteger value) {
    return value.doubleValue() / scale;
  }

  // Special FFT: evaluates the packed polynomial at the primitive roots zeta^(5^j).
  private void embed(double[] re, double[] im) {
    int n = re.length;
    bitReverse(re, im);
    int m = 2 * ringDimension;
    for (int len = 2; len <= n; len <<= 1) {
      int lenh = len >> 1;
      int lenq = len << 2;
      int step = m / lenq;
      for (int i = 0; i < n; i += len) {
        for (int j = 0; j < lenh; j++) {
          int idx = (rotationGroup[j] % lenq) * step;
          double ur = re[i + j];
          double ui = im[i + j];
          double vr = re[i + j + lenh] * ksiReal[idx] - im[i + j + lenh] * ksiImag[idx];
          double vi = re[i + j + lenh] * ksiImag[idx] + im[i + j + lenh] * ksiReal[idx];
          re[i + j] = ur + vr;
          im[i + j] = ui + vi;
          re[i + j + lenh] = ur - vr;
          im[i + j + lenh] = ui - vi;
        }
      }
    }
  }

  private void embedInverse(double[] re, double[] im) {
    int n = re.length;
    int m = 2 * ringDimension;
    for (int len = n; len >= 1; len >>= 1) {
      int lenh = len >> 1;
      int lenq = len << 2;
      int step = m / lenq;
      for (int i = 0; i < n; i += len) {
        for (int j = 0; j < lenh; j++) {
          int idx = (lenq - (rotationGroup[j] % lenq)) * step;
          double ur = re[i + j] + re[i + j + lenh];
          double ui = im[i + j] + im[i + j + lenh];
          double dr = re[i + j] - re[i + j + lenh];
          double di = im[i + j] - im[i + j + lenh];
          re[i + j] = ur;
          im[i + j] = ui;
          re[i + j + lenh] = dr * ksiReal[idx] - di * ksiImag[idx];
          im[i + j + lenh] = dr * ksiImag[idx] + di * ksiReal[idx];
        }
      }
    }
    bitReverse(re, im);
    for (int i = 0; i < n; i++) {
      re[i] /= n;
      im[i] /= n;
    }
  }

  private static void bitReverse(double[] re, double[] im) {
    int n = re.length;
    for (int i = 1, j = 0; i < n; i++) {
      int bit = n >> 1;
      for (; j >= bit; bit >>= 1) {
        j -= bit;
      }
      j += bit;
      if (i < j) {
        double t = re[i];
        re[i] = re[j];
        re[j] = t;
        t = im[i];
        im[i] = im[j];
        im[j] = t;
      }
    }
  }
}
