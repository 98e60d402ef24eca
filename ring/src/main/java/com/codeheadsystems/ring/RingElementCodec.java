package com.codeheadsystems.ring;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/**
 * Binary form of a {@link RingElement}: tower count (int), dimension (int), then every residue as a
 * 4-byte big-endian integer, tower by tower.
 */
public class RingElementCodec {

  private static final int HEADER_BYTES = 8;

  private RingElementCodec() {
  }

  /**
   * Serialized size of any element of the ring.
   *
   * @param ring the ring
   * @return size in bytes
   */
  public static int serializedSize(Ring ring) {
    return HEADER_BYTES + 4 * ring.residueCount() * ring.dimension();
  }

  /**
   * Serializes an element.
   *
   * @param element the element
   * @return the bytes
   */
  public static byte[] toBytes(RingElement element) {
    Ring ring = element.ring();
    ByteBuffer buffer = ByteBuffer.allocate(serializedSize(ring));
    buffer.putInt(ring.residueCount());
    buffer.putInt(ring.dimension());
    for (long[] tower : element.residues()) {
      for (long value : tower) {
        buffer.putInt((int) value);
      }
    }
    return buffer.array();
  }

  /**
   * Parses an element of {@code ring}, rejecting a header for another ring and out-of-range residues.
   *
   * @param ring  the ring
   * @param bytes the serialized element
   * @return the element
   */
  public static RingElement fromBytes(Ring ring, byte[] bytes) {
    if (bytes == null || bytes.length != serializedSize(ring)) {
      throw new IllegalArgumentException("Ring element must be " + serializedSize(ring) + " bytes");
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    try {
      int towers = buffer.getInt();
      int dimension = buffer.getInt();
      if (towers != ring.residueCount() || dimension != ring.dimension()) {
        throw new IllegalArgumentException("Ring element header (" + towers + "x" + dimension
            + ") does not match the ring (" + ring.residueCount() + "x" + ring.dimension() + ")");
      }
      long[][] residues = new long[towers][dimension];
      for (int t = 0; t < towers; t++) {
        long q = ring.modulusOf(t);
        for (int j = 0; j < dimension; j++) {
          long value = Integer.toUnsignedLong(buffer.getInt());
          if (value >= q) {
            throw new IllegalArgumentException("Residue out of range in tower " + t);
          }
          residues[t][j] = value;
        }
      }
      return new RingElement(ring, residues);
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("Truncated ring element", e);
    }
  }
}
