package com.codeheadsystems.secagg.common;

import java.util.Arrays;

/**
 * Utility methods for octet string encoding and key material handling.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017, for long values.
   * Converts a non-negative integer to a big-endian octet string of specified length.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(long value, int length) {
    if (value < 0 || (length < 8 && value >= (1L << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0 && i >= length - 8; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>>= 8;
    }
    return result;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Fits key material to an exact length: longer input is truncated, shorter input is zero padded.
   *
   * @param material the input
   * @param length   the target length
   * @return a new array of {@code length} bytes
   */
  public static byte[] fitToLength(byte[] material, int length) {
    return Arrays.copyOf(material, length);
  }

  /**
   * Reads eight bytes as an unsigned little-endian value held in a long.
   *
   * @param bytes  the source
   * @param offset the first byte
   * @return the value, to be interpreted as unsigned
   */
  public static long readLongLittleEndian(byte[] bytes, int offset) {
    if (offset < 0 || offset + 8 > bytes.length) {
      throw new IllegalArgumentException("Need 8 bytes at offset " + offset + ", have " + bytes.length);
    }
    long value = 0;
    for (int i = 7; i >= 0; i--) {
      value = (value << 8) | (bytes[offset + i] & 0xFFL);
    }
    return value;
  }

  /**
   * Overwrites the array with zeros.
   *
   * @param bytes the array, may be null
   */
  public static void zeroize(byte[] bytes) {
    if (bytes != null) {
      Arrays.fill(bytes, (byte) 0);
    }
  }
}
