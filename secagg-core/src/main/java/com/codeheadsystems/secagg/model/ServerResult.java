package com.codeheadsystems.secagg.model;

import java.util.Arrays;

/**
 * The decoded aggregate.
 *
 * @param vector the elementwise sum of all client inputs, up to noise
 */
public record ServerResult(double[] vector) {

  public ServerResult {
    vector = vector.clone();
  }

  @Override
  public double[] vector() {
    return vector.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ServerResult other && Arrays.equals(vector, other.vector);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(vector);
  }

  @Override
  public String toString() {
    return "ServerResult" + Arrays.toString(vector);
  }
}
