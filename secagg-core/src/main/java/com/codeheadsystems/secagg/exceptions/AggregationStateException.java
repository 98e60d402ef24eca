package com.codeheadsystems.secagg.exceptions;

/**
 * The type Aggregation state exception. Thrown when an aggregator operation is invoked in a
 * lifecycle state that does not allow it.
 */
public class AggregationStateException extends RuntimeException {

  /**
   * Instantiates a new Aggregation state exception.
   *
   * @param message the message
   */
  public AggregationStateException(final String message) {
    super(message);
  }
}
