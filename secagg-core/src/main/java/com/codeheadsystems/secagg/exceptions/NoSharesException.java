package com.codeheadsystems.secagg.exceptions;

/**
 * The type No shares exception.
 */
public class NoSharesException extends RuntimeException {

  /**
   * Instantiates a new No shares exception.
   *
   * @param message the message
   */
  public NoSharesException(final String message) {
    super(message);
  }
}
