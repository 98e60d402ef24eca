package com.codeheadsystems.secagg.exceptions;

/**
 * The type Key exchange exception. Raised for malformed peer public keys, curve mismatches and
 * failed shared-secret derivation.
 */
public class KeyExchangeException extends RuntimeException {

  /**
   * Instantiates a new Key exchange exception.
   *
   * @param message the message
   */
  public KeyExchangeException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Key exchange exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyExchangeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
