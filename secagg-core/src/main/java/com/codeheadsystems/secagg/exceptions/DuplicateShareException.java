package com.codeheadsystems.secagg.exceptions;

/**
 * The type Duplicate share exception.
 */
public class DuplicateShareException extends RuntimeException {

  private final int clientId;

  /**
   * Instantiates a new Duplicate share exception.
   *
   * @param clientId the client whose share was already collected
   */
  public DuplicateShareException(final int clientId) {
    super("Share already collected for client " + clientId);
    this.clientId = clientId;
  }

  /**
   * The offending client id.
   *
   * @return the client id
   */
  public int clientId() {
    return clientId;
  }
}
