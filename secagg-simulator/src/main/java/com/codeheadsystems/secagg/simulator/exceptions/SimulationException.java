package com.codeheadsystems.secagg.simulator.exceptions;

/**
 * The type Simulation exception. Wraps failures of client tasks and of the experiment logs.
 */
public class SimulationException extends RuntimeException {

  /**
   * Instantiates a new Simulation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SimulationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
