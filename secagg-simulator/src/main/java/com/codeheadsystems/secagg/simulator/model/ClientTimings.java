package com.codeheadsystems.secagg.simulator.model;

/**
 * Per-client computation times in milliseconds.
 *
 * @param clientId        the client
 * @param keyGenMkCkksMs  MK-CKKS key generation
 * @param keyGenEcdhMs    exchange key generation
 * @param encryptMs       encoding, encryption and partial decryption
 * @param maskGenMs       mask derivation against all peers
 */
public record ClientTimings(int clientId,
                            double keyGenMkCkksMs,
                            double keyGenEcdhMs,
                            double encryptMs,
                            double maskGenMs) {

  public double keyGenTotalMs() {
    return keyGenMkCkksMs + keyGenEcdhMs;
  }

  /**
   * Time spent preparing the share, key generation excluded.
   *
   * @return encrypt plus mask generation
   */
  public double clientTotalMs() {
    return encryptMs + maskGenMs;
  }

  public ClientTimings withShareTimes(double encryptMs, double maskGenMs) {
    return new ClientTimings(clientId, keyGenMkCkksMs, keyGenEcdhMs, encryptMs, maskGenMs);
  }
}
