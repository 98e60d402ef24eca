package com.codeheadsystems.secagg.simulator.model;

/**
 * Communication cost of one run.
 *
 * @param plaintextBytes     one client's raw vector, eight bytes per value
 * @param ciphertextBytes    a standard two-component ciphertext (c0, c1)
 * @param clientUplinkBytes  one client's share message as transmitted
 * @param setupBytes         all published exchange public keys
 * @param finalDownlinkBytes the decoded result, eight bytes per value
 * @param numClients         number of clients sharing the setup and downlink
 */
public record CommunicationReport(long plaintextBytes,
                                  long ciphertextBytes,
                                  long clientUplinkBytes,
                                  long setupBytes,
                                  long finalDownlinkBytes,
                                  int numClients) {

  public double ciphertextExpansion() {
    return (double) ciphertextBytes / plaintextBytes;
  }

  /**
   * Bytes one client exchanges in total, relative to its plaintext: its part of the setup, its
   * uplink and its part of the downlink.
   *
   * @return the expansion factor
   */
  public double commExpansion() {
    long perClient = setupBytes / numClients + clientUplinkBytes + finalDownlinkBytes / numClients;
    return (double) perClient / plaintextBytes;
  }
}
