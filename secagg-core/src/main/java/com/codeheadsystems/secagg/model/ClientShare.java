package com.codeheadsystems.secagg.model;

import com.codeheadsystems.ring.RingElement;
import com.codeheadsystems.secagg.mkckks.CiphertextShare;

/**
 * What a client sends to the aggregator.
 *
 * @param c0      the first ciphertext component
 * @param dMasked the partial decryption plus the client's zero-sum mask
 */
public record ClientShare(RingElement c0, RingElement dMasked) {

  /**
   * Combines a ciphertext share with a mask: (c0, d + mask).
   *
   * @param ciphertextShare the encrypted and partially decrypted data
   * @param mask            the client's mask for the round
   * @return the share
   */
  public static ClientShare masked(CiphertextShare ciphertextShare, RingElement mask) {
    return new ClientShare(ciphertextShare.c0(), ciphertextShare.d().add(mask));
  }
}
