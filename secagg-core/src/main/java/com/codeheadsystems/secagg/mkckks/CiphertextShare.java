package com.codeheadsystems.secagg.mkckks;

import com.codeheadsystems.ring.RingElement;

/**
 * The output of the combined encrypt-and-partial-decrypt step.
 *
 * @param c0 the first ciphertext component
 * @param d  the partial decryption of the second component, with smudging noise
 */
public record CiphertextShare(RingElement c0, RingElement d) {
}
