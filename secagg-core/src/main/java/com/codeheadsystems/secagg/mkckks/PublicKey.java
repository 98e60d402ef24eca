package com.codeheadsystems.secagg.mkckks;

import com.codeheadsystems.ring.RingElement;

/**
 * A client's public key (b, a) with b = -s*a + e and a the common reference value.
 *
 * @param b the key component
 * @param a the common reference value
 */
public record PublicKey(RingElement b, RingElement a) {
}
