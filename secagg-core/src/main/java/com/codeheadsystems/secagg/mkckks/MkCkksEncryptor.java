package com.codeheadsystems.secagg.mkckks;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingElement;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts a plaintext under the client's own public key and immediately applies the client's
 * partial decryption to the second component. The resulting pair satisfies
 * c0 + d = m + (small noise).
 */
@Singleton
public class MkCkksEncryptor {

  private static final Logger log = LoggerFactory.getLogger(MkCkksEncryptor.class);

  private final Ring ring;
  private final MkCkksParameters parameters;

  /**
   * Instantiates a new encryptor.
   *
   * @param ring       the ring
   * @param parameters the noise parameters
   */
  @Inject
  public MkCkksEncryptor(final Ring ring, final MkCkksParameters parameters) {
    this.ring = ring;
    this.parameters = parameters;
    log.info("MkCkksEncryptor({})", parameters);
  }

  /**
   * Computes c0 = v*b + m + e0 and d = (v*a + e1)*s + e*.
   *
   * @param publicKey the client's public key
   * @param secretKey the client's secret key
   * @param plaintext the encoded plaintext
   * @return the ciphertext share
   */
  public CiphertextShare encrypt(final PublicKey publicKey,
                                 final SecretKey secretKey,
                                 final RingElement plaintext) {
    log.trace("encrypt()");
    final double sigma = parameters.keyStandardDeviation();
    final RingElement v = ring.sampleGaussian(sigma);
    final RingElement e0 = ring.sampleGaussian(sigma);
    final RingElement e1 = ring.sampleGaussian(sigma);

    final RingElement c0 = v.multiply(publicKey.b()).add(plaintext).add(e0);
    final RingElement c1 = v.multiply(publicKey.a()).add(e1);

    final RingElement smudging = ring.sampleGaussian(parameters.smudgingStandardDeviation());
    final RingElement d = c1.multiply(secretKey.element()).add(smudging);
    return new CiphertextShare(c0, d);
  }
}
