package com.codeheadsystems.secagg.mkckks;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingElement;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the common reference value and per-client MK-CKKS key pairs.
 */
@Singleton
public class MkCkksKeyGenerator {

  private static final Logger log = LoggerFactory.getLogger(MkCkksKeyGenerator.class);

  private final Ring ring;
  private final MkCkksParameters parameters;

  /**
   * Instantiates a new key generator.
   *
   * @param ring       the ring
   * @param parameters the noise parameters
   */
  @Inject
  public MkCkksKeyGenerator(final Ring ring, final MkCkksParameters parameters) {
    this.ring = ring;
    this.parameters = parameters;
    log.info("MkCkksKeyGenerator({})", parameters);
  }

  /**
   * Samples the common reference value: one uniformly random element, shared by every client of
   * an epoch.
   *
   * @return the reference value
   */
  public RingElement generateReferenceValue() {
    log.trace("generateReferenceValue()");
    return ring.sampleUniform();
  }

  /**
   * Samples s and e and returns (s, (b, crs)) with b = -s*crs + e.
   *
   * @param crs the common reference value
   * @return the key pair
   */
  public MkKeyPair generateKeyPair(final RingElement crs) {
    log.trace("generateKeyPair()");
    final RingElement s = ring.sampleGaussian(parameters.keyStandardDeviation());
    final RingElement e = ring.sampleGaussian(parameters.keyStandardDeviation());
    final RingElement b = s.multiply(crs).negate().add(e);
    return new MkKeyPair(new SecretKey(s), new PublicKey(b, crs));
  }
}
