package com.codeheadsystems.secagg.config;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingParameters;
import com.codeheadsystems.secagg.common.RandomProvider;
import com.codeheadsystems.secagg.masking.ExchangeCurve;
import com.codeheadsystems.secagg.mkckks.MkCkksParameters;

/**
 * Everything a protocol participant needs to agree on with the others, plus its random source.
 *
 * @param ring             the ring, shared by all parties
 * @param mkCkksParameters the noise parameters
 * @param exchangeCurve    the Diffie-Hellman curve
 * @param randomProvider   the random source for exchange keys
 */
public record SecAggConfig(Ring ring,
                           MkCkksParameters mkCkksParameters,
                           ExchangeCurve exchangeCurve,
                           RandomProvider randomProvider) {

  /**
   * Default configuration over the given ring.
   *
   * @param ring the ring
   * @return the config
   */
  public static SecAggConfig forRing(Ring ring) {
    return new SecAggConfig(ring, MkCkksParameters.DEFAULT, ExchangeCurve.DEFAULT, new RandomProvider());
  }

  /**
   * Default configuration over a ring built from the parameters, sharing the random source.
   *
   * @param parameters the ring parameters
   * @return the config
   */
  public static SecAggConfig forParameters(RingParameters parameters) {
    RandomProvider randomProvider = new RandomProvider();
    return new SecAggConfig(new Ring(parameters, randomProvider.random()), MkCkksParameters.DEFAULT,
        ExchangeCurve.DEFAULT, randomProvider);
  }

  public SecAggConfig withMkCkksParameters(MkCkksParameters mkCkksParameters) {
    return new SecAggConfig(ring, mkCkksParameters, exchangeCurve, randomProvider);
  }

  public SecAggConfig withExchangeCurve(ExchangeCurve exchangeCurve) {
    return new SecAggConfig(ring, mkCkksParameters, exchangeCurve, randomProvider);
  }

  public SecAggConfig withRandomProvider(RandomProvider randomProvider) {
    return new SecAggConfig(ring, mkCkksParameters, exchangeCurve, randomProvider);
  }
}
