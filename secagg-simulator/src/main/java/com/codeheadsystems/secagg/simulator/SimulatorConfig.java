package com.codeheadsystems.secagg.simulator;

import com.codeheadsystems.secagg.masking.ExchangeCurve;
import com.codeheadsystems.secagg.mkckks.MkCkksParameters;

/**
 * Settings shared by every experiment of a simulator run.
 *
 * @param ringDimensionPolicy how the ring is sized from the data
 * @param mkCkksParameters    the noise parameters
 * @param exchangeCurve       the Diffie-Hellman curve
 * @param threads             worker threads for the clients
 * @param valueBound          client values are drawn uniformly from [-valueBound, valueBound]
 * @param tolerance           maximum elementwise error for a run to count as verified
 * @param seed                seed of the client data generator
 */
public record SimulatorConfig(RingDimensionPolicy ringDimensionPolicy,
                              MkCkksParameters mkCkksParameters,
                              ExchangeCurve exchangeCurve,
                              int threads,
                              double valueBound,
                              double tolerance,
                              long seed) {

  public SimulatorConfig {
    if (threads < 1) {
      throw new IllegalArgumentException("At least one thread is required: " + threads);
    }
    if (!(valueBound > 0) || Double.isInfinite(valueBound)) {
      throw new IllegalArgumentException("Value bound must be positive: " + valueBound);
    }
    if (!(tolerance > 0)) {
      throw new IllegalArgumentException("Tolerance must be positive: " + tolerance);
    }
  }

  /**
   * Defaults: minimum ring dimension 16384, values in [-999, 999], tolerance 1e-3, one thread per
   * processor.
   *
   * @return the config
   */
  public static SimulatorConfig defaults() {
    return new SimulatorConfig(new RingDimensionPolicy(), MkCkksParameters.DEFAULT, ExchangeCurve.DEFAULT,
        Runtime.getRuntime().availableProcessors(), 999.0, 1e-3, System.nanoTime());
  }

  public SimulatorConfig withRingDimensionPolicy(RingDimensionPolicy ringDimensionPolicy) {
    return new SimulatorConfig(ringDimensionPolicy, mkCkksParameters, exchangeCurve, threads, valueBound, tolerance, seed);
  }

  public SimulatorConfig withExchangeCurve(ExchangeCurve exchangeCurve) {
    return new SimulatorConfig(ringDimensionPolicy, mkCkksParameters, exchangeCurve, threads, valueBound, tolerance, seed);
  }

  public SimulatorConfig withThreads(int threads) {
    return new SimulatorConfig(ringDimensionPolicy, mkCkksParameters, exchangeCurve, threads, valueBound, tolerance, seed);
  }

  public SimulatorConfig withValueBound(double valueBound) {
    return new SimulatorConfig(ringDimensionPolicy, mkCkksParameters, exchangeCurve, threads, valueBound, tolerance, seed);
  }

  public SimulatorConfig withSeed(long seed) {
    return new SimulatorConfig(ringDimensionPolicy, mkCkksParameters, exchangeCurve, threads, valueBound, tolerance, seed);
  }
}
