package com.codeheadsystems.secagg.simulator.model;

/**
 * Aggregator computation times in milliseconds.
 *
 * @param aggregateMs summing the shares
 * @param decodeMs    decoding the aggregate
 */
public record ServerTimings(double aggregateMs, double decodeMs) {

  public double serverTotalMs() {
    return aggregateMs + decodeMs;
  }
}
