package com.codeheadsystems.secagg.server;

/**
 * Lifecycle of one aggregation round.
 */
public enum AggregationState {
  /**
   * Shares are being accepted.
   */
  COLLECTING,
  /**
   * Collection is closed and the aggregate has been computed.
   */
  AGGREGATED,
  /**
   * The result has been handed out; only {@link Aggregator#reset()} is allowed.
   */
  CONSUMED
}
