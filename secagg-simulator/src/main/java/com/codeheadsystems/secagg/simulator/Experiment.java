package com.codeheadsystems.secagg.simulator;

/**
 * One simulated aggregation round.
 *
 * @param name       the experiment label written to the logs
 * @param numClients number of participating clients
 * @param dataSize   number of values per client
 */
public record Experiment(String name, int numClients, int dataSize) {

  public Experiment {
    if (name == null || name.isBlank() || name.contains(",")) {
      throw new IllegalArgumentException("Experiment name must be non-blank and comma free: " + name);
    }
    if (numClients < 1) {
      throw new IllegalArgumentException("At least one client is required: " + numClients);
    }
    if (dataSize < 1) {
      throw new IllegalArgumentException("Data size must be positive: " + dataSize);
    }
  }
}
