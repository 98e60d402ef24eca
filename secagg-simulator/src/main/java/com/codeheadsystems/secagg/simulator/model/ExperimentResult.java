package com.codeheadsystems.secagg.simulator.model;

import com.codeheadsystems.secagg.simulator.Experiment;
import java.util.List;

/**
 * Everything measured in one run.
 *
 * @param experiment    the experiment
 * @param ringDimension the ring dimension used
 * @param clientTimings one entry per client, ordered by id
 * @param serverTimings the aggregator timings
 * @param communication the communication report
 * @param maxError      largest elementwise deviation from the plaintext sum
 * @param verified      whether maxError is within the configured tolerance
 */
public record ExperimentResult(Experiment experiment,
                               int ringDimension,
                               List<ClientTimings> clientTimings,
                               ServerTimings serverTimings,
                               CommunicationReport communication,
                               double maxError,
                               boolean verified) {

  public ExperimentResult {
    clientTimings = List.copyOf(clientTimings);
  }
}
