package com.codeheadsystems.secagg.model.wire;

import com.codeheadsystems.secagg.model.ServerResult;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the decoded aggregate the server publishes at the end of a round.
 *
 * @param values      the decoded sum
 * @param clientCount how many shares went into it
 */
public record AggregateResultResponse(
    @JsonProperty("values") double[] values,
    @JsonProperty("clientCount") int clientCount) {

  public AggregateResultResponse(ServerResult result, int clientCount) {
    this(result.vector(), clientCount);
  }

  public ServerResult serverResult() {
    if (values == null) {
      throw new IllegalArgumentException("Missing required field: values");
    }
    return new ServerResult(values);
  }
}
