package com.codeheadsystems.secagg.model.wire;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.secagg.model.ServerResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class AggregateResultResponseTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void jsonRoundTrip() throws Exception {
    AggregateResultResponse original = new AggregateResultResponse(new ServerResult(new double[]{5.0, 6.0}), 3);

    String json = mapper.writeValueAsString(original);
    AggregateResultResponse restored = mapper.readValue(json, AggregateResultResponse.class);

    assertThat(json).contains("\"values\":[5.0,6.0]").contains("\"clientCount\":3");
    assertThat(restored.clientCount()).isEqualTo(3);
    assertThat(restored.serverResult()).isEqualTo(new ServerResult(new double[]{5.0, 6.0}));
  }

  @Test
  void serverResult_missingValuesThrowsIAE() {
    AggregateResultResponse response = new AggregateResultResponse((double[]) null, 0);
    assertThatThrownBy(response::serverResult)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Missing required field");
  }
}
