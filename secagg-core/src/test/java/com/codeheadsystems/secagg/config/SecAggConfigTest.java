package com.codeheadsystems.secagg.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.ring.RingParameters;
import com.codeheadsystems.secagg.TestRings;
import com.codeheadsystems.secagg.common.RandomProvider;
import com.codeheadsystems.secagg.masking.ExchangeCurve;
import com.codeheadsystems.secagg.mkckks.MkCkksParameters;
import org.junit.jupiter.api.Test;

class SecAggConfigTest {

  @Test
  void forRing_usesDefaults() {
    SecAggConfig config = SecAggConfig.forRing(TestRings.TINY);

    assertThat(config.ring()).isSameAs(TestRings.TINY);
    assertThat(config.mkCkksParameters()).isEqualTo(MkCkksParameters.DEFAULT);
    assertThat(config.exchangeCurve()).isEqualTo(ExchangeCurve.P384);
    assertThat(config.randomProvider()).isNotNull();
  }

  @Test
  void forParameters_buildsTheRing() {
    RingParameters parameters = RingParameters.builder().withRingDimension(128).build();

    assertThat(SecAggConfig.forParameters(parameters).ring().parameters()).isEqualTo(parameters);
  }

  @Test
  void withMethodsReplaceOneField() {
    SecAggConfig base = SecAggConfig.forRing(TestRings.TINY);
    RandomProvider random = new RandomProvider();

    SecAggConfig changed = base.withExchangeCurve(ExchangeCurve.P256)
        .withMkCkksParameters(new MkCkksParameters(3.19, 8.0))
        .withRandomProvider(random);

    assertThat(changed.ring()).isSameAs(base.ring());
    assertThat(changed.exchangeCurve()).isEqualTo(ExchangeCurve.P256);
    assertThat(changed.mkCkksParameters().smudgingStandardDeviation()).isEqualTo(8.0);
    assertThat(changed.randomProvider()).isSameAs(random);
    assertThat(base.exchangeCurve()).isEqualTo(ExchangeCurve.P384);
  }
}
