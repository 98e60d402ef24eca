package com.codeheadsystems.ring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RingParametersTest {

  @Test
  void builder_defaults() {
    RingParameters parameters = RingParameters.builder().build();

    assertThat(parameters.ringDimension()).isEqualTo(4096);
    assertThat(parameters.towerCount()).isEqualTo(4);
    assertThat(parameters.modulusBits()).isEqualTo(30);
    assertThat(parameters.scalingFactorBits()).isEqualTo(40);
    assertThat(parameters.batchSize()).isEqualTo(2048);
    assertThat(parameters.maxSlots()).isEqualTo(2048);
    assertThat(parameters.gaussianStandardDeviation()).isEqualTo(RingParameters.DEFAULT_STANDARD_DEVIATION);
  }

  @Test
  void ringDimension_mustBePowerOfTwo() {
    assertThatThrownBy(() -> RingParameters.builder().withRingDimension(1000).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("power of two");
  }

  @Test
  void batchSize_cannotExceedHalfTheDimension() {
    assertThatThrownBy(() -> RingParameters.builder().withRingDimension(64).withBatchSize(64).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Batch size");
  }

  @Test
  void modulusBits_boundedByWordArithmetic() {
    assertThatThrownBy(() -> RingParameters.builder().withModulusBits(32).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void totalModulus_mustLeaveHeadroomForTheScalingFactor() {
    assertThatThrownBy(() -> RingParameters.builder().withTowerCount(1).withScalingFactorBits(40).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("too small");
  }

  @Test
  void standardDeviation_mustBePositive() {
    assertThatThrownBy(() -> RingParameters.builder().withGaussianStandardDeviation(0).build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
