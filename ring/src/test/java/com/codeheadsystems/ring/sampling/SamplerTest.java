package com.codeheadsystems.ring.sampling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.security.SecureRandom;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class SamplerTest {

  private final SecureRandom random = new SecureRandom();

  @Test
  void gaussian_hasRoughlyTheRequestedSpread() {
    long[] samples = new DiscreteGaussianSampler(random).sample(20000, 3.19);

    double mean = Arrays.stream(samples).average().orElseThrow();
    double variance = Arrays.stream(samples).mapToDouble(s -> (s - mean) * (s - mean)).sum() / samples.length;

    assertThat(mean).isCloseTo(0.0, within(0.2));
    assertThat(Math.sqrt(variance)).isCloseTo(3.19, within(0.3));
  }

  @Test
  void gaussian_rejectsInvalidDeviation() {
    DiscreteGaussianSampler sampler = new DiscreteGaussianSampler(random);
    assertThatThrownBy(() -> sampler.sample(4, -1.0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> sampler.sample(4, Double.POSITIVE_INFINITY)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void uniform_staysBelowModulus() {
    long[] samples = new UniformSampler(random).sample(5000, 97);

    assertThat(Arrays.stream(samples).allMatch(v -> v >= 0 && v < 97)).isTrue();
    assertThat(Arrays.stream(samples).distinct().count()).isGreaterThan(90);
  }

  @Test
  void uniform_rejectsOversizedModulus() {
    assertThatThrownBy(() -> new UniformSampler(random).sample(1, 1L << 32))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
