package com.codeheadsystems.ring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class RingElementTest {

  private static Ring ring;

  @BeforeAll
  static void setUpRing() {
    ring = new Ring(RingParameters.builder().withRingDimension(256).withTowerCount(3).build(),
        new SecureRandom());
  }

  @Test
  void addThenSubtract_isIdentity() {
    RingElement a = ring.sampleUniform();
    RingElement b = ring.sampleUniform();

    assertThat(a.add(b).subtract(b)).isEqualTo(a);
  }

  @Test
  void addNegation_isExactlyZero() {
    RingElement a = ring.sampleUniform();

    assertThat(a.add(a.negate()).isZero()).isTrue();
    assertThat(a.add(a.negate())).isEqualTo(ring.zero());
  }

  @Test
  void negateZero_isZero() {
    assertThat(ring.zero().negate().isZero()).isTrue();
  }

  @Test
  void multiply_distributesOverAddition() {
    RingElement a = ring.sampleUniform();
    RingElement b = ring.sampleUniform();
    RingElement c = ring.sampleGaussian();

    assertThat(a.add(b).multiply(c)).isEqualTo(a.multiply(c).add(b.multiply(c)));
  }

  @Test
  void multiply_isCommutative() {
    RingElement a = ring.sampleUniform();
    RingElement b = ring.sampleGaussian();

    assertThat(a.multiply(b)).isEqualTo(b.multiply(a));
  }

  @Test
  void multiply_byOneIsIdentity() {
    long[] one = new long[ring.dimension()];
    one[0] = 1;
    RingElement a = ring.sampleUniform();

    assertThat(a.multiply(ring.fromCoefficients(one))).isEqualTo(a);
  }

  @Test
  void multiply_bySmallIntegersMatchesSignedCoefficients() {
    long[] x = new long[ring.dimension()];
    x[ring.dimension() - 1] = 3;
    long[] y = new long[ring.dimension()];
    y[2] = -2;

    long[] expected = new long[ring.dimension()];
    // 3X^(N-1) * -2X^2 = -6X^(N+1) = 6X
    expected[1] = 6;

    assertThat(ring.fromCoefficients(x).multiply(ring.fromCoefficients(y)))
        .isEqualTo(ring.fromCoefficients(expected));
  }

  @Test
  void residue_returnsDefensiveCopy() {
    RingElement a = ring.sampleUniform();
    long[] tower = a.residue(0);
    long original = tower[0];
    tower[0] = original + 1;

    assertThat(a.residue(0)[0]).isEqualTo(original);
  }

  @Test
  void sampleUniform_residuesAreInRange() {
    RingElement a = ring.sampleUniform();
    for (int t = 0; t < ring.residueCount(); t++) {
      long q = ring.modulusOf(t);
      assertThat(Arrays.stream(a.residue(t)).allMatch(v -> v >= 0 && v < q)).isTrue();
    }
  }

  @Test
  void fromResidues_reducesValues() {
    long[][] residues = new long[ring.residueCount()][ring.dimension()];
    residues[0][0] = ring.modulusOf(0) + 5;
    residues[1][0] = -1;

    RingElement e = ring.fromResidues(residues);

    assertThat(e.residue(0)[0]).isEqualTo(5);
    assertThat(e.residue(1)[0]).isEqualTo(ring.modulusOf(1) - 1);
  }

  @Test
  void fromResidues_rejectsWrongShape() {
    assertThatThrownBy(() -> ring.fromResidues(new long[ring.residueCount() + 1][ring.dimension()]))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ring.fromResidues(new long[ring.residueCount()][ring.dimension() - 1]))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void setResidue_replacesOneTowerOnly() {
    RingElement a = ring.sampleUniform();
    long[] values = new long[ring.dimension()];
    values[0] = 7;

    RingElement b = ring.setResidue(a, 1, values);

    assertThat(b.residue(0)).isEqualTo(a.residue(0));
    assertThat(b.residue(1)).isEqualTo(values);
    assertThat(b.residue(2)).isEqualTo(a.residue(2));
  }

  @Test
  void operationsAcrossIncompatibleRingsThrow() {
    Ring other = new Ring(RingParameters.builder().withRingDimension(128).withTowerCount(3).build());

    assertThatThrownBy(() -> ring.zero().add(other.zero()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("different ring");
  }

  @Test
  void equalRingsFromSameParametersAreCompatible() {
    Ring twin = new Ring(ring.parameters());
    RingElement a = ring.sampleUniform();

    assertThat(twin.isCompatible(ring)).isTrue();
    assertThat(a.add(twin.zero())).isEqualTo(a);
  }
}
