package com.codeheadsystems.secagg.mkckks;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingElement;
import com.codeheadsystems.secagg.TestRings;
import org.junit.jupiter.api.Test;

class MkCkksKeyGeneratorTest {

  private final Ring ring = TestRings.SMALL;
  private final MkCkksKeyGenerator generator = new MkCkksKeyGenerator(ring, MkCkksParameters.DEFAULT);

  @Test
  void referenceValue_isFreshEachCall() {
    assertThat(generator.generateReferenceValue()).isNotEqualTo(generator.generateReferenceValue());
  }

  @Test
  void keyPair_publicKeyHidesSecretBehindSmallNoise() {
    RingElement crs = generator.generateReferenceValue();
    MkKeyPair keyPair = generator.generateKeyPair(crs);

    // b + s*a = e, which is small
    RingElement e = keyPair.publicKey().b().add(keyPair.secretKey().element().multiply(crs));
    assertThat(TestRings.maxCenteredMagnitude(e)).isLessThan(40);
    assertThat(TestRings.maxCenteredMagnitude(keyPair.publicKey().b())).isGreaterThan(1L << 20);
  }

  @Test
  void keyPair_carriesTheReferenceValue() {
    RingElement crs = generator.generateReferenceValue();
    assertThat(generator.generateKeyPair(crs).publicKey().a()).isSameAs(crs);
  }

  @Test
  void keyPairs_areIndependent() {
    RingElement crs = generator.generateReferenceValue();
    MkKeyPair first = generator.generateKeyPair(crs);
    MkKeyPair second = generator.generateKeyPair(crs);
    assertThat(first.secretKey().element()).isNotEqualTo(second.secretKey().element());
  }
}
