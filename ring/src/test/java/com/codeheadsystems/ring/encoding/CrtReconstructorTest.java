package com.codeheadsystems.ring.encoding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class CrtReconstructorTest {

  private final long[] moduli = {1000003L, 1000033L, 1000037L};
  private final CrtReconstructor crt = new CrtReconstructor(moduli);

  private long[] residuesOf(BigInteger value) {
    long[] out = new long[moduli.length];
    for (int i = 0; i < moduli.length; i++) {
      out[i] = value.mod(BigInteger.valueOf(moduli[i])).longValueExact();
    }
    return out;
  }

  @Test
  void reconstructsPositiveValue() {
    BigInteger value = BigInteger.valueOf(123456789012345L);
    assertThat(crt.reconstructCentered(residuesOf(value))).isEqualTo(value);
  }

  @Test
  void reconstructsNegativeValueAsCentered() {
    BigInteger value = BigInteger.valueOf(-987654321098L);
    assertThat(crt.reconstructCentered(residuesOf(value))).isEqualTo(value);
  }

  @Test
  void modulusIsProduct() {
    assertThat(crt.modulus()).isEqualTo(BigInteger.valueOf(1000003L)
        .multiply(BigInteger.valueOf(1000033L)).multiply(BigInteger.valueOf(1000037L)));
  }

  @Test
  void rejectsWrongResidueCount() {
    assertThatThrownBy(() -> crt.reconstructCentered(new long[]{1, 2}))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
