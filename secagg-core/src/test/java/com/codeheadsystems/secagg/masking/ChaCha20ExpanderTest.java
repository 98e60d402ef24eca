package com.codeheadsystems.secagg.masking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class ChaCha20ExpanderTest {

  private final ChaCha20Expander expander = new ChaCha20Expander();

  @Test
  void zeroKeyZeroNonce_matchesKnownKeystream() {
    // RFC 7539 appendix A.1, test vector #1
    byte[] out = expander.expand(new byte[32], new byte[12], 32);

    assertThat(Hex.toHexString(out))
        .isEqualTo("76b8e0ada0f13d90405d6ae55386bd28bdd219b8a08ded1aa836efcc8b770dc7");
  }

  @Test
  void expand_isDeterministic() {
    byte[] key = Hex.decode("000102030405060708090a0b0c0d0e0f");

    assertThat(expander.expand(key, new byte[12], 100)).isEqualTo(expander.expand(key, new byte[12], 100));
  }

  @Test
  void expand_prefixIsStable() {
    byte[] key = {9, 9, 9};
    byte[] longer = expander.expand(key, new byte[12], 256);
    byte[] shorter = expander.expand(key, new byte[12], 64);

    assertThat(Arrays.copyOf(longer, 64)).isEqualTo(shorter);
  }

  @Test
  void shortKeyIsZeroPadded() {
    byte[] padded = new byte[32];
    padded[0] = 7;

    assertThat(expander.expand(new byte[]{7}, new byte[12], 48)).isEqualTo(expander.expand(padded, new byte[12], 48));
  }

  @Test
  void longKeyIsTruncated() {
    byte[] p521Secret = new byte[66];
    Arrays.fill(p521Secret, (byte) 3);
    p521Secret[40] = 1;

    assertThat(expander.expand(p521Secret, new byte[12], 48))
        .isEqualTo(expander.expand(Arrays.copyOf(p521Secret, 32), new byte[12], 48));
  }

  @Test
  void differentNonceGivesDifferentStream() {
    byte[] nonce = new byte[12];
    nonce[11] = 1;

    assertThat(expander.expand(new byte[32], nonce, 32)).isNotEqualTo(expander.expand(new byte[32], new byte[12], 32));
  }

  @Test
  void keyIsNotModified() {
    byte[] key = {1, 2, 3};
    expander.expand(key, new byte[12], 16);
    assertThat(key).isEqualTo(new byte[]{1, 2, 3});
  }

  @Test
  void wrongNonceLengthThrows() {
    assertThatThrownBy(() -> expander.expand(new byte[32], new byte[8], 16))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
