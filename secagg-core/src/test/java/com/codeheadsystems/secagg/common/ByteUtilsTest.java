package com.codeheadsystems.secagg.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  // ─── Constructor ──────────────────────────────────────────────────────────

  @Test
  void privateConstructorIsInaccessible() throws Exception {
    Constructor<ByteUtils> ctor = ByteUtils.class.getDeclaredConstructor();
    ctor.setAccessible(true);
    ctor.newInstance();
  }

  // ─── I2OSP ────────────────────────────────────────────────────────────────

  @Test
  void i2osp_singleByteMaxValue() {
    assertThat(ByteUtils.I2OSP(255, 1)).isEqualTo(new byte[]{(byte) 0xFF});
  }

  @Test
  void i2osp_eightByteRound() {
    assertThat(ByteUtils.I2OSP(0x0102L, 8)).isEqualTo(new byte[]{0, 0, 0, 0, 0, 0, 0x01, 0x02});
  }

  @Test
  void i2osp_longerThanEightBytesIsLeftPadded() {
    byte[] out = ByteUtils.I2OSP(Long.MAX_VALUE, 12);
    assertThat(out).hasSize(12);
    assertThat(out[3]).isZero();
    assertThat(out[4]).isEqualTo((byte) 0x7F);
    assertThat(out[11]).isEqualTo((byte) 0xFF);
  }

  @Test
  void i2osp_negativeValueThrows() {
    assertThatThrownBy(() -> ByteUtils.I2OSP(-1L, 8))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Value too large for specified length");
  }

  @Test
  void i2osp_valueTooLargeForLengthThrows() {
    assertThatThrownBy(() -> ByteUtils.I2OSP(256L, 1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ─── concat ───────────────────────────────────────────────────────────────

  @Test
  void concat_threeArrays() {
    assertThat(ByteUtils.concat(new byte[]{1}, new byte[0], new byte[]{2, 3})).isEqualTo(new byte[]{1, 2, 3});
  }

  @Test
  void concat_noArraysReturnsEmpty() {
    assertThat(ByteUtils.concat()).isEmpty();
  }

  // ─── fitToLength ──────────────────────────────────────────────────────────

  @Test
  void fitToLength_truncatesAndPads() {
    assertThat(ByteUtils.fitToLength(new byte[]{1, 2, 3}, 2)).isEqualTo(new byte[]{1, 2});
    assertThat(ByteUtils.fitToLength(new byte[]{1, 2}, 4)).isEqualTo(new byte[]{1, 2, 0, 0});
  }

  @Test
  void fitToLength_doesNotAliasInput() {
    byte[] in = {1, 2};
    byte[] out = ByteUtils.fitToLength(in, 2);
    out[0] = 9;
    assertThat(in[0]).isEqualTo((byte) 1);
  }

  // ─── readLongLittleEndian ─────────────────────────────────────────────────

  @Test
  void readLongLittleEndian_lowByteFirst() {
    byte[] bytes = {0x01, 0, 0, 0, 0, 0, 0, 0, (byte) 0xFF};
    assertThat(ByteUtils.readLongLittleEndian(bytes, 0)).isEqualTo(1L);
  }

  @Test
  void readLongLittleEndian_highBitIsUnsigned() {
    byte[] bytes = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF,
        (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};
    long value = ByteUtils.readLongLittleEndian(bytes, 0);
    assertThat(Long.toUnsignedString(value)).isEqualTo("18446744073709551615");
  }

  @Test
  void readLongLittleEndian_shortInputThrows() {
    assertThatThrownBy(() -> ByteUtils.readLongLittleEndian(new byte[9], 2))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ─── zeroize ──────────────────────────────────────────────────────────────

  @Test
  void zeroize_clearsAndToleratesNull() {
    byte[] secret = {5, 6, 7};
    ByteUtils.zeroize(secret);
    ByteUtils.zeroize(null);
    assertThat(secret).containsOnly(0);
  }
}
