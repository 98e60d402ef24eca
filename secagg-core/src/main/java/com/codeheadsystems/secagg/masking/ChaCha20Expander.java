package com.codeheadsystems.secagg.masking;

import com.codeheadsystems.secagg.common.ByteUtils;
import javax.inject.Singleton;
import org.bouncycastle.crypto.engines.ChaCha7539Engine;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;

/**
 * ChaCha20 keystream (RFC 7539 variant) as the pseudorandom expander. Keys are truncated or zero
 * padded to 32 bytes.
 */
@Singleton
public class ChaCha20Expander implements PseudorandomExpander {

  /**
   * ChaCha20 key length.
   */
  public static final int KEY_LENGTH = 32;

  /**
   * ChaCha20 (RFC 7539) nonce length.
   */
  public static final int NONCE_LENGTH = 12;

  @Override
  public int nonceLength() {
    return NONCE_LENGTH;
  }

  @Override
  public byte[] expand(final byte[] key, final byte[] nonce, final int length) {
    if (nonce.length != NONCE_LENGTH) {
      throw new IllegalArgumentException("ChaCha20 nonce must be " + NONCE_LENGTH + " bytes: " + nonce.length);
    }
    if (length < 0) {
      throw new IllegalArgumentException("Negative length: " + length);
    }
    final byte[] fitted = ByteUtils.fitToLength(key, KEY_LENGTH);
    try {
      final ChaCha7539Engine engine = new ChaCha7539Engine();
      engine.init(true, new ParametersWithIV(new KeyParameter(fitted), nonce));
      final byte[] out = new byte[length];
      engine.processBytes(new byte[length], 0, length, out, 0);
      return out;
    } finally {
      ByteUtils.zeroize(fitted);
    }
  }
}
