package com.codeheadsystems.secagg.masking;

import java.math.BigInteger;
import javax.security.auth.Destroyable;
import org.bouncycastle.math.ec.ECPoint;

/**
 * An ECDH key pair owned by a single client. The private scalar cannot be zeroized in place, so
 * destruction drops the reference and forbids further use.
 */
public final class ExchangeKeyPair implements Destroyable {

  private final ExchangeCurve curve;
  private final ECPoint publicKey;
  private BigInteger privateKey;

  /**
   * Instantiates a new exchange key pair.
   *
   * @param curve      the curve
   * @param privateKey the private scalar in [1, n-1]
   * @param publicKey  privateKey * G
   */
  public ExchangeKeyPair(final ExchangeCurve curve, final BigInteger privateKey, final ECPoint publicKey) {
    this.curve = curve;
    this.privateKey = privateKey;
    this.publicKey = publicKey;
  }

  public ExchangeCurve curve() {
    return curve;
  }

  public ECPoint publicKey() {
    return publicKey;
  }

  /**
   * The private scalar.
   *
   * @return the scalar
   */
  public synchronized BigInteger privateKey() {
    if (privateKey == null) {
      throw new IllegalStateException("Exchange key pair has been destroyed");
    }
    return privateKey;
  }

  @Override
  public synchronized void destroy() {
    privateKey = null;
  }

  @Override
  public synchronized boolean isDestroyed() {
    return privateKey == null;
  }

  @Override
  public String toString() {
    return "ExchangeKeyPair[" + curve + ", " + (isDestroyed() ? "destroyed" : "redacted") + "]";
  }
}
