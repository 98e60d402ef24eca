package com.codeheadsystems.secagg.masking;

import com.codeheadsystems.secagg.common.RandomProvider;
import com.codeheadsystems.secagg.exceptions.KeyExchangeException;
import java.math.BigInteger;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.crypto.agreement.ECDHBasicAgreement;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Elliptic-curve Diffie-Hellman over one {@link ExchangeCurve}. Public keys travel as compressed
 * SEC1 points.
 */
@Singleton
public class KeyExchange {

  private static final Logger log = LoggerFactory.getLogger(KeyExchange.class);

  private final ExchangeCurve curve;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new key exchange.
   *
   * @param curve          the curve
   * @param randomProvider the random provider
   */
  @Inject
  public KeyExchange(final ExchangeCurve curve, final RandomProvider randomProvider) {
    this.curve = curve;
    this.randomProvider = randomProvider;
    log.info("KeyExchange({})", curve);
  }

  public ExchangeCurve curve() {
    return curve;
  }

  /**
   * Generates a fresh key pair with a private scalar uniform in [1, n-1].
   *
   * @return the key pair
   */
  public ExchangeKeyPair generateKeyPair() {
    log.trace("generateKeyPair()");
    final BigInteger d = BigIntegers.createRandomInRange(BigInteger.ONE, curve.n().subtract(BigInteger.ONE),
        randomProvider.random());
    final ECPoint q = curve.g().multiply(d).normalize();
    return new ExchangeKeyPair(curve, d, q);
  }

  /**
   * Serializes the public half as a compressed SEC1 point.
   *
   * @param keyPair the key pair
   * @return the encoded point
   */
  public byte[] serializePublicKey(final ExchangeKeyPair keyPair) {
    return keyPair.publicKey().getEncoded(true);
  }

  /**
   * Decodes and validates a peer's public key.
   *
   * @param encoded the SEC1 encoded point
   * @return the point
   * @throws KeyExchangeException if the bytes are not a valid point of this curve
   */
  public ECPoint deserializePublicKey(final byte[] encoded) {
    if (encoded == null || encoded.length == 0) {
      throw new KeyExchangeException("Empty peer public key");
    }
    final int compressed = curve.compressedPointSize();
    final int uncompressed = 1 + 2 * curve.fieldSize();
    if (encoded.length != compressed && encoded.length != uncompressed) {
      throw new KeyExchangeException("Curve mismatch: " + encoded.length + " byte key is not a " + curve.curveName() + " point");
    }
    final ECPoint p;
    try {
      p = curve.curve().decodePoint(encoded);
    } catch (IllegalArgumentException e) {
      throw new KeyExchangeException("Malformed peer public key", e);
    }
    if (p.isInfinity()) {
      throw new KeyExchangeException("Invalid peer public key: identity element not allowed");
    }
    if (!p.isValid()) {
      throw new KeyExchangeException("Invalid peer public key: not on curve");
    }
    return p.normalize();
  }

  /**
   * Derives the ECDH shared secret: the x-coordinate of d * Q as a fixed-length field element.
   * The result is symmetric in the two parties.
   *
   * @param myKeyPair     this client's key pair
   * @param peerPublicKey the peer's serialized public key
   * @return the shared secret
   */
  public byte[] deriveSharedSecret(final ExchangeKeyPair myKeyPair, final byte[] peerPublicKey) {
    if (myKeyPair.curve() != curve) {
      throw new KeyExchangeException("Curve mismatch: key pair is on " + myKeyPair.curve() + ", exchange uses " + curve);
    }
    final BigInteger d = myKeyPair.privateKey();
    final ECPoint peer = deserializePublicKey(peerPublicKey);
    final ECDHBasicAgreement agreement = new ECDHBasicAgreement();
    try {
      agreement.init(new ECPrivateKeyParameters(d, curve.params()));
      final BigInteger z = agreement.calculateAgreement(new ECPublicKeyParameters(peer, curve.params()));
      return BigIntegers.asUnsignedByteArray(curve.fieldSize(), z);
    } catch (IllegalStateException | IllegalArgumentException e) {
      throw new KeyExchangeException("Shared secret derivation failed", e);
    }
  }
}
