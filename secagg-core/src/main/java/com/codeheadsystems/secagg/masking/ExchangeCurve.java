package com.codeheadsystems.secagg.masking;

import java.math.BigInteger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;

/**
 * The elliptic curves available for the pairwise Diffie-Hellman exchange.
 */
public enum ExchangeCurve {
  P256("P-256"),
  P384("P-384"),
  P521("P-521");

  /**
   * The default curve.
   */
  public static final ExchangeCurve DEFAULT = P384;

  private final String curveName;
  private final ECDomainParameters params;

  ExchangeCurve(String curveName) {
    this.curveName = curveName;
    X9ECParameters x9 = CustomNamedCurves.getByName(curveName);
    if (x9 == null) {
      throw new IllegalArgumentException("Unsupported curve: " + curveName);
    }
    this.params = new ECDomainParameters(x9.getCurve(), x9.getG(), x9.getN(), x9.getH());
  }

  public String curveName() {
    return curveName;
  }

  public ECDomainParameters params() {
    return params;
  }

  public ECCurve curve() {
    return params.getCurve();
  }

  public ECPoint g() {
    return params.getG();
  }

  public BigInteger n() {
    return params.getN();
  }

  /**
   * Byte length of a field element, which is also the shared secret length.
   *
   * @return the field size in bytes
   */
  public int fieldSize() {
    return (params.getCurve().getFieldSize() + 7) / 8;
  }

  /**
   * Byte length of a compressed SEC1 point.
   *
   * @return 1 + field size
   */
  public int compressedPointSize() {
    return 1 + fieldSize();
  }

  /**
   * Looks a curve up by its enum name or its curve name, case insensitive.
   *
   * @param name e.g. "P384" or "P-384"
   * @return the curve
   */
  public static ExchangeCurve fromName(String name) {
    for (ExchangeCurve c : values()) {
      if (c.name().equalsIgnoreCase(name) || c.curveName.equalsIgnoreCase(name)) {
        return c;
      }
    }
    throw new IllegalArgumentException("Unsupported curve: " + name);
  }
}
