package com.codeheadsystems.secagg.mkckks;

/**
 * The MK-CKKS key pair of one client.
 *
 * @param secretKey the secret key
 * @param publicKey the public key
 */
public record MkKeyPair(SecretKey secretKey, PublicKey publicKey) {
}
