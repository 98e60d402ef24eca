package com.codeheadsystems.secagg.client;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingElement;
import com.codeheadsystems.secagg.config.SecAggConfig;
import com.codeheadsystems.secagg.masking.ChaCha20Expander;
import com.codeheadsystems.secagg.masking.ExchangeKeyPair;
import com.codeheadsystems.secagg.masking.KeyExchange;
import com.codeheadsystems.secagg.masking.MaskEngine;
import com.codeheadsystems.secagg.mkckks.CiphertextShare;
import com.codeheadsystems.secagg.mkckks.MkCkksEncryptor;
import com.codeheadsystems.secagg.mkckks.MkCkksKeyGenerator;
import com.codeheadsystems.secagg.mkckks.MkKeyPair;
import com.codeheadsystems.secagg.mkckks.PublicKey;
import com.codeheadsystems.secagg.model.ClientShare;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One protocol participant. Owns its MK-CKKS secret key and its exchange key pair for its whole
 * lifetime; {@link #close()} destroys both.
 * <p>
 * Every client of a round must call {@link #prepareShare} with the same complete peer directory,
 * published before any client starts masking.
 */
public class SecAggClient implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SecAggClient.class);

  private final int clientId;
  private final Ring ring;
  private final MkKeyPair mkKeyPair;
  private final ExchangeKeyPair exchangeKeyPair;
  private final MkCkksEncryptor encryptor;
  private final KeyExchange keyExchange;
  private final MaskEngine maskEngine;

  /**
   * Instantiates a client from already generated keys.
   *
   * @param clientId        the id, unique within the round
   * @param config          the shared configuration
   * @param mkKeyPair       the MK-CKKS key pair
   * @param exchangeKeyPair the exchange key pair
   */
  public SecAggClient(final int clientId,
                      final SecAggConfig config,
                      final MkKeyPair mkKeyPair,
                      final ExchangeKeyPair exchangeKeyPair) {
    this.clientId = clientId;
    this.ring = config.ring();
    this.mkKeyPair = mkKeyPair;
    this.exchangeKeyPair = exchangeKeyPair;
    this.encryptor = new MkCkksEncryptor(ring, config.mkCkksParameters());
    this.keyExchange = new KeyExchange(config.exchangeCurve(), config.randomProvider());
    this.maskEngine = new MaskEngine(ring, keyExchange, new ChaCha20Expander());
    log.info("SecAggClient({})", clientId);
  }

  /**
   * Generates both key pairs and builds the client.
   *
   * @param clientId the id, unique within the round
   * @param config   the shared configuration
   * @param crs      the common reference value of the epoch
   * @return the client
   */
  public static SecAggClient create(final int clientId, final SecAggConfig config, final RingElement crs) {
    final MkKeyPair mkKeyPair = new MkCkksKeyGenerator(config.ring(), config.mkCkksParameters()).generateKeyPair(crs);
    final ExchangeKeyPair exchangeKeyPair =
        new KeyExchange(config.exchangeCurve(), config.randomProvider()).generateKeyPair();
    return new SecAggClient(clientId, config, mkKeyPair, exchangeKeyPair);
  }

  public int clientId() {
    return clientId;
  }

  public PublicKey publicKey() {
    return mkKeyPair.publicKey();
  }

  /**
   * Whether {@link #close()} has destroyed the key material.
   *
   * @return true once both the secret key and the exchange key pair are destroyed
   */
  public boolean isClosed() {
    return mkKeyPair.secretKey().isDestroyed() && exchangeKeyPair.isDestroyed();
  }

  /**
   * The serialized exchange public key to publish to the other clients.
   *
   * @return the compressed point
   */
  public byte[] exchangePublicKey() {
    return keyExchange.serializePublicKey(exchangeKeyPair);
  }

  /**
   * Encodes and encrypts the data, folding in this client's partial decryption.
   *
   * @param data at most {@code ring.slots()} values
   * @return the ciphertext share
   */
  public CiphertextShare encryptData(final double[] data) {
    log.trace("encryptData({}, size={})", clientId, data.length);
    final RingElement plaintext = ring.encode(data);
    return encryptor.encrypt(mkKeyPair.publicKey(), mkKeyPair.secretKey(), plaintext);
  }

  /**
   * This client's zero-sum mask for the round.
   *
   * @param peerKeys every client's serialized public key, by id
   * @param round    the round number
   * @return the mask
   */
  public RingElement generateMask(final Map<Integer, byte[]> peerKeys, final long round) {
    return maskEngine.generateMask(clientId, exchangeKeyPair, peerKeys, round);
  }

  /**
   * Prepares the round-0 share.
   *
   * @param data     the values
   * @param peerKeys every client's serialized public key, by id
   * @return the share
   */
  public ClientShare prepareShare(final double[] data, final Map<Integer, byte[]> peerKeys) {
    return prepareShare(data, peerKeys, 0L);
  }

  /**
   * Prepares the share (c0, d + mask).
   *
   * @param data     the values
   * @param peerKeys every client's serialized public key, by id
   * @param round    the round number
   * @return the share
   */
  public ClientShare prepareShare(final double[] data, final Map<Integer, byte[]> peerKeys, final long round) {
    log.debug("prepareShare({}, size={}, peers={}, round={})", clientId, data.length, peerKeys.size(), round);
    final CiphertextShare ciphertextShare = encryptData(data);
    final RingElement mask = generateMask(peerKeys, round);
    return ClientShare.masked(ciphertextShare, mask);
  }

  /**
   * Destroys the secret key and the exchange key pair.
   */
  @Override
  public void close() {
    log.debug("close({})", clientId);
    mkKeyPair.secretKey().destroy();
    exchangeKeyPair.destroy();
  }
}
