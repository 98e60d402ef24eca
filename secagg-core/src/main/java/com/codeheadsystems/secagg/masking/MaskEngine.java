package com.codeheadsystems.secagg.masking;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingElement;
import com.codeheadsystems.secagg.common.ByteUtils;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives zero-sum masks from pairwise Diffie-Hellman secrets.
 * <p>
 * For each pair (i, j) both parties expand the same shared secret into the same ring element; the
 * lower id subtracts it and the higher id adds it. Summed over a consistent peer set the masks are
 * exactly zero. A client that sees a different peer set than the others silently breaks this.
 */
@Singleton
public class MaskEngine {

  private static final Logger log = LoggerFactory.getLogger(MaskEngine.class);

  private final Ring ring;
  private final KeyExchange keyExchange;
  private final PseudorandomExpander expander;

  /**
   * Instantiates a new mask engine.
   *
   * @param ring        the ring the masks live in
   * @param keyExchange the key exchange
   * @param expander    the pseudorandom expander
   */
  @Inject
  public MaskEngine(final Ring ring, final KeyExchange keyExchange, final PseudorandomExpander expander) {
    this.ring = ring;
    this.keyExchange = keyExchange;
    this.expander = expander;
    log.info("MaskEngine({}, {})", keyExchange.curve(), expander.getClass().getSimpleName());
  }

  /**
   * Nonce for a round: the round number in the last eight bytes, big-endian. Round 0 gives the
   * all-zero nonce.
   *
   * @param round the round, non-negative
   * @return the nonce
   */
  public byte[] roundNonce(final long round) {
    final int length = expander.nonceLength();
    if (length < 8) {
      return ByteUtils.I2OSP(round, length);
    }
    return ByteUtils.concat(new byte[length - 8], ByteUtils.I2OSP(round, 8));
  }

  /**
   * Expands a shared secret with the round-0 nonce.
   *
   * @param secret the shared secret
   * @return the pairwise ring element
   */
  public RingElement expandToRingElement(final byte[] secret) {
    return expandToRingElement(secret, 0L);
  }

  /**
   * Expands a shared secret into a ring element: eight keystream bytes per coefficient, read as an
   * unsigned little-endian value and reduced modulo the tower's modulus, tower after tower.
   *
   * @param secret the shared secret
   * @param round  the round number selecting the nonce
   * @return the pairwise ring element
   */
  public RingElement expandToRingElement(final byte[] secret, final long round) {
    final int n = ring.dimension();
    final int towers = ring.residueCount();
    final byte[] stream = expander.expand(secret, roundNonce(round), Math.multiplyExact(Math.multiplyExact(n, 8), towers));
    final long[][] residues = new long[towers][n];
    int offset = 0;
    for (int t = 0; t < towers; t++) {
      final long q = ring.modulusOf(t);
      for (int j = 0; j < n; j++) {
        residues[t][j] = Long.remainderUnsigned(ByteUtils.readLongLittleEndian(stream, offset), q);
        offset += 8;
      }
    }
    ByteUtils.zeroize(stream);
    return ring.fromResidues(residues);
  }

  /**
   * Mask for round 0.
   *
   * @param myId     this client's id
   * @param myKeys   this client's exchange key pair
   * @param peerKeys every client's serialized public key, by id
   * @return the mask
   */
  public RingElement generateMask(final int myId, final ExchangeKeyPair myKeys, final Map<Integer, byte[]> peerKeys) {
    return generateMask(myId, myKeys, peerKeys, 0L);
  }

  /**
   * Sums the signed pairwise elements with every peer other than {@code myId}.
   *
   * @param myId     this client's id
   * @param myKeys   this client's exchange key pair
   * @param peerKeys every client's serialized public key, by id
   * @param round    the round number
   * @return the mask
   */
  public RingElement generateMask(final int myId,
                                  final ExchangeKeyPair myKeys,
                                  final Map<Integer, byte[]> peerKeys,
                                  final long round) {
    log.trace("generateMask({}, peers={}, round={})", myId, peerKeys.size(), round);
    if (!peerKeys.containsKey(myId)) {
      log.warn("Client {} is missing from its own peer directory; masks will not cancel", myId);
    }
    RingElement mask = ring.zero();
    for (Map.Entry<Integer, byte[]> entry : peerKeys.entrySet()) {
      final int peerId = entry.getKey();
      if (peerId == myId) {
        continue;
      }
      final byte[] secret = keyExchange.deriveSharedSecret(myKeys, entry.getValue());
      final RingElement pairwise = expandToRingElement(secret, round);
      ByteUtils.zeroize(secret);
      mask = myId < peerId ? mask.subtract(pairwise) : mask.add(pairwise);
    }
    return mask;
  }
}
