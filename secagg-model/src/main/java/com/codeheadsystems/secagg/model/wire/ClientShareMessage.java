package com.codeheadsystems.secagg.model.wire;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingElementCodec;
import com.codeheadsystems.secagg.model.ClientShare;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;

/**
 * Wire model for the share a client uploads to the aggregator.
 * <p>
 * Both ring elements are serialized with {@link RingElementCodec} and base64-encoded. The masked
 * partial decryption reveals nothing on its own; only the sum over all clients does.
 *
 * @param clientId      the sending client
 * @param c0Base64      base64-encoded first ciphertext component
 * @param dMaskedBase64 base64-encoded masked partial decryption
 */
public record ClientShareMessage(
    @JsonProperty("clientId") int clientId,
    @JsonProperty("c0") String c0Base64,
    @JsonProperty("dMasked") String dMaskedBase64) {

  private static final Base64.Encoder B64 = Base64.getEncoder();

  public ClientShareMessage(int clientId, ClientShare share) {
    this(clientId,
        B64.encodeToString(RingElementCodec.toBytes(share.c0())),
        B64.encodeToString(RingElementCodec.toBytes(share.dMasked())));
  }

  /**
   * Decodes the share into elements of the given ring.
   *
   * @param ring the aggregation ring
   * @return the share
   */
  public ClientShare share(Ring ring) {
    return new ClientShare(
        RingElementCodec.fromBytes(ring, PeerKeyAnnouncement.decode(c0Base64, "c0")),
        RingElementCodec.fromBytes(ring, PeerKeyAnnouncement.decode(dMaskedBase64, "dMasked")));
  }
}
