package com.codeheadsystems.secagg.model.wire;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Wire model for a client publishing its key-exchange public key to the other participants.
 * <p>
 * Every client must have received the announcement of every other client before it derives its
 * mask. The public key is the compressed SEC1 encoding of the client's ECDH point, base64-encoded.
 *
 * @param clientId        the announcing client
 * @param publicKeyBase64 base64-encoded compressed SEC1 public key
 */
public record PeerKeyAnnouncement(
    @JsonProperty("clientId") int clientId,
    @JsonProperty("publicKey") String publicKeyBase64) {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  public PeerKeyAnnouncement(int clientId, byte[] publicKey) {
    this(clientId, B64.encodeToString(publicKey));
  }

  static byte[] decode(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }

  public byte[] publicKey() {
    return decode(publicKeyBase64, "publicKey");
  }

  /**
   * Builds the immutable peer directory the clients mask against.
   *
   * @param announcements one announcement per client
   * @return public keys by client id
   */
  public static Map<Integer, byte[]> directory(Collection<PeerKeyAnnouncement> announcements) {
    Map<Integer, byte[]> peers = new HashMap<>();
    for (PeerKeyAnnouncement announcement : announcements) {
      if (peers.put(announcement.clientId(), announcement.publicKey()) != null) {
        throw new IllegalArgumentException("Duplicate announcement for client " + announcement.clientId());
      }
    }
    return Collections.unmodifiableMap(peers);
  }
}
