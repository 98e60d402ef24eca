package com.codeheadsystems.secagg.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingElement;
import com.codeheadsystems.secagg.TestRings;
import com.codeheadsystems.secagg.config.SecAggConfig;
import com.codeheadsystems.secagg.exceptions.KeyExchangeException;
import com.codeheadsystems.secagg.mkckks.CiphertextShare;
import com.codeheadsystems.secagg.mkckks.MkCkksKeyGenerator;
import com.codeheadsystems.secagg.model.ClientShare;
import com.codeheadsystems.secagg.model.ServerResult;
import com.codeheadsystems.secagg.server.Aggregator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SecAggClientTest {

  private static final double TOLERANCE = 1e-3;

  private final Ring ring = TestRings.SMALL;
  private final SecAggConfig config = SecAggConfig.forRing(ring);
  private final List<SecAggClient> clients = new ArrayList<>();
  private RingElement crs;

  @BeforeEach
  void setUp() {
    crs = new MkCkksKeyGenerator(ring, config.mkCkksParameters()).generateReferenceValue();
  }

  @AfterEach
  void tearDown() {
    clients.forEach(SecAggClient::close);
  }

  private List<SecAggClient> createClients(int count) {
    for (int i = 0; i < count; i++) {
      clients.add(SecAggClient.create(i, config, crs));
    }
    return clients;
  }

  private Map<Integer, byte[]> directory(List<SecAggClient> participants) {
    Map<Integer, byte[]> peers = new HashMap<>();
    participants.forEach(c -> peers.put(c.clientId(), c.exchangePublicKey()));
    return Collections.unmodifiableMap(peers);
  }

  private double[] runRound(List<SecAggClient> participants, double[][] data, long round) {
    Map<Integer, byte[]> peers = directory(participants);
    Aggregator aggregator = new Aggregator(ring);
    for (int i = 0; i < participants.size(); i++) {
      SecAggClient client = participants.get(i);
      aggregator.collectShare(client.clientId(), client.prepareShare(data[i], peers, round));
    }
    ServerResult result = aggregator.finalResult(data[0].length);
    return result.vector();
  }

  @Test
  void tenClientsOf128Values_sumWithinTolerance() {
    List<SecAggClient> participants = createClients(10);
    Random random = new Random(2024);
    double[][] data = new double[10][128];
    double[] expected = new double[128];
    for (int i = 0; i < 10; i++) {
      for (int j = 0; j < 128; j++) {
        data[i][j] = random.nextDouble() * 20 - 10;
        expected[j] += data[i][j];
      }
    }

    double[] actual = runRound(participants, data, 0L);

    assertThat(actual).hasSize(128);
    for (int j = 0; j < 128; j++) {
      assertThat(actual[j]).isCloseTo(expected[j], within(TOLERANCE));
    }
  }

  @Test
  void threeClientScenario() {
    List<SecAggClient> participants = createClients(3);
    double[][] data = {
        {1, 2, 3, 4},
        {5, 6, 7, 8},
        {-1, -2, -3, -4}
    };

    assertThat(runRound(participants, data, 0L)).containsExactly(new double[]{5, 6, 7, 8}, within(TOLERANCE));
  }

  @Test
  void sameKeysWorkAcrossRounds() {
    List<SecAggClient> participants = createClients(3);
    double[][] data = {{1}, {2}, {3}};

    assertThat(runRound(participants, data, 1L)).containsExactly(new double[]{6}, within(TOLERANCE));
    assertThat(runRound(participants, data, 2L)).containsExactly(new double[]{6}, within(TOLERANCE));
  }

  @Test
  void singleClient_maskIsZeroAndShareDecodesToItsData() {
    SecAggClient client = createClients(1).get(0);
    Map<Integer, byte[]> peers = directory(clients);

    assertThat(client.generateMask(peers, 0L).isZero()).isTrue();
    ClientShare share = client.prepareShare(new double[]{3.5, -1.5}, peers);
    assertThat(ring.decode(share.c0().add(share.dMasked()), 2)).containsExactly(new double[]{3.5, -1.5}, within(TOLERANCE));
  }

  @Test
  void maskedShareAloneDoesNotDecodeToTheData() {
    List<SecAggClient> participants = createClients(2);
    ClientShare share = participants.get(0).prepareShare(new double[]{1.0}, directory(participants));

    double[] alone = ring.decode(share.c0().add(share.dMasked()), 1);
    assertThat(Math.abs(alone[0] - 1.0)).isGreaterThan(1.0);
  }

  @Test
  void encryptData_andGenerateMask_composeToPrepareShare() {
    List<SecAggClient> participants = createClients(2);
    Map<Integer, byte[]> peers = directory(participants);
    SecAggClient client = participants.get(0);

    CiphertextShare ciphertext = client.encryptData(new double[]{2.0});
    RingElement mask = client.generateMask(peers, 0L);
    RingElement partner = participants.get(1).generateMask(peers, 0L);

    assertThat(mask.add(partner).isZero()).isTrue();
    assertThat(ring.decode(ciphertext.c0().add(ciphertext.d()), 1)).containsExactly(new double[]{2.0}, within(TOLERANCE));
  }

  @Test
  void exchangePublicKey_isCompressedP384ByDefault() {
    assertThat(createClients(1).get(0).exchangePublicKey()).hasSize(49);
  }

  @Test
  void corruptPeerKeyFailsMasking() {
    List<SecAggClient> participants = createClients(2);
    Map<Integer, byte[]> peers = new HashMap<>(directory(participants));
    peers.put(1, new byte[]{1, 2, 3});

    assertThatThrownBy(() -> participants.get(0).prepareShare(new double[]{1.0}, peers))
        .isInstanceOf(KeyExchangeException.class);
  }

  @Test
  void close_destroysKeyMaterial() {
    SecAggClient client = SecAggClient.create(0, config, crs);
    Map<Integer, byte[]> peers = Map.of(0, client.exchangePublicKey(), 1, client.exchangePublicKey());

    assertThat(client.isClosed()).isFalse();
    client.close();

    assertThat(client.isClosed()).isTrue();
    assertThatThrownBy(() -> client.encryptData(new double[]{1.0})).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> client.generateMask(peers, 0L)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void publicKey_sharesTheReferenceValue() {
    SecAggClient first = SecAggClient.create(0, config, crs);
    SecAggClient second = SecAggClient.create(1, config, crs);

    assertThat(first.publicKey().a()).isEqualTo(crs);
    assertThat(second.publicKey().a()).isEqualTo(crs);
    assertThat(first.publicKey().b()).isNotEqualTo(second.publicKey().b());
  }
}
