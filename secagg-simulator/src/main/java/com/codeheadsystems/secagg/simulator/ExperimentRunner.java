package com.codeheadsystems.secagg.simulator;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingElement;
import com.codeheadsystems.ring.RingElementCodec;
import com.codeheadsystems.ring.RingParameters;
import com.codeheadsystems.secagg.client.SecAggClient;
import com.codeheadsystems.secagg.common.RandomProvider;
import com.codeheadsystems.secagg.config.SecAggConfig;
import com.codeheadsystems.secagg.masking.ExchangeKeyPair;
import com.codeheadsystems.secagg.masking.KeyExchange;
import com.codeheadsystems.secagg.mkckks.CiphertextShare;
import com.codeheadsystems.secagg.mkckks.MkCkksKeyGenerator;
import com.codeheadsystems.secagg.mkckks.MkKeyPair;
import com.codeheadsystems.secagg.model.ClientShare;
import com.codeheadsystems.secagg.model.ServerResult;
import com.codeheadsystems.secagg.model.wire.AggregateResultResponse;
import com.codeheadsystems.secagg.model.wire.ClientShareMessage;
import com.codeheadsystems.secagg.model.wire.PeerKeyAnnouncement;
import com.codeheadsystems.secagg.server.Aggregator;
import com.codeheadsystems.secagg.simulator.exceptions.SimulationException;
import com.codeheadsystems.secagg.simulator.model.ClientTimings;
import com.codeheadsystems.secagg.simulator.model.CommunicationReport;
import com.codeheadsystems.secagg.simulator.model.ExperimentResult;
import com.codeheadsystems.secagg.simulator.model.ServerTimings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs complete aggregation rounds in one process and measures them.
 * <p>
 * Key generation and share preparation run on a worker pool. The peer directory is built only
 * after every client has generated its keys and is immutable from then on, so no client masks
 * against a partial directory. Shares travel to the aggregator as JSON {@link ClientShareMessage}s.
 */
public class ExperimentRunner {

  private static final Logger log = LoggerFactory.getLogger(ExperimentRunner.class);

  private final SimulatorConfig config;
  private final ObjectMapper objectMapper;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new experiment runner.
   *
   * @param config       the simulator settings
   * @param objectMapper the mapper for the wire messages
   */
  public ExperimentRunner(final SimulatorConfig config, final ObjectMapper objectMapper) {
    this.config = config;
    this.objectMapper = objectMapper;
    this.randomProvider = new RandomProvider();
    log.info("ExperimentRunner({})", config);
  }

  /**
   * Runs one experiment end to end.
   *
   * @param experiment the experiment
   * @return the measurements
   */
  public ExperimentResult run(final Experiment experiment) {
    final int numClients = experiment.numClients();
    final int dataSize = experiment.dataSize();
    final RingDimensionPolicy policy = config.ringDimensionPolicy();
    final RingParameters parameters = RingParameters.builder()
        .withRingDimension(policy.ringDimension(dataSize))
        .withBatchSize(policy.batchSize(dataSize))
        .build();
    log.info("Running {} with clients={} dataSize={} ringDimension={}", experiment.name(), numClients, dataSize,
        parameters.ringDimension());

    final Ring ring = new Ring(parameters, randomProvider.random());
    final SecAggConfig secAggConfig = new SecAggConfig(ring, config.mkCkksParameters(), config.exchangeCurve(),
        randomProvider);
    final MkCkksKeyGenerator keyGenerator = new MkCkksKeyGenerator(ring, config.mkCkksParameters());
    final KeyExchange keyExchange = new KeyExchange(config.exchangeCurve(), randomProvider);
    final RingElement crs = keyGenerator.generateReferenceValue();
    final double[][] data = generateData(numClients, dataSize);

    final List<SecAggClient> clients = new ArrayList<>(numClients);
    final ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.threads(), numClients));
    try {
      // Phase 1: keys
      final List<Callable<KeyedClient>> keyTasks = new ArrayList<>(numClients);
      for (int i = 0; i < numClients; i++) {
        final int clientId = i;
        keyTasks.add(() -> generateClient(clientId, secAggConfig, keyGenerator, keyExchange, crs));
      }
      final List<ClientTimings> keyTimings = new ArrayList<>(numClients);
      for (KeyedClient keyed : awaitAll(executor, keyTasks)) {
        clients.add(keyed.client());
        keyTimings.add(keyed.timings());
      }

      // Phase 2: every exchange key is published before anyone masks
      final List<PeerKeyAnnouncement> announcements = new ArrayList<>(numClients);
      long setupBytes = 0;
      for (SecAggClient client : clients) {
        final byte[] publicKey = client.exchangePublicKey();
        setupBytes += publicKey.length;
        announcements.add(new PeerKeyAnnouncement(client.clientId(), publicKey));
      }
      final Map<Integer, byte[]> peers = PeerKeyAnnouncement.directory(announcements);
      log.debug("Published {} exchange keys ({} bytes)", peers.size(), setupBytes);

      // Phase 3: shares
      final Aggregator aggregator = new Aggregator(ring);
      final List<Callable<PreparedShare>> shareTasks = new ArrayList<>(numClients);
      for (SecAggClient client : clients) {
        final ClientTimings timings = keyTimings.get(client.clientId());
        final double[] values = data[client.clientId()];
        shareTasks.add(() -> prepareAndSend(client, values, peers, timings, ring, aggregator));
      }
      final List<PreparedShare> prepared = awaitAll(executor, shareTasks);

      // Phase 4: aggregation
      long start = System.nanoTime();
      aggregator.aggregate();
      final double aggregateMs = elapsedMs(start);
      start = System.nanoTime();
      final ServerResult serverResult = aggregator.finalResult(dataSize);
      final double decodeMs = elapsedMs(start);
      final double[] published = publish(serverResult, numClients);

      final double maxError = maxError(data, published);
      final boolean verified = maxError <= config.tolerance();
      if (verified) {
        log.info("{}: max error {} within tolerance", experiment.name(), maxError);
      } else {
        log.warn("{}: max error {} exceeds tolerance {}", experiment.name(), maxError, config.tolerance());
      }

      final CommunicationReport communication = new CommunicationReport(
          (long) dataSize * Double.BYTES,
          2L * RingElementCodec.serializedSize(ring),
          prepared.get(0).messageBytes(),
          setupBytes,
          (long) published.length * Double.BYTES,
          numClients);
      final List<ClientTimings> clientTimings = new ArrayList<>(numClients);
      prepared.forEach(p -> clientTimings.add(p.timings()));
      return new ExperimentResult(experiment, parameters.ringDimension(), clientTimings,
          new ServerTimings(aggregateMs, decodeMs), communication, maxError, verified);
    } finally {
      executor.shutdownNow();
      clients.forEach(SecAggClient::close);
    }
  }

  private KeyedClient generateClient(final int clientId,
                                     final SecAggConfig secAggConfig,
                                     final MkCkksKeyGenerator keyGenerator,
                                     final KeyExchange keyExchange,
                                     final RingElement crs) {
    long start = System.nanoTime();
    final MkKeyPair mkKeyPair = keyGenerator.generateKeyPair(crs);
    final double mkCkksMs = elapsedMs(start);
    start = System.nanoTime();
    final ExchangeKeyPair exchangeKeyPair = keyExchange.generateKeyPair();
    final double ecdhMs = elapsedMs(start);
    final SecAggClient client = new SecAggClient(clientId, secAggConfig, mkKeyPair, exchangeKeyPair);
    return new KeyedClient(client, new ClientTimings(clientId, mkCkksMs, ecdhMs, 0, 0));
  }

  private PreparedShare prepareAndSend(final SecAggClient client,
                                       final double[] values,
                                       final Map<Integer, byte[]> peers,
                                       final ClientTimings keyTimings,
                                       final Ring ring,
                                       final Aggregator aggregator) throws Exception {
    long start = System.nanoTime();
    final CiphertextShare ciphertextShare = client.encryptData(values);
    final double encryptMs = elapsedMs(start);
    start = System.nanoTime();
    final RingElement mask = client.generateMask(peers, 0L);
    final double maskGenMs = elapsedMs(start);
    final ClientShare share = ClientShare.masked(ciphertextShare, mask);

    final String json = objectMapper.writeValueAsString(new ClientShareMessage(client.clientId(), share));
    final ClientShareMessage received = objectMapper.readValue(json, ClientShareMessage.class);
    aggregator.collectShare(received.clientId(), received.share(ring));
    return new PreparedShare(keyTimings.withShareTimes(encryptMs, maskGenMs),
        json.getBytes(StandardCharsets.UTF_8).length);
  }

  private double[] publish(final ServerResult serverResult, final int numClients) {
    try {
      final String json = objectMapper.writeValueAsString(new AggregateResultResponse(serverResult, numClients));
      return objectMapper.readValue(json, AggregateResultResponse.class).serverResult().vector();
    } catch (JsonProcessingException e) {
      throw new SimulationException("Unable to transport the aggregate result", e);
    }
  }

  private double[][] generateData(final int numClients, final int dataSize) {
    final Random random = new Random(config.seed());
    final double bound = config.valueBound();
    final double[][] data = new double[numClients][dataSize];
    for (int i = 0; i < numClients; i++) {
      for (int j = 0; j < dataSize; j++) {
        data[i][j] = (random.nextDouble() * 2 - 1) * bound;
      }
    }
    return data;
  }

  static double maxError(final double[][] data, final double[] actual) {
    double max = 0;
    for (int j = 0; j < actual.length; j++) {
      double expected = 0;
      for (double[] row : data) {
        expected += row[j];
      }
      max = Math.max(max, Math.abs(expected - actual[j]));
    }
    return max;
  }

  private static <T> List<T> awaitAll(final ExecutorService executor, final List<Callable<T>> tasks) {
    try {
      final List<T> results = new ArrayList<>(tasks.size());
      for (Future<T> future : executor.invokeAll(tasks)) {
        results.add(future.get());
      }
      return results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SimulationException("Interrupted while waiting for clients", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new SimulationException("Client task failed", e.getCause());
    }
  }

  private static double elapsedMs(final long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }

  private record KeyedClient(SecAggClient client, ClientTimings timings) {
  }

  private record PreparedShare(ClientTimings timings, long messageBytes) {
  }
}
