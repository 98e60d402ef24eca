package com.codeheadsystems.secagg.server;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingElement;
import com.codeheadsystems.secagg.exceptions.AggregationStateException;
import com.codeheadsystems.secagg.exceptions.DuplicateShareException;
import com.codeheadsystems.secagg.exceptions.NoSharesException;
import com.codeheadsystems.secagg.model.ClientShare;
import com.codeheadsystems.secagg.model.ServerResult;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects client shares for one round and sums them. Holds no key material. Use one instance
 * per round, or call {@link #reset()} before reusing it for the next round.
 * <p>
 * State transitions: COLLECTING to AGGREGATED on {@link #aggregate()}, AGGREGATED to CONSUMED on
 * {@link #finalResult(int)}, any state back to COLLECTING on {@link #reset()}.
 */
public class Aggregator {

  private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

  private final Ring ring;
  private final Map<Integer, ClientShare> shares = new LinkedHashMap<>();
  private AggregationState state = AggregationState.COLLECTING;
  private RingElement aggregate;

  /**
   * Instantiates a new aggregator.
   *
   * @param ring the ring
   */
  @Inject
  public Aggregator(final Ring ring) {
    this.ring = ring;
    log.info("Aggregator({})", ring.parameters());
  }

  public synchronized AggregationState state() {
    return state;
  }

  public synchronized int shareCount() {
    return shares.size();
  }

  /**
   * The collected shares by client id, in arrival order.
   *
   * @return an unmodifiable snapshot
   */
  public synchronized Map<Integer, ClientShare> shares() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(shares));
  }

  /**
   * Accepts one share per client id.
   *
   * @param clientId the sender
   * @param share    the share
   */
  public synchronized void collectShare(final int clientId, final ClientShare share) {
    if (state != AggregationState.COLLECTING) {
      throw new AggregationStateException("Cannot collect shares in state " + state);
    }
    if (!ring.isCompatible(share.c0().ring()) || !ring.isCompatible(share.dMasked().ring())) {
      throw new IllegalArgumentException("Share from client " + clientId + " belongs to a different ring");
    }
    if (shares.containsKey(clientId)) {
      throw new DuplicateShareException(clientId);
    }
    shares.put(clientId, share);
    log.debug("collectShare({}) count={}", clientId, shares.size());
  }

  /**
   * Closes collection and returns sum(c0) + sum(dMasked). Repeated calls return the same element.
   *
   * @return the aggregate
   */
  public synchronized RingElement aggregate() {
    if (aggregate != null) {
      return aggregate;
    }
    if (shares.isEmpty()) {
      throw new NoSharesException("No shares collected");
    }
    RingElement sumC0 = ring.zero();
    RingElement sumD = ring.zero();
    for (ClientShare share : shares.values()) {
      sumC0 = sumC0.add(share.c0());
      sumD = sumD.add(share.dMasked());
    }
    aggregate = sumC0.add(sumD);
    state = AggregationState.AGGREGATED;
    log.debug("aggregate() shares={}", shares.size());
    return aggregate;
  }

  /**
   * Decodes an aggregate. Pure: does not touch the round state.
   *
   * @param aggregate the aggregate
   * @param dataSize  the number of values
   * @return the decoded values
   */
  public double[] decode(final RingElement aggregate, final int dataSize) {
    return ring.decode(aggregate, dataSize);
  }

  /**
   * Aggregates if needed, decodes and marks the round consumed.
   *
   * @param dataSize the number of values
   * @return the result
   */
  public synchronized ServerResult finalResult(final int dataSize) {
    if (state == AggregationState.CONSUMED) {
      throw new AggregationStateException("Round already consumed");
    }
    final ServerResult result = new ServerResult(decode(aggregate(), dataSize));
    state = AggregationState.CONSUMED;
    log.info("finalResult() clients={} dataSize={}", shares.size(), dataSize);
    return result;
  }

  /**
   * Drops all shares and starts a new round.
   */
  public synchronized void reset() {
    log.debug("reset() from {}", state);
    shares.clear();
    aggregate = null;
    state = AggregationState.COLLECTING;
  }
}
