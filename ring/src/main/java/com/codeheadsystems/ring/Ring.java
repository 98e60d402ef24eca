package com.codeheadsystems.ring;

import com.codeheadsystems.ring.encoding.CkksEncoder;
import com.codeheadsystems.ring.ntt.ModularArithmetic;
import com.codeheadsystems.ring.ntt.NegacyclicNtt;
import com.codeheadsystems.ring.ntt.NttPrimes;
import com.codeheadsystems.ring.sampling.DiscreteGaussianSampler;
import com.codeheadsystems.ring.sampling.UniformSampler;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The polynomial ring Z_Q[X]/(X^N + 1) in residue-number-system form, together with its
 * samplers and its CKKS encoder. Instances are immutable apart from the random source and are safe
 * to share between threads.
 */
public class Ring {

  private static final Logger log = LoggerFactory.getLogger(Ring.class);

  private final RingParameters parameters;
  private final long[] moduli;
  private final NegacyclicNtt[] transforms;
  private final CkksEncoder encoder;
  private final UniformSampler uniformSampler;
  private final DiscreteGaussianSampler gaussianSampler;

  /**
   * Instantiates a new ring with a default {@link SecureRandom}.
   *
   * @param parameters the parameters
   */
  public Ring(RingParameters parameters) {
    this(parameters, new SecureRandom());
  }

  /**
   * Instantiates a new ring.
   *
   * @param parameters the parameters
   * @param random     the random source for sampling
   */
  public Ring(RingParameters parameters, SecureRandom random) {
    this.parameters = parameters;
    this.moduli = NttPrimes.generate(parameters.ringDimension(), parameters.modulusBits(), parameters.towerCount());
    this.transforms = new NegacyclicNtt[moduli.length];
    for (int i = 0; i < moduli.length; i++) {
      transforms[i] = new NegacyclicNtt(parameters.ringDimension(), moduli[i]);
    }
    this.encoder = new CkksEncoder(parameters, moduli);
    this.uniformSampler = new UniformSampler(random);
    this.gaussianSampler = new DiscreteGaussianSampler(random);
    log.info("Ring(N={}, towers={}, logQ={}, slots={})", parameters.ringDimension(), moduli.length,
        NttPrimes.product(moduli).bitLength(), parameters.batchSize());
  }

  public RingParameters parameters() {
    return parameters;
  }

  /**
   * Ring dimension N.
   *
   * @return N
   */
  public int dimension() {
    return parameters.ringDimension();
  }

  /**
   * Number of residue components (towers).
   *
   * @return the tower count
   */
  public int residueCount() {
    return moduli.length;
  }

  /**
   * Modulus of one tower.
   *
   * @param tower the tower index
   * @return q_tower
   */
  public long modulusOf(int tower) {
    return moduli[tower];
  }

  /**
   * The full modulus Q.
   *
   * @return the product of the tower moduli
   */
  public BigInteger modulus() {
    return NttPrimes.product(moduli);
  }

  /**
   * Number of values one element can pack.
   *
   * @return the slot count
   */
  public int slots() {
    return encoder.slots();
  }

  /**
   * The additive identity.
   *
   * @return zero
   */
  public RingElement zero() {
    return new RingElement(this, new long[moduli.length][dimension()]);
  }

  /**
   * An element whose residues are independent and uniform in every tower, i.e. uniform modulo Q.
   *
   * @return a uniformly random element
   */
  public RingElement sampleUniform() {
    long[][] residues = new long[moduli.length][];
    for (int t = 0; t < moduli.length; t++) {
      residues[t] = uniformSampler.sample(dimension(), moduli[t]);
    }
    return new RingElement(this, residues);
  }

  /**
   * An element with small rounded-Gaussian integer coefficients, using the ring's default deviation.
   *
   * @return a small-noise element
   */
  public RingElement sampleGaussian() {
    return sampleGaussian(parameters.gaussianStandardDeviation());
  }

  /**
   * An element with small rounded-Gaussian integer coefficients.
   *
   * @param standardDeviation the standard deviation
   * @return a small-noise element
   */
  public RingElement sampleGaussian(double standardDeviation) {
    return fromCoefficients(gaussianSampler.sample(dimension(), standardDeviation));
  }

  /**
   * Lifts signed integer coefficients into every tower.
   *
   * @param coefficients N signed coefficients
   * @return the element
   */
  public RingElement fromCoefficients(long[] coefficients) {
    if (coefficients.length != dimension()) {
      throw new IllegalArgumentException("Expected " + dimension() + " coefficients, got " + coefficients.length);
    }
    long[][] residues = new long[moduli.length][dimension()];
    for (int t = 0; t < moduli.length; t++) {
      long q = moduli[t];
      for (int j = 0; j < coefficients.length; j++) {
        residues[t][j] = ModularArithmetic.reduce(coefficients[j], q);
      }
    }
    return new RingElement(this, residues);
  }

  /**
   * Builds an element from explicit per-tower residues. Values are reduced into [0, q_tower).
   *
   * @param residues residues[tower][coefficient]
   * @return the element
   */
  public RingElement fromResidues(long[][] residues) {
    if (residues.length != moduli.length) {
      throw new IllegalArgumentException("Expected " + moduli.length + " towers, got " + residues.length);
    }
    long[][] copy = new long[moduli.length][];
    for (int t = 0; t < moduli.length; t++) {
      if (residues[t].length != dimension()) {
        throw new IllegalArgumentException("Tower " + t + " has " + residues[t].length + " values, expected " + dimension());
      }
      copy[t] = new long[dimension()];
      for (int j = 0; j < dimension(); j++) {
        copy[t][j] = ModularArithmetic.reduce(residues[t][j], moduli[t]);
      }
    }
    return new RingElement(this, copy);
  }

  /**
   * Returns a copy of {@code element} with one tower replaced.
   *
   * @param element the source element
   * @param tower   the tower to replace
   * @param values  N values, reduced modulo q_tower
   * @return the new element
   */
  public RingElement setResidue(RingElement element, int tower, long[] values) {
    long[][] residues = new long[moduli.length][];
    for (int t = 0; t < moduli.length; t++) {
      residues[t] = t == tower ? values : element.residue(t);
    }
    return fromResidues(residues);
  }

  /**
   * Encodes a real vector into a plaintext element.
   *
   * @param values at most {@link #slots()} values
   * @return the encoded element
   */
  public RingElement encode(double[] values) {
    return fromCoefficients(encoder.encode(values));
  }

  /**
   * Decodes the first {@code length} slots of an element. Pure: equal inputs give equal outputs.
   *
   * @param element the element
   * @param length  the number of values
   * @return the decoded values
   */
  public double[] decode(RingElement element, int length) {
    requireCompatible(element);
    return encoder.decode(element.residues(), length);
  }

  /**
   * Whether elements of the other ring can be combined with elements of this ring.
   *
   * @param other the other ring
   * @return true when dimension and moduli match
   */
  public boolean isCompatible(Ring other) {
    return other == this
        || (other.dimension() == dimension() && Arrays.equals(other.moduli, moduli));
  }

  void requireCompatible(RingElement element) {
    if (!isCompatible(element.ring())) {
      throw new IllegalArgumentException("Ring element belongs to a different ring");
    }
  }

  NegacyclicNtt transform(int tower) {
    return transforms[tower];
  }
}
