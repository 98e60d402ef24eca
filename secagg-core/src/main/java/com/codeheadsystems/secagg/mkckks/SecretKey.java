package com.codeheadsystems.secagg.mkckks;

import com.codeheadsystems.ring.Ring;
import com.codeheadsystems.ring.RingElement;
import java.util.Arrays;
import javax.security.auth.Destroyable;

/**
 * A client's secret ring element. The key keeps its own copy of the residues so that
 * {@link #destroy()} can overwrite them; any use after that fails.
 */
public final class SecretKey implements Destroyable {

  private final Ring ring;
  private final long[][] residues;
  private volatile boolean destroyed;

  /**
   * Instantiates a new secret key from the element s.
   *
   * @param s the secret element
   */
  public SecretKey(RingElement s) {
    this.ring = s.ring();
    this.residues = new long[ring.residueCount()][];
    for (int t = 0; t < residues.length; t++) {
      residues[t] = s.residue(t);
    }
  }

  /**
   * Rebuilds the secret element.
   *
   * @return s
   */
  public RingElement element() {
    if (destroyed) {
      throw new IllegalStateException("Secret key has been destroyed");
    }
    return ring.fromResidues(residues);
  }

  @Override
  public void destroy() {
    for (long[] residue : residues) {
      Arrays.fill(residue, 0L);
    }
    destroyed = true;
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  @Override
  public String toString() {
    return "SecretKey[" + (destroyed ? "destroyed" : "redacted") + "]";
  }
}
