/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.proxy;

/** Point-in-time view of a proxy pool for status output. */
public final class ProxyStats {

  private final boolean enabled;

  private final int total;

  private final int currentIndex;

  private final int failed;

  private final String current;

  ProxyStats(boolean enabled, int total, int currentIndex, int failed,
      String current) {
    this.enabled = enabled;
    this.total = total;
    this.currentIndex = currentIndex;
    this.failed = failed;
    this.current = current;
  }

  public boolean isEnabled() {
    return this.enabled;
  }

  public int getTotal() {
    return this.total;
  }

  public int getCurrentIndex() {
    return this.currentIndex;
  }

  public int getFailed() {
    return this.failed;
  }

  /** Returns the masked current entry, or {@code null} if disabled. */
  public String getCurrent() {
    return this.current;
  }

  @Override
  public String toString() {
    if (!this.enabled) {
      return "Proxy: disabled";
    }
    return "Proxy: " + this.current + " (" + (this.currentIndex + 1) + "/"
        + this.total + ", " + this.failed + " failed)";
  }
}
