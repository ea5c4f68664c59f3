/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.proxy;

/** Outcome of probing one proxy entry. */
public final class ProxyHealthResult {

  private final String proxy;

  private final boolean success;

  private final long latencyMillis;

  private final String ip;

  private final String error;

  private ProxyHealthResult(String proxy, boolean success, long latencyMillis,
      String ip, String error) {
    this.proxy = proxy;
    this.success = success;
    this.latencyMillis = latencyMillis;
    this.ip = ip;
    this.error = error;
  }

  static ProxyHealthResult healthy(String proxy, long latencyMillis,
      String ip) {
    return new ProxyHealthResult(proxy, true, latencyMillis, ip, null);
  }

  static ProxyHealthResult dead(String proxy, String error) {
    return new ProxyHealthResult(proxy, false, -1L, null, error);
  }

  /** Returns the probed entry as stored in the pool. */
  public String getProxy() {
    return this.proxy;
  }

  public boolean isSuccess() {
    return this.success;
  }

  /** Returns the round-trip time in milliseconds, or -1 for dead entries. */
  public long getLatencyMillis() {
    return this.latencyMillis;
  }

  /** Returns the address reported by the echo endpoint, if any. */
  public String getIp() {
    return this.ip;
  }

  public String getError() {
    return this.error;
  }

  @Override
  public String toString() {
    String masked = ProxyEndpoint.mask(this.proxy);
    if (this.success) {
      return masked + " IP: " + this.ip + " | Latency: " + this.latencyMillis
          + "ms";
    }
    return masked + " Error: " + this.error;
  }
}
