/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.proxy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Results of probing all pool entries, healthy entries first in order of
 * increasing latency.
 */
public final class HealthCheckReport {

  static final HealthCheckReport EMPTY = new HealthCheckReport(
      Collections.<ProxyHealthResult>emptyList());

  private final List<ProxyHealthResult> results;

  private final int healthy;

  HealthCheckReport(List<ProxyHealthResult> probed) {
    List<ProxyHealthResult> sorted = new ArrayList<>(probed);
    sorted.sort(Comparator
        .comparing((ProxyHealthResult result) -> !result.isSuccess())
        .thenComparingLong(ProxyHealthResult::getLatencyMillis));
    this.results = Collections.unmodifiableList(sorted);
    int count = 0;
    for (ProxyHealthResult result : sorted) {
      if (result.isSuccess()) {
        count++;
      }
    }
    this.healthy = count;
  }

  public int getTotal() {
    return this.results.size();
  }

  public int getHealthy() {
    return this.healthy;
  }

  public int getDead() {
    return this.results.size() - this.healthy;
  }

  /**
   * Returns the rounded average latency of healthy entries, or {@code null}
   * if none is healthy.
   */
  public Long getAverageLatency() {
    if (0 == this.healthy) {
      return null;
    }
    long sum = 0L;
    for (ProxyHealthResult result : this.healthyResults()) {
      sum += result.getLatencyMillis();
    }
    return Math.round((double) sum / this.healthy);
  }

  /** Returns the fastest healthy entry, or {@code null}. */
  public ProxyHealthResult getFastest() {
    return 0 == this.healthy ? null : this.results.get(0);
  }

  /** Returns all results, healthy first. */
  public List<ProxyHealthResult> getResults() {
    return this.results;
  }

  /** Returns only the healthy results, fastest first. */
  public List<ProxyHealthResult> healthyResults() {
    return this.results.subList(0, this.healthy);
  }

  /** Returns only the dead results. */
  public List<ProxyHealthResult> deadResults() {
    return this.results.subList(this.healthy, this.results.size());
  }
}
