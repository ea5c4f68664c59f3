/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.ratelimit;

import java.time.Instant;

/**
 * Consumption of the rolling one-hour Graph API budget as last reported in
 * an {@code x-app-usage} response header.
 */
public final class UsageSnapshot {

  /** Snapshot of a fresh process that has not seen any header yet. */
  static final UsageSnapshot EMPTY = new UsageSnapshot(0, 0, 0, null);

  private final int callPercent;

  private final int cpuPercent;

  private final int timePercent;

  private final Instant observedAt;

  UsageSnapshot(int callPercent, int cpuPercent, int timePercent,
      Instant observedAt) {
    this.callPercent = callPercent;
    this.cpuPercent = cpuPercent;
    this.timePercent = timePercent;
    this.observedAt = observedAt;
  }

  public int getCallPercent() {
    return this.callPercent;
  }

  public int getCpuPercent() {
    return this.cpuPercent;
  }

  public int getTimePercent() {
    return this.timePercent;
  }

  /** Returns when the header was observed, or {@code null} if never. */
  public Instant getObservedAt() {
    return this.observedAt;
  }

  /** Returns the highest of the three percentages. */
  public int maxPercent() {
    return Math.max(this.callPercent,
        Math.max(this.cpuPercent, this.timePercent));
  }

  @Override
  public String toString() {
    return "calls=" + this.callPercent + "% cpu=" + this.cpuPercent
        + "% time=" + this.timePercent + "%";
  }
}
