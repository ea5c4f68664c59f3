/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.persist;

/** Whether a media item needs to be downloaded, and why. */
public final class SkipDecision {

  static final SkipDecision DOWNLOAD = new SkipDecision(false, false, null);

  static final SkipDecision UPGRADE = new SkipDecision(false, true, null);

  private final boolean skip;

  private final boolean needsUpgrade;

  private final String reason;

  private SkipDecision(boolean skip, boolean needsUpgrade, String reason) {
    this.skip = skip;
    this.needsUpgrade = needsUpgrade;
    this.reason = reason;
  }

  static SkipDecision skip(String reason) {
    return new SkipDecision(true, false, reason);
  }

  public boolean isSkip() {
    return this.skip;
  }

  /** Returns whether a standard-quality copy exists and may be replaced. */
  public boolean isNeedsUpgrade() {
    return this.needsUpgrade;
  }

  public String getReason() {
    return this.reason;
  }
}
