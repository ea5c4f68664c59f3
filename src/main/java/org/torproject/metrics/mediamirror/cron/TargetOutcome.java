/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.cron;

import org.torproject.metrics.mediamirror.sync.SyncResult;

/** How one target of a batch ended. */
public final class TargetOutcome {

  private final String targetId;

  private final SyncResult result;

  private final String error;

  private TargetOutcome(String targetId, SyncResult result, String error) {
    this.targetId = targetId;
    this.result = result;
    this.error = error;
  }

  static TargetOutcome success(String targetId, SyncResult result) {
    return new TargetOutcome(targetId, result, null);
  }

  static TargetOutcome failure(String targetId, String error) {
    return new TargetOutcome(targetId, null, error);
  }

  public String getTargetId() {
    return this.targetId;
  }

  public boolean isSuccess() {
    return null == this.error;
  }

  /** Returns the sync result, or {@code null} if the target failed. */
  public SyncResult getResult() {
    return this.result;
  }

  public int getSaved() {
    return null == this.result ? 0 : this.result.getSaved();
  }

  public int getSkipped() {
    return null == this.result ? 0 : this.result.getSkipped();
  }

  public String getError() {
    return this.error;
  }
}
