/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.cron;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Aggregated outcome of a batch of targets. */
public final class BatchResult {

  private final List<TargetOutcome> outcomes;

  private final long elapsedMillis;

  private final boolean cancelled;

  BatchResult(List<TargetOutcome> outcomes, long elapsedMillis,
      boolean cancelled) {
    this.outcomes = Collections.unmodifiableList(
        new ArrayList<>(outcomes));
    this.elapsedMillis = elapsedMillis;
    this.cancelled = cancelled;
  }

  /** Returns outcomes of all attempted targets in batch order. */
  public List<TargetOutcome> getOutcomes() {
    return this.outcomes;
  }

  public int getSuccessful() {
    int count = 0;
    for (TargetOutcome outcome : this.outcomes) {
      if (outcome.isSuccess()) {
        count++;
      }
    }
    return count;
  }

  public int getFailed() {
    return this.outcomes.size() - this.getSuccessful();
  }

  public int getTotalSaved() {
    int total = 0;
    for (TargetOutcome outcome : this.outcomes) {
      total += outcome.getSaved();
    }
    return total;
  }

  public int getTotalSkipped() {
    int total = 0;
    for (TargetOutcome outcome : this.outcomes) {
      total += outcome.getSkipped();
    }
    return total;
  }

  public int getTotalSavedPhotos() {
    int total = 0;
    for (TargetOutcome outcome : this.outcomes) {
      if (outcome.isSuccess()) {
        total += outcome.getResult().getSavedPhotos();
      }
    }
    return total;
  }

  public int getTotalSavedVideos() {
    int total = 0;
    for (TargetOutcome outcome : this.outcomes) {
      if (outcome.isSuccess()) {
        total += outcome.getResult().getSavedVideos();
      }
    }
    return total;
  }

  public long getElapsedMillis() {
    return this.elapsedMillis;
  }

  public boolean isCancelled() {
    return this.cancelled;
  }
}
