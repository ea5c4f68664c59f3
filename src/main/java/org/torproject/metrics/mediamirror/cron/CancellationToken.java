/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared by the control thread and the
 * threads that request cancellation.
 *
 * <p>Cancellation is only observed at page and target boundaries, so a
 * download or request in progress always finishes.</p>
 */
public class CancellationToken {

  private static final Logger logger = LoggerFactory.getLogger(
      CancellationToken.class);

  /** Life cycle of the current operation. */
  public enum RunState {
    IDLE, RUNNING, COMPLETED, CANCELLED
  }

  private final AtomicReference<RunState> state
      = new AtomicReference<>(RunState.IDLE);

  private volatile boolean cancelRequested = false;

  /** Marks a new operation as running and clears earlier requests. */
  public void start() {
    this.cancelRequested = false;
    this.state.set(RunState.RUNNING);
  }

  /** Requests cancellation; repeated calls have no further effect. */
  public void cancel() {
    if (!this.cancelRequested) {
      this.cancelRequested = true;
      logger.info("Cancelling... Waiting for the current operation to "
          + "complete.");
    }
  }

  public boolean isCancelled() {
    return this.cancelRequested;
  }

  /**
   * Ends the running operation as cancelled or completed, depending on
   * whether cancellation was requested.
   */
  public RunState finish() {
    RunState end = this.cancelRequested ? RunState.CANCELLED
        : RunState.COMPLETED;
    this.state.set(end);
    return end;
  }

  /** Returns to idle and clears any cancellation request. */
  public void reset() {
    this.cancelRequested = false;
    this.state.set(RunState.IDLE);
  }

  public RunState getState() {
    return this.state.get();
  }
}
