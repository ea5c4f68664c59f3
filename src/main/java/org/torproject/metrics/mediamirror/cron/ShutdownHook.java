/* Copyright 2016--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Requests cancellation on JVM shutdown and waits a grace period for the
 * control thread to finish its current download.
 */
public final class ShutdownHook extends Thread {

  private static final Logger logger
      = LoggerFactory.getLogger(ShutdownHook.class);

  private final CancellationToken cancellation;

  private final long graceMillis;

  private boolean finished = false;

  /** Names the shutdown thread for debugging purposes. */
  public ShutdownHook(CancellationToken cancellation, long graceMillis) {
    super("MediaMirror-ShutdownThread");
    this.cancellation = cancellation;
    this.graceMillis = graceMillis;
  }

  /**
   * Signals that the control thread is done, so that shutdown may proceed.
   */
  public void finished() {
    synchronized (this) {
      this.finished = true;
      this.notifyAll();
    }
  }

  @Override
  public void run() {
    logger.info("Shutdown in progress ... ");
    this.cancellation.cancel();
    long deadline = System.currentTimeMillis() + this.graceMillis;
    synchronized (this) {
      while (!this.finished) {
        long left = deadline - System.currentTimeMillis();
        if (left <= 0L) {
          logger.warn("Current operation did not finish within {} ms.",
              this.graceMillis);
          break;
        }
        try {
          this.wait(left);
        } catch (InterruptedException e) {
          logger.warn("Interrupted while waiting for current operation.");
          Thread.currentThread().interrupt();
          break;
        }
      }
    }
    logger.info("Shutdown finished. Exiting.");
  }
}
