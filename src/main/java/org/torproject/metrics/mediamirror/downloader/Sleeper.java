/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.downloader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pauses the control thread; tests substitute an implementation that only
 * records the requested delays.
 */
public interface Sleeper {

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  Sleeper SYSTEM = new Sleeper() {

    private final Logger logger = LoggerFactory.getLogger(Sleeper.class);

    @Override
    public void sleep(long millis) {
      if (millis <= 0L) {
        return;
      }
      try {
        Thread.sleep(millis);
      } catch (InterruptedException e) {
        logger.debug("Interrupted while pausing for {} ms.", millis);
        Thread.currentThread().interrupt();
      }
    }
  };

  /**
   * Pause for the given number of milliseconds; non-positive values return
   * immediately.
   */
  void sleep(long millis);
}
