/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Watches console input on a daemon thread and requests cancellation when
 * the user enters {@code q}.
 */
public class ConsoleCancellationListener implements Runnable {

  private static final Logger logger = LoggerFactory.getLogger(
      ConsoleCancellationListener.class);

  private final InputStream in;

  private final CancellationToken cancellation;

  public ConsoleCancellationListener(InputStream in,
      CancellationToken cancellation) {
    this.in = in;
    this.cancellation = cancellation;
  }

  /** Starts listening on a daemon thread. */
  public Thread start() {
    Thread thread = new Thread(this, "MediaMirror-ConsoleListener");
    thread.setDaemon(true);
    thread.start();
    logger.info("Enter [q] anytime to cancel after the current download.");
    return thread;
  }

  @Override
  public void run() {
    try (BufferedReader br = new BufferedReader(
        new InputStreamReader(this.in, StandardCharsets.UTF_8))) {
      String line;
      while ((line = br.readLine()) != null) {
        if ("q".equalsIgnoreCase(line.trim())) {
          this.cancellation.cancel();
          return;
        }
      }
    } catch (IOException e) {
      logger.debug("Stopped reading console input.", e);
    }
  }
}
