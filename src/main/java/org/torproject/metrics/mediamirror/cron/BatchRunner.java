/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.cron;

import org.torproject.metrics.mediamirror.downloader.Sleeper;
import org.torproject.metrics.mediamirror.sync.SyncException;
import org.torproject.metrics.mediamirror.sync.SyncResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a task for several targets strictly one after another, pausing
 * between targets, and aggregates the outcomes.
 */
public class BatchRunner {

  private static final Logger logger = LoggerFactory.getLogger(
      BatchRunner.class);

  public static final long DEFAULT_DELAY_BETWEEN_TARGETS_MILLIS = 1000L;

  private final CancellationToken cancellation;

  private final Sleeper sleeper;

  private final long delayBetweenTargetsMillis;

  /** Creates a runner pausing the given time between targets. */
  public BatchRunner(CancellationToken cancellation, Sleeper sleeper,
      long delayBetweenTargetsMillis) {
    this.cancellation = cancellation;
    this.sleeper = sleeper;
    this.delayBetweenTargetsMillis = delayBetweenTargetsMillis;
  }

  /**
   * Splits comma-separated target ids, dropping blanks and surrounding
   * whitespace.
   */
  public static List<String> parseTargetIds(String input) {
    List<String> ids = new ArrayList<>();
    if (null == input) {
      return ids;
    }
    for (String part : input.split(",")) {
      if (!part.trim().isEmpty()) {
        ids.add(part.trim());
      }
    }
    return ids;
  }

  /**
   * Runs the task for each target until all are done or cancellation is
   * requested. A failing target is recorded and the batch continues.
   */
  public BatchResult run(List<String> targetIds, TargetTask task) {
    this.cancellation.start();
    long started = System.currentTimeMillis();
    List<TargetOutcome> outcomes = new ArrayList<>();
    for (int i = 0; i < targetIds.size(); i++) {
      if (this.cancellation.isCancelled()) {
        logger.info("Batch cancelled. Skipping the remaining {} targets.",
            targetIds.size() - i);
        break;
      }
      String targetId = targetIds.get(i);
      logger.info("[{}/{}] Processing {}.", i + 1, targetIds.size(),
          targetId);
      try {
        SyncResult result = task.run(targetId);
        outcomes.add(TargetOutcome.success(targetId, result));
      } catch (SyncException e) {
        logger.warn("Target {} failed: {}", targetId, e.getMessage());
        outcomes.add(TargetOutcome.failure(targetId, e.getMessage()));
      } catch (RuntimeException e) {
        logger.error("Target {} failed: {}", targetId, e.getMessage(), e);
        outcomes.add(TargetOutcome.failure(targetId, String.valueOf(e)));
      }
      if (i < targetIds.size() - 1 && !this.cancellation.isCancelled()) {
        this.sleeper.sleep(this.delayBetweenTargetsMillis);
      }
    }
    boolean cancelled = CancellationToken.RunState.CANCELLED
        == this.cancellation.finish();
    BatchResult batch = new BatchResult(outcomes,
        System.currentTimeMillis() - started, cancelled);
    logSummary(batch, targetIds.size());
    return batch;
  }

  private static void logSummary(BatchResult batch, int requested) {
    if (batch.isCancelled()) {
      logger.info("Batch was cancelled.");
    }
    logger.info("Batch summary: {} targets requested, {} successful, {} "
        + "failed.", requested, batch.getSuccessful(), batch.getFailed());
    logger.info("Total downloaded: {} ({} photos, {} videos), skipped: {}, "
        + "elapsed: {} s.", batch.getTotalSaved(),
        batch.getTotalSavedPhotos(), batch.getTotalSavedVideos(),
        batch.getTotalSkipped(), batch.getElapsedMillis() / 1000.0);
    for (TargetOutcome outcome : batch.getOutcomes()) {
      if (!outcome.isSuccess()) {
        logger.info("Failed target {}: {}", outcome.getTargetId(),
            outcome.getError());
      }
    }
  }
}
