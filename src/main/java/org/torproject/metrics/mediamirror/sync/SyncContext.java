/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.cron.CancellationToken;
import org.torproject.metrics.mediamirror.downloader.Downloader;
import org.torproject.metrics.mediamirror.downloader.GraphClient;
import org.torproject.metrics.mediamirror.pagination.Paginator;
import org.torproject.metrics.mediamirror.persist.MediaTracker;

/**
 * Collaborators shared by all syncs of one process.
 */
public class SyncContext {

  private final GraphClient client;

  private final Downloader downloader;

  private final MediaTracker tracker;

  private final CancellationToken cancellation;

  private final SyncSettings settings;

  private ProgressListener listener = ProgressListener.NONE;

  /** Bundles the given collaborators. */
  public SyncContext(GraphClient client, Downloader downloader,
      MediaTracker tracker, CancellationToken cancellation,
      SyncSettings settings) {
    this.client = client;
    this.downloader = downloader;
    this.tracker = tracker;
    this.cancellation = cancellation;
    this.settings = settings;
  }

  public GraphClient getClient() {
    return this.client;
  }

  public Downloader getDownloader() {
    return this.downloader;
  }

  public MediaTracker getTracker() {
    return this.tracker;
  }

  public CancellationToken getCancellation() {
    return this.cancellation;
  }

  public SyncSettings getSettings() {
    return this.settings;
  }

  public ProgressListener getListener() {
    return this.listener;
  }

  public void setListener(ProgressListener listener) {
    this.listener = null == listener ? ProgressListener.NONE : listener;
  }

  /** Returns a paginator honoring the configured pause between pages. */
  public Paginator newPaginator() {
    return new Paginator(this.client, this.client.getSleeper(),
        this.cancellation, this.settings.getWaitBetweenPagesMillis());
  }
}
