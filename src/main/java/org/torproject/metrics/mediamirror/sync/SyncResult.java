/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.pagination.MediaType;

/** Counters of one sync run. */
public class SyncResult {

  private int savedPhotos;

  private int savedVideos;

  private int skippedPhotos;

  private int skippedVideos;

  private int failed;

  private int pagesFetched;

  private boolean cancelled;

  void recordSaved(MediaType type) {
    if (MediaType.PHOTO == type) {
      this.savedPhotos++;
    } else {
      this.savedVideos++;
    }
  }

  void recordSkipped(MediaType type) {
    if (MediaType.PHOTO == type) {
      this.skippedPhotos++;
    } else {
      this.skippedVideos++;
    }
  }

  void recordFailed() {
    this.failed++;
  }

  void setPagesFetched(int pagesFetched) {
    this.pagesFetched = pagesFetched;
  }

  void setCancelled(boolean cancelled) {
    this.cancelled = cancelled;
  }

  public int getSaved() {
    return this.savedPhotos + this.savedVideos;
  }

  public int getSkipped() {
    return this.skippedPhotos + this.skippedVideos;
  }

  public int getFailed() {
    return this.failed;
  }

  public int getSavedPhotos() {
    return this.savedPhotos;
  }

  public int getSavedVideos() {
    return this.savedVideos;
  }

  public int getSkippedPhotos() {
    return this.skippedPhotos;
  }

  public int getSkippedVideos() {
    return this.skippedVideos;
  }

  public int getPagesFetched() {
    return this.pagesFetched;
  }

  public boolean isCancelled() {
    return this.cancelled;
  }

  @Override
  public String toString() {
    return "saved " + this.getSaved() + " (" + this.savedPhotos
        + " photos, " + this.savedVideos + " videos), skipped "
        + this.getSkipped() + ", failed " + this.failed + ", pages "
        + this.pagesFetched + (this.cancelled ? ", cancelled" : "");
  }
}
