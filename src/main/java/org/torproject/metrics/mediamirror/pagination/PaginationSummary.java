/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

/** What a walk over a paginated collection produced. */
public final class PaginationSummary {

  private final int pagesFetched;

  private final int itemCount;

  private final String lastCursor;

  private final boolean cancelled;

  private final boolean completed;

  PaginationSummary(int pagesFetched, int itemCount, String lastCursor,
      boolean cancelled, boolean completed) {
    this.pagesFetched = pagesFetched;
    this.itemCount = itemCount;
    this.lastCursor = lastCursor;
    this.cancelled = cancelled;
    this.completed = completed;
  }

  public int getPagesFetched() {
    return this.pagesFetched;
  }

  public int getItemCount() {
    return this.itemCount;
  }

  /** Returns the last cursor seen, or {@code null} if none. */
  public String getLastCursor() {
    return this.lastCursor;
  }

  public boolean isCancelled() {
    return this.cancelled;
  }

  /**
   * Returns whether the walk reached the end of the collection, as opposed
   * to stopping at the page limit, a failed page, or cancellation.
   */
  public boolean isCompleted() {
    return this.completed;
  }

  @Override
  public String toString() {
    return this.itemCount + " items on " + this.pagesFetched + " pages"
        + (this.cancelled ? " (cancelled)" : "")
        + (this.completed ? " (complete)" : "");
  }
}
