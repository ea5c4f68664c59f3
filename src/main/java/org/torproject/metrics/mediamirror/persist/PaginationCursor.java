/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.persist;

import java.time.Instant;

/** Position in an owner's collection from which a later run can resume. */
public final class PaginationCursor {

  private final long ownerId;

  private final CollectionKind kind;

  private final String cursorToken;

  private final int pagesLoaded;

  private final Instant lastUpdated;

  /** Creates a cursor as read from the store. */
  public PaginationCursor(long ownerId, CollectionKind kind,
      String cursorToken, int pagesLoaded, Instant lastUpdated) {
    this.ownerId = ownerId;
    this.kind = kind;
    this.cursorToken = cursorToken;
    this.pagesLoaded = pagesLoaded;
    this.lastUpdated = lastUpdated;
  }

  public long getOwnerId() {
    return this.ownerId;
  }

  public CollectionKind getKind() {
    return this.kind;
  }

  public String getCursorToken() {
    return this.cursorToken;
  }

  public int getPagesLoaded() {
    return this.pagesLoaded;
  }

  public Instant getLastUpdated() {
    return this.lastUpdated;
  }
}
