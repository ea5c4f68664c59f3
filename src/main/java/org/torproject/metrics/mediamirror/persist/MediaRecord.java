/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.persist;

import java.time.Instant;

/** Stored fact that a media item of an owner was downloaded. */
public final class MediaRecord {

  private final long ownerId;

  private final String mediaId;

  private final boolean highQuality;

  private final String filePath;

  private final Instant createdAt;

  /** Creates a record as read from the store. */
  public MediaRecord(long ownerId, String mediaId, boolean highQuality,
      String filePath, Instant createdAt) {
    this.ownerId = ownerId;
    this.mediaId = mediaId;
    this.highQuality = highQuality;
    this.filePath = filePath;
    this.createdAt = createdAt;
  }

  public long getOwnerId() {
    return this.ownerId;
  }

  public String getMediaId() {
    return this.mediaId;
  }

  public boolean isHighQuality() {
    return this.highQuality;
  }

  public String getFilePath() {
    return this.filePath;
  }

  public Instant getCreatedAt() {
    return this.createdAt;
  }
}
