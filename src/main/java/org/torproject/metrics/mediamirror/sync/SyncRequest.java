/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

/** Target of one sync and an optional photo id to start from. */
public final class SyncRequest {

  private final String targetId;

  private final String fromPhotoId;

  public SyncRequest(String targetId, String fromPhotoId) {
    this.targetId = targetId;
    this.fromPhotoId = fromPhotoId;
  }

  public static SyncRequest of(String targetId) {
    return new SyncRequest(targetId, null);
  }

  public String getTargetId() {
    return this.targetId;
  }

  /** Returns the photo id to start at, or {@code null} for the newest. */
  public String getFromPhotoId() {
    return this.fromPhotoId;
  }

  @Override
  public String toString() {
    return null == this.fromPhotoId ? this.targetId
        : this.targetId + " from photo " + this.fromPhotoId;
  }
}
