/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.persist;

import java.util.Collections;
import java.util.List;

/**
 * Store used when persistence is switched off: remembers nothing, so every
 * item counts as not yet downloaded.
 */
public class DisabledMediaStore implements MediaStore {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public long getOrCreateOwner(int platform, String uid) {
    return 0L;
  }

  @Override
  public MediaRecord findMedia(long ownerId, String mediaId) {
    return null;
  }

  @Override
  public void insertMedia(long ownerId, String mediaId, boolean highQuality,
      String filePath) {
    /* Nothing to remember. */
  }

  @Override
  public boolean upgradeMedia(long ownerId, String mediaId, String filePath) {
    return false;
  }

  @Override
  public List<MediaRecord> findStandardQuality(long ownerId) {
    return Collections.emptyList();
  }

  @Override
  public PaginationCursor findCursor(long ownerId, CollectionKind kind) {
    return null;
  }

  @Override
  public void saveCursor(long ownerId, CollectionKind kind,
      String cursorToken, int pagesLoaded) {
    /* Nothing to remember. */
  }

  @Override
  public void clearCursor(long ownerId, CollectionKind kind) {
    /* Nothing to remember. */
  }

  @Override
  public void close() {
    /* Nothing to release. */
  }
}
