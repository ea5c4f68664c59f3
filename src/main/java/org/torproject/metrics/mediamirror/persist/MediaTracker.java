/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.persist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Decides per media item whether it was already downloaded and records
 * download outcomes.
 *
 * <p>Store failures never propagate: a failed lookup counts as "not yet
 * downloaded", a failed write is logged, and the item is downloaded again
 * by a later run.</p>
 */
public class MediaTracker {

  private static final Logger logger = LoggerFactory.getLogger(
      MediaTracker.class);

  private final MediaStore store;

  public MediaTracker(MediaStore store) {
    this.store = store;
  }

  public boolean isEnabled() {
    return this.store.isEnabled();
  }

  /**
   * Returns the local owner id for an external id, or {@code null} if
   * persistence is off or the store failed.
   */
  public Long ownerFor(String uid) {
    if (!this.store.isEnabled()) {
      return null;
    }
    try {
      return this.store.getOrCreateOwner(MediaStore.PLATFORM_GRAPH, uid);
    } catch (MediaStoreException e) {
      logger.warn("Could not look up owner {}; not tracking downloads.", uid,
          e);
      return null;
    }
  }

  /**
   * Decides whether to skip an item.
   *
   * @param ownerId Local owner id, {@code null} if untracked.
   * @param mediaId Vendor media id.
   * @param wantHighQuality Whether a high-quality copy is wanted.
   * @return Skip if recorded in sufficient quality; upgrade if recorded in
   *     standard quality while high quality is wanted; download otherwise.
   */
  public SkipDecision shouldSkip(Long ownerId, String mediaId,
      boolean wantHighQuality) {
    if (null == ownerId) {
      return SkipDecision.DOWNLOAD;
    }
    MediaRecord record;
    try {
      record = this.store.findMedia(ownerId, mediaId);
    } catch (MediaStoreException e) {
      logger.warn("Could not look up media {}; downloading it.", mediaId, e);
      return SkipDecision.DOWNLOAD;
    }
    if (null == record) {
      return SkipDecision.DOWNLOAD;
    }
    if (wantHighQuality && !record.isHighQuality()) {
      return SkipDecision.UPGRADE;
    }
    return SkipDecision.skip(record.isHighQuality()
        ? "already downloaded, HD" : "already downloaded");
  }

  /**
   * Records a completed download. Existing records are only ever raised to
   * high quality, never lowered.
   */
  public void recordOutcome(Long ownerId, String mediaId,
      boolean highQuality, Path path, boolean wasUpgrade) {
    if (null == ownerId) {
      return;
    }
    String filePath = path.toString();
    try {
      MediaRecord existing = this.store.findMedia(ownerId, mediaId);
      if (null == existing) {
        this.store.insertMedia(ownerId, mediaId, highQuality, filePath);
      } else if (highQuality) {
        this.store.upgradeMedia(ownerId, mediaId, filePath);
        if (wasUpgrade) {
          logger.info("Upgraded {} to HD.", mediaId);
        }
      }
    } catch (MediaStoreException e) {
      logger.warn("Could not record download of {} at {}.", mediaId,
          filePath, e);
    }
  }

  /** Lists the owner's records that are still in standard quality. */
  public List<MediaRecord> findStandardQuality(Long ownerId) {
    if (null == ownerId) {
      return Collections.emptyList();
    }
    try {
      return this.store.findStandardQuality(ownerId);
    } catch (MediaStoreException e) {
      logger.warn("Could not list standard-quality media of owner {}.",
          ownerId, e);
      return Collections.emptyList();
    }
  }

  /** Returns the stored cursor, or {@code null}. */
  public PaginationCursor loadCursor(Long ownerId, CollectionKind kind) {
    if (null == ownerId) {
      return null;
    }
    try {
      return this.store.findCursor(ownerId, kind);
    } catch (MediaStoreException e) {
      logger.warn("Could not read {} cursor; starting from the beginning.",
          kind, e);
      return null;
    }
  }

  /** Stores the cursor after a processed page. */
  public void saveCursor(Long ownerId, CollectionKind kind, String cursor,
      int pagesLoaded) {
    if (null == ownerId || null == cursor) {
      return;
    }
    try {
      this.store.saveCursor(ownerId, kind, cursor, pagesLoaded);
    } catch (MediaStoreException e) {
      logger.warn("Could not save {} cursor after page {}.", kind,
          pagesLoaded, e);
    }
  }

  /** Forgets the cursor once a collection was walked to its end. */
  public void clearCursor(Long ownerId, CollectionKind kind) {
    if (null == ownerId) {
      return;
    }
    try {
      this.store.clearCursor(ownerId, kind);
    } catch (MediaStoreException e) {
      logger.warn("Could not clear {} cursor.", kind, e);
    }
  }
}
