/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.persist;

import java.util.List;

/**
 * Persistent record of owners, downloaded media, and pagination cursors.
 */
public interface MediaStore extends AutoCloseable {

  /** Platform number of the Graph API vendor. */
  int PLATFORM_GRAPH = 1;

  /** Returns whether this store persists anything at all. */
  boolean isEnabled();

  /**
   * Returns the local id of the owner with the given external id, creating
   * the owner on first use.
   */
  long getOrCreateOwner(int platform, String uid) throws MediaStoreException;

  /** Returns the record of a media item, or {@code null} if none exists. */
  MediaRecord findMedia(long ownerId, String mediaId)
      throws MediaStoreException;

  /** Inserts a record unless one exists for the same owner and media id. */
  void insertMedia(long ownerId, String mediaId, boolean highQuality,
      String filePath) throws MediaStoreException;

  /**
   * Marks an existing record as high quality and updates its file path.
   *
   * @return Whether a record was updated.
   */
  boolean upgradeMedia(long ownerId, String mediaId, String filePath)
      throws MediaStoreException;

  /** Returns all records of an owner that are not yet high quality. */
  List<MediaRecord> findStandardQuality(long ownerId)
      throws MediaStoreException;

  /** Returns the stored cursor, or {@code null} if none exists. */
  PaginationCursor findCursor(long ownerId, CollectionKind kind)
      throws MediaStoreException;

  /** Inserts or replaces the cursor of an owner's collection. */
  void saveCursor(long ownerId, CollectionKind kind, String cursorToken,
      int pagesLoaded) throws MediaStoreException;

  /** Removes the cursor of an owner's collection, if any. */
  void clearCursor(long ownerId, CollectionKind kind)
      throws MediaStoreException;

  @Override
  void close() throws MediaStoreException;
}
