/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.persist;

/** Collections of an owner for which a pagination cursor is kept. */
public enum CollectionKind {
  ALBUM_PHOTOS, USER_PHOTOS, USER_VIDEOS, WALL_MEDIA
}
