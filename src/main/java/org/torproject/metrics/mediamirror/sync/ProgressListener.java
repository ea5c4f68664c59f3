/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.pagination.MediaItem;
import org.torproject.metrics.mediamirror.pagination.MediaPage;

import java.nio.file.Path;

/**
 * Receives structured progress events of a sync, e.g., for a console or a
 * user interface.
 */
public interface ProgressListener {

  /** Listener that ignores all events. */
  ProgressListener NONE = new ProgressListener() {
    @Override
    public void itemSaved(MediaItem item, Path path) {
    }

    @Override
    public void itemSkipped(MediaItem item, String reason) {
    }

    @Override
    public void itemFailed(MediaItem item, Exception cause) {
    }

    @Override
    public void pageDone(MediaPage page, SyncResult soFar) {
    }
  };

  void itemSaved(MediaItem item, Path path);

  void itemSkipped(MediaItem item, String reason);

  void itemFailed(MediaItem item, Exception cause);

  void pageDone(MediaPage page, SyncResult soFar);
}
