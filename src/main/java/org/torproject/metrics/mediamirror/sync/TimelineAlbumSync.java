/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves the photos of a page's timeline album, the hidden album of type
 * {@code wall} holding everything posted to the page.
 */
public class TimelineAlbumSync extends MediaSync {

  private static final Logger logger = LoggerFactory.getLogger(
      TimelineAlbumSync.class);

  private final AlbumPhotoSync albumSync;

  public TimelineAlbumSync(SyncContext context) {
    this(context, new AlbumPhotoSync(context));
  }

  TimelineAlbumSync(SyncContext context, AlbumPhotoSync albumSync) {
    super(context);
    this.albumSync = albumSync;
  }

  @Override
  public String module() {
    return "timeline";
  }

  @Override
  protected SyncResult startProcessing(SyncRequest request)
      throws SyncException {
    String albumId = this.context.getClient().findTimelineAlbumId(
        request.getTargetId());
    if (null == albumId) {
      throw new SyncException("Page " + request.getTargetId()
          + " has no timeline album.");
    }
    logger.info("Found timeline album {} of page {}.", albumId,
        request.getTargetId());
    return this.albumSync.sync(new SyncRequest(albumId,
        request.getFromPhotoId()));
  }
}
