/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.pagination.Attachments;
import org.torproject.metrics.mediamirror.pagination.MediaItem;
import org.torproject.metrics.mediamirror.pagination.PageSource;
import org.torproject.metrics.mediamirror.persist.CollectionKind;

/**
 * Saves the photos and, if configured, videos attached to the posts on the
 * wall of a user, page, or group.
 */
public class WallMediaSync extends MediaSync {

  /** Feed fields with nested attachments, braces URL-encoded. */
  static final String FEED_FIELDS
      = "fields=attachments%7Bmedia,type,subattachments,target%7D";

  public WallMediaSync(SyncContext context) {
    super(context);
  }

  @Override
  public String module() {
    return "wall";
  }

  @Override
  protected SyncResult startProcessing(SyncRequest request) {
    String targetId = request.getTargetId();
    Long ownerId = this.context.getTracker().ownerFor(targetId);
    PageSource source = PageSource.link(this.context.getClient().graphUrl(
        targetId + "/feed", FEED_FIELDS));
    return this.walkAndSave(request, ownerId, targetId, ownerId,
        CollectionKind.WALL_MEDIA, source, Attachments::fromFeedPage);
  }

  @Override
  protected boolean accepts(MediaItem item) {
    return item.isPhoto() || this.context.getSettings().isIncludeVideo();
  }
}
