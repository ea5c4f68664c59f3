/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.pagination.Listings;
import org.torproject.metrics.mediamirror.pagination.PageSource;
import org.torproject.metrics.mediamirror.persist.CollectionKind;

/**
 * Saves the videos attached to a user's feed posts, with their
 * descriptions next to them.
 */
public class UserVideoSync extends MediaSync {

  public UserVideoSync(SyncContext context) {
    super(context);
  }

  @Override
  public String module() {
    return "user-videos";
  }

  @Override
  protected SyncResult startProcessing(SyncRequest request) {
    String userId = request.getTargetId();
    Long ownerId = this.context.getTracker().ownerFor(userId);
    PageSource source = PageSource.link(this.context.getClient().graphUrl(
        userId + "/feed", "fields=attachments%7Bmedia,type,subattachments,"
        + "target,description%7D"));
    return this.walkAndSave(request, ownerId, userId, ownerId,
        CollectionKind.USER_VIDEOS, source, Listings::feedVideos);
  }
}
