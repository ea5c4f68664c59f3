/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.pagination.Listings;
import org.torproject.metrics.mediamirror.pagination.MediaItem;
import org.torproject.metrics.mediamirror.pagination.PageSource;
import org.torproject.metrics.mediamirror.persist.CollectionKind;

import java.nio.file.Path;

/**
 * Saves the photos a user uploaded, grouped into one folder per album, with
 * captions next to the photos.
 */
public class UserPhotoSync extends MediaSync {

  static final String NO_ALBUM_FOLDER = "(no album)";

  public UserPhotoSync(SyncContext context) {
    super(context);
  }

  @Override
  public String module() {
    return "user-photos";
  }

  @Override
  protected SyncResult startProcessing(SyncRequest request) {
    String userId = request.getTargetId();
    Long ownerId = this.context.getTracker().ownerFor(userId);
    PageSource source = PageSource.cursor(this.context.getClient().graphUrl(
        userId + "/photos", "type=uploaded&fields=largest_image,name,album"));
    return this.walkAndSave(request, ownerId, userId, ownerId,
        CollectionKind.USER_PHOTOS, source, Listings::uploadedPhotos);
  }

  @Override
  protected Path destinationFor(String folderOwner, MediaItem item) {
    Path defaultPath = super.destinationFor(folderOwner, item);
    String album = null == item.getAlbumName() ? NO_ALBUM_FOLDER
        : MediaSaver.sanitizeFolderName(item.getAlbumName());
    return defaultPath.resolveSibling(album)
        .resolve(defaultPath.getFileName());
  }
}
