/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.downloader.GraphClient;
import org.torproject.metrics.mediamirror.pagination.Listings;
import org.torproject.metrics.mediamirror.pagination.PageSource;
import org.torproject.metrics.mediamirror.persist.CollectionKind;
import org.torproject.metrics.mediamirror.persist.MediaTracker;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves all photos of an album into the photo folder of the album's owner.
 */
public class AlbumPhotoSync extends MediaSync {

  private static final Logger logger = LoggerFactory.getLogger(
      AlbumPhotoSync.class);

  public AlbumPhotoSync(SyncContext context) {
    super(context);
  }

  @Override
  public String module() {
    return "album";
  }

  @Override
  protected SyncResult startProcessing(SyncRequest request) {
    String albumId = request.getTargetId();
    GraphClient client = this.context.getClient();
    String ownerUid = resolveOwner(client, albumId);
    if (null == ownerUid) {
      logger.warn("Could not determine owner of album {}. Using the album "
          + "id for the folder.", albumId);
      ownerUid = albumId;
    }
    MediaTracker tracker = this.context.getTracker();
    Long ownerId = tracker.ownerFor(ownerUid);
    Long cursorOwnerId = albumId.equals(ownerUid) ? ownerId
        : tracker.ownerFor(albumId);
    PageSource source = PageSource.cursor(client.graphUrl(
        albumId + "/photos", "fields=largest_image&limit=100"));
    return this.walkAndSave(request, ownerId, ownerUid, cursorOwnerId,
        CollectionKind.ALBUM_PHOTOS, source, Listings::albumPhotos);
  }

  private static String resolveOwner(GraphClient client, String albumId) {
    JsonNode info = client.fetchAlbumInfo(albumId);
    if (null == info) {
      return null;
    }
    String owner = info.path("from").path("id").asText("");
    return owner.isEmpty() ? null : owner;
  }
}
