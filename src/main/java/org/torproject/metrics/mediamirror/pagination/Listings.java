/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts media items from photo listing pages requested with
 * {@code fields=largest_image}.
 */
public final class Listings {

  private Listings() {
  }

  /** Extracts photos of an album listing. */
  public static List<MediaItem> albumPhotos(JsonNode body) {
    return photos(body, false);
  }

  /** Extracts uploaded photos including caption and album name. */
  public static List<MediaItem> uploadedPhotos(JsonNode body) {
    return photos(body, true);
  }

  private static List<MediaItem> photos(JsonNode body, boolean withDetails) {
    List<MediaItem> items = new ArrayList<>();
    for (JsonNode photo : body.path("data")) {
      String id = Attachments.text(photo.path("id"));
      String url = Attachments.text(photo.path("largest_image")
          .path("source"));
      if (null == id || null == url) {
        continue;
      }
      String caption = null;
      String albumName = null;
      if (withDetails) {
        caption = Attachments.text(photo.path("name"));
        albumName = Attachments.text(photo.path("album").path("name"));
      }
      items.add(new MediaItem(MediaType.PHOTO, id, url, true, caption,
          albumName));
    }
    return items;
  }

  /** Extracts only the videos of a feed page. */
  public static List<MediaItem> feedVideos(JsonNode body) {
    List<MediaItem> videos = new ArrayList<>();
    for (MediaItem item : Attachments.fromFeedPage(body)) {
      if (!item.isPhoto()) {
        videos.add(item);
      }
    }
    return videos;
  }
}
