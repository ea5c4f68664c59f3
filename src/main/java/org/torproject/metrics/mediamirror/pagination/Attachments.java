/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens feed post attachments, including nested album attachments, into
 * media items.
 */
public final class Attachments {

  private Attachments() {
  }

  /**
   * Extracts the media of one attachment.
   *
   * <p>Attachments of type {@code photo} yield a photo from
   * {@code media.image.src}; {@code video}, {@code video_inline} and
   * {@code video_autoplay} yield a video from {@code media.source};
   * {@code album} yields the media of its sub-attachments. Attachments
   * without target id, type, or media URL yield nothing.</p>
   */
  public static List<MediaItem> flatten(JsonNode attachment) {
    List<MediaItem> items = new ArrayList<>();
    collect(attachment, items);
    return items;
  }

  /** Extracts the media of all attachments of all posts on a feed page. */
  public static List<MediaItem> fromFeedPage(JsonNode body) {
    List<MediaItem> items = new ArrayList<>();
    for (JsonNode post : body.path("data")) {
      for (JsonNode attachment : post.path("attachments").path("data")) {
        collect(attachment, items);
      }
    }
    return items;
  }

  private static void collect(JsonNode attachment, List<MediaItem> items) {
    if (null == attachment) {
      return;
    }
    String id = text(attachment.path("target").path("id"));
    String type = text(attachment.path("type"));
    if (null == id || null == type) {
      return;
    }
    String caption = text(attachment.path("description"));
    switch (type) {
      case "photo":
        String src = text(attachment.path("media").path("image").path("src"));
        if (null != src) {
          items.add(new MediaItem(MediaType.PHOTO, id, src, false, caption,
              null));
        }
        break;
      case "video":
      case "video_inline":
      case "video_autoplay":
        String source = text(attachment.path("media").path("source"));
        if (null != source) {
          items.add(new MediaItem(MediaType.VIDEO, id, source, false, caption,
              null));
        }
        break;
      case "album":
        for (JsonNode sub : attachment.path("subattachments").path("data")) {
          collect(sub, items);
        }
        break;
      default:
        break;
    }
  }

  static String text(JsonNode node) {
    if (null == node || !node.isValueNode()) {
      return null;
    }
    String value = node.asText();
    return value.isEmpty() ? null : value;
  }
}
