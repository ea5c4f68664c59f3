/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

/**
 * One downloadable photo or video extracted from a listing page.
 */
public final class MediaItem {

  private final MediaType type;

  private final String id;

  private final String url;

  private final boolean highQuality;

  private final String caption;

  private final String albumName;

  /**
   * Creates an item.
   *
   * @param type Photo or video.
   * @param id Vendor-assigned media id.
   * @param url Source URL of the rendition listed.
   * @param highQuality Whether the listed URL is already the largest
   *     rendition.
   * @param caption Optional caption, may be {@code null}.
   * @param albumName Optional album name, may be {@code null}.
   */
  public MediaItem(MediaType type, String id, String url, boolean highQuality,
      String caption, String albumName) {
    this.type = type;
    this.id = id;
    this.url = url;
    this.highQuality = highQuality;
    this.caption = caption;
    this.albumName = albumName;
  }

  public static MediaItem photo(String id, String url) {
    return new MediaItem(MediaType.PHOTO, id, url, false, null, null);
  }

  public static MediaItem video(String id, String url) {
    return new MediaItem(MediaType.VIDEO, id, url, false, null, null);
  }

  public MediaType getType() {
    return this.type;
  }

  public boolean isPhoto() {
    return MediaType.PHOTO == this.type;
  }

  public String getId() {
    return this.id;
  }

  public String getUrl() {
    return this.url;
  }

  public boolean isHighQuality() {
    return this.highQuality;
  }

  public String getCaption() {
    return this.caption;
  }

  public String getAlbumName() {
    return this.albumName;
  }

  @Override
  public String toString() {
    return this.type + " " + this.id;
  }
}
