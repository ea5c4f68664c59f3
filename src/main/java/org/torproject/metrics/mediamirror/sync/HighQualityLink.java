/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

/** Result of looking up the largest rendition of a photo. */
public final class HighQualityLink {

  private final String url;

  private final boolean shouldSkip;

  HighQualityLink(String url, boolean shouldSkip) {
    this.url = url;
    this.shouldSkip = shouldSkip;
  }

  /** Returns the URL of the largest rendition, or {@code null}. */
  public String getUrl() {
    return this.url;
  }

  /**
   * Returns whether to skip the item, which is the case when an upgrade of
   * an existing copy failed.
   */
  public boolean isShouldSkip() {
    return this.shouldSkip;
  }
}
