/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

import java.util.Collections;
import java.util.List;

/** Items of one fetched listing page. */
public final class MediaPage {

  private final int number;

  private final List<MediaItem> items;

  private final String cursorAfter;

  MediaPage(int number, List<MediaItem> items, String cursorAfter) {
    this.number = number;
    this.items = Collections.unmodifiableList(items);
    this.cursorAfter = cursorAfter;
  }

  /** Returns the 1-based number of this page within the walk. */
  public int getNumber() {
    return this.number;
  }

  public List<MediaItem> getItems() {
    return this.items;
  }

  /** Returns the cursor pointing after this page, or {@code null}. */
  public String getCursorAfter() {
    return this.cursorAfter;
  }
}
