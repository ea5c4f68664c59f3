/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

/** Kinds of media that are mirrored, with their folder names. */
public enum MediaType {

  PHOTO("photos"),

  VIDEO("videos");

  private final String folder;

  MediaType(String folder) {
    this.folder = folder;
  }

  /** Returns the name of the per-owner folder holding this kind. */
  public String getFolder() {
    return this.folder;
  }
}
