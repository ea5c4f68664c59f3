/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

/**
 * Consumes a page completely, including any downloads, before the next page
 * is requested.
 */
public interface PageHandler {

  void onPage(MediaPage page);
}
