/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;

/**
 * Describes where a paginated collection starts and how the URL of the
 * following page is derived from a response.
 */
public final class PageSource {

  /** How the next page is addressed. */
  public enum Style {

    /** Base URL plus the {@code paging.cursors.after} token. */
    CURSOR,

    /** The absolute {@code paging.next} URL. */
    LINK
  }

  private final Style style;

  private final String baseUrl;

  private final String startCursor;

  private PageSource(Style style, String baseUrl, String startCursor) {
    this.style = style;
    this.baseUrl = baseUrl;
    this.startCursor = startCursor;
  }

  /** Pages by appending {@code &after=<cursor>} to the base URL. */
  public static PageSource cursor(String baseUrl) {
    return new PageSource(Style.CURSOR, baseUrl, null);
  }

  /** Pages by following {@code paging.next} links. */
  public static PageSource link(String baseUrl) {
    return new PageSource(Style.LINK, baseUrl, null);
  }

  /** Returns a source starting after the given cursor, if not blank. */
  public PageSource startingAfter(String cursor) {
    if (null == cursor || cursor.trim().isEmpty()) {
      return this;
    }
    return new PageSource(this.style, this.baseUrl, cursor.trim());
  }

  /**
   * Returns a source starting at the given photo id, which the vendor
   * accepts as a Base64-encoded cursor.
   */
  public PageSource startingAtPhoto(String photoId) {
    if (null == photoId || photoId.trim().isEmpty()) {
      return this;
    }
    return this.startingAfter(encodePhotoCursor(photoId.trim()));
  }

  /** Encodes a photo id into a cursor token. */
  public static String encodePhotoCursor(String photoId) {
    return Base64.encodeBase64String(
        photoId.getBytes(StandardCharsets.UTF_8));
  }

  public Style getStyle() {
    return this.style;
  }

  public String getStartCursor() {
    return this.startCursor;
  }

  /** Returns the URL of the first page. */
  String firstUrl() {
    return null == this.startCursor ? this.baseUrl
        : this.baseUrl + "&after=" + this.startCursor;
  }

  /**
   * Returns the URL of the page after the given response, or {@code null}
   * when the collection ends there.
   */
  String nextUrl(JsonNode body) {
    if (Style.CURSOR == this.style) {
      String after = cursorAfter(body);
      return null == after ? null : this.baseUrl + "&after=" + after;
    }
    return Attachments.text(body.path("paging").path("next"));
  }

  static String cursorAfter(JsonNode body) {
    return Attachments.text(body.path("paging").path("cursors")
        .path("after"));
  }
}
