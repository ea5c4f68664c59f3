/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.torproject.metrics.mediamirror.cron.CancellationToken;
import org.torproject.metrics.mediamirror.downloader.GraphClient;
import org.torproject.metrics.mediamirror.downloader.RecordingSleeper;
import org.torproject.metrics.mediamirror.downloader.StubConnections;
import org.torproject.metrics.mediamirror.proxy.ProxyPool;
import org.torproject.metrics.mediamirror.ratelimit.RateUsageTracker;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class PaginatorTest {

  private StubConnections connections;

  private RecordingSleeper sleeper;

  private CancellationToken cancellation;

  private GraphClient client;

  private Paginator paginator;

  private String base;

  private final List<MediaPage> pages = new ArrayList<>();

  private final PageHandler collect = new PageHandler() {
    @Override
    public void onPage(MediaPage page) {
      pages.add(page);
    }
  };

  @Before
  public void setUp() {
    this.connections = new StubConnections();
    this.sleeper = new RecordingSleeper();
    this.cancellation = new CancellationToken();
    this.client = new GraphClient("https://graph.example.com/v21.0", "t",
        new RateUsageTracker(0L), ProxyPool.direct(), this.connections,
        this.sleeper, 0);
    this.paginator = new Paginator(this.client, this.sleeper,
        this.cancellation, 500L);
    this.base = this.client.graphUrl("album/photos",
        "fields=largest_image&limit=100");
  }

  private static String photoPage(String after, String... ids) {
    StringBuilder sb = new StringBuilder("{\"data\":[");
    for (int i = 0; i < ids.length; i++) {
      sb.append(i > 0 ? "," : "").append("{\"id\":\"").append(ids[i])
          .append("\",\"largest_image\":{\"source\":\"https://cdn/")
          .append(ids[i]).append(".jpg\"}}");
    }
    sb.append("]");
    if (null != after) {
      sb.append(",\"paging\":{\"cursors\":{\"before\":\"B\",\"after\":\"")
          .append(after).append("\"}}");
    }
    return sb.append("}").toString();
  }

  private List<String> ids() {
    List<String> ids = new ArrayList<>();
    for (MediaPage page : this.pages) {
      for (MediaItem item : page.getItems()) {
        ids.add(item.getId());
      }
    }
    return ids;
  }

  @Test
  public void testCursorStyleWalksToEnd() throws Exception {
    this.connections.ok(this.base, photoPage("C1", "1", "2"));
    this.connections.ok(this.base + "&after=C1", photoPage("C2", "3", "4"));
    this.connections.ok(this.base + "&after=C2", photoPage(null, "5"));
    PaginationSummary summary = this.paginator.walk(
        PageSource.cursor(this.base), Integer.MAX_VALUE,
        Listings::albumPhotos, this.collect);
    assertEquals(Arrays.asList("1", "2", "3", "4", "5"), ids());
    assertEquals(3, summary.getPagesFetched());
    assertEquals(5, summary.getItemCount());
    assertEquals("C2", summary.getLastCursor());
    assertTrue(summary.isCompleted());
    assertFalse(summary.isCancelled());
    assertEquals(3, this.pages.get(2).getNumber());
    assertEquals("C1", this.pages.get(0).getCursorAfter());
    assertNull(this.pages.get(2).getCursorAfter());
    assertEquals(Arrays.asList(500L, 500L), this.sleeper.getPauses());
    assertEquals(Arrays.asList(this.base, this.base + "&after=C1",
        this.base + "&after=C2"), this.connections.getRequested());
  }

  @Test
  public void testLinkStyleFollowsNext() throws Exception {
    String feed = this.client.graphUrl("wall/feed", "fields=attachments");
    String next = "https://graph.example.com/v21.0/wall/feed?after=X&t=1";
    this.connections.ok(feed, "{\"data\":[{\"attachments\":{\"data\":[{"
        + "\"type\":\"photo\",\"target\":{\"id\":\"P\"},\"media\":{\"image\":"
        + "{\"src\":\"u\"}}}]}}],\"paging\":{\"next\":\"" + next + "\"}}");
    this.connections.ok(next, "{\"data\":[]}");
    PaginationSummary summary = this.paginator.walk(PageSource.link(feed),
        Integer.MAX_VALUE, Attachments::fromFeedPage, this.collect);
    assertEquals(2, summary.getPagesFetched());
    assertEquals(1, summary.getItemCount());
    assertTrue(summary.isCompleted());
  }

  @Test
  public void testPageLimit() throws Exception {
    this.connections.ok(this.base, photoPage("C1", "1"));
    this.connections.ok(this.base + "&after=C1", photoPage("C2", "2"));
    PaginationSummary summary = this.paginator.walk(
        PageSource.cursor(this.base), 2, Listings::albumPhotos, this.collect);
    assertEquals(2, summary.getPagesFetched());
    assertFalse(summary.isCompleted());
    assertEquals("C2", summary.getLastCursor());
    assertEquals(Arrays.asList(500L), this.sleeper.getPauses());
  }

  @Test
  public void testCancellationStopsAtPageBoundary() throws Exception {
    this.connections.ok(this.base, photoPage("C1", "1", "2"));
    this.connections.ok(this.base + "&after=C1", photoPage(null, "3"));
    PaginationSummary summary = this.paginator.walk(
        PageSource.cursor(this.base), Integer.MAX_VALUE,
        Listings::albumPhotos, new PageHandler() {
          @Override
          public void onPage(MediaPage page) {
            pages.add(page);
            cancellation.cancel();
          }
        });
    assertEquals(Arrays.asList("1", "2"), ids());
    assertEquals(1, summary.getPagesFetched());
    assertTrue(summary.isCancelled());
    assertFalse(summary.isCompleted());
    assertEquals(1, this.connections.getRequested().size());
  }

  @Test
  public void testFailedPageStopsWalk() throws Exception {
    this.connections.ok(this.base, photoPage("C1", "1"));
    this.connections.status(this.base + "&after=C1", 500);
    PaginationSummary summary = this.paginator.walk(
        PageSource.cursor(this.base), Integer.MAX_VALUE,
        Listings::albumPhotos, this.collect);
    assertEquals(1, summary.getPagesFetched());
    assertFalse(summary.isCompleted());
    assertEquals("C1", summary.getLastCursor());
  }

  @Test
  public void testBodyWithoutDataStopsWalk() throws Exception {
    this.connections.ok(this.base, "{\"id\":\"album\"}");
    PaginationSummary summary = this.paginator.walk(
        PageSource.cursor(this.base), Integer.MAX_VALUE,
        Listings::albumPhotos, this.collect);
    assertEquals(0, summary.getPagesFetched());
    assertTrue(this.pages.isEmpty());
  }

  @Test
  public void testStartingAtPhoto() throws Exception {
    String cursor = PageSource.encodePhotoCursor("123");
    assertEquals("MTIz", cursor);
    this.connections.ok(this.base + "&after=MTIz", photoPage(null, "124"));
    PaginationSummary summary = this.paginator.walk(
        PageSource.cursor(this.base).startingAtPhoto("123"),
        Integer.MAX_VALUE, Listings::albumPhotos, this.collect);
    assertEquals(Arrays.asList("124"), ids());
    assertEquals("MTIz", summary.getLastCursor());
  }

  @Test
  public void testStartingAfterBlankCursorStartsAtBeginning() {
    PageSource source = PageSource.cursor(this.base).startingAfter(" ");
    assertNull(source.getStartCursor());
    assertEquals(this.base, source.firstUrl());
  }
}
