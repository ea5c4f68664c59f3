/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.pagination;

import org.torproject.metrics.mediamirror.cron.CancellationToken;
import org.torproject.metrics.mediamirror.downloader.FetchOutcome;
import org.torproject.metrics.mediamirror.downloader.GraphClient;
import org.torproject.metrics.mediamirror.downloader.Sleeper;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Walks a paginated Graph collection page by page, handing each page to a
 * handler before requesting the next one.
 */
public class Paginator {

  private static final Logger logger = LoggerFactory.getLogger(
      Paginator.class);

  private final GraphClient client;

  private final Sleeper sleeper;

  private final CancellationToken cancellation;

  private final long waitBetweenPagesMillis;

  /**
   * Creates a paginator.
   *
   * @param client Client for page requests.
   * @param sleeper Used for the fixed pause between pages.
   * @param cancellation Polled before each page request.
   * @param waitBetweenPagesMillis Fixed pause between pages, applied in
   *     addition to any pause recommended by the usage tracker.
   */
  public Paginator(GraphClient client, Sleeper sleeper,
      CancellationToken cancellation, long waitBetweenPagesMillis) {
    this.client = client;
    this.sleeper = sleeper;
    this.cancellation = cancellation;
    this.waitBetweenPagesMillis = waitBetweenPagesMillis;
  }

  /**
   * Walks the collection until it ends, the page limit is reached, a page
   * cannot be fetched, or cancellation is requested.
   *
   * @param source First page and paging style.
   * @param pageLimit Maximum number of pages to fetch.
   * @param extractor Turns a page body into media items.
   * @param handler Receives every fetched page.
   * @return Summary of the walk.
   */
  public PaginationSummary walk(PageSource source, int pageLimit,
      Function<JsonNode, List<MediaItem>> extractor, PageHandler handler) {
    String url = source.firstUrl();
    String lastCursor = source.getStartCursor();
    int pagesFetched = 0;
    int itemCount = 0;
    boolean cancelled = false;
    boolean completed = false;
    while (pagesFetched < pageLimit) {
      if (this.cancellation.isCancelled()) {
        logger.info("Stopping after page {} (cancelled).", pagesFetched);
        cancelled = true;
        break;
      }
      int pageNumber = pagesFetched + 1;
      logger.info("Fetching page {}.", pageNumber);
      FetchOutcome outcome = this.client.fetch(url);
      JsonNode body = outcome.getBody();
      if (!outcome.isSuccess() || !body.path("data").isArray()) {
        logger.warn("Could not fetch page {} ({}). Stopping.", pageNumber,
            outcome);
        break;
      }
      pagesFetched++;
      List<MediaItem> items = extractor.apply(body);
      String cursorAfter = PageSource.cursorAfter(body);
      itemCount += items.size();
      logger.info("Found {} items on page {} ({} in total).", items.size(),
          pageNumber, itemCount);
      handler.onPage(new MediaPage(pageNumber, items, cursorAfter));
      if (null != cursorAfter) {
        lastCursor = cursorAfter;
      }
      url = source.nextUrl(body);
      if (null == url) {
        completed = true;
        break;
      }
      if (pagesFetched < pageLimit && this.waitBetweenPagesMillis > 0L) {
        logger.debug("Pausing {} ms before next page.",
            this.waitBetweenPagesMillis);
        this.sleeper.sleep(this.waitBetweenPagesMillis);
      }
    }
    PaginationSummary summary = new PaginationSummary(pagesFetched,
        itemCount, lastCursor, cancelled, completed);
    logger.info("Pagination finished: {}.", summary);
    return summary;
  }
}
