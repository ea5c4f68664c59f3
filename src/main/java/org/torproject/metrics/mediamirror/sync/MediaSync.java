/* Copyright 2016--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.pagination.MediaItem;
import org.torproject.metrics.mediamirror.pagination.MediaPage;
import org.torproject.metrics.mediamirror.pagination.PageHandler;
import org.torproject.metrics.mediamirror.pagination.PageSource;
import org.torproject.metrics.mediamirror.pagination.PaginationSummary;
import org.torproject.metrics.mediamirror.persist.CollectionKind;
import org.torproject.metrics.mediamirror.persist.MediaTracker;
import org.torproject.metrics.mediamirror.persist.PaginationCursor;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

/**
 * Base class of the collection syncs: walks a collection page by page and
 * saves every item of a page before requesting the next one.
 */
public abstract class MediaSync {

  private static final Logger logger = LoggerFactory.getLogger(
      MediaSync.class);

  protected final SyncContext context;

  protected final MediaSaver saver;

  protected MediaSync(SyncContext context) {
    this.context = context;
    this.saver = new MediaSaver(context);
  }

  /**
   * Syncs the requested target and logs the outcome.
   *
   * @throws SyncException Thrown if the target cannot be synced at all.
   */
  public final SyncResult sync(SyncRequest request) throws SyncException {
    logger.info("Starting {} sync of {}.", module(), request);
    SyncResult result = startProcessing(request);
    logger.info("Finished {} sync of {}: {}", module(), request, result);
    return result;
  }

  /**
   * Module specific code goes here.
   */
  protected abstract SyncResult startProcessing(SyncRequest request)
      throws SyncException;

  /**
   * Returns the module name for logging purposes.
   */
  public abstract String module();

  /**
   * Returns the default destination of an item:
   * {@code <downloads>/<folderOwner>/<photos|videos>/<id>.<format>}.
   */
  protected Path destinationFor(String folderOwner, MediaItem item) {
    SyncSettings settings = this.context.getSettings();
    String format = item.isPhoto() ? settings.getPhotoFileFormat()
        : settings.getVideoFileFormat();
    return settings.getDownloadsPath().resolve(folderOwner)
        .resolve(item.getType().getFolder())
        .resolve(item.getId() + "." + format);
  }

  /** Returns whether the sync saves the given item at all. */
  protected boolean accepts(MediaItem item) {
    return true;
  }

  /**
   * Walks the collection and saves its items.
   *
   * <p>Starts at the requested photo if any, otherwise at the stored cursor
   * if resuming is enabled. The cursor is saved after every page whose
   * items were all handled, and no longer after the first page with a failed
   * item, so that a resumed run revisits that page. It is cleared when the
   * collection was walked to its end.</p>
   *
   * @param request The sync request.
   * @param ownerId Local owner of the saved items, {@code null} if untracked.
   * @param folderOwner Name of the owner folder below the downloads path.
   * @param cursorOwnerId Local owner of the stored cursor.
   * @param kind Collection kind of the stored cursor.
   * @param source First page and paging style.
   * @param extractor Turns a page body into items.
   * @return Counters of the walk.
   */
  protected SyncResult walkAndSave(final SyncRequest request,
      final Long ownerId, final String folderOwner, final Long cursorOwnerId,
      final CollectionKind kind, PageSource source,
      Function<JsonNode, List<MediaItem>> extractor) {
    final MediaTracker tracker = this.context.getTracker();
    final SyncResult result = new SyncResult();
    PageSource start = source;
    int pagesBefore = 0;
    if (null != request.getFromPhotoId()) {
      start = source.startingAtPhoto(request.getFromPhotoId());
    } else if (this.context.getSettings().isResumeFromCursor()) {
      PaginationCursor cursor = tracker.loadCursor(cursorOwnerId, kind);
      if (null != cursor) {
        logger.info("Resuming {} of {} after page {}.", kind,
            request.getTargetId(), cursor.getPagesLoaded());
        start = source.startingAfter(cursor.getCursorToken());
        pagesBefore = cursor.getPagesLoaded();
      }
    }
    final int pagesOffset = pagesBefore;
    PaginationSummary summary = this.context.newPaginator().walk(start,
        this.context.getSettings().getPageLimit(), extractor,
        new PageHandler() {

          private boolean cursorFrozen = false;

          @Override
          public void onPage(MediaPage page) {
            int failedBefore = result.getFailed();
            for (MediaItem item : page.getItems()) {
              if (accepts(item)) {
                saver.save(ownerId, item, destinationFor(folderOwner, item),
                    result);
              }
            }
            if (result.getFailed() > failedBefore && !this.cursorFrozen) {
              logger.warn("Page {} of {} had failed items, keeping the stored "
                  + "cursor before it.", pagesOffset + page.getNumber(),
                  request.getTargetId());
              this.cursorFrozen = true;
            }
            if (!this.cursorFrozen) {
              tracker.saveCursor(cursorOwnerId, kind, page.getCursorAfter(),
                  pagesOffset + page.getNumber());
            }
            context.getListener().pageDone(page, result);
          }
        });
    if (summary.isCompleted()) {
      tracker.clearCursor(cursorOwnerId, kind);
    }
    result.setPagesFetched(summary.getPagesFetched());
    result.setCancelled(summary.isCancelled());
    return result;
  }
}
