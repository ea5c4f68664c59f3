/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.downloader.GraphClient;
import org.torproject.metrics.mediamirror.pagination.Attachments;
import org.torproject.metrics.mediamirror.pagination.Listings;
import org.torproject.metrics.mediamirror.pagination.MediaItem;
import org.torproject.metrics.mediamirror.pagination.MediaPage;
import org.torproject.metrics.mediamirror.pagination.PageHandler;
import org.torproject.metrics.mediamirror.pagination.PageSource;
import org.torproject.metrics.mediamirror.pagination.PaginationSummary;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Writes {@code id;url} lines of an album's or a wall's media to
 * {@code <links>/<id>.txt} without downloading anything.
 *
 * <p>The saved count of the returned result is the number of links
 * written.</p>
 */
public class LinkExporter {

  private static final Logger logger = LoggerFactory.getLogger(
      LinkExporter.class);

  static final String ID_LINK_SEPARATOR = ";";

  private final SyncContext context;

  public LinkExporter(SyncContext context) {
    this.context = context;
  }

  /** Exports the photo links of an album. */
  public SyncResult exportAlbum(SyncRequest request) throws SyncException {
    GraphClient client = this.context.getClient();
    PageSource source = PageSource.cursor(client.graphUrl(
        request.getTargetId() + "/photos", "fields=largest_image&limit=100"))
        .startingAtPhoto(request.getFromPhotoId());
    return this.export(request.getTargetId(), source, Listings::albumPhotos,
        true);
  }

  /** Exports the media links of a wall, videos only if configured. */
  public SyncResult exportWall(SyncRequest request) throws SyncException {
    GraphClient client = this.context.getClient();
    PageSource source = PageSource.link(client.graphUrl(
        request.getTargetId() + "/feed", WallMediaSync.FEED_FIELDS));
    return this.export(request.getTargetId(), source,
        Attachments::fromFeedPage,
        this.context.getSettings().isIncludeVideo());
  }

  private SyncResult export(String id, PageSource source,
      Function<JsonNode, List<MediaItem>> extractor,
      final boolean includeVideo) throws SyncException {
    final Path linksFile = this.context.getSettings().getLinksPath()
        .resolve(id + ".txt");
    final SyncResult result = new SyncResult();
    try {
      Files.createDirectories(linksFile.toAbsolutePath().getParent());
      Files.deleteIfExists(linksFile);
    } catch (IOException e) {
      throw new SyncException("Cannot prepare links file " + linksFile + ".",
          e);
    }
    PaginationSummary summary;
    try {
      summary = this.context.newPaginator().walk(source,
          this.context.getSettings().getPageLimit(), extractor,
          new PageHandler() {
            @Override
            public void onPage(MediaPage page) {
              List<String> lines = new ArrayList<>();
              for (MediaItem item : page.getItems()) {
                if (item.isPhoto() || includeVideo) {
                  lines.add(item.getId() + ID_LINK_SEPARATOR + item.getUrl());
                  result.recordSaved(item.getType());
                }
              }
              appendLines(linksFile, lines);
            }
          });
    } catch (UncheckedIOException e) {
      throw new SyncException("Cannot write links file " + linksFile + ".",
          e.getCause());
    }
    result.setPagesFetched(summary.getPagesFetched());
    result.setCancelled(summary.isCancelled());
    logger.info("Saved {} links to {}.", result.getSaved(), linksFile);
    return result;
  }

  private static void appendLines(Path linksFile, List<String> lines) {
    if (lines.isEmpty()) {
      return;
    }
    try {
      Files.write(linksFile, lines, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
