/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.pagination.MediaItem;
import org.torproject.metrics.mediamirror.persist.MediaTracker;
import org.torproject.metrics.mediamirror.persist.SkipDecision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves single media items: skips what was already downloaded, upgrades
 * standard-quality copies of photos when high quality is wanted, and
 * records every completed download.
 *
 * <p>The same rule applies to every photo, whichever collection or nested
 * album it was found in. Videos and photos listed in their largest
 * rendition are recorded as high quality.</p>
 */
public class MediaSaver {

  private static final Logger logger = LoggerFactory.getLogger(
      MediaSaver.class);

  static final String CAPTION_SUFFIX = ".txt";

  private final SyncContext context;

  public MediaSaver(SyncContext context) {
    this.context = context;
  }

  /**
   * Looks up the largest rendition of a photo after the configured pause.
   *
   * @param mediaId Photo id.
   * @param isUpgrade Whether a standard-quality copy exists already, in
   *     which case a failed lookup means the item is skipped.
   */
  public HighQualityLink fetchHighQuality(String mediaId, boolean isUpgrade) {
    this.context.getClient().getSleeper().sleep(
        this.context.getSettings().getWaitBeforeHighQualityMillis());
    logger.debug("Fetching HD link of {}.", mediaId);
    String url = this.context.getClient().fetchLargestImageUrl(mediaId);
    if (null != url) {
      return new HighQualityLink(url, false);
    }
    return new HighQualityLink(null, isUpgrade);
  }

  /**
   * Saves the item to the destination unless it can be skipped, counting the
   * outcome in the given result. Download failures are logged and counted,
   * never thrown.
   */
  public void save(Long ownerId, MediaItem item, Path destination,
      SyncResult result) {
    MediaTracker tracker = this.context.getTracker();
    ProgressListener listener = this.context.getListener();
    boolean wantHighQuality = item.isPhoto()
        && this.context.getSettings().isHighQuality();
    SkipDecision decision = tracker.shouldSkip(ownerId, item.getId(),
        wantHighQuality);
    if (decision.isSkip()) {
      logger.info("Skipping {} ({}).", item.getId(), decision.getReason());
      result.recordSkipped(item.getType());
      listener.itemSkipped(item, decision.getReason());
      return;
    }
    if (decision.isNeedsUpgrade()) {
      logger.info("Upgrading {} to HD (was SD).", item.getId());
    }
    String url = item.getUrl();
    boolean highQuality = !item.isPhoto() || item.isHighQuality();
    if (wantHighQuality && !item.isHighQuality()) {
      HighQualityLink link = this.fetchHighQuality(item.getId(),
          decision.isNeedsUpgrade());
      if (link.isShouldSkip()) {
        logger.info("Skipping {} (HD fetch failed, keeping SD version).",
            item.getId());
        result.recordSkipped(item.getType());
        listener.itemSkipped(item, "HD fetch failed");
        return;
      }
      if (null != link.getUrl()) {
        url = link.getUrl();
        highQuality = true;
      }
    }
    try {
      logger.info("Saving {} to {}.", item, destination);
      this.context.getDownloader().download(url, destination);
    } catch (IOException | RuntimeException e) {
      logger.warn("Error saving {} to {}: {}", item, destination,
          e.getMessage(), e);
      result.recordFailed();
      listener.itemFailed(item, e);
      return;
    }
    tracker.recordOutcome(ownerId, item.getId(), highQuality, destination,
        decision.isNeedsUpgrade());
    result.recordSaved(item.getType());
    listener.itemSaved(item, destination);
    if (null != item.getCaption()) {
      writeCaption(destination.resolveSibling(item.getId() + CAPTION_SUFFIX),
          item.getCaption());
    }
  }

  /** Writes a non-blank caption next to the media file. */
  static void writeCaption(Path captionPath, String caption) {
    if (null == caption || caption.trim().isEmpty()) {
      return;
    }
    try {
      Files.write(captionPath, caption.trim().getBytes(
          StandardCharsets.UTF_8));
    } catch (IOException e) {
      logger.warn("Failed to save caption {}.", captionPath, e);
    }
  }

  /**
   * Turns an album name into a folder name by replacing characters that are
   * invalid in file names, collapsing whitespace, and limiting the length.
   */
  public static String sanitizeFolderName(String name) {
    if (null == name) {
      return "(no name)";
    }
    String sanitized = name.replaceAll("[<>:\"/\\\\|?*\\r\\n\\t]", "_")
        .replaceAll("\\s+", " ").trim();
    if (sanitized.length() > 100) {
      sanitized = sanitized.substring(0, 100).trim();
    }
    if (sanitized.isEmpty() || ".".equals(sanitized)
        || "..".equals(sanitized)) {
      return "(no name)";
    }
    return sanitized;
  }
}
