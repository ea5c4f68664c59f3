/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

import org.torproject.metrics.mediamirror.conf.Configuration;
import org.torproject.metrics.mediamirror.conf.ConfigurationException;
import org.torproject.metrics.mediamirror.conf.Key;

import java.nio.file.Path;

/**
 * Settings shared by all collection syncs.
 */
public class SyncSettings {

  private final Path downloadsPath;

  private Path linksPath;

  private String photoFileFormat = "jpg";

  private String videoFileFormat = "mp4";

  private boolean highQuality = false;

  private boolean includeVideo = true;

  private boolean resumeFromCursor = false;

  private int pageLimit = Integer.MAX_VALUE;

  private long waitBetweenPagesMillis = 0L;

  private long waitBeforeHighQualityMillis = 0L;

  /** Creates settings with defaults, saving below the given directory. */
  public SyncSettings(Path downloadsPath) {
    this.downloadsPath = downloadsPath;
    this.linksPath = downloadsPath.resolveSibling("links");
  }

  /** Reads all sync settings from the configuration. */
  public static SyncSettings fromConfiguration(Configuration config)
      throws ConfigurationException {
    SyncSettings settings = new SyncSettings(
        config.getPath(Key.DownloadsPath));
    settings.setLinksPath(config.getPath(Key.LinksPath));
    settings.setPhotoFileFormat(config.getString(Key.PhotoFileFormat));
    settings.setVideoFileFormat(config.getString(Key.VideoFileFormat));
    settings.setHighQuality(config.getBool(Key.HighQuality));
    settings.setIncludeVideo(config.getBool(Key.IncludeVideo));
    settings.setResumeFromCursor(config.getBool(Key.ResumeFromCursor));
    settings.setPageLimit(config.getInt(Key.PageLimit));
    settings.setWaitBetweenPagesMillis(
        config.getLong(Key.WaitBeforeNextFetchMillis));
    settings.setWaitBeforeHighQualityMillis(
        config.getLong(Key.WaitBeforeLargestPhotoFetchMillis));
    return settings;
  }

  public Path getDownloadsPath() {
    return this.downloadsPath;
  }

  public Path getLinksPath() {
    return this.linksPath;
  }

  public void setLinksPath(Path linksPath) {
    this.linksPath = linksPath;
  }

  public String getPhotoFileFormat() {
    return this.photoFileFormat;
  }

  public void setPhotoFileFormat(String photoFileFormat) {
    this.photoFileFormat = photoFileFormat;
  }

  public String getVideoFileFormat() {
    return this.videoFileFormat;
  }

  public void setVideoFileFormat(String videoFileFormat) {
    this.videoFileFormat = videoFileFormat;
  }

  /** Returns whether photos are fetched in their largest rendition. */
  public boolean isHighQuality() {
    return this.highQuality;
  }

  public void setHighQuality(boolean highQuality) {
    this.highQuality = highQuality;
  }

  public boolean isIncludeVideo() {
    return this.includeVideo;
  }

  public void setIncludeVideo(boolean includeVideo) {
    this.includeVideo = includeVideo;
  }

  public boolean isResumeFromCursor() {
    return this.resumeFromCursor;
  }

  public void setResumeFromCursor(boolean resumeFromCursor) {
    this.resumeFromCursor = resumeFromCursor;
  }

  public int getPageLimit() {
    return this.pageLimit;
  }

  public void setPageLimit(int pageLimit) {
    this.pageLimit = pageLimit;
  }

  public long getWaitBetweenPagesMillis() {
    return this.waitBetweenPagesMillis;
  }

  public void setWaitBetweenPagesMillis(long waitBetweenPagesMillis) {
    this.waitBetweenPagesMillis = waitBetweenPagesMillis;
  }

  public long getWaitBeforeHighQualityMillis() {
    return this.waitBeforeHighQualityMillis;
  }

  public void setWaitBeforeHighQualityMillis(
      long waitBeforeHighQualityMillis) {
    this.waitBeforeHighQualityMillis = waitBeforeHighQualityMillis;
  }
}
