/* Copyright 2019--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.downloader;

import org.torproject.metrics.mediamirror.proxy.ProxyPool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Downloads media files from HTTP servers into place without ever leaving a
 * partial file at the destination.
 */
public class Downloader {

  private static final Logger logger = LoggerFactory.getLogger(
      Downloader.class);

  /** Suffix of the file that receives bytes until the download completes. */
  public static final String TEMPFIX = ".tmp";

  public static final int DEFAULT_TIMEOUT_MILLIS = 60000;

  static final int MAX_REDIRECTS = 10;

  private final ConnectionFactory connectionFactory;

  private final ProxyPool proxyPool;

  private final int timeoutMillis;

  /**
   * Creates a downloader routing requests through the current proxy of the
   * given pool.
   */
  public Downloader(ConnectionFactory connectionFactory, ProxyPool proxyPool,
      int timeoutMillis) {
    this.connectionFactory = connectionFactory;
    this.proxyPool = proxyPool;
    this.timeoutMillis = timeoutMillis;
  }

  /** Returns the temporary sibling used while downloading to the path. */
  public static Path tempPathFor(Path destination) {
    return destination.resolveSibling(destination.getFileName() + TEMPFIX);
  }

  /**
   * Download the given URL to the destination, following redirects.
   *
   * <p>Bytes are written to a temporary sibling file that is renamed to the
   * destination only after the whole response was read. On any failure the
   * temporary file is removed and an existing destination is left as it
   * was.</p>
   *
   * @param sourceUrl URL to download.
   * @param destination Final file path; parent directories are created.
   * @throws IOException Thrown if anything goes wrong while downloading.
   */
  public void download(String sourceUrl, Path destination)
      throws IOException {
    Path parent = destination.toAbsolutePath().getParent();
    if (null != parent) {
      Files.createDirectories(parent);
    }
    Path tmpPath = tempPathFor(destination);
    Files.deleteIfExists(tmpPath);
    try {
      this.downloadTo(new URL(sourceUrl), tmpPath);
      moveIntoPlace(tmpPath, destination);
    } catch (IOException | RuntimeException e) {
      try {
        Files.deleteIfExists(tmpPath);
      } catch (IOException cleanup) {
        e.addSuppressed(cleanup);
      }
      throw e;
    }
  }

  private void downloadTo(URL url, Path tmpPath) throws IOException {
    URL current = url;
    for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
      HttpURLConnection huc = this.connectionFactory.open(current,
          this.proxyPool.currentProxy());
      try {
        huc.setInstanceFollowRedirects(false);
        huc.setRequestMethod("GET");
        huc.setConnectTimeout(this.timeoutMillis);
        huc.setReadTimeout(this.timeoutMillis);
        huc.connect();
        int response = huc.getResponseCode();
        String location = huc.getHeaderField("Location");
        if (response >= 300 && response < 400 && null != location) {
          current = new URL(current, location);
          logger.debug("Following redirect {} to {}.", response,
              current.getHost());
          continue;
        }
        if (response != 200) {
          throw new IOException("HTTP " + response + ": "
              + huc.getResponseMessage());
        }
        try (InputStream in = new BufferedInputStream(
            huc.getInputStream())) {
          Files.copy(in, tmpPath, StandardCopyOption.REPLACE_EXISTING);
        }
        return;
      } finally {
        huc.disconnect();
      }
    }
    throw new IOException("Too many redirects (more than " + MAX_REDIRECTS
        + ") for " + url.getHost());
  }

  private static void moveIntoPlace(Path tmpPath, Path destination)
      throws IOException {
    try {
      Files.move(tmpPath, destination, StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      logger.debug("Atomic move not supported for {}, replacing instead.",
          destination);
      Files.move(tmpPath, destination, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
