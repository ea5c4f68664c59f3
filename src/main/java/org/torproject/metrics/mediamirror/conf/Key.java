/* Copyright 2016--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.conf;

import java.net.URL;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Enum containing all the properties keys of the configuration.
 * Specifies the key type.
 */
public enum Key {

  ShutdownGraceWaitMinutes(Long.class),
  GraphApiHost(String.class),
  AccessToken(String.class),
  WaitBeforeNextFetchMillis(Long.class),
  WaitBeforeLargestPhotoFetchMillis(Long.class),
  MaxRetries(Integer.class),
  DelayBetweenTargetsMillis(Long.class),
  DownloadTimeoutMillis(Integer.class),
  ProxyEnabled(Boolean.class),
  ProxyUrl(String[].class),
  ProxyListFile(Path.class),
  ProxyCheckUrl(URL.class),
  ProxyCheckTimeoutMillis(Integer.class),
  DatabaseEnabled(Boolean.class),
  DatabasePath(Path.class),
  DownloadsPath(Path.class),
  LinksPath(Path.class),
  PhotoFileFormat(String.class),
  VideoFileFormat(String.class),
  PageLimit(Integer.class),
  HighQuality(Boolean.class),
  IncludeVideo(Boolean.class),
  ResumeFromCursor(Boolean.class);

  private Class clazz;
  private static Set<String> keys;

  /**
   * Instantiate a new {@code Key} using the given class for the key value.
   *
   * @param clazz Class of key value.
   */
  Key(Class clazz) {
    this.clazz = clazz;
  }

  public Class keyClass() {
    return clazz;
  }

  /** Verifies, if the given string corresponds to an enum value. */
  public static boolean has(String someKey) {
    if (null == keys) {
      keys = new HashSet<>();
      for (Key key : values()) {
        keys.add(key.name());
      }
    }
    return keys.contains(someKey);
  }

}
