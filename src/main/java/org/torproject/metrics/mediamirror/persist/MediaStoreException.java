/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.persist;

/** Thrown when the media store cannot be read or written. */
public class MediaStoreException extends Exception {

  public MediaStoreException(String msg) {
    super(msg);
  }

  public MediaStoreException(String msg, Exception ex) {
    super(msg, ex);
  }

}
