/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.sync;

/** Thrown when a target cannot be synced at all. */
public class SyncException extends Exception {

  public SyncException(String msg) {
    super(msg);
  }

  public SyncException(String msg, Exception ex) {
    super(msg, ex);
  }

}
