/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.cron;

import org.torproject.metrics.mediamirror.sync.SyncException;
import org.torproject.metrics.mediamirror.sync.SyncResult;

/** Work done for one target of a batch. */
public interface TargetTask {

  SyncResult run(String targetId) throws SyncException;
}
