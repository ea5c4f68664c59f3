/* Copyright 2016--2026 The Tor Project
 * See LICENSE for licensing information */

/** This package keeps track of what was downloaded already.
 * <p>{@code MediaTracker} decides per item whether to skip, download, or
 * upgrade it and never lets a storage failure stop a sync. Records live in
 * a {@code MediaStore}, either the SQLite database or the disabled store
 * that remembers nothing.</p>
 */
package org.torproject.metrics.mediamirror.persist;

