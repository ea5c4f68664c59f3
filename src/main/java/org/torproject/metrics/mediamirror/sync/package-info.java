/* Copyright 2016--2026 The Tor Project
 * See LICENSE for licensing information */

/** This package mirrors media collections to the local file system.
 * <p>Every collection sync extends {@code MediaSync}, which walks the
 * collection page by page and hands each item to {@code MediaSaver}.
 * {@code LinkExporter} writes the links of a collection instead of
 * downloading it.</p>
 */
package org.torproject.metrics.mediamirror.sync;

