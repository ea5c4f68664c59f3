/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

/** Outbound proxy rotation and health checks.
 * <p>{@code ProxyPool} hands out the transport proxy for each new
 * connection and moves on when a connection fails.</p>
 */
package org.torproject.metrics.mediamirror.proxy;

