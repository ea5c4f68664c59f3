/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.downloader;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.Proxy;
import java.net.URL;

/**
 * Opens HTTP connections through a given proxy; replaced in tests by a
 * factory handing out mocked connections.
 */
public interface ConnectionFactory {

  /** Factory that opens real connections using {@link URL#openConnection}. */
  ConnectionFactory DEFAULT = new ConnectionFactory() {
    @Override
    public HttpURLConnection open(URL url, Proxy proxy) throws IOException {
      return (HttpURLConnection) url.openConnection(proxy);
    }
  };

  /**
   * Open, but do not connect, an HTTP connection to the given URL.
   *
   * @param url URL to open.
   * @param proxy Proxy to route through, {@link Proxy#NO_PROXY} for a direct
   *     connection.
   * @return Unconnected connection.
   * @throws IOException Thrown if the connection cannot be opened.
   */
  HttpURLConnection open(URL url, Proxy proxy) throws IOException;
}
