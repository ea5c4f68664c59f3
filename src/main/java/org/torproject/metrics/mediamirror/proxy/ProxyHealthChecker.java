/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.proxy;

import org.torproject.metrics.mediamirror.downloader.ConnectionFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import java.net.URL;

/**
 * Probes a single proxy entry by fetching a public IP echo endpoint through
 * it.
 */
public class ProxyHealthChecker {

  private static final Logger logger = LoggerFactory.getLogger(
      ProxyHealthChecker.class);

  /** Echo endpoint answering with {@code {"ip":"..."}}. */
  public static final String DEFAULT_CHECK_URL
      = "https://api.ipify.org?format=json";

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final ConnectionFactory connectionFactory;

  private final URL checkUrl;

  /** Creates a checker that probes the given echo endpoint. */
  public ProxyHealthChecker(ConnectionFactory connectionFactory,
      URL checkUrl) {
    this.connectionFactory = connectionFactory;
    this.checkUrl = checkUrl;
  }

  /** Creates a checker that probes the default echo endpoint. */
  public static ProxyHealthChecker withDefaultEndpoint(
      ConnectionFactory connectionFactory) {
    try {
      return new ProxyHealthChecker(connectionFactory,
          new URL(DEFAULT_CHECK_URL));
    } catch (MalformedURLException e) {
      throw new IllegalStateException("Invalid default check URL.", e);
    }
  }

  /**
   * Probes the given entry; failures of any kind are reported in the
   * result rather than thrown.
   */
  public ProxyHealthResult probe(String entry, int timeoutMillis) {
    ProxyEndpoint endpoint;
    try {
      endpoint = ProxyEndpoint.parse(entry);
    } catch (IllegalArgumentException e) {
      return ProxyHealthResult.dead(entry,
          "Failed to create proxy transport: " + e.getMessage());
    }
    long started = System.nanoTime();
    HttpURLConnection huc = null;
    try {
      huc = this.connectionFactory.open(this.checkUrl, endpoint.toProxy());
      huc.setRequestMethod("GET");
      huc.setConnectTimeout(timeoutMillis);
      huc.setReadTimeout(timeoutMillis);
      huc.connect();
      int response = huc.getResponseCode();
      if (response != 200) {
        return ProxyHealthResult.dead(entry, "HTTP " + response);
      }
      JsonNode body;
      try (InputStream in = new BufferedInputStream(huc.getInputStream())) {
        body = objectMapper.readTree(in);
      }
      long latency = (System.nanoTime() - started) / 1000000L;
      String ip = null == body ? null : body.path("ip").asText(null);
      logger.debug("Proxy {} answered in {} ms.", endpoint, latency);
      return ProxyHealthResult.healthy(entry, latency, ip);
    } catch (SocketTimeoutException e) {
      return ProxyHealthResult.dead(entry, "Timeout");
    } catch (IOException e) {
      return ProxyHealthResult.dead(entry, null == e.getMessage()
          ? e.getClass().getSimpleName() : e.getMessage());
    } finally {
      if (null != huc) {
        huc.disconnect();
      }
    }
  }
}
