/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.downloader;

import org.torproject.metrics.mediamirror.proxy.ProxyPool;
import org.torproject.metrics.mediamirror.ratelimit.RateUsageTracker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Issues Graph API requests, absorbing rate limits and transient network
 * failures by waiting, rotating proxies, and retrying within a bounded
 * budget.
 *
 * <p>Rate limiting is expected backpressure and never fails a request by
 * itself; only running out of retries does.</p>
 */
public class GraphClient {

  private static final Logger logger = LoggerFactory.getLogger(
      GraphClient.class);

  public static final int DEFAULT_MAX_RETRIES = 17;

  static final String RETRY_AFTER_HEADER = "Retry-After";

  static final String BUSINESS_USAGE_HEADER = "x-business-use-case-usage";

  static final long DEFAULT_RATE_LIMIT_WAIT_MILLIS = 60000L;

  static final long NETWORK_ERROR_WAIT_MILLIS = 2000L;

  /** Error envelope codes meaning the application or user is throttled. */
  static final Set<Integer> RATE_LIMIT_ERROR_CODES = new HashSet<>(
      Arrays.asList(4, 17, 32));

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final String apiHost;

  private final String accessToken;

  private final RateUsageTracker tracker;

  private final ProxyPool proxyPool;

  private final ConnectionFactory connectionFactory;

  private final Sleeper sleeper;

  private final int maxRetries;

  /**
   * Creates a client for the given API host, e.g.
   * {@code https://graph.facebook.com/v21.0}.
   */
  public GraphClient(String apiHost, String accessToken,
      RateUsageTracker tracker, ProxyPool proxyPool,
      ConnectionFactory connectionFactory, Sleeper sleeper, int maxRetries) {
    this.apiHost = apiHost.endsWith("/")
        ? apiHost.substring(0, apiHost.length() - 1) : apiHost;
    this.accessToken = accessToken;
    this.tracker = tracker;
    this.proxyPool = proxyPool;
    this.connectionFactory = connectionFactory;
    this.sleeper = sleeper;
    this.maxRetries = Math.max(0, maxRetries);
  }

  /**
   * Builds an authenticated Graph URL from a path like {@code 123/photos}
   * and an optional query without leading {@code ?}.
   */
  public String graphUrl(String path, String query) {
    StringBuilder sb = new StringBuilder(this.apiHost).append('/')
        .append(path).append('?');
    if (null != query && !query.isEmpty()) {
      sb.append(query).append('&');
    }
    return sb.append("access_token=").append(this.accessToken).toString();
  }

  /** Replaces the access token in the given URL for log output. */
  public static String mask(String url) {
    return null == url ? null
        : url.replaceAll("access_token=[^&]*", "access_token=***");
  }

  public RateUsageTracker getTracker() {
    return this.tracker;
  }

  public ProxyPool getProxyPool() {
    return this.proxyPool;
  }

  public Sleeper getSleeper() {
    return this.sleeper;
  }

  /** Fetches the URL and pauses as recommended by the usage tracker. */
  public FetchOutcome fetch(String url) {
    return this.fetch(url, true);
  }

  /**
   * Fetches the URL as one logical request.
   *
   * @param url Absolute URL including access token.
   * @param applyRecommendedDelay Whether to pause for the tracker's
   *     recommended delay after a successful response.
   * @return Outcome that carries the parsed body on success.
   */
  public FetchOutcome fetch(String url, boolean applyRecommendedDelay) {
    String masked = mask(url);
    URL requestUrl;
    try {
      requestUrl = new URL(url);
    } catch (MalformedURLException e) {
      logger.warn("Not fetching malformed URL {}.", masked, e);
      return FetchOutcome.fatal(0);
    }
    int retries = 0;
    while (retries <= this.maxRetries) {
      HttpURLConnection huc = null;
      try {
        huc = this.connectionFactory.open(requestUrl,
            this.proxyPool.currentProxy());
        huc.setRequestMethod("GET");
        huc.connect();
        int response = huc.getResponseCode();
        this.tracker.recordUsage(huc.getHeaderField(
            RateUsageTracker.USAGE_HEADER));
        if (429 == response) {
          long wait = rateLimitWait(huc);
          logger.warn("Rate limited (429). Waiting {} s before retry "
              + "(attempt {}/{}).", wait / 1000L, retries + 1,
              this.maxRetries + 1);
          this.sleeper.sleep(wait);
          retries++;
          continue;
        }
        if (response < 200 || response >= 300) {
          logger.warn("HTTP error {} {} for {}.", response,
              huc.getResponseMessage(), masked);
          return FetchOutcome.fatal(retries);
        }
        JsonNode body;
        try (InputStream in = new BufferedInputStream(
            huc.getInputStream())) {
          body = objectMapper.readTree(in);
        }
        if (null == body || body.isMissingNode()) {
          logger.warn("Empty response body for {}.", masked);
          return FetchOutcome.fatal(retries);
        }
        if (body.has("error")) {
          JsonNode error = body.get("error");
          int code = error.path("code").asInt(-1);
          if (RATE_LIMIT_ERROR_CODES.contains(code)) {
            logger.warn("Rate limit error {} in response. Waiting {} s "
                + "before retry.", code,
                DEFAULT_RATE_LIMIT_WAIT_MILLIS / 1000L);
            this.sleeper.sleep(DEFAULT_RATE_LIMIT_WAIT_MILLIS);
            retries++;
            continue;
          }
          logger.warn("Graph API error for {}: {}", masked, error);
          return FetchOutcome.fatal(retries);
        }
        if (applyRecommendedDelay) {
          this.sleeper.sleep(this.tracker.recommendedDelay());
        }
        return FetchOutcome.success(retries, body);
      } catch (JsonProcessingException e) {
        logger.warn("Unparseable response for {}.", masked, e);
        return FetchOutcome.fatal(retries);
      } catch (IOException e) {
        if (retries >= this.maxRetries) {
          logger.warn("Network error for {}: {}. No retries left.", masked,
              e.toString());
          return FetchOutcome.exhausted(retries);
        }
        retries++;
        logger.warn("Network error: {}. Rotating proxy and retrying "
            + "(attempt {}/{}).", e.toString(), retries,
            this.maxRetries + 1);
        this.proxyPool.rotate(true);
        this.sleeper.sleep(NETWORK_ERROR_WAIT_MILLIS);
      } finally {
        if (null != huc) {
          huc.disconnect();
        }
      }
    }
    logger.warn("Max retries ({}) exceeded for {}. Giving up.",
        this.maxRetries, masked);
    return FetchOutcome.exhausted(retries);
  }

  /**
   * Determines the wait after a 429 response from {@code Retry-After}
   * seconds, the business usage header's minutes, or the fixed fallback.
   */
  static long rateLimitWait(HttpURLConnection huc) {
    String retryAfter = huc.getHeaderField(RETRY_AFTER_HEADER);
    if (null != retryAfter) {
      try {
        return Long.parseLong(retryAfter.trim()) * 1000L;
      } catch (NumberFormatException e) {
        logger.debug("Ignoring non-numeric {} header {}.", RETRY_AFTER_HEADER,
            retryAfter);
      }
    }
    String business = huc.getHeaderField(BUSINESS_USAGE_HEADER);
    if (null != business) {
      try {
        JsonNode accounts = objectMapper.readTree(business);
        Iterator<JsonNode> perAccount = accounts.elements();
        while (perAccount.hasNext()) {
          for (JsonNode item : perAccount.next()) {
            long minutes = item.path("estimated_time_to_regain_access")
                .asLong(0L);
            if (minutes > 0L) {
              return minutes * 60L * 1000L;
            }
          }
        }
      } catch (IOException e) {
        logger.debug("Ignoring unparseable {} header.", BUSINESS_USAGE_HEADER,
            e);
      }
    }
    return DEFAULT_RATE_LIMIT_WAIT_MILLIS;
  }

  /**
   * Fetches the URL of the largest available rendition of a photo, or
   * {@code null} if it cannot be determined.
   */
  public String fetchLargestImageUrl(String mediaId) {
    FetchOutcome outcome = this.fetch(this.graphUrl(mediaId,
        "fields=largest_image"));
    if (!outcome.isSuccess()) {
      return null;
    }
    return textOrNull(outcome.getBody().path("largest_image").path("source"));
  }

  /**
   * Fetches id, owner, name, type, count, and link of an album, or returns
   * {@code null} on failure.
   */
  public JsonNode fetchAlbumInfo(String albumId) {
    FetchOutcome outcome = this.fetch(this.graphUrl(albumId,
        "fields=id,from,name,type,count,link"));
    return outcome.isSuccess() ? outcome.getBody() : null;
  }

  /**
   * Finds the id of the album of type {@code wall} among the first 100
   * albums of a page, or returns {@code null}.
   */
  public String findTimelineAlbumId(String pageId) {
    FetchOutcome outcome = this.fetch(this.graphUrl(pageId + "/albums",
        "fields=type&limit=100"));
    if (!outcome.isSuccess()) {
      return null;
    }
    for (JsonNode album : outcome.getBody().path("data")) {
      if ("wall".equals(album.path("type").asText())) {
        return textOrNull(album.path("id"));
      }
    }
    return null;
  }

  static String textOrNull(JsonNode node) {
    if (null == node || node.isMissingNode() || node.isNull()) {
      return null;
    }
    String text = node.asText();
    return text.isEmpty() ? null : text;
  }
}
