/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.ratelimit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Keeps track of the Graph API usage reported in {@code x-app-usage} headers
 * and recommends how long to pause before the next request.
 *
 * <p>The vendor enforces a rolling one-hour budget and exposes no other
 * per-request signal than this header, which is why delays grow in tiers as
 * usage approaches the ceiling.</p>
 *
 * <p>Instances are owned by the single control thread and are not
 * thread-safe beyond the visibility of the latest snapshot.</p>
 */
public class RateUsageTracker {

  private static final Logger logger = LoggerFactory.getLogger(
      RateUsageTracker.class);

  /** Name of the response header carrying the usage percentages. */
  public static final String USAGE_HEADER = "x-app-usage";

  static final int LOW_THRESHOLD = 20;

  static final int MEDIUM_THRESHOLD = 50;

  static final int HIGH_THRESHOLD = 80;

  static final int CRITICAL_THRESHOLD = 95;

  static final long MODERATE_DELAY_MILLIS = 2000L;

  static final long HIGH_DELAY_MILLIS = 5000L;

  static final long CRITICAL_DELAY_MILLIS = 15000L;

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final long minimumDelayMillis;

  private final Clock clock;

  private volatile UsageSnapshot current = UsageSnapshot.EMPTY;

  /**
   * Create a tracker using the given minimum delay for the normal usage tier.
   *
   * @param minimumDelayMillis Configured minimum inter-request delay; capped at
   *     the moderate tier so that delays never shrink as usage grows.
   */
  public RateUsageTracker(long minimumDelayMillis) {
    this(minimumDelayMillis, Clock.systemUTC());
  }

  RateUsageTracker(long minimumDelayMillis, Clock clock) {
    this.minimumDelayMillis = Math.max(0L,
        Math.min(minimumDelayMillis, MODERATE_DELAY_MILLIS));
    this.clock = clock;
  }

  /**
   * Parse the given {@code x-app-usage} header value and store it as the
   * current snapshot.
   *
   * <p>Null, blank, or malformed values leave the current snapshot
   * untouched.</p>
   *
   * @param headerValue Raw header value, e.g.
   *     {@code {"call_count":28,"total_cputime":15,"total_time":24}}.
   * @return {@code true} if the snapshot was updated.
   */
  public boolean recordUsage(String headerValue) {
    if (null == headerValue || headerValue.trim().isEmpty()) {
      return false;
    }
    try {
      JsonNode usage = objectMapper.readTree(headerValue);
      if (null == usage || !usage.isObject()) {
        logger.debug("Ignoring usage header that is not an object: {}",
            headerValue);
        return false;
      }
      this.current = new UsageSnapshot(
          percent(usage, "call_count"),
          percent(usage, "total_cputime"),
          percent(usage, "total_time"),
          this.clock.instant());
      logger.trace("Recorded API usage {}.", this.current);
      return true;
    } catch (IOException e) {
      logger.debug("Could not parse usage header {}.", headerValue, e);
      return false;
    }
  }

  private static int percent(JsonNode usage, String field) {
    int value = usage.path(field).asInt(0);
    return Math.max(0, Math.min(100, value));
  }

  /** Returns the current snapshot, which is never {@code null}. */
  public UsageSnapshot snapshot() {
    return this.current;
  }

  /** Returns the highest current usage percentage, 0 if nothing recorded. */
  public int maxUsagePercent() {
    return this.current.maxPercent();
  }

  /**
   * Returns the delay in milliseconds recommended before the next request,
   * based on the highest current usage percentage.
   */
  public long recommendedDelay() {
    return delayFor(this.maxUsagePercent());
  }

  long delayFor(int usagePercent) {
    if (usagePercent >= CRITICAL_THRESHOLD) {
      return CRITICAL_DELAY_MILLIS;
    } else if (usagePercent >= HIGH_THRESHOLD) {
      return HIGH_DELAY_MILLIS;
    } else if (usagePercent >= MEDIUM_THRESHOLD) {
      return MODERATE_DELAY_MILLIS;
    } else if (usagePercent >= LOW_THRESHOLD) {
      return this.minimumDelayMillis;
    } else {
      return 0L;
    }
  }

  /** Returns a one-line status of the current usage for log output. */
  public String formatStatus() {
    UsageSnapshot snapshot = this.current;
    String updated = "never";
    if (null != snapshot.getObservedAt()) {
      updated = Duration.between(snapshot.getObservedAt(),
          this.clock.instant()).getSeconds() + "s ago";
    }
    return "Rate limit: " + snapshot + " (updated " + updated + ")";
  }
}
