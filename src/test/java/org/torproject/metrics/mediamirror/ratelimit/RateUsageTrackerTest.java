/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.ratelimit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

public class RateUsageTrackerTest {

  private final Clock clock = Clock.fixed(
      Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

  @Test
  public void testFreshTrackerRecommendsNoDelay() {
    RateUsageTracker tracker = new RateUsageTracker(500L, this.clock);
    assertEquals(0, tracker.maxUsagePercent());
    assertEquals(0L, tracker.recommendedDelay());
    assertNull(tracker.snapshot().getObservedAt());
  }

  @Test
  public void testHighUsageHeader() {
    RateUsageTracker tracker = new RateUsageTracker(500L, this.clock);
    assertTrue(tracker.recordUsage(
        "{\"call_count\":28,\"total_cputime\":85,\"total_time\":40}"));
    UsageSnapshot snapshot = tracker.snapshot();
    assertEquals(28, snapshot.getCallPercent());
    assertEquals(85, snapshot.getCpuPercent());
    assertEquals(40, snapshot.getTimePercent());
    assertEquals(85, tracker.maxUsagePercent());
    assertEquals(RateUsageTracker.HIGH_DELAY_MILLIS,
        tracker.recommendedDelay());
    assertNotNull(snapshot.getObservedAt());
  }

  @Test
  public void testTiers() {
    RateUsageTracker tracker = new RateUsageTracker(500L, this.clock);
    assertEquals(0L, tracker.delayFor(0));
    assertEquals(0L, tracker.delayFor(19));
    assertEquals(500L, tracker.delayFor(20));
    assertEquals(500L, tracker.delayFor(49));
    assertEquals(2000L, tracker.delayFor(50));
    assertEquals(2000L, tracker.delayFor(79));
    assertEquals(5000L, tracker.delayFor(80));
    assertEquals(5000L, tracker.delayFor(94));
    assertEquals(15000L, tracker.delayFor(95));
    assertEquals(15000L, tracker.delayFor(100));
  }

  @Test
  public void testDelayNeverShrinksAsUsageGrows() {
    for (long minimum : new long[] { 0L, 500L, 2000L, 10000L }) {
      RateUsageTracker tracker = new RateUsageTracker(minimum, this.clock);
      long previous = 0L;
      for (int percent = 0; percent <= 100; percent++) {
        long delay = tracker.delayFor(percent);
        assertTrue("Delay shrank at " + percent + "% with minimum "
            + minimum, delay >= previous);
        previous = delay;
      }
    }
  }

  @Test
  public void testMinimumIsCappedAtModerateTier() {
    RateUsageTracker tracker = new RateUsageTracker(10000L, this.clock);
    assertEquals(RateUsageTracker.MODERATE_DELAY_MILLIS,
        tracker.delayFor(RateUsageTracker.LOW_THRESHOLD));
  }

  @Test
  public void testMalformedHeadersKeepLastSnapshot() {
    RateUsageTracker tracker = new RateUsageTracker(500L, this.clock);
    tracker.recordUsage("{\"call_count\":60}");
    assertFalse(tracker.recordUsage(null));
    assertFalse(tracker.recordUsage(" "));
    assertFalse(tracker.recordUsage("{call_count"));
    assertFalse(tracker.recordUsage("[1,2]"));
    assertEquals(60, tracker.maxUsagePercent());
  }

  @Test
  public void testMissingFieldsCountAsZeroAndValuesAreClamped() {
    RateUsageTracker tracker = new RateUsageTracker(500L, this.clock);
    assertTrue(tracker.recordUsage("{\"total_time\":250}"));
    assertEquals(0, tracker.snapshot().getCallPercent());
    assertEquals(100, tracker.snapshot().getTimePercent());
    assertEquals(RateUsageTracker.CRITICAL_DELAY_MILLIS,
        tracker.recommendedDelay());
  }

  @Test
  public void testFormatStatus() {
    RateUsageTracker tracker = new RateUsageTracker(500L, this.clock);
    assertEquals("Rate limit: calls=0% cpu=0% time=0% (updated never)",
        tracker.formatStatus());
    tracker.recordUsage("{\"call_count\":5,\"total_cputime\":6,"
        + "\"total_time\":7}");
    assertEquals("Rate limit: calls=5% cpu=6% time=7% (updated 0s ago)",
        tracker.formatStatus());
  }
}
