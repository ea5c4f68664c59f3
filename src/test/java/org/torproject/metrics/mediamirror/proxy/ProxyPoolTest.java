/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.proxy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import org.torproject.metrics.mediamirror.conf.Configuration;
import org.torproject.metrics.mediamirror.conf.Key;
import org.torproject.metrics.mediamirror.downloader.StubConnections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.net.Proxy;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class ProxyPoolTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private static final String A = "http://10.0.0.1:8080";

  private static final String B = "http://10.0.0.2:8080";

  private static final String C = "socks5://10.0.0.3:1080";

  private ProxyPool pool() {
    return new ProxyPool(Arrays.asList("10.0.0.1:8080", B, C), true);
  }

  @Test
  public void testDisabledPoolConnectsDirectly() {
    ProxyPool pool = new ProxyPool(Arrays.asList(A), false);
    assertSame(Proxy.NO_PROXY, pool.currentProxy());
    assertNull(pool.currentEntry());
    assertNull(pool.rotate(true));
    assertEquals("Proxy: disabled", pool.stats().toString());
    pool.setEnabled(true);
    assertEquals(A, pool.currentEntry());
  }

  @Test
  public void testRotateCyclesWithoutMarking() {
    ProxyPool pool = pool();
    assertEquals(A, pool.currentEntry());
    assertEquals(B, pool.rotate(false));
    assertEquals(C, pool.rotate(false));
    assertEquals(A, pool.rotate(false));
    assertEquals(0, pool.getFailedCount());
  }

  @Test
  public void testRotateSkipsFailedEntries() {
    ProxyPool pool = pool();
    pool.rotate(false);
    assertEquals(C, pool.rotate(true));
    assertEquals(A, pool.rotate(false));
    assertEquals(C, pool.rotate(false));
    assertEquals(1, pool.getFailedCount());
  }

  @Test
  public void testAllFailedResetsToFirst() {
    ProxyPool pool = pool();
    pool.rotate(true);
    pool.rotate(true);
    assertEquals(2, pool.getFailedCount());
    assertEquals(A, pool.rotate(true));
    assertEquals(0, pool.getFailedCount());
    assertEquals(0, pool.getCurrentIndex());
  }

  @Test
  public void testMalformedEntryIsSkipped() {
    ProxyPool pool = new ProxyPool(Arrays.asList("ftp://bad:21", B), true);
    Proxy proxy = pool.currentProxy();
    assertEquals(Proxy.Type.HTTP, proxy.type());
    assertEquals(B, pool.currentEntry());
    assertEquals(1, pool.getFailedCount());
  }

  @Test
  public void testOnlyMalformedEntriesConnectDirectly() {
    ProxyPool pool = new ProxyPool(Arrays.asList("ftp://bad:21"), true);
    assertSame(Proxy.NO_PROXY, pool.currentProxy());
  }

  @Test
  public void testStatsMaskCredentials() {
    ProxyPool pool = new ProxyPool(Arrays.asList("http://u:pw@h:1", B), true);
    pool.rotate(false);
    pool.rotate(true);
    ProxyStats stats = pool.stats();
    assertTrue(stats.isEnabled());
    assertEquals(2, stats.getTotal());
    assertEquals(0, stats.getCurrentIndex());
    assertEquals(1, stats.getFailed());
    assertEquals("Proxy: http://u:***@h:1 (1/2, 1 failed)", stats.toString());
  }

  @Test
  public void testReadProxyList() throws Exception {
    Path list = tmpf.newFile("proxies.txt").toPath();
    Files.write(list, Arrays.asList("# office", "", "10.0.0.1:8080",
        "  socks5://10.0.0.3:1080  "), StandardCharsets.UTF_8);
    assertEquals(Arrays.asList(A, C), ProxyPool.readProxyList(list));
    assertTrue(ProxyPool.readProxyList(
        tmpf.getRoot().toPath().resolve("missing.txt")).isEmpty());
  }

  @Test
  public void testFromConfigurationPrefersListFile() throws Exception {
    Path list = tmpf.newFile("proxies.txt").toPath();
    Files.write(list, Arrays.asList(B, C), StandardCharsets.UTF_8);
    Configuration conf = new Configuration();
    conf.setProperty(Key.ProxyEnabled.name(), "true");
    conf.setProperty(Key.ProxyUrl.name(), A);
    conf.setProperty(Key.ProxyListFile.name(), list.toString());
    conf.setProperty(Key.ProxyCheckUrl.name(), "https://echo.example.com/");
    ProxyPool pool = ProxyPool.fromConfiguration(conf,
        new StubConnections());
    assertEquals(Arrays.asList(B, C), pool.getEntries());
    conf.setProperty(Key.ProxyListFile.name(),
        tmpf.getRoot().toPath().resolve("absent.txt").toString());
    assertEquals(Arrays.asList(A), ProxyPool.fromConfiguration(conf,
        new StubConnections()).getEntries());
  }

  @Test
  public void testFromConfigurationDisabled() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.ProxyEnabled.name(), "false");
    conf.setProperty(Key.ProxyUrl.name(), A);
    ProxyPool pool = ProxyPool.fromConfiguration(conf, new StubConnections());
    assertFalse(pool.isEnabled());
    assertEquals(0, pool.size());
  }

  private ProxyHealthChecker checker() {
    ProxyHealthChecker checker = mock(ProxyHealthChecker.class);
    given(checker.probe(eq(A), anyInt())).willReturn(
        ProxyHealthResult.healthy(A, 300L, "1.1.1.1"));
    given(checker.probe(eq(B), anyInt())).willReturn(
        ProxyHealthResult.dead(B, "Timeout"));
    given(checker.probe(eq(C), anyInt())).willReturn(
        ProxyHealthResult.healthy(C, 100L, "3.3.3.3"));
    return checker;
  }

  @Test
  public void testHealthCheckReport() {
    ProxyPool pool = pool();
    pool.setHealthChecker(checker());
    HealthCheckReport report = pool.healthCheckAll(1000, false);
    assertEquals(3, report.getTotal());
    assertEquals(2, report.getHealthy());
    assertEquals(1, report.getDead());
    assertEquals(Long.valueOf(200L), report.getAverageLatency());
    assertEquals(C, report.getFastest().getProxy());
    assertEquals(B, report.deadResults().get(0).getProxy());
    assertEquals(3, pool.size());
  }

  @Test
  public void testHealthCheckRemovesDead() {
    ProxyPool pool = pool();
    pool.setHealthChecker(checker());
    pool.rotate(true);
    pool.healthCheckAll(1000, true);
    assertEquals(Arrays.asList(A, C), pool.getEntries());
    assertEquals(0, pool.getCurrentIndex());
    assertEquals(0, pool.getFailedCount());
  }

  @Test
  public void testReorderByLatency() {
    ProxyPool pool = pool();
    pool.setHealthChecker(checker());
    pool.reorderByLatency(pool.healthCheckAll(1000, false));
    assertEquals(Arrays.asList(C, A), pool.getEntries());
    assertEquals(C, pool.currentEntry());
  }

  @Test
  public void testHealthCheckInBatches() {
    List<String> entries = new ArrayList<>();
    for (int i = 0; i < 25; i++) {
      entries.add("http://10.1.0." + i + ":8080");
    }
    ProxyPool pool = new ProxyPool(entries, true);
    ProxyHealthChecker checker = mock(ProxyHealthChecker.class);
    for (String entry : entries) {
      given(checker.probe(eq(entry), anyInt())).willReturn(
          ProxyHealthResult.dead(entry, "HTTP 503"));
    }
    pool.setHealthChecker(checker);
    HealthCheckReport report = pool.healthCheckAll(1000, true);
    assertEquals(25, report.getDead());
    assertNull(report.getAverageLatency());
    assertNull(report.getFastest());
    assertEquals(0, pool.size());
  }

  @Test
  public void testHealthCheckOfEmptyPool() {
    assertEquals(0, ProxyPool.direct().healthCheckAll(1000, true).getTotal());
  }
}
