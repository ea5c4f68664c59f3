/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.proxy;

import org.torproject.metrics.mediamirror.conf.Configuration;
import org.torproject.metrics.mediamirror.conf.ConfigurationException;
import org.torproject.metrics.mediamirror.conf.Key;
import org.torproject.metrics.mediamirror.downloader.ConnectionFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Authenticator;
import java.net.Proxy;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Ordered list of outbound proxies with a rotation pointer and a set of
 * entries that recently failed.
 *
 * <p>The pointer and the failed set are only mutated from the control
 * thread; health checks probe a copy of the entries.</p>
 */
public class ProxyPool {

  private static final Logger logger = LoggerFactory.getLogger(
      ProxyPool.class);

  /** Number of entries probed in parallel during a health check. */
  static final int PROBE_BATCH_SIZE = 10;

  private List<String> entries;

  private final Set<String> failed = new HashSet<>();

  private int currentIndex = 0;

  private boolean enabled;

  private ProxyHealthChecker healthChecker;

  /**
   * Creates a pool over the given entries; bare {@code host:port} entries
   * are taken as HTTP proxies.
   */
  public ProxyPool(List<String> entries, boolean enabled) {
    this.entries = new ArrayList<>();
    for (String entry : entries) {
      if (null != entry && !entry.trim().isEmpty()) {
        this.entries.add(ProxyEndpoint.normalize(entry));
      }
    }
    this.enabled = enabled;
    this.healthChecker = ProxyHealthChecker.withDefaultEndpoint(
        ConnectionFactory.DEFAULT);
  }

  /** Returns a disabled pool without entries. */
  public static ProxyPool direct() {
    return new ProxyPool(Collections.<String>emptyList(), false);
  }

  /**
   * Creates the pool described by the configuration: the list file if it
   * exists, otherwise the inline entries.
   */
  public static ProxyPool fromConfiguration(Configuration config,
      ConnectionFactory connectionFactory) throws ConfigurationException {
    boolean enabled = config.getBool(Key.ProxyEnabled);
    if (!enabled) {
      logger.info("Proxy: disabled.");
      return direct();
    }
    List<String> entries;
    Path listFile = config.getOptionalPath(Key.ProxyListFile);
    if (null != listFile && Files.exists(listFile)) {
      entries = readProxyList(listFile);
      logger.info("Loaded {} proxies from {}.", entries.size(), listFile);
    } else {
      entries = Arrays.asList(config.getStringArray(Key.ProxyUrl));
    }
    if (entries.isEmpty()) {
      logger.warn("Proxy enabled but neither {} nor {} configured, "
          + "connecting directly.", Key.ProxyUrl, Key.ProxyListFile);
      return direct();
    }
    ProxyPool pool = new ProxyPool(entries, true);
    pool.setHealthChecker(new ProxyHealthChecker(connectionFactory,
        config.getUrl(Key.ProxyCheckUrl)));
    pool.installAuthenticator();
    logger.info("Proxy: loaded {} entries.", pool.size());
    return pool;
  }

  /**
   * Reads one entry per line, skipping blank lines and lines starting with
   * {@code #}. Unreadable files yield an empty list.
   */
  public static List<String> readProxyList(Path listFile) {
    List<String> entries = new ArrayList<>();
    try {
      for (String line : Files.readAllLines(listFile,
          StandardCharsets.UTF_8)) {
        String trimmed = line.trim();
        if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
          entries.add(ProxyEndpoint.normalize(trimmed));
        }
      }
    } catch (IOException e) {
      logger.warn("Error loading proxy list {}.", listFile, e);
      return new ArrayList<>();
    }
    return entries;
  }

  /**
   * Registers the credentials of all entries with the JDK, if any entry
   * has some.
   */
  public void installAuthenticator() {
    List<ProxyEndpoint> endpoints = new ArrayList<>();
    for (String entry : this.entries) {
      try {
        endpoints.add(ProxyEndpoint.parse(entry));
      } catch (IllegalArgumentException e) {
        logger.debug("Not registering credentials for {}: {}",
            ProxyEndpoint.mask(entry), e.getMessage());
      }
    }
    ProxyAuthenticator authenticator = new ProxyAuthenticator(endpoints);
    if (authenticator.hasCredentials()) {
      /* Basic authentication for CONNECT tunnels is off by default. */
      System.setProperty("jdk.http.auth.tunneling.disabledSchemes", "");
      Authenticator.setDefault(authenticator);
      logger.debug("Registered proxy credentials.");
    }
  }

  void setHealthChecker(ProxyHealthChecker healthChecker) {
    this.healthChecker = healthChecker;
  }

  public boolean isEnabled() {
    return this.enabled;
  }

  /** Switches proxy use on or off without touching the entries. */
  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
    logger.info("Proxy: {}.", enabled ? "enabled" : "disabled");
  }

  public int size() {
    return this.entries.size();
  }

  /** Returns a copy of the current entries in rotation order. */
  public List<String> getEntries() {
    return new ArrayList<>(this.entries);
  }

  int getCurrentIndex() {
    return this.currentIndex;
  }

  int getFailedCount() {
    return this.failed.size();
  }

  /** Returns the current entry, or {@code null} if disabled or empty. */
  public String currentEntry() {
    if (!this.enabled || this.entries.isEmpty()) {
      return null;
    }
    return this.entries.get(this.currentIndex);
  }

  /**
   * Returns the transport proxy of the current entry, or
   * {@link Proxy#NO_PROXY} if disabled or empty.
   *
   * <p>Entries that cannot be turned into a proxy are marked failed and
   * skipped. If no entry is usable, the connection goes direct.</p>
   */
  public Proxy currentProxy() {
    for (int attempt = 0; attempt < this.entries.size(); attempt++) {
      String entry = this.currentEntry();
      if (null == entry) {
        break;
      }
      try {
        return ProxyEndpoint.parse(entry).toProxy();
      } catch (IllegalArgumentException e) {
        logger.warn("Skipping unusable proxy entry: {}", e.getMessage());
        this.rotate(true);
      }
    }
    if (this.enabled && !this.entries.isEmpty()) {
      logger.warn("No usable proxy entry, connecting directly.");
    }
    return Proxy.NO_PROXY;
  }

  /**
   * Advances to the next entry that is not marked failed.
   *
   * @param markCurrentFailed Whether to mark the current entry failed first.
   * @return The new current entry, or {@code null} if disabled or empty.
   */
  public String rotate(boolean markCurrentFailed) {
    if (!this.enabled || this.entries.isEmpty()) {
      return null;
    }
    if (markCurrentFailed) {
      String current = this.entries.get(this.currentIndex);
      this.failed.add(current);
      logger.info("Marking proxy as failed: {}",
          ProxyEndpoint.mask(current));
    }
    if (this.failed.containsAll(this.entries)) {
      logger.warn("All proxies failed. Resetting failed list.");
      this.failed.clear();
      this.currentIndex = 0;
    } else {
      do {
        this.currentIndex = (this.currentIndex + 1) % this.entries.size();
      } while (this.failed.contains(this.entries.get(this.currentIndex)));
    }
    String next = this.entries.get(this.currentIndex);
    logger.info("Switched to proxy: {}", ProxyEndpoint.mask(next));
    return next;
  }

  /**
   * Probes all entries in parallel batches and optionally removes dead
   * ones.
   *
   * @param timeoutMillis Connect and read timeout per probe.
   * @param removeDead Whether to drop dead entries and reset rotation.
   * @return Report with healthy entries first, fastest first.
   */
  public HealthCheckReport healthCheckAll(final int timeoutMillis,
      boolean removeDead) {
    if (!this.enabled || this.entries.isEmpty()) {
      logger.warn("No proxies loaded to check.");
      return HealthCheckReport.EMPTY;
    }
    final List<String> snapshot = this.getEntries();
    logger.info("Testing {} proxies (timeout: {} ms each).", snapshot.size(),
        timeoutMillis);
    List<ProxyHealthResult> results = new ArrayList<>();
    ExecutorService executor = Executors.newFixedThreadPool(
        Math.min(PROBE_BATCH_SIZE, snapshot.size()));
    try {
      for (int from = 0; from < snapshot.size(); from += PROBE_BATCH_SIZE) {
        List<String> batch = snapshot.subList(from,
            Math.min(from + PROBE_BATCH_SIZE, snapshot.size()));
        List<Future<ProxyHealthResult>> futures = new ArrayList<>();
        for (final String entry : batch) {
          futures.add(executor.submit(new Callable<ProxyHealthResult>() {
            @Override
            public ProxyHealthResult call() {
              return healthChecker.probe(entry, timeoutMillis);
            }
          }));
        }
        for (int i = 0; i < futures.size(); i++) {
          results.add(await(batch.get(i), futures.get(i)));
        }
      }
    } finally {
      executor.shutdownNow();
    }
    HealthCheckReport report = new HealthCheckReport(results);
    this.logReport(report);
    if (removeDead && report.getDead() > 0) {
      Set<String> dead = new HashSet<>();
      for (ProxyHealthResult result : report.deadResults()) {
        dead.add(result.getProxy());
      }
      List<String> remaining = new ArrayList<>();
      for (String entry : this.entries) {
        if (!dead.contains(entry)) {
          remaining.add(entry);
        }
      }
      logger.info("Removed {} dead proxies. {} remaining.",
          this.entries.size() - remaining.size(), remaining.size());
      this.entries = remaining;
      this.currentIndex = 0;
      this.failed.clear();
    }
    return report;
  }

  private static ProxyHealthResult await(String entry,
      Future<ProxyHealthResult> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return ProxyHealthResult.dead(entry, "Interrupted");
    } catch (ExecutionException e) {
      return ProxyHealthResult.dead(entry, String.valueOf(e.getCause()));
    }
  }

  private void logReport(HealthCheckReport report) {
    for (ProxyHealthResult result : report.healthyResults()) {
      logger.info("Healthy: {}", result);
    }
    for (ProxyHealthResult result : report.deadResults()) {
      logger.info("Dead: {}", result);
    }
    logger.info("Summary: {} healthy, {} dead out of {} total.",
        report.getHealthy(), report.getDead(), report.getTotal());
    if (report.getHealthy() > 0) {
      logger.info("Average latency: {} ms | Fastest: {} ms",
          report.getAverageLatency(),
          report.getFastest().getLatencyMillis());
    }
  }

  /**
   * Replaces the entries by the healthy entries of the given report,
   * fastest first; does nothing if none is healthy.
   */
  public void reorderByLatency(HealthCheckReport report) {
    if (null == report || 0 == report.getHealthy()) {
      return;
    }
    List<String> reordered = new ArrayList<>();
    for (ProxyHealthResult result : report.healthyResults()) {
      reordered.add(result.getProxy());
    }
    this.entries = reordered;
    this.currentIndex = 0;
    this.failed.clear();
    logger.info("Reordered {} proxies by latency, fastest first.",
        reordered.size());
  }

  /** Returns the pool state with the current entry masked. */
  public ProxyStats stats() {
    String current = this.currentEntry();
    return new ProxyStats(this.enabled, this.entries.size(),
        this.currentIndex, this.failed.size(),
        this.enabled ? ProxyEndpoint.mask(current) : null);
  }
}
