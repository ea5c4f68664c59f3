/* Copyright 2016--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror;

import org.torproject.metrics.mediamirror.conf.Configuration;
import org.torproject.metrics.mediamirror.conf.ConfigurationException;
import org.torproject.metrics.mediamirror.conf.Key;
import org.torproject.metrics.mediamirror.cron.BatchRunner;
import org.torproject.metrics.mediamirror.cron.CancellationToken;
import org.torproject.metrics.mediamirror.cron.ConsoleCancellationListener;
import org.torproject.metrics.mediamirror.cron.ShutdownHook;
import org.torproject.metrics.mediamirror.cron.TargetTask;
import org.torproject.metrics.mediamirror.downloader.ConnectionFactory;
import org.torproject.metrics.mediamirror.downloader.Downloader;
import org.torproject.metrics.mediamirror.downloader.GraphClient;
import org.torproject.metrics.mediamirror.downloader.Sleeper;
import org.torproject.metrics.mediamirror.persist.DisabledMediaStore;
import org.torproject.metrics.mediamirror.persist.MediaStore;
import org.torproject.metrics.mediamirror.persist.MediaStoreException;
import org.torproject.metrics.mediamirror.persist.MediaTracker;
import org.torproject.metrics.mediamirror.persist.SqliteMediaStore;
import org.torproject.metrics.mediamirror.proxy.HealthCheckReport;
import org.torproject.metrics.mediamirror.proxy.ProxyPool;
import org.torproject.metrics.mediamirror.ratelimit.RateUsageTracker;
import org.torproject.metrics.mediamirror.sync.AlbumPhotoSync;
import org.torproject.metrics.mediamirror.sync.LinkExporter;
import org.torproject.metrics.mediamirror.sync.SyncContext;
import org.torproject.metrics.mediamirror.sync.SyncRequest;
import org.torproject.metrics.mediamirror.sync.SyncSettings;
import org.torproject.metrics.mediamirror.sync.TimelineAlbumSync;
import org.torproject.metrics.mediamirror.sync.UserPhotoSync;
import org.torproject.metrics.mediamirror.sync.UserVideoSync;
import org.torproject.metrics.mediamirror.sync.WallMediaSync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Main class for starting a MediaMirror run.
 * <br>
 * Run without arguments in order to read the usage information, i.e.
 * <br>
 * <code>java -jar mediamirror.jar</code>
 */
public class Main {

  private static final Logger logger = LoggerFactory.getLogger(Main.class);

  public static final String CONF_FILE = "mediamirror.properties";

  static final String CHECK_PROXIES = "check-proxies";

  static final List<String> COMMANDS = Collections.unmodifiableList(
      Arrays.asList("album", "timeline", "user-photos", "user-videos", "wall",
      "album-links", "wall-links", CHECK_PROXIES));

  private static Configuration conf = new Configuration();

  /**
   * Expects a command, target ids unless checking proxies, and optionally
   * a configuration file. See class description {@link Main}.
   */
  public static void main(String[] args) throws Exception {
    if (null == args || args.length == 0 || !COMMANDS.contains(args[0])) {
      printUsage("Missing or unknown command.");
      return;
    }
    String command = args[0];
    int confIndex = CHECK_PROXIES.equals(command) ? 1 : 2;
    if (args.length < confIndex || args.length > confIndex + 1) {
      printUsage("Wrong number of arguments for " + command + ".");
      return;
    }
    Path confPath = args.length > confIndex ? Paths.get(args[confIndex])
        : Paths.get(CONF_FILE);
    if (!confPath.toFile().exists() || confPath.toFile().length() < 1L) {
      writeDefaultConfig(confPath);
      return;
    }
    try {
      conf.loadAndCheckConfiguration(confPath);
      if (CHECK_PROXIES.equals(command)) {
        checkProxies();
      } else {
        runBatch(command, BatchRunner.parseTargetIds(args[1]));
      }
    } catch (ConfigurationException ce) {
      printUsage(ce.getMessage());
    }
  }

  private static void checkProxies() throws ConfigurationException {
    ProxyPool pool = ProxyPool.fromConfiguration(conf,
        ConnectionFactory.DEFAULT);
    HealthCheckReport report = pool.healthCheckAll(
        conf.getInt(Key.ProxyCheckTimeoutMillis), false);
    pool.reorderByLatency(report);
    logger.info("{} of {} proxies are healthy. {}", report.getHealthy(),
        report.getTotal(), pool.stats());
  }

  private static void runBatch(String command, List<String> targetIds)
      throws ConfigurationException {
    if (targetIds.isEmpty()) {
      printUsage("No target ids given.");
      return;
    }
    Sleeper sleeper = Sleeper.SYSTEM;
    ProxyPool pool = ProxyPool.fromConfiguration(conf,
        ConnectionFactory.DEFAULT);
    RateUsageTracker usage = new RateUsageTracker(
        conf.getLong(Key.WaitBeforeNextFetchMillis));
    GraphClient client = new GraphClient(conf.getString(Key.GraphApiHost),
        conf.getString(Key.AccessToken), usage, pool,
        ConnectionFactory.DEFAULT, sleeper, conf.getInt(Key.MaxRetries));
    Downloader downloader = new Downloader(ConnectionFactory.DEFAULT, pool,
        conf.getInt(Key.DownloadTimeoutMillis));
    CancellationToken cancellation = new CancellationToken();
    MediaStore store = openStore();
    SyncContext context = new SyncContext(client, downloader,
        new MediaTracker(store), cancellation,
        SyncSettings.fromConfiguration(conf));
    ShutdownHook shutdownHook = new ShutdownHook(cancellation,
        conf.getLong(Key.ShutdownGraceWaitMinutes) * 60L * 1000L);
    Runtime.getRuntime().addShutdownHook(shutdownHook);
    new ConsoleCancellationListener(System.in, cancellation).start();
    try {
      new BatchRunner(cancellation, sleeper,
          conf.getLong(Key.DelayBetweenTargetsMillis))
          .run(targetIds, taskFor(command, context));
      logger.info(usage.formatStatus());
      logger.info(pool.stats().toString());
    } finally {
      closeStore(store);
      shutdownHook.finished();
    }
  }

  static TargetTask taskFor(String command, final SyncContext context) {
    switch (command) {
      case "album":
        return id -> new AlbumPhotoSync(context).sync(SyncRequest.of(id));
      case "timeline":
        return id -> new TimelineAlbumSync(context).sync(SyncRequest.of(id));
      case "user-photos":
        return id -> new UserPhotoSync(context).sync(SyncRequest.of(id));
      case "user-videos":
        return id -> new UserVideoSync(context).sync(SyncRequest.of(id));
      case "wall":
        return id -> new WallMediaSync(context).sync(SyncRequest.of(id));
      case "album-links":
        return id -> new LinkExporter(context).exportAlbum(
            SyncRequest.of(id));
      case "wall-links":
        return id -> new LinkExporter(context).exportWall(SyncRequest.of(id));
      default:
        throw new IllegalArgumentException("Unknown command " + command);
    }
  }

  private static MediaStore openStore() throws ConfigurationException {
    if (!conf.getBool(Key.DatabaseEnabled)) {
      logger.info("Database disabled; every item counts as new.");
      return new DisabledMediaStore();
    }
    try {
      return new SqliteMediaStore(conf.getPath(Key.DatabasePath));
    } catch (MediaStoreException e) {
      logger.warn("Cannot open database; continuing without download "
          + "tracking.", e);
      return new DisabledMediaStore();
    }
  }

  private static void closeStore(MediaStore store) {
    try {
      store.close();
    } catch (MediaStoreException e) {
      logger.warn("Cannot close database.", e);
    }
  }

  private static void printUsage(String msg) {
    final String usage = "Usage:\njava -jar mediamirror.jar <command> "
        + "<targetId[,targetId...]> [path/to/configFile]\n"
        + "java -jar mediamirror.jar " + CHECK_PROXIES
        + " [path/to/configFile]\nCommands: " + String.join(", ", COMMANDS);
    System.out.println(msg + "\n" + usage);
  }

  private static void writeDefaultConfig(Path confPath) {
    try {
      Files.copy(Main.class.getClassLoader().getResource(CONF_FILE)
          .openStream(), confPath, StandardCopyOption.REPLACE_EXISTING);
      printUsage("Could not find config file. A default configuration was "
          + "written to " + confPath + ". You need to set at least the "
          + Key.AccessToken + " before running again.");
    } catch (IOException e) {
      logger.error("Cannot write default configuration. Reason: " + e, e);
      throw new RuntimeException(e);
    }
  }

}
