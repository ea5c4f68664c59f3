/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.persist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Media store in a local SQLite database file.
 *
 * <p>Every method runs in auto-commit mode, so each call is its own
 * transaction.</p>
 */
public class SqliteMediaStore implements MediaStore {

  private static final Logger logger = LoggerFactory.getLogger(
      SqliteMediaStore.class);

  static final String SCHEMA_RESOURCE = "/mediamirror-schema.sql";

  private final Connection conn;

  private final Clock clock;

  /**
   * Opens or creates the database at the given path and makes sure all
   * tables exist.
   *
   * @throws MediaStoreException Thrown if the database cannot be opened or
   *     initialized.
   */
  public SqliteMediaStore(Path databasePath) throws MediaStoreException {
    this(databasePath, Clock.systemUTC());
  }

  SqliteMediaStore(Path databasePath, Clock clock)
      throws MediaStoreException {
    this.clock = clock;
    try {
      Path parent = databasePath.toAbsolutePath().getParent();
      if (null != parent) {
        Files.createDirectories(parent);
      }
      this.conn = DriverManager.getConnection("jdbc:sqlite:"
          + databasePath.toAbsolutePath());
      this.initSchema();
    } catch (IOException | SQLException e) {
      throw new MediaStoreException("Could not open media database "
          + databasePath + ".", e);
    }
    logger.info("Opened media database {}.", databasePath);
  }

  private void initSchema() throws IOException, SQLException {
    try (Statement st = this.conn.createStatement()) {
      for (String sql : readSchema()) {
        st.executeUpdate(sql);
      }
    }
  }

  static List<String> readSchema() throws IOException {
    InputStream in = SqliteMediaStore.class.getResourceAsStream(
        SCHEMA_RESOURCE);
    if (null == in) {
      throw new IOException("Missing resource " + SCHEMA_RESOURCE);
    }
    StringBuilder sb = new StringBuilder();
    try (BufferedReader br = new BufferedReader(
        new InputStreamReader(in, StandardCharsets.UTF_8))) {
      String line;
      while ((line = br.readLine()) != null) {
        if (!line.trim().startsWith("--")) {
          sb.append(line).append('\n');
        }
      }
    }
    List<String> statements = new ArrayList<>();
    for (String part : sb.toString().split(";")) {
      if (!part.trim().isEmpty()) {
        statements.add(part.trim());
      }
    }
    return statements;
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  @Override
  public long getOrCreateOwner(int platform, String uid)
      throws MediaStoreException {
    try (PreparedStatement ps = this.conn.prepareStatement(
        "INSERT OR IGNORE INTO owners (platform_id, uid, created_at) "
        + "VALUES (?, ?, ?)")) {
      ps.setInt(1, platform);
      ps.setString(2, uid);
      ps.setLong(3, this.clock.millis());
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new MediaStoreException("Could not create owner " + uid + ".", e);
    }
    try (PreparedStatement ps = this.conn.prepareStatement(
        "SELECT id FROM owners WHERE platform_id = ? AND uid = ?")) {
      ps.setInt(1, platform);
      ps.setString(2, uid);
      try (ResultSet rs = ps.executeQuery()) {
        if (rs.next()) {
          return rs.getLong(1);
        }
      }
    } catch (SQLException e) {
      throw new MediaStoreException("Could not look up owner " + uid + ".",
          e);
    }
    throw new MediaStoreException("Owner " + uid + " vanished after insert.");
  }

  @Override
  public MediaRecord findMedia(long ownerId, String mediaId)
      throws MediaStoreException {
    try (PreparedStatement ps = this.conn.prepareStatement(
        "SELECT is_hd, file_path, created_at FROM saved_media "
        + "WHERE owner_id = ? AND media_id = ?")) {
      ps.setLong(1, ownerId);
      ps.setString(2, mediaId);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          return null;
        }
        return new MediaRecord(ownerId, mediaId, rs.getInt(1) != 0,
            rs.getString(2), Instant.ofEpochMilli(rs.getLong(3)));
      }
    } catch (SQLException e) {
      throw new MediaStoreException("Could not read media " + mediaId + ".",
          e);
    }
  }

  @Override
  public void insertMedia(long ownerId, String mediaId, boolean highQuality,
      String filePath) throws MediaStoreException {
    try (PreparedStatement ps = this.conn.prepareStatement(
        "INSERT OR IGNORE INTO saved_media "
        + "(owner_id, media_id, is_hd, file_path, created_at) "
        + "VALUES (?, ?, ?, ?, ?)")) {
      ps.setLong(1, ownerId);
      ps.setString(2, mediaId);
      ps.setInt(3, highQuality ? 1 : 0);
      ps.setString(4, filePath);
      ps.setLong(5, this.clock.millis());
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new MediaStoreException("Could not save media " + mediaId + ".",
          e);
    }
  }

  @Override
  public boolean upgradeMedia(long ownerId, String mediaId, String filePath)
      throws MediaStoreException {
    try (PreparedStatement ps = this.conn.prepareStatement(
        "UPDATE saved_media SET is_hd = 1, file_path = ? "
        + "WHERE owner_id = ? AND media_id = ?")) {
      ps.setString(1, filePath);
      ps.setLong(2, ownerId);
      ps.setString(3, mediaId);
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new MediaStoreException("Could not upgrade media " + mediaId
          + ".", e);
    }
  }

  @Override
  public List<MediaRecord> findStandardQuality(long ownerId)
      throws MediaStoreException {
    List<MediaRecord> records = new ArrayList<>();
    try (PreparedStatement ps = this.conn.prepareStatement(
        "SELECT media_id, file_path, created_at FROM saved_media "
        + "WHERE owner_id = ? AND is_hd = 0 ORDER BY created_at, id")) {
      ps.setLong(1, ownerId);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          records.add(new MediaRecord(ownerId, rs.getString(1), false,
              rs.getString(2), Instant.ofEpochMilli(rs.getLong(3))));
        }
      }
    } catch (SQLException e) {
      throw new MediaStoreException("Could not list standard-quality media "
          + "of owner " + ownerId + ".", e);
    }
    return records;
  }

  @Override
  public PaginationCursor findCursor(long ownerId, CollectionKind kind)
      throws MediaStoreException {
    try (PreparedStatement ps = this.conn.prepareStatement(
        "SELECT cursor, pages_loaded, last_updated FROM media_cursors "
        + "WHERE owner_id = ? AND collection_kind = ?")) {
      ps.setLong(1, ownerId);
      ps.setString(2, kind.name());
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          return null;
        }
        return new PaginationCursor(ownerId, kind, rs.getString(1),
            rs.getInt(2), Instant.ofEpochMilli(rs.getLong(3)));
      }
    } catch (SQLException e) {
      throw new MediaStoreException("Could not read " + kind + " cursor of "
          + "owner " + ownerId + ".", e);
    }
  }

  @Override
  public void saveCursor(long ownerId, CollectionKind kind,
      String cursorToken, int pagesLoaded) throws MediaStoreException {
    try (PreparedStatement ps = this.conn.prepareStatement(
        "INSERT OR REPLACE INTO media_cursors "
        + "(owner_id, collection_kind, cursor, pages_loaded, last_updated) "
        + "VALUES (?, ?, ?, ?, ?)")) {
      ps.setLong(1, ownerId);
      ps.setString(2, kind.name());
      ps.setString(3, cursorToken);
      ps.setInt(4, pagesLoaded);
      ps.setLong(5, this.clock.millis());
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new MediaStoreException("Could not save " + kind + " cursor of "
          + "owner " + ownerId + ".", e);
    }
  }

  @Override
  public void clearCursor(long ownerId, CollectionKind kind)
      throws MediaStoreException {
    try (PreparedStatement ps = this.conn.prepareStatement(
        "DELETE FROM media_cursors WHERE owner_id = ? "
        + "AND collection_kind = ?")) {
      ps.setLong(1, ownerId);
      ps.setString(2, kind.name());
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new MediaStoreException("Could not clear " + kind + " cursor of "
          + "owner " + ownerId + ".", e);
    }
  }

  @Override
  public void close() throws MediaStoreException {
    try {
      this.conn.close();
    } catch (SQLException e) {
      throw new MediaStoreException("Could not close media database.", e);
    }
  }
}
